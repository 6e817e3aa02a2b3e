package com.retailpos.pricing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "pos.catalog")
@Data
public class CatalogProperties {
    private int retentionDays = 30;
    private String purgeCron = "0 0 3 * * *";
}

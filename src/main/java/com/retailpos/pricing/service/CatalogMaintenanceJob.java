package com.retailpos.pricing.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class CatalogMaintenanceJob {

    private static final Logger logger = LoggerFactory.getLogger(CatalogMaintenanceJob.class);

    private final CatalogService catalogService;

    public CatalogMaintenanceJob(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @Scheduled(cron = "${pos.catalog.purge-cron:0 0 3 * * *}")
    public void purgeDeletedProducts() {
        int purged = catalogService.purgeExpiredDeletions();
        logger.debug("Recycle bin purge removed {} products", purged);
    }
}

package com.retailpos.pricing.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "pos.pricing")
@Data
public class PricingProperties {
    // Identity resolution floor for the fuzzy tier
    private double fuzzyThreshold = 0.3;
    private double searchThreshold = 0.15;
    private int searchLimit = 15;
    private List<String> subGramUnits = new ArrayList<>(List.of("g", "gram", "grams"));

    public boolean isSubGram(String uom) {
        if (uom == null) {
            return false;
        }
        String u = uom.trim();
        return subGramUnits.stream().anyMatch(unit -> unit.equalsIgnoreCase(u));
    }
}

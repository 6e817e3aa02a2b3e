package com.retailpos.pricing.service;

import com.retailpos.pricing.config.PricingProperties;
import com.retailpos.pricing.dto.ScoredVariant;
import com.retailpos.pricing.dto.Variant;
import com.retailpos.pricing.store.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Turns a scanned code or typed fragment into exactly one {@link Variant}.
 * <p>
 * Tiers are tried in order and the first tier that yields a candidate wins:
 * product barcode, alias barcode, whole product name, name fragment, then a trigram
 * fuzzy match over product names/barcodes and alias barcodes.
 */
@Service
public class IdentityResolver {

    private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);

    private final CatalogStore catalogStore;
    private final PricingProperties properties;

    public IdentityResolver(CatalogStore catalogStore, PricingProperties properties) {
        this.catalogStore = catalogStore;
        this.properties = properties;
    }

    public Optional<Variant> resolve(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String query = token.trim();

        Optional<Variant> byBarcode = catalogStore.findByExactBarcode(query);
        if (byBarcode.isPresent()) {
            logger.debug("'{}' resolved by barcode (alias={})", query, byBarcode.get().isAlias());
            return byBarcode;
        }

        Optional<Variant> byName = catalogStore.findByExactName(query);
        if (byName.isPresent()) {
            logger.debug("'{}' resolved by exact name", query);
            return byName;
        }

        Optional<Variant> byFragment = catalogStore.findFirstByNameFragment(query);
        if (byFragment.isPresent()) {
            logger.debug("'{}' resolved by name fragment to '{}'", query, byFragment.get().displayName());
            return byFragment;
        }

        return resolveFuzzy(query);
    }

    private Optional<Variant> resolveFuzzy(String query) {
        double floor = properties.getFuzzyThreshold();
        Optional<ScoredVariant> bestProduct = catalogStore.findBestProductBySimilarity(query, floor);
        Optional<ScoredVariant> bestAlias = catalogStore.findBestAliasByBarcode(query, floor);

        if (bestProduct.isPresent() && bestAlias.isPresent()) {
            double productScore = bestProduct.get().score();
            double aliasScore = bestAlias.get().barcodeSimilarity();
            logger.debug("'{}' fuzzy: product {} vs alias {}", query, productScore, aliasScore);
            return Optional.of(productScore >= aliasScore
                    ? bestProduct.get().variant()
                    : bestAlias.get().variant());
        }
        if (bestProduct.isPresent()) {
            return Optional.of(bestProduct.get().variant());
        }
        if (bestAlias.isPresent()) {
            return Optional.of(bestAlias.get().variant());
        }

        logger.debug("'{}' matched nothing", query);
        return Optional.empty();
    }

    /**
     * Ranked catalog search for pick lists. Unlike {@link #resolve(String)} this returns every
     * hit above the looser search threshold, best first.
     */
    public List<ScoredVariant> search(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return catalogStore.findProductsByName(query.trim(), properties.getSearchThreshold(),
                properties.getSearchLimit());
    }
}

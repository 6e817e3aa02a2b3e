package com.retailpos.pricing.service;

import com.retailpos.pricing.dto.ActiveRule;
import com.retailpos.pricing.store.CatalogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the one promotional rule that applies to a line.
 * <p>
 * A rule applies when its scheme is active and current, the quantity falls inside
 * [minQty, maxQty] (maxQty open when null), and its optional UOM and MRP targets match the
 * line. Rules without a UOM or MRP target apply to every variant of the product. Among the
 * survivors the highest minQty wins, then the highest benefit value; rule id breaks any
 * remaining tie so repeated calls agree.
 */
@Service
public class SchemeMatcher {

    private static final Logger logger = LoggerFactory.getLogger(SchemeMatcher.class);

    static final Comparator<ActiveRule> PRIORITY = Comparator
            .comparing(ActiveRule::minQty, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(ActiveRule::benefitValue, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(ActiveRule::ruleId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final CatalogStore catalogStore;
    private final UomNormalizer uomNormalizer;
    private final Clock clock;

    public SchemeMatcher(CatalogStore catalogStore, UomNormalizer uomNormalizer, Clock clock) {
        this.catalogStore = catalogStore;
        this.uomNormalizer = uomNormalizer;
        this.clock = clock;
    }

    public Optional<ActiveRule> bestRule(Long productId, BigDecimal quantity, String uom, BigDecimal mrp) {
        return bestRule(productId, quantity, uom, mrp, uomNormalizer.snapshot());
    }

    public Optional<ActiveRule> bestRule(Long productId, BigDecimal quantity, String uom, BigDecimal mrp,
            UomNormalizer.UomMap uoms) {
        LocalDate today = LocalDate.now(clock);
        List<ActiveRule> candidates = catalogStore.listActiveRules(productId, today);

        Optional<ActiveRule> winner = candidates.stream()
                .filter(r -> matchesQuantity(r, quantity))
                .filter(r -> r.targetUom() == null || uoms.sameUnit(r.targetUom(), uom))
                .filter(r -> r.targetMrp() == null || (mrp != null && r.targetMrp().compareTo(mrp) == 0))
                .min(PRIORITY);

        winner.ifPresent(r -> logger.debug("Scheme '{}' rule {} applies to product {} at qty {}",
                r.schemeName(), r.ruleId(), productId, quantity));
        return winner;
    }

    private static boolean matchesQuantity(ActiveRule rule, BigDecimal quantity) {
        if (quantity == null) {
            return false;
        }
        BigDecimal min = rule.minQty() != null ? rule.minQty() : BigDecimal.ZERO;
        if (quantity.compareTo(min) < 0) {
            return false;
        }
        return rule.maxQty() == null || quantity.compareTo(rule.maxQty()) <= 0;
    }
}

package com.retailpos.pricing.service;

import com.retailpos.pricing.config.PricingProperties;
import com.retailpos.pricing.dto.ActiveRule;
import com.retailpos.pricing.dto.LineItem;
import com.retailpos.pricing.dto.MrpVariant;
import com.retailpos.pricing.dto.UnitEntry;
import com.retailpos.pricing.dto.Variant;
import com.retailpos.pricing.exception.UnresolvedProductException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Prices a single bill line: resolves the product, settles the unit and MRP tier, applies
 * at most one scheme rule and returns an immutable {@link LineItem}.
 * <p>
 * The engine never calls back into its callers and keeps no state between calls; the same
 * inputs against the same catalog always give the same line.
 */
@Service
public class PricingEngine {

    private static final Logger logger = LoggerFactory.getLogger(PricingEngine.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final IdentityResolver identityResolver;
    private final UnitTable unitTable;
    private final SchemeMatcher schemeMatcher;
    private final UomNormalizer uomNormalizer;
    private final PricingProperties properties;

    public PricingEngine(IdentityResolver identityResolver, UnitTable unitTable, SchemeMatcher schemeMatcher,
            UomNormalizer uomNormalizer, PricingProperties properties) {
        this.identityResolver = identityResolver;
        this.unitTable = unitTable;
        this.schemeMatcher = schemeMatcher;
        this.uomNormalizer = uomNormalizer;
        this.properties = properties;
    }

    public LineItem priceLine(String token, BigDecimal quantity, String chosenUom, BigDecimal chosenMrp) {
        Variant variant = identityResolver.resolve(token)
                .orElseThrow(() -> new UnresolvedProductException(token));
        return priceLine(variant, quantity, chosenUom, chosenMrp);
    }

    public LineItem priceLine(Variant variant, BigDecimal quantity, String chosenUom, BigDecimal chosenMrp) {
        UomNormalizer.UomMap uoms = uomNormalizer.snapshot();
        BigDecimal qty = quantity != null ? quantity : BigDecimal.ZERO;

        Line line = new Line(variant);
        if (chosenUom != null && !chosenUom.isBlank() && !uoms.sameUnit(chosenUom, line.uom)) {
            switchUnit(line, chosenUom.trim(), variant, uoms);
        }
        applyMrpTier(line, chosenMrp);
        if (line.rate.signum() == 0 && variant.basePrice() != null) {
            line.rate = variant.basePrice().multiply(line.factor);
        }

        Optional<ActiveRule> rule = schemeMatcher.bestRule(variant.productId(), qty, line.uom, line.mrp, uoms);
        if (rule.isPresent() && targetsOtherUnit(rule.get(), line, uoms)) {
            // The rule is keyed to another unit: re-derive once and match again
            String targetUom = rule.get().targetUom();
            Optional<UnitEntry> target = unitTable.lookup(variant.productId(), uoms.canonical(targetUom));
            if (target.isEmpty()) {
                target = unitTable.lookup(variant.productId(), targetUom);
            }
            if (target.isPresent()) {
                line.adopt(target.get());
                rule = schemeMatcher.bestRule(variant.productId(), qty, line.uom, line.mrp, uoms);
            }
            if (rule.isPresent() && targetsOtherUnit(rule.get(), line, uoms)) {
                logger.warn("Scheme rule {} targets unit '{}' but the line stays in '{}'; rule not applied",
                        rule.get().ruleId(), rule.get().targetUom(), line.uom);
                rule = Optional.empty();
            }
        }

        return compute(variant, qty, line, rule.orElse(null));
    }

    private void switchUnit(Line line, String typed, Variant variant, UomNormalizer.UomMap uoms) {
        String wanted = uoms.canonical(typed);
        Optional<UnitEntry> unit = unitTable.lookup(variant.productId(), wanted);
        if (unit.isEmpty() && !wanted.equals(typed)) {
            unit = unitTable.lookup(variant.productId(), typed);
        }
        if (unit.isPresent()) {
            line.adopt(unit.get());
        } else {
            // Keep billing moving on a catalog gap: show the unit, keep the last known rate
            logger.warn("Unit '{}' is not defined for product {} ({}); keeping rate {}", wanted,
                    variant.productId(), variant.displayName(), line.rate);
            line.uom = wanted;
        }
    }

    private static boolean targetsOtherUnit(ActiveRule rule, Line line, UomNormalizer.UomMap uoms) {
        return rule.targetUom() != null && !uoms.sameUnit(rule.targetUom(), line.uom);
    }

    private void applyMrpTier(Line line, BigDecimal chosenMrp) {
        if (chosenMrp == null || chosenMrp.compareTo(line.mrp) == 0) {
            return;
        }
        for (MrpVariant tier : unitTable.mrpVariants(line.productId, line.uom)) {
            if (tier.mrp().compareTo(chosenMrp) == 0) {
                line.rate = tier.price();
                break;
            }
        }
        line.mrp = chosenMrp;
    }

    private LineItem compute(Variant variant, BigDecimal qty, Line line, ActiveRule rule) {
        boolean subGram = properties.isSubGram(line.uom);
        BigDecimal effectiveRate = perBillingUnit(line.rate, subGram);
        BigDecimal gross = qty.multiply(effectiveRate);
        BigDecimal discount = BigDecimal.ZERO;

        if (rule != null) {
            BigDecimal value = rule.benefitValue() != null ? rule.benefitValue() : BigDecimal.ZERO;
            switch (rule.benefitType()) {
                case ABSOLUTE_RATE -> {
                    effectiveRate = perBillingUnit(value, subGram);
                    gross = qty.multiply(effectiveRate);
                }
                case PERCENT -> discount = gross.multiply(value).divide(HUNDRED);
                case AMOUNT -> discount = qty.multiply(perBillingUnit(value, subGram));
            }
        }

        BigDecimal amount = gross.subtract(discount).setScale(2, RoundingMode.HALF_UP);
        BigDecimal mrpValue = qty.multiply(perBillingUnit(line.mrp, subGram));
        BigDecimal savings = mrpValue.subtract(amount).max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);

        return new LineItem(
                variant.productId(),
                line.aliasId,
                variant.displayName(),
                variant.barcode(),
                line.uom,
                qty,
                effectiveRate,
                line.mrp,
                line.factor,
                gross.setScale(2, RoundingMode.HALF_UP),
                discount.setScale(2, RoundingMode.HALF_UP),
                amount,
                rule != null ? rule.schemeName() : null,
                savings);
    }

    // Gram lines are sold against a per-kilogram rate
    private static BigDecimal perBillingUnit(BigDecimal value, boolean subGram) {
        return subGram ? value.movePointLeft(3) : value;
    }

    private static final class Line {
        final Long productId;
        Long aliasId;
        String uom;
        BigDecimal rate;
        BigDecimal mrp;
        BigDecimal factor;

        Line(Variant variant) {
            this.productId = variant.productId();
            this.aliasId = variant.aliasId();
            this.uom = variant.uom();
            this.rate = variant.price() != null ? variant.price() : BigDecimal.ZERO;
            this.mrp = variant.mrp() != null ? variant.mrp() : BigDecimal.ZERO;
            this.factor = variant.factor() != null ? variant.factor() : BigDecimal.ONE;
        }

        void adopt(UnitEntry unit) {
            this.uom = unit.uom();
            this.aliasId = unit.aliasId();
            this.rate = unit.price();
            this.mrp = unit.mrp();
            this.factor = unit.factor();
        }
    }
}

package com.retailpos.pricing.service;

import com.retailpos.pricing.dto.MrpVariant;
import com.retailpos.pricing.dto.UnitEntry;
import com.retailpos.pricing.store.CatalogStore;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class UnitTable {

    private final CatalogStore catalogStore;

    public UnitTable(CatalogStore catalogStore) {
        this.catalogStore = catalogStore;
    }

    /**
     * All units a product can be sold in: the base unit (factor 1) followed by its aliases.
     * Aliases without a stored price are priced at base price times factor.
     */
    public List<UnitEntry> unitsFor(Long productId) {
        List<UnitEntry> raw = catalogStore.listUnits(productId);
        BigDecimal basePrice = raw.stream()
                .filter(UnitEntry::isBase)
                .map(UnitEntry::price)
                .findFirst()
                .orElse(BigDecimal.ZERO);
        return raw.stream().map(u -> withPrice(u, basePrice)).toList();
    }

    /** Exact, case-sensitive unit match; the base unit wins over aliases sharing its name. */
    public Optional<UnitEntry> lookup(Long productId, String uom) {
        if (uom == null) {
            return Optional.empty();
        }
        return unitsFor(productId).stream()
                .filter(u -> uom.equals(u.uom()))
                .findFirst();
    }

    public List<MrpVariant> mrpVariants(Long productId, String uom) {
        List<MrpVariant> tiers = new ArrayList<>();
        BigDecimal basePrice = null;
        for (UnitEntry entry : catalogStore.listMrpVariants(productId, uom)) {
            if (entry.price() == null && basePrice == null) {
                basePrice = basePrice(productId);
            }
            UnitEntry priced = withPrice(entry, basePrice);
            boolean seen = tiers.stream().anyMatch(t -> t.mrp().compareTo(priced.mrp()) == 0
                    && t.price().compareTo(priced.price()) == 0);
            if (!seen) {
                tiers.add(new MrpVariant(priced.mrp(), priced.price()));
            }
        }
        return tiers;
    }

    private BigDecimal basePrice(Long productId) {
        return catalogStore.listUnits(productId).stream()
                .filter(UnitEntry::isBase)
                .map(UnitEntry::price)
                .findFirst()
                .orElse(BigDecimal.ZERO);
    }

    private static UnitEntry withPrice(UnitEntry entry, BigDecimal basePrice) {
        if (entry.price() != null) {
            return entry;
        }
        return new UnitEntry(entry.uom(), basePrice.multiply(entry.factor()), entry.mrp(), entry.factor(),
                entry.aliasId());
    }
}

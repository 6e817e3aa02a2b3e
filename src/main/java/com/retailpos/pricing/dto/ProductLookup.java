package com.retailpos.pricing.dto;

import java.util.List;

public record ProductLookup(
        Variant variant,
        List<UnitEntry> units,
        List<MrpVariant> mrpVariants) {
}

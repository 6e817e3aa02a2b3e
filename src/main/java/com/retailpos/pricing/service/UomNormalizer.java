package com.retailpos.pricing.service;

import com.retailpos.pricing.store.CatalogStore;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Maps typed unit names ("kg", "KG") to their canonical names ("kilogram"). A fresh
 * {@link UomMap} is read from the catalog per call; nothing is cached between calls.
 */
@Service
public class UomNormalizer {

    private final CatalogStore catalogStore;

    public UomNormalizer(CatalogStore catalogStore) {
        this.catalogStore = catalogStore;
    }

    public UomMap snapshot() {
        return new UomMap(Map.copyOf(catalogStore.uomAliases()));
    }

    public static final class UomMap {

        private final Map<String, String> aliases;

        public UomMap(Map<String, String> aliases) {
            this.aliases = aliases;
        }

        public static UomMap empty() {
            return new UomMap(Map.of());
        }

        public String canonical(String uom) {
            if (uom == null) {
                return null;
            }
            String trimmed = uom.trim();
            String mapped = aliases.get(trimmed.toLowerCase(Locale.ROOT));
            return mapped != null ? mapped : trimmed;
        }

        public boolean sameUnit(String a, String b) {
            if (a == null || b == null) {
                return false;
            }
            return canonical(a).equalsIgnoreCase(canonical(b));
        }
    }
}

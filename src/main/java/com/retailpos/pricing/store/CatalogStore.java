package com.retailpos.pricing.store;

import com.retailpos.pricing.dto.ActiveRule;
import com.retailpos.pricing.dto.ScoredVariant;
import com.retailpos.pricing.dto.UnitEntry;
import com.retailpos.pricing.dto.Variant;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the product catalog used by the resolution and pricing code.
 * Soft-deleted products and their aliases are never returned.
 * <p>
 * Implementations wrap their own failures in
 * {@link com.retailpos.pricing.exception.StoreUnavailableException}.
 */
public interface CatalogStore {

    /** Product barcode first, then alias barcode. */
    Optional<Variant> findByExactBarcode(String code);

    /** Case-insensitive whole-name match against product names. */
    Optional<Variant> findByExactName(String name);

    /** Case-insensitive substring match, lexicographically first product name. */
    Optional<Variant> findFirstByNameFragment(String fragment);

    /**
     * Product and alias rows scored by trigram similarity against {@code pattern}, ranked by
     * the better of the two scores (descending) and then by name.
     */
    List<ScoredVariant> findProductsByName(String pattern, double threshold, int limit);

    /** Best product row whose name or barcode scores above {@code threshold}. Aliases are not considered. */
    Optional<ScoredVariant> findBestProductBySimilarity(String pattern, double threshold);

    /** Best alias row whose own barcode scores above {@code threshold}; the product name plays no part. */
    Optional<ScoredVariant> findBestAliasByBarcode(String pattern, double threshold);

    /** Base unit first, then one entry per alias. Alias prices are returned as stored. */
    List<UnitEntry> listUnits(Long productId);

    /** Raw unit entries for one UOM, base unit first. */
    List<UnitEntry> listMrpVariants(Long productId, String uom);

    /** Rules of active schemes whose validity window contains {@code today}. */
    List<ActiveRule> listActiveRules(Long productId, LocalDate today);

    /** Lower-cased UOM alias mapped to its canonical name. */
    Map<String, String> uomAliases();
}

package com.retailpos.pricing.store;

import com.retailpos.pricing.dto.ActiveRule;
import com.retailpos.pricing.dto.ScoredVariant;
import com.retailpos.pricing.dto.UnitEntry;
import com.retailpos.pricing.dto.Variant;
import com.retailpos.pricing.exception.StoreUnavailableException;
import com.retailpos.pricing.model.Product;
import com.retailpos.pricing.model.ProductAlias;
import com.retailpos.pricing.model.SchemeRule;
import com.retailpos.pricing.model.UOM;
import com.retailpos.pricing.repository.ProductAliasRepository;
import com.retailpos.pricing.repository.ProductRepository;
import com.retailpos.pricing.repository.SchemeRuleRepository;
import com.retailpos.pricing.repository.UOMRepository;
import com.retailpos.pricing.util.TrigramSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Component
@Transactional(readOnly = true)
public class JpaCatalogStore implements CatalogStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaCatalogStore.class);

    private static final Comparator<ScoredVariant> BEST_FIRST = Comparator
            .comparingDouble(ScoredVariant::score).reversed()
            .thenComparing(s -> s.variant().displayName());

    private final ProductRepository productRepository;
    private final ProductAliasRepository aliasRepository;
    private final SchemeRuleRepository ruleRepository;
    private final UOMRepository uomRepository;

    public JpaCatalogStore(ProductRepository productRepository, ProductAliasRepository aliasRepository,
            SchemeRuleRepository ruleRepository, UOMRepository uomRepository) {
        this.productRepository = productRepository;
        this.aliasRepository = aliasRepository;
        this.ruleRepository = ruleRepository;
        this.uomRepository = uomRepository;
    }

    @Override
    public Optional<Variant> findByExactBarcode(String code) {
        return query("barcode lookup", () -> {
            Optional<Product> product = productRepository.findByBarcodeAndDeletedFalse(code);
            if (product.isPresent()) {
                return product.map(JpaCatalogStore::toVariant);
            }
            return aliasRepository.findByBarcodeAndProductDeletedFalse(code).map(JpaCatalogStore::toVariant);
        });
    }

    @Override
    public Optional<Variant> findByExactName(String name) {
        return query("name lookup", () -> productRepository
                .findFirstByNameIgnoreCaseAndDeletedFalseOrderByNameAsc(name)
                .map(JpaCatalogStore::toVariant));
    }

    @Override
    public Optional<Variant> findFirstByNameFragment(String fragment) {
        return query("name fragment lookup", () -> productRepository
                .findFirstByNameContainingIgnoreCaseAndDeletedFalseOrderByNameAsc(fragment)
                .map(JpaCatalogStore::toVariant));
    }

    @Override
    public List<ScoredVariant> findProductsByName(String pattern, double threshold, int limit) {
        return query("similarity search", () -> {
            String needle = pattern.toLowerCase(Locale.ROOT);
            List<ScoredVariant> hits = new ArrayList<>();

            for (Product p : productRepository.findByDeletedFalse()) {
                ScoredVariant scored = new ScoredVariant(toVariant(p),
                        TrigramSimilarity.similarity(p.getName(), pattern),
                        TrigramSimilarity.similarity(p.getBarcode(), pattern));
                if (qualifies(scored, needle, threshold)) {
                    hits.add(scored);
                }
            }
            for (ProductAlias a : aliasRepository.findByProductDeletedFalse()) {
                ScoredVariant scored = new ScoredVariant(toVariant(a),
                        TrigramSimilarity.similarity(a.getProduct().getName(), pattern),
                        TrigramSimilarity.similarity(a.getBarcode(), pattern));
                if (qualifies(scored, needle, threshold)) {
                    hits.add(scored);
                }
            }

            return hits.stream()
                    .sorted(BEST_FIRST)
                    .limit(limit)
                    .toList();
        });
    }

    @Override
    public Optional<ScoredVariant> findBestProductBySimilarity(String pattern, double threshold) {
        return query("product similarity match", () -> productRepository.findByDeletedFalse().stream()
                .map(p -> new ScoredVariant(toVariant(p),
                        TrigramSimilarity.similarity(p.getName(), pattern),
                        TrigramSimilarity.similarity(p.getBarcode(), pattern)))
                .filter(s -> s.score() > threshold)
                .min(BEST_FIRST));
    }

    @Override
    public Optional<ScoredVariant> findBestAliasByBarcode(String pattern, double threshold) {
        return query("alias barcode similarity match", () -> aliasRepository.findByProductDeletedFalse().stream()
                .map(a -> new ScoredVariant(toVariant(a), 0.0, TrigramSimilarity.similarity(a.getBarcode(), pattern)))
                .filter(s -> s.barcodeSimilarity() > threshold)
                .min(BEST_FIRST));
    }

    private static boolean qualifies(ScoredVariant scored, String needle, double threshold) {
        if (scored.nameSimilarity() > threshold || scored.barcodeSimilarity() > threshold) {
            return true;
        }
        Variant v = scored.variant();
        return contains(v.displayName(), needle) || contains(v.barcode(), needle);
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    @Override
    public List<UnitEntry> listUnits(Long productId) {
        return query("unit listing", () -> {
            List<UnitEntry> units = new ArrayList<>();
            productRepository.findById(productId).ifPresent(p -> units.add(baseUnit(p)));
            for (ProductAlias a : aliasRepository.findByProductIdOrderByIdAsc(productId)) {
                units.add(aliasUnit(a));
            }
            return units;
        });
    }

    @Override
    public List<UnitEntry> listMrpVariants(Long productId, String uom) {
        return query("MRP tier listing", () -> {
            List<UnitEntry> units = new ArrayList<>();
            productRepository.findById(productId)
                    .filter(p -> uom != null && uom.equals(p.getBaseUom()))
                    .ifPresent(p -> units.add(baseUnit(p)));
            for (ProductAlias a : aliasRepository.findByProductIdAndUomOrderByIdAsc(productId, uom)) {
                units.add(aliasUnit(a));
            }
            return units;
        });
    }

    @Override
    public List<ActiveRule> listActiveRules(Long productId, LocalDate today) {
        return query("scheme rule lookup", () -> ruleRepository.findActiveRules(productId, today).stream()
                .map(JpaCatalogStore::toActiveRule)
                .toList());
    }

    @Override
    public Map<String, String> uomAliases() {
        return query("UOM alias map", () -> {
            Map<String, String> mapping = new HashMap<>();
            for (UOM uom : uomRepository.findAll()) {
                if (uom.getAlias() != null && !uom.getAlias().isBlank()) {
                    mapping.put(uom.getAlias().trim().toLowerCase(Locale.ROOT), uom.getName());
                }
            }
            return mapping;
        });
    }

    private <T> T query(String what, Supplier<T> body) {
        try {
            return body.get();
        } catch (DataAccessException e) {
            logger.error("Catalog store failed during {}: {}", what, e.getMessage());
            throw new StoreUnavailableException("Catalog store unavailable during " + what, e);
        }
    }

    static Variant toVariant(Product p) {
        return new Variant(p.getId(), null, p.getName(), p.getBarcode(), p.getBaseUom(), p.getMrp(), p.getPrice(),
                BigDecimal.ONE, BigDecimal.ONE, p.getPrice(), p.getCategory(), false);
    }

    static Variant toVariant(ProductAlias a) {
        Product p = a.getProduct();
        // Derived on every read so a changed base price shows up straight away
        BigDecimal price = a.getPrice() != null ? a.getPrice() : p.getPrice().multiply(a.getFactor());
        return new Variant(p.getId(), a.getId(), p.getName(), a.getBarcode(), a.getUom(), a.getMrp(), price,
                a.getFactor(), a.getLoadQty(), p.getPrice(), p.getCategory(), true);
    }

    private static UnitEntry baseUnit(Product p) {
        return new UnitEntry(p.getBaseUom(), p.getPrice(), p.getMrp(), BigDecimal.ONE, null);
    }

    private static UnitEntry aliasUnit(ProductAlias a) {
        return new UnitEntry(a.getUom(), a.getPrice(), a.getMrp(), a.getFactor(), a.getId());
    }

    static ActiveRule toActiveRule(SchemeRule r) {
        return new ActiveRule(r.getId(), r.getScheme().getId(), r.getScheme().getName(), r.getProduct().getId(),
                r.getMinQty(), r.getMaxQty(), r.getTargetUom(), r.getTargetMrp(), r.getBenefitType(),
                r.getBenefitValue());
    }
}

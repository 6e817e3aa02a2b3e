package com.retailpos.pricing.store;

import com.retailpos.pricing.dto.ActiveRule;
import com.retailpos.pricing.dto.ScoredVariant;
import com.retailpos.pricing.dto.UnitEntry;
import com.retailpos.pricing.dto.Variant;
import com.retailpos.pricing.model.*;
import com.retailpos.pricing.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import(JpaCatalogStore.class)
class JpaCatalogStoreTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 19);

    @Autowired
    private JpaCatalogStore store;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private ProductAliasRepository aliasRepository;

    @Autowired
    private SchemeRepository schemeRepository;

    @Autowired
    private UOMRepository uomRepository;

    private Product rice;

    @BeforeEach
    void setUp() {
        rice = product("Basmati Rice", "RICE01", "kilogram", "110", "120");

        ProductAlias bag = new ProductAlias();
        bag.setProduct(rice);
        bag.setBarcode("RICE5KG");
        bag.setUom("kilogram");
        bag.setMrp(new BigDecimal("580"));
        bag.setFactor(new BigDecimal("5"));
        aliasRepository.save(bag);

        Product soap = product("Lux Soap", "SOAP01", "pcs", "35", "40");
        soap.setDeleted(true);
        soap.setDeletedAt(LocalDateTime.of(2026, 10, 1, 9, 0));
        productRepository.save(soap);

        UOM kg = new UOM();
        kg.setName("kilogram");
        kg.setAlias("KG");
        uomRepository.save(kg);
        UOM pcs = new UOM();
        pcs.setName("pcs");
        uomRepository.save(pcs);
    }

    private Product product(String name, String barcode, String uom, String price, String mrp) {
        Product p = new Product();
        p.setName(name);
        p.setBarcode(barcode);
        p.setBaseUom(uom);
        p.setPrice(new BigDecimal(price));
        p.setMrp(new BigDecimal(mrp));
        return productRepository.save(p);
    }

    private Scheme scheme(String name, LocalDate from, LocalDate to, boolean active) {
        Scheme s = new Scheme();
        s.setName(name);
        s.setValidFrom(from);
        s.setValidTo(to);
        s.setActive(active);
        SchemeRule r = new SchemeRule();
        r.setProduct(rice);
        r.setMinQty(BigDecimal.ONE);
        r.setBenefitValue(BigDecimal.TEN);
        s.addRule(r);
        return schemeRepository.save(s);
    }

    @Test
    void findByExactBarcode_Alias_ShouldDerivePriceFromFactor() {
        Optional<Variant> hit = store.findByExactBarcode("RICE5KG");

        assertTrue(hit.isPresent());
        assertTrue(hit.get().isAlias());
        assertEquals(rice.getId(), hit.get().productId());
        assertEquals(0, hit.get().price().compareTo(new BigDecimal("550")));
    }

    @Test
    void findByExactBarcode_DeletedProduct_ShouldBeHidden() {
        assertTrue(store.findByExactBarcode("SOAP01").isEmpty());
        assertTrue(store.findByExactName("lux soap").isEmpty());
    }

    @Test
    void findByExactName_ShouldIgnoreCase() {
        assertEquals("RICE01", store.findByExactName("BASMATI RICE").orElseThrow().barcode());
        assertEquals("RICE01", store.findFirstByNameFragment("mati").orElseThrow().barcode());
    }

    @Test
    void findProductsByName_ShouldScoreProductsAndAliases() {
        List<ScoredVariant> hits = store.findProductsByName("basmati", 0.15, 15);

        assertEquals(2, hits.size());
        assertTrue(hits.stream().allMatch(h -> h.variant().productId().equals(rice.getId())));
        assertTrue(store.findProductsByName("lux", 0.15, 15).isEmpty());
    }

    @Test
    void findBestAliasByBarcode_ShouldIgnoreSameNamePacks() {
        for (int i = 1; i <= 60; i++) {
            ProductAlias pack = new ProductAlias();
            pack.setProduct(rice);
            pack.setBarcode(String.format("PACK-%03d", i));
            pack.setUom("pcs");
            aliasRepository.save(pack);
        }

        Optional<ScoredVariant> hit = store.findBestAliasByBarcode("RICE5K", 0.3);

        assertEquals("RICE5KG", hit.orElseThrow().variant().barcode());
        assertTrue(store.findBestAliasByBarcode("Basmati Rice", 0.3).isEmpty());
    }

    @Test
    void findBestProductBySimilarity_ShouldSkipAliasesAndDeletedProducts() {
        ScoredVariant hit = store.findBestProductBySimilarity("basmti rice", 0.3).orElseThrow();

        assertFalse(hit.variant().isAlias());
        assertEquals("RICE01", hit.variant().barcode());
        assertTrue(store.findBestProductBySimilarity("lux soap", 0.3).isEmpty());
    }

    @Test
    void listUnits_ShouldListBaseThenAliases() {
        List<UnitEntry> units = store.listUnits(rice.getId());

        assertEquals(2, units.size());
        assertTrue(units.get(0).isBase());
        assertNull(units.get(1).price());
    }

    @Test
    void listMrpVariants_ShouldFilterByUnit() {
        assertEquals(2, store.listMrpVariants(rice.getId(), "kilogram").size());
        assertTrue(store.listMrpVariants(rice.getId(), "pcs").isEmpty());
    }

    @Test
    void listActiveRules_ShouldHonourActiveFlagAndDateWindow() {
        scheme("Current", TODAY.minusDays(1), TODAY, true);
        scheme("Open Ended", null, null, true);
        scheme("Expired", TODAY.minusDays(10), TODAY.minusDays(1), true);
        scheme("Future", TODAY.plusDays(1), null, true);
        scheme("Paused", null, null, false);

        List<ActiveRule> rules = store.listActiveRules(rice.getId(), TODAY);

        assertEquals(2, rules.size());
        assertTrue(rules.stream().anyMatch(r -> r.schemeName().equals("Current")));
        assertTrue(rules.stream().anyMatch(r -> r.schemeName().equals("Open Ended")));
    }

    @Test
    void uomAliases_ShouldMapLowerCasedAliasToName() {
        Map<String, String> aliases = store.uomAliases();

        assertEquals(Map.of("kg", "kilogram"), aliases);
    }
}

package com.retailpos.pricing;

import com.retailpos.pricing.dto.Bill;
import com.retailpos.pricing.dto.LineItem;
import com.retailpos.pricing.dto.LineRequest;
import com.retailpos.pricing.dto.RuleDraft;
import com.retailpos.pricing.dto.Variant;
import com.retailpos.pricing.exception.UnresolvedProductException;
import com.retailpos.pricing.model.BenefitType;
import com.retailpos.pricing.model.Product;
import com.retailpos.pricing.model.Scheme;
import com.retailpos.pricing.service.BillingService;
import com.retailpos.pricing.service.CatalogService;
import com.retailpos.pricing.service.IdentityResolver;
import com.retailpos.pricing.service.PricingEngine;
import com.retailpos.pricing.service.SchemeService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Transactional
class PricingIntegrationTest {

    @Autowired
    private CatalogService catalogService;
    @Autowired
    private SchemeService schemeService;
    @Autowired
    private IdentityResolver identityResolver;
    @Autowired
    private PricingEngine pricingEngine;
    @Autowired
    private BillingService billingService;

    private Product rice;

    @BeforeEach
    void setUp() {
        rice = catalogService.addProduct("Rice", "RICE01", new BigDecimal("120.00"), new BigDecimal("110.00"),
                "Grocery", "kg");
        catalogService.addAlias(rice.getId(), "RICE5KG", "kg", new BigDecimal("580.00"), new BigDecimal("540.00"),
                new BigDecimal("5.0"), new BigDecimal("5"));
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    @Test
    void aliasBarcode_ShouldResolveAndPriceAsPack() {
        Variant variant = identityResolver.resolve("RICE5KG").orElseThrow();
        assertTrue(variant.isAlias());
        assertAmount("5.0", variant.factor());
        assertAmount("540.00", variant.price());

        LineItem line = pricingEngine.priceLine("RICE5KG", new BigDecimal("2"), "kg", new BigDecimal("540.00"));

        assertAmount("1080.00", line.lineAmount());
    }

    @Test
    void percentScheme_ShouldDiscountFromMinimumQuantity() {
        schemeService.createScheme("Rice Week", null, null, List.of(new RuleDraft(rice.getId(), new BigDecimal("5"),
                null, null, null, BenefitType.PERCENT, new BigDecimal("10"))));

        LineItem line = pricingEngine.priceLine("RICE01", new BigDecimal("6"), "kg", new BigDecimal("110.00"));

        assertAmount("660.00", line.grossAmount());
        assertAmount("66.00", line.discountAmount());
        assertAmount("594.00", line.lineAmount());
        assertEquals("Rice Week", line.schemeName());
    }

    @Test
    void pausedScheme_ShouldNotApply() {
        Scheme scheme = schemeService.createScheme("Rice Week", null, null, List.of(new RuleDraft(rice.getId(),
                BigDecimal.ONE, null, null, null, BenefitType.PERCENT, new BigDecimal("10"))));
        schemeService.setActive(scheme.getId(), false);

        LineItem line = pricingEngine.priceLine("RICE01", new BigDecimal("6"), null, null);

        assertAmount("660.00", line.lineAmount());
        assertNull(line.schemeName());
    }

    @Test
    void unknownUnit_ShouldKeepLastKnownRate() {
        LineItem line = pricingEngine.priceLine("RICE01", new BigDecimal("2"), "box", null);

        assertEquals("box", line.uom());
        assertAmount("220.00", line.lineAmount());
    }

    @Test
    void deletedProduct_ShouldNotResolveUntilRestored() {
        catalogService.softDeleteProduct(rice.getId());

        assertThrows(UnresolvedProductException.class,
                () -> pricingEngine.priceLine("RICE01", BigDecimal.ONE, null, null));
        assertEquals(1, catalogService.listDeletedProducts().size());

        catalogService.restoreProduct(rice.getId());

        assertAmount("110.00", pricingEngine.priceLine("RICE01", BigDecimal.ONE, null, null).lineAmount());
    }

    @Test
    void duplicateBarcode_ShouldBeRejectedAcrossAliases() {
        assertThrows(IllegalArgumentException.class, () -> catalogService.addProduct("Rice Pack", "RICE5KG",
                BigDecimal.TEN, BigDecimal.TEN, null, null));
    }

    @Test
    void bill_ShouldRoundOnlyTheTotal() {
        catalogService.addProduct("Loose Dal", "DAL01", new BigDecimal("0"), new BigDecimal("10.25"), "Grocery",
                "kg");

        Bill bill = billingService.priceBill(List.of(
                new LineRequest("RICE01", new BigDecimal("1"), null, null),
                new LineRequest("DAL01", new BigDecimal("2"), null, null),
                new LineRequest("UNKNOWN-99", BigDecimal.ONE, null, null)));

        assertEquals(3, bill.lines().size());
        assertTrue(bill.lines().get(2).isBlank());
        assertAmount("130.50", bill.netAmount());
        assertAmount("131", bill.roundedTotal());
    }
}

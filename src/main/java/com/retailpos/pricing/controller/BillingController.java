package com.retailpos.pricing.controller;

import com.retailpos.pricing.dto.Bill;
import com.retailpos.pricing.dto.LineForm;
import com.retailpos.pricing.dto.LineItem;
import com.retailpos.pricing.dto.LineRequest;
import com.retailpos.pricing.dto.ProductLookup;
import com.retailpos.pricing.dto.ScoredVariant;
import com.retailpos.pricing.service.BillingService;
import com.retailpos.pricing.service.IdentityResolver;
import com.retailpos.pricing.service.PricingEngine;
import com.retailpos.pricing.util.NumberParsing;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/billing")
public class BillingController {

    private final PricingEngine pricingEngine;
    private final BillingService billingService;
    private final IdentityResolver identityResolver;

    public BillingController(PricingEngine pricingEngine, BillingService billingService,
            IdentityResolver identityResolver) {
        this.pricingEngine = pricingEngine;
        this.billingService = billingService;
        this.identityResolver = identityResolver;
    }

    // Cells arrive as typed; bad numbers turn into zero here, not in the engine
    @PostMapping("/line")
    public LineItem priceLine(@RequestParam String token,
            @RequestParam(required = false) String quantity,
            @RequestParam(required = false) String uom,
            @RequestParam(required = false) String mrp) {
        return pricingEngine.priceLine(token, NumberParsing.parseOrZero(quantity), uom,
                NumberParsing.parseOrNull(mrp));
    }

    @PostMapping("/bill")
    public Bill priceBill(@RequestBody List<LineForm> rows) {
        List<LineRequest> requests = rows.stream()
                .map(row -> new LineRequest(row.token(), NumberParsing.parseOrZero(row.quantity()), row.uom(),
                        NumberParsing.parseOrNull(row.mrp())))
                .toList();
        return billingService.priceBill(requests);
    }

    @GetMapping("/lookup")
    public ProductLookup lookup(@RequestParam String token) {
        return billingService.lookup(token);
    }

    @GetMapping("/search")
    public List<ScoredVariant> search(@RequestParam("q") String query) {
        return identityResolver.search(query);
    }
}

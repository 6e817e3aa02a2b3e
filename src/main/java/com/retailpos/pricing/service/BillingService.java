package com.retailpos.pricing.service;

import com.retailpos.pricing.dto.Bill;
import com.retailpos.pricing.dto.LineItem;
import com.retailpos.pricing.dto.LineRequest;
import com.retailpos.pricing.dto.ProductLookup;
import com.retailpos.pricing.dto.Variant;
import com.retailpos.pricing.exception.UnresolvedProductException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

@Service
public class BillingService {

    private static final Logger logger = LoggerFactory.getLogger(BillingService.class);

    private final PricingEngine pricingEngine;
    private final IdentityResolver identityResolver;
    private final UnitTable unitTable;

    public BillingService(PricingEngine pricingEngine, IdentityResolver identityResolver, UnitTable unitTable) {
        this.pricingEngine = pricingEngine;
        this.identityResolver = identityResolver;
        this.unitTable = unitTable;
    }

    /**
     * Reprices every line of a bill (live grid or a recalled held bill). Unknown tokens come
     * back as blank lines; lines with zero or negative quantity stay in the list but do not
     * count towards the totals. The payable total is rounded to whole currency units here,
     * never per line.
     */
    public Bill priceBill(List<LineRequest> requests) {
        List<LineItem> lines = new ArrayList<>();
        BigDecimal totalQty = BigDecimal.ZERO;
        BigDecimal net = BigDecimal.ZERO;

        for (LineRequest request : requests) {
            LineItem line;
            try {
                line = pricingEngine.priceLine(request.token(), request.quantity(), request.uom(), request.mrp());
            } catch (UnresolvedProductException e) {
                logger.warn("Bill line left blank: {}", e.getMessage());
                line = LineItem.blank(request.token());
            }
            lines.add(line);

            if (!line.isBlank() && line.quantity().signum() > 0) {
                totalQty = totalQty.add(line.quantity());
                net = net.add(line.lineAmount());
            }
        }

        return new Bill(lines, totalQty, net, net.setScale(0, RoundingMode.HALF_UP));
    }

    /** Row population for billing and purchase entry: the variant plus its unit and MRP choices. */
    public ProductLookup lookup(String token) {
        Variant variant = identityResolver.resolve(token)
                .orElseThrow(() -> new UnresolvedProductException(token));
        return new ProductLookup(variant,
                unitTable.unitsFor(variant.productId()),
                unitTable.mrpVariants(variant.productId(), variant.uom()));
    }
}

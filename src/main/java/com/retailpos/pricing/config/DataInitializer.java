package com.retailpos.pricing.config;

import com.retailpos.pricing.dto.RuleDraft;
import com.retailpos.pricing.model.BenefitType;
import com.retailpos.pricing.model.Product;
import com.retailpos.pricing.repository.ProductRepository;
import com.retailpos.pricing.repository.SchemeRepository;
import com.retailpos.pricing.repository.UOMRepository;
import com.retailpos.pricing.service.CatalogService;
import com.retailpos.pricing.service.SchemeService;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Configuration
@ConditionalOnProperty(name = "pos.demo-data.enabled", havingValue = "true")
public class DataInitializer {

    @Bean
    CommandLineRunner init(CatalogService catalogService,
            SchemeService schemeService,
            ProductRepository productRepo,
            UOMRepository uomRepo,
            SchemeRepository schemeRepo,
            Clock clock) {
        return args -> {
            // Default UOMs
            if (uomRepo.count() == 0) {
                catalogService.addUom("gram", "g");
                catalogService.addUom("kilogram", "kg");
                catalogService.addUom("packet", "pkt");
                catalogService.addUom("box", "bx");
            }

            // Sample catalog
            if (productRepo.count() == 0) {
                catalogService.addProduct("Amul Butter 100g", "8901234001", new BigDecimal("60"),
                        new BigDecimal("55"), "Dairy", "pcs");
                catalogService.addProduct("Tata Salt 1kg", "8901234002", new BigDecimal("28"),
                        new BigDecimal("25"), "Grocery", "pcs");
                Product maggi = catalogService.addProduct("Maggi Noodles 70g", "8901234003", new BigDecimal("14"),
                        new BigDecimal("12"), "Snacks", "pcs");
                catalogService.addProduct("Coca Cola 500ml", "8901234004", new BigDecimal("40"),
                        new BigDecimal("35"), "Beverages", "pcs");
                Product rice = catalogService.addProduct("Basmati Rice", "8901234005", new BigDecimal("120"),
                        new BigDecimal("110"), "Grocery", "kilogram");

                catalogService.addAlias(rice.getId(), "8901234005-5", "kilogram", new BigDecimal("580"),
                        new BigDecimal("540"), new BigDecimal("5"), new BigDecimal("5"));

                if (schemeRepo.count() == 0) {
                    LocalDate today = LocalDate.now(clock);
                    schemeService.createScheme("Maggi Bulk Offer", today, today.plusDays(30), List.of(
                            new RuleDraft(maggi.getId(), new BigDecimal("5"), null, "pcs", null,
                                    BenefitType.PERCENT, new BigDecimal("10"))));
                }
            }
        };
    }
}

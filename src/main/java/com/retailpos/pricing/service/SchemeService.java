package com.retailpos.pricing.service;

import com.retailpos.pricing.dto.RuleDraft;
import com.retailpos.pricing.model.Product;
import com.retailpos.pricing.model.Scheme;
import com.retailpos.pricing.model.SchemeRule;
import com.retailpos.pricing.repository.ProductRepository;
import com.retailpos.pricing.repository.SchemeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Service
public class SchemeService {

    private final SchemeRepository schemeRepository;
    private final ProductRepository productRepository;
    private final AuditService auditService;

    public SchemeService(SchemeRepository schemeRepository, ProductRepository productRepository,
            AuditService auditService) {
        this.schemeRepository = schemeRepository;
        this.productRepository = productRepository;
        this.auditService = auditService;
    }

    @Transactional
    public Scheme createScheme(String name, LocalDate validFrom, LocalDate validTo, List<RuleDraft> rules) {
        Scheme scheme = new Scheme();
        applyHeader(scheme, name, validFrom, validTo);
        rules.forEach(draft -> scheme.addRule(toRule(draft)));
        Scheme saved = schemeRepository.save(scheme);
        auditService.log("ADD_SCHEME", "Scheme " + saved.getId() + " (" + name + "), " + rules.size() + " rules");
        return saved;
    }

    /** Rewrites the header and replaces every rule of the scheme. */
    @Transactional
    public Scheme updateScheme(Long schemeId, String name, LocalDate validFrom, LocalDate validTo,
            List<RuleDraft> rules) {
        Scheme scheme = schemeRepository.findById(schemeId)
                .orElseThrow(() -> new IllegalArgumentException("Invalid scheme Id:" + schemeId));
        applyHeader(scheme, name, validFrom, validTo);
        scheme.getRules().clear();
        rules.forEach(draft -> scheme.addRule(toRule(draft)));
        auditService.log("UPDATE_SCHEME", "Scheme " + schemeId + " (" + name + "), " + rules.size() + " rules");
        return schemeRepository.save(scheme);
    }

    @Transactional
    public void setActive(Long schemeId, boolean active) {
        Scheme scheme = schemeRepository.findById(schemeId)
                .orElseThrow(() -> new IllegalArgumentException("Invalid scheme Id:" + schemeId));
        scheme.setActive(active);
        schemeRepository.save(scheme);
        auditService.log(active ? "ACTIVATE_SCHEME" : "DEACTIVATE_SCHEME", "Scheme " + schemeId);
    }

    @Transactional
    public void deleteScheme(Long schemeId) {
        schemeRepository.deleteById(schemeId);
        auditService.log("DELETE_SCHEME", "Scheme " + schemeId);
    }

    private static void applyHeader(Scheme scheme, String name, LocalDate validFrom, LocalDate validTo) {
        if (validTo != null && validFrom != null && validTo.isBefore(validFrom)) {
            throw new IllegalArgumentException("Scheme ends before it starts: " + validFrom + " > " + validTo);
        }
        scheme.setName(name);
        scheme.setValidFrom(validFrom);
        scheme.setValidTo(validTo);
    }

    private SchemeRule toRule(RuleDraft draft) {
        Product product = productRepository.findById(draft.productId())
                .orElseThrow(() -> new IllegalArgumentException("Invalid product Id:" + draft.productId()));
        if (draft.maxQty() != null && draft.minQty() != null && draft.maxQty().compareTo(draft.minQty()) < 0) {
            throw new IllegalArgumentException("Max quantity below min quantity for product " + product.getName());
        }
        SchemeRule rule = new SchemeRule();
        rule.setProduct(product);
        rule.setMinQty(draft.minQty() != null ? draft.minQty() : BigDecimal.ZERO);
        rule.setMaxQty(draft.maxQty());
        rule.setTargetUom(draft.targetUom() == null || draft.targetUom().isBlank() ? null : draft.targetUom().trim());
        rule.setTargetMrp(draft.targetMrp());
        if (draft.benefitType() != null) {
            rule.setBenefitType(draft.benefitType());
        }
        rule.setBenefitValue(draft.benefitValue() != null ? draft.benefitValue() : BigDecimal.ZERO);
        return rule;
    }
}

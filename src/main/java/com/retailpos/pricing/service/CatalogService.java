package com.retailpos.pricing.service;

import com.retailpos.pricing.config.CatalogProperties;
import com.retailpos.pricing.model.Product;
import com.retailpos.pricing.model.ProductAlias;
import com.retailpos.pricing.model.UOM;
import com.retailpos.pricing.repository.ProductAliasRepository;
import com.retailpos.pricing.repository.ProductRepository;
import com.retailpos.pricing.repository.SchemeRuleRepository;
import com.retailpos.pricing.repository.UOMRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class CatalogService {

    private static final Logger logger = LoggerFactory.getLogger(CatalogService.class);

    private final ProductRepository productRepository;
    private final ProductAliasRepository aliasRepository;
    private final SchemeRuleRepository ruleRepository;
    private final UOMRepository uomRepository;
    private final AuditService auditService;
    private final CatalogProperties catalogProperties;
    private final Clock clock;

    public CatalogService(ProductRepository productRepository, ProductAliasRepository aliasRepository,
            SchemeRuleRepository ruleRepository, UOMRepository uomRepository, AuditService auditService,
            CatalogProperties catalogProperties, Clock clock) {
        this.productRepository = productRepository;
        this.aliasRepository = aliasRepository;
        this.ruleRepository = ruleRepository;
        this.uomRepository = uomRepository;
        this.auditService = auditService;
        this.catalogProperties = catalogProperties;
        this.clock = clock;
    }

    /** Adds a unit, or sets the alias of an existing one when an alias is given. */
    @Transactional
    public UOM addUom(String name, String alias) {
        UOM uom = uomRepository.findByName(name).orElseGet(() -> {
            UOM fresh = new UOM();
            fresh.setName(name);
            return fresh;
        });
        if (alias != null && !alias.isBlank()) {
            uom.setAlias(alias.trim());
        }
        UOM saved = uomRepository.save(uom);
        auditService.log("ADD_UOM", "UOM " + name + (uom.getAlias() != null ? " (" + uom.getAlias() + ")" : ""));
        return saved;
    }

    @Transactional
    public Product addProduct(String name, String barcode, BigDecimal mrp, BigDecimal price, String category,
            String baseUom) {
        requireFreeBarcode(barcode);
        Product p = new Product();
        p.setName(name);
        p.setBarcode(barcode);
        p.setMrp(mrp != null ? mrp : BigDecimal.ZERO);
        p.setPrice(price);
        if (category != null) {
            p.setCategory(category);
        }
        if (baseUom != null) {
            p.setBaseUom(baseUom);
        }
        Product saved = productRepository.save(p);
        auditService.log("ADD_PRODUCT", "Product " + saved.getId() + " (" + name + ")");
        return saved;
    }

    @Transactional
    public Product updateProduct(Long productId, String name, String barcode, BigDecimal mrp, BigDecimal price,
            String category, String baseUom) {
        Product p = productRepository.findById(productId)
                .orElseThrow(() -> new IllegalArgumentException("Invalid product Id:" + productId));
        if (barcode != null && !barcode.equals(p.getBarcode())) {
            requireFreeBarcode(barcode);
        }
        p.setName(name);
        p.setBarcode(barcode);
        p.setMrp(mrp);
        p.setPrice(price);
        p.setCategory(category);
        p.setBaseUom(baseUom);
        auditService.log("UPDATE_PRODUCT", "Product " + productId + ", Price: " + price + ", MRP: " + mrp);
        return productRepository.save(p);
    }

    /**
     * Adds a packaging alias. A null price means the alias is priced at base price times
     * factor whenever it is looked up.
     */
    @Transactional
    public ProductAlias addAlias(Long productId, String barcode, String uom, BigDecimal mrp, BigDecimal price,
            BigDecimal factor, BigDecimal loadQty) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new IllegalArgumentException("Invalid product Id:" + productId));
        requireFreeBarcode(barcode);

        ProductAlias alias = new ProductAlias();
        alias.setProduct(product);
        alias.setBarcode(barcode);
        alias.setUom(uom);
        alias.setMrp(mrp != null ? mrp : BigDecimal.ZERO);
        alias.setPrice(price);
        alias.setFactor(factor != null ? factor : BigDecimal.ONE);
        alias.setLoadQty(loadQty != null ? loadQty : BigDecimal.ONE);
        ProductAlias saved = aliasRepository.save(alias);
        auditService.log("ADD_ALIAS", "Alias " + barcode + " (" + uom + " x" + alias.getFactor() + ") for product "
                + productId);
        return saved;
    }

    @Transactional
    public void deleteAlias(Long aliasId) {
        aliasRepository.deleteById(aliasId);
        auditService.log("DELETE_ALIAS", "Alias " + aliasId);
    }

    @Transactional
    public void softDeleteProduct(Long productId) {
        Product p = productRepository.findById(productId)
                .orElseThrow(() -> new IllegalArgumentException("Invalid product Id:" + productId));
        p.setDeleted(true);
        p.setDeletedAt(LocalDateTime.now(clock));
        productRepository.save(p);
        auditService.log("DELETE_PRODUCT", "Product " + productId + " (" + p.getName() + ")");
    }

    @Transactional
    public void restoreProduct(Long productId) {
        Product p = productRepository.findById(productId)
                .orElseThrow(() -> new IllegalArgumentException("Invalid product Id:" + productId));
        p.setDeleted(false);
        p.setDeletedAt(null);
        productRepository.save(p);
        auditService.log("RESTORE_PRODUCT", "Product " + productId + " (" + p.getName() + ")");
    }

    public List<Product> listDeletedProducts() {
        return productRepository.findByDeletedTrueOrderByDeletedAtDesc();
    }

    /** Physically removes products that have sat in the recycle bin past the retention window. */
    @Transactional
    public int purgeExpiredDeletions() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(catalogProperties.getRetentionDays());
        List<Product> expired = productRepository.findByDeletedTrueAndDeletedAtBefore(cutoff);
        for (Product p : expired) {
            ruleRepository.deleteByProductId(p.getId());
            aliasRepository.deleteByProductId(p.getId());
            productRepository.delete(p);
        }
        if (!expired.isEmpty()) {
            logger.info("Purged {} products deleted before {}", expired.size(), cutoff);
            auditService.log("PURGE_PRODUCTS", expired.size() + " products deleted before " + cutoff);
        }
        return expired.size();
    }

    // Barcodes are unique across products and aliases together
    private void requireFreeBarcode(String barcode) {
        if (barcode == null || barcode.isBlank()) {
            return;
        }
        if (productRepository.existsByBarcode(barcode) || aliasRepository.existsByBarcode(barcode)) {
            throw new IllegalArgumentException("Barcode already in use: " + barcode);
        }
    }
}

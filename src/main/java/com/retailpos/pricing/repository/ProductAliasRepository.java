package com.retailpos.pricing.repository;

import com.retailpos.pricing.model.ProductAlias;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface ProductAliasRepository extends JpaRepository<ProductAlias, Long> {
    Optional<ProductAlias> findByBarcodeAndProductDeletedFalse(String barcode);

    List<ProductAlias> findByProductIdOrderByIdAsc(Long productId);

    List<ProductAlias> findByProductIdAndUomOrderByIdAsc(Long productId, String uom);

    List<ProductAlias> findByProductDeletedFalse();

    boolean existsByBarcode(String barcode);

    void deleteByProductId(Long productId);
}

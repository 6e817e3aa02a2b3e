package com.retailpos.pricing.repository;

import com.retailpos.pricing.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {
    Optional<Product> findByBarcodeAndDeletedFalse(String barcode);

    Optional<Product> findFirstByNameIgnoreCaseAndDeletedFalseOrderByNameAsc(String name);

    Optional<Product> findFirstByNameContainingIgnoreCaseAndDeletedFalseOrderByNameAsc(String fragment);

    List<Product> findByDeletedFalse();

    List<Product> findByDeletedTrueOrderByDeletedAtDesc();

    List<Product> findByDeletedTrueAndDeletedAtBefore(LocalDateTime cutoff);

    boolean existsByBarcode(String barcode);
}

package com.retailpos.pricing.repository;

import com.retailpos.pricing.model.UOM;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UOMRepository extends JpaRepository<UOM, Long> {
    Optional<UOM> findByName(String name);
}

package com.retailpos.pricing.repository;

import com.retailpos.pricing.model.Scheme;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SchemeRepository extends JpaRepository<Scheme, Long> {
}

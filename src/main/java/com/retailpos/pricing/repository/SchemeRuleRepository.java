package com.retailpos.pricing.repository;

import com.retailpos.pricing.model.SchemeRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

public interface SchemeRuleRepository extends JpaRepository<SchemeRule, Long> {

    @Query("SELECT r FROM SchemeRule r JOIN FETCH r.scheme s "
            + "WHERE r.product.id = :productId AND s.active = true "
            + "AND (s.validFrom IS NULL OR s.validFrom <= :today) "
            + "AND (s.validTo IS NULL OR s.validTo >= :today)")
    List<SchemeRule> findActiveRules(@Param("productId") Long productId, @Param("today") LocalDate today);

    void deleteByProductId(Long productId);
}

package com.retailpos.pricing.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs")
@Data
public class AuditLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String actor;
    private String action; // e.g. "DELETE_PRODUCT", "UPDATE_SCHEME"

    @Column(length = 1000)
    private String details; // e.g. "Product 12 (Basmati Rice)"

    private LocalDateTime timestamp;

    @PrePersist
    protected void onCreate() {
        timestamp = LocalDateTime.now();
    }
}

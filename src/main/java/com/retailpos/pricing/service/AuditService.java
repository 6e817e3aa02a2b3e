package com.retailpos.pricing.service;

import com.retailpos.pricing.model.AuditLog;
import com.retailpos.pricing.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    public void log(String action, String details) {
        try {
            AuditLog log = new AuditLog();
            log.setAction(action);
            log.setDetails(details);
            log.setActor("SYSTEM");
            auditLogRepository.save(log);
        } catch (Exception e) {
            // Audit logging should not break catalog maintenance
            logger.warn("Failed to write audit log for {}: {}", action, e.getMessage());
        }
    }
}

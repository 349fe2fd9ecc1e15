package io.b2mash.eventops.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/** Database-backed implementation of {@link AuditService}. */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;
  private final TransactionTemplate requiresNewTemplate;

  public DatabaseAuditService(
      AuditEventRepository auditEventRepository, PlatformTransactionManager transactionManager) {
    this.auditEventRepository = auditEventRepository;
    this.requiresNewTemplate = new TransactionTemplate(transactionManager);
    this.requiresNewTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  @Override
  public void log(AuditEventRecord record) {
    try {
      requiresNewTemplate.executeWithoutResult(
          tx -> auditEventRepository.save(new AuditEvent(record)));
      log.debug(
          "Recorded audit event: type={}, entity={}/{}, actor={}",
          record.eventType(),
          record.entityType(),
          record.entityId(),
          record.actor());
    } catch (RuntimeException e) {
      log.error(
          "Failed to record audit event {} for {}/{}",
          record.eventType(),
          record.entityType(),
          record.entityId(),
          e);
    }
  }
}

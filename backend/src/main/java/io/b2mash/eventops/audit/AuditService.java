package io.b2mash.eventops.audit;

/**
 * Records activity for staff-facing history. Logging is best-effort: implementations never
 * propagate a failure to the caller of the main operation.
 */
public interface AuditService {

  /**
   * Records a single audit event in its own transaction, so a rollback of the caller does not
   * remove it and a failure here does not roll back the caller.
   */
  void log(AuditEventRecord record);
}

package io.b2mash.eventops.automation;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Claims a (template, event, recipient) slot before sending. Each claim commits in its own
 * transaction so a concurrent run sees it immediately.
 */
@Service
public class DispatchClaimService {

  private static final Logger log = LoggerFactory.getLogger(DispatchClaimService.class);

  private final DispatchClaimRepository repository;
  private final TransactionTemplate requiresNewTemplate;

  public DispatchClaimService(
      DispatchClaimRepository repository, PlatformTransactionManager transactionManager) {
    this.repository = repository;
    this.requiresNewTemplate = new TransactionTemplate(transactionManager);
    this.requiresNewTemplate.setPropagationBehavior(
        TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * @return the claim, or empty when another run already holds the slot
   */
  public Optional<DispatchClaim> tryClaim(String templateSlug, UUID eventId, String email) {
    String normalized = email.trim().toLowerCase(Locale.ROOT);
    try {
      var claim =
          requiresNewTemplate.execute(
              tx -> repository.saveAndFlush(new DispatchClaim(templateSlug, eventId, normalized)));
      return Optional.ofNullable(claim);
    } catch (DataIntegrityViolationException e) {
      log.debug(
          "Dispatch slot already claimed: template={}, event={}, recipient={}",
          templateSlug,
          eventId,
          normalized);
      return Optional.empty();
    }
  }

  /** Frees a slot after a failed send so a later run may retry it. */
  public void release(DispatchClaim claim) {
    try {
      requiresNewTemplate.executeWithoutResult(tx -> repository.deleteById(claim.getId()));
    } catch (RuntimeException e) {
      log.error(
          "Failed to release dispatch claim {} for template={}, event={}",
          claim.getId(),
          claim.getTemplateSlug(),
          claim.getEventId(),
          e);
    }
  }
}

package io.b2mash.eventops.integration.email;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmailDeliveryLogRepository extends JpaRepository<EmailDeliveryLog, UUID> {

  boolean existsByTemplateSlugAndEventIdAndRecipientEmailAndStatus(
      String templateSlug, UUID eventId, String recipientEmail, EmailDeliveryStatus status);

  List<EmailDeliveryLog> findByEventIdOrderByCreatedAtDesc(UUID eventId);
}

package io.b2mash.eventops.notification.template;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmailTemplateRepository extends JpaRepository<EmailTemplate, UUID> {

  List<EmailTemplate> findByActiveTrueOrderBySlugAsc();

  List<EmailTemplate> findAllByOrderBySlugAsc();
}

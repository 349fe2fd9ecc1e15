package io.b2mash.eventops.registration;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RegistrationRepository extends JpaRepository<Registration, UUID> {

  List<Registration> findByEventIdOrderByRegisteredAtAsc(UUID eventId);
}

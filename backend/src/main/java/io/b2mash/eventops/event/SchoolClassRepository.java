package io.b2mash.eventops.event;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SchoolClassRepository extends JpaRepository<SchoolClass, UUID> {

  List<SchoolClass> findByEventId(UUID eventId);

  List<SchoolClass> findByEventIdIn(Collection<UUID> eventIds);
}

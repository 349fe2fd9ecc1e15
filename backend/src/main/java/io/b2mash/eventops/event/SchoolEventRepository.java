package io.b2mash.eventops.event;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SchoolEventRepository extends JpaRepository<SchoolEvent, UUID> {

  List<SchoolEvent> findByEventDateBetweenOrderByEventDateAsc(LocalDate from, LocalDate to);
}

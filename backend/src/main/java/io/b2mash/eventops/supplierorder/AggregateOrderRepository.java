package io.b2mash.eventops.supplierorder;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AggregateOrderRepository extends JpaRepository<AggregateOrder, UUID> {

  Optional<AggregateOrder> findBySourceTaskId(UUID sourceTaskId);

  List<AggregateOrder> findByEventIdOrderByOrderDateAsc(UUID eventId);
}

package io.b2mash.eventops.supplierorder;

import io.b2mash.eventops.audit.AuditEventBuilder;
import io.b2mash.eventops.audit.AuditService;
import io.b2mash.eventops.exception.ResourceNotFoundException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AggregateOrderService {

  private static final Logger log = LoggerFactory.getLogger(AggregateOrderService.class);

  private final AggregateOrderRepository aggregateOrderRepository;
  private final AuditService auditService;

  public AggregateOrderService(
      AggregateOrderRepository aggregateOrderRepository, AuditService auditService) {
    this.aggregateOrderRepository = aggregateOrderRepository;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<AggregateOrder> listForEvent(UUID eventId) {
    return aggregateOrderRepository.findByEventIdOrderByOrderDateAsc(eventId);
  }

  @Transactional
  public AggregateOrder markArrived(UUID orderId, LocalDate arrivalDate, String actor) {
    var order =
        aggregateOrderRepository
            .findById(orderId)
            .orElseThrow(() -> new ResourceNotFoundException("AggregateOrder", orderId));
    order.markArrived(arrivalDate);
    order = aggregateOrderRepository.save(order);
    log.info("Aggregate order {} marked arrived on {}", orderId, arrivalDate);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("aggregate_order.arrived")
            .entityType("aggregate_order")
            .entityId(orderId)
            .actor(actor)
            .details(Map.of("arrival_date", arrivalDate.toString()))
            .build());
    return order;
  }
}

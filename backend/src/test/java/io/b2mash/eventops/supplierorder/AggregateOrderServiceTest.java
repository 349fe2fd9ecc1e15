package io.b2mash.eventops.supplierorder;

import static io.b2mash.eventops.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.eventops.audit.AuditEventRecord;
import io.b2mash.eventops.audit.AuditService;
import io.b2mash.eventops.exception.InvalidStateException;
import io.b2mash.eventops.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AggregateOrderServiceTest {

  @Mock private AggregateOrderRepository aggregateOrderRepository;
  @Mock private AuditService auditService;
  @InjectMocks private AggregateOrderService service;

  @Test
  void markArrived_setsDateAndAudits() {
    var orderId = UUID.randomUUID();
    var order = withId(newOrder(), orderId);
    when(aggregateOrderRepository.findById(orderId)).thenReturn(Optional.of(order));
    when(aggregateOrderRepository.save(order)).thenReturn(order);

    var result = service.markArrived(orderId, LocalDate.of(2026, 2, 28), "ops@minimusiker.de");

    assertThat(result.getArrivalDate()).isEqualTo(LocalDate.of(2026, 2, 28));
    var audit = ArgumentCaptor.forClass(AuditEventRecord.class);
    verify(auditService).log(audit.capture());
    assertThat(audit.getValue().eventType()).isEqualTo("aggregate_order.arrived");
    assertThat(audit.getValue().details()).containsEntry("arrival_date", "2026-02-28");
  }

  @Test
  void markArrived_rejectsSecondArrival() {
    var orderId = UUID.randomUUID();
    var order = withId(newOrder(), orderId);
    order.markArrived(LocalDate.of(2026, 2, 20));
    when(aggregateOrderRepository.findById(orderId)).thenReturn(Optional.of(order));

    assertThatThrownBy(() -> service.markArrived(orderId, LocalDate.of(2026, 2, 28), "ops"))
        .isInstanceOf(InvalidStateException.class);
    verify(aggregateOrderRepository, never()).save(any());
    verify(auditService, never()).log(any());
  }

  @Test
  void markArrived_unknownOrder() {
    var orderId = UUID.randomUUID();
    when(aggregateOrderRepository.findById(orderId)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.markArrived(orderId, LocalDate.of(2026, 2, 28), "ops"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  private static AggregateOrder newOrder() {
    return new AggregateOrder(
        UUID.randomUUID(),
        UUID.randomUUID(),
        new BigDecimal("120.00"),
        LocalDate.of(2026, 2, 10),
        List.of(),
        List.of(new OrderContentItem("tshirt-98/104", "T-Shirt 98/104", 4)));
  }
}

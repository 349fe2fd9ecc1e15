package io.b2mash.eventops.supplierorder;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AggregateOrderController {

  private final AggregateOrderService aggregateOrderService;

  public AggregateOrderController(AggregateOrderService aggregateOrderService) {
    this.aggregateOrderService = aggregateOrderService;
  }

  @GetMapping("/api/events/{eventId}/aggregate-orders")
  public ResponseEntity<List<AggregateOrderResponse>> listForEvent(@PathVariable UUID eventId) {
    return ResponseEntity.ok(
        aggregateOrderService.listForEvent(eventId).stream()
            .map(AggregateOrderResponse::from)
            .toList());
  }

  @PostMapping("/api/aggregate-orders/{orderId}/arrived")
  public ResponseEntity<AggregateOrderResponse> markArrived(
      @PathVariable UUID orderId, @Valid @RequestBody MarkArrivedRequest request) {
    var order =
        aggregateOrderService.markArrived(orderId, request.arrivalDate(), request.actorEmail());
    return ResponseEntity.ok(AggregateOrderResponse.from(order));
  }

  public record MarkArrivedRequest(@NotNull LocalDate arrivalDate, String actorEmail) {}

  public record AggregateOrderResponse(
      UUID id,
      UUID eventId,
      UUID sourceTaskId,
      List<UUID> sourceOrderIds,
      BigDecimal amount,
      LocalDate orderDate,
      List<OrderContentItem> contents,
      LocalDate arrivalDate) {

    public static AggregateOrderResponse from(AggregateOrder order) {
      return new AggregateOrderResponse(
          order.getId(),
          order.getEventId(),
          order.getSourceTaskId(),
          order.getSourceOrderIds(),
          order.getAmount(),
          order.getOrderDate(),
          order.getContents(),
          order.getArrivalDate());
    }
  }
}

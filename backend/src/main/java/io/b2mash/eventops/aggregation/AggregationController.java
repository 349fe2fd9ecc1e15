package io.b2mash.eventops.aggregation;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AggregationController {

  private final OrderAggregationService aggregationService;

  public AggregationController(OrderAggregationService aggregationService) {
    this.aggregationService = aggregationService;
  }

  @GetMapping("/api/aggregation/clothing")
  public ResponseEntity<List<EventOrderGroup>> pendingClothingOrders() {
    return ResponseEntity.ok(aggregationService.pendingClothingOrders());
  }

  @GetMapping("/api/aggregation/minicards")
  public ResponseEntity<List<EventOrderGroup>> pendingMinicardOrders() {
    return ResponseEntity.ok(aggregationService.pendingMinicardOrders());
  }

  @PostMapping("/api/aggregation/clothing/{eventId}/complete")
  public ResponseEntity<CompleteClothingOrderResponse> completeClothingOrder(
      @PathVariable UUID eventId, @Valid @RequestBody CompleteClothingOrderRequest request) {
    var result =
        aggregationService.completeClothingOrder(
            eventId, request.amount(), request.notes(), request.orderIds(), request.actorEmail());
    return ResponseEntity.ok(
        new CompleteClothingOrderResponse(
            result.task().getId(), result.orderId(), result.followUpTaskId()));
  }

  public record CompleteClothingOrderRequest(
      @NotNull @PositiveOrZero BigDecimal amount,
      String notes,
      List<UUID> orderIds,
      @NotBlank @Email String actorEmail) {}

  public record CompleteClothingOrderResponse(UUID taskId, UUID orderId, UUID followUpTaskId) {}
}

package io.b2mash.eventops.supplierorder;

import io.b2mash.eventops.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Supplier order created when an order-producing task is completed. There is at most one per
 * source task; the unique {@code source_task_id} column enforces it.
 */
@Entity
@Table(name = "aggregate_orders")
public class AggregateOrder {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_id", nullable = false)
  private UUID eventId;

  @Column(name = "source_task_id", nullable = false, unique = true)
  private UUID sourceTaskId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "source_order_ids", columnDefinition = "jsonb")
  private List<UUID> sourceOrderIds = new ArrayList<>();

  @Column(name = "amount", precision = 12, scale = 2)
  private BigDecimal amount;

  @Column(name = "order_date", nullable = false)
  private LocalDate orderDate;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "contents", columnDefinition = "jsonb")
  private List<OrderContentItem> contents = new ArrayList<>();

  @Column(name = "arrival_date")
  private LocalDate arrivalDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected AggregateOrder() {}

  public AggregateOrder(
      UUID eventId,
      UUID sourceTaskId,
      BigDecimal amount,
      LocalDate orderDate,
      List<UUID> sourceOrderIds,
      List<OrderContentItem> contents) {
    this.eventId = eventId;
    this.sourceTaskId = sourceTaskId;
    this.amount = amount;
    this.orderDate = orderDate;
    this.sourceOrderIds =
        sourceOrderIds != null ? new ArrayList<>(sourceOrderIds) : new ArrayList<>();
    this.contents = contents != null ? new ArrayList<>(contents) : new ArrayList<>();
    this.createdAt = Instant.now();
  }

  public void markArrived(LocalDate date) {
    if (arrivalDate != null) {
      throw new InvalidStateException(
          "Order already arrived", "Order " + id + " arrived on " + arrivalDate);
    }
    this.arrivalDate = date;
  }

  public UUID getId() {
    return id;
  }

  public UUID getEventId() {
    return eventId;
  }

  public UUID getSourceTaskId() {
    return sourceTaskId;
  }

  public List<UUID> getSourceOrderIds() {
    return sourceOrderIds != null ? sourceOrderIds : List.of();
  }

  public BigDecimal getAmount() {
    return amount;
  }

  public LocalDate getOrderDate() {
    return orderDate;
  }

  public List<OrderContentItem> getContents() {
    return contents != null ? contents : List.of();
  }

  public LocalDate getArrivalDate() {
    return arrivalDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}

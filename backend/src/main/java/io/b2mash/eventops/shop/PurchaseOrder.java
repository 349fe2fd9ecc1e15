package io.b2mash.eventops.shop;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Read-only copy of a shop order. Written by the shop sync; this service only reads it. An order
 * links to its event directly or through the class of the child it was bought for.
 */
@Entity
@Table(name = "purchase_orders")
public class PurchaseOrder {

  public static final String PAYMENT_STATUS_PAID = "paid";

  @Id private UUID id;

  @Column(name = "order_number", nullable = false, length = 50)
  private String orderNumber;

  @Column(name = "ordered_at", nullable = false)
  private Instant orderedAt;

  @Column(name = "payment_status", nullable = false, length = 30)
  private String paymentStatus;

  @Column(name = "event_id")
  private UUID eventId;

  @Column(name = "class_id")
  private UUID classId;

  @Column(name = "parent_id")
  private UUID parentId;

  @Column(name = "total_amount", precision = 12, scale = 2)
  private BigDecimal totalAmount;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "line_items", columnDefinition = "jsonb")
  private List<LineItem> lineItems = new ArrayList<>();

  protected PurchaseOrder() {}

  public PurchaseOrder(
      UUID id,
      String orderNumber,
      Instant orderedAt,
      String paymentStatus,
      UUID eventId,
      UUID classId,
      UUID parentId,
      BigDecimal totalAmount,
      List<LineItem> lineItems) {
    this.id = id;
    this.orderNumber = orderNumber;
    this.orderedAt = orderedAt;
    this.paymentStatus = paymentStatus;
    this.eventId = eventId;
    this.classId = classId;
    this.parentId = parentId;
    this.totalAmount = totalAmount;
    this.lineItems = lineItems != null ? new ArrayList<>(lineItems) : new ArrayList<>();
  }

  public boolean isPaid() {
    return PAYMENT_STATUS_PAID.equalsIgnoreCase(paymentStatus);
  }

  public UUID getId() {
    return id;
  }

  public String getOrderNumber() {
    return orderNumber;
  }

  public Instant getOrderedAt() {
    return orderedAt;
  }

  public String getPaymentStatus() {
    return paymentStatus;
  }

  public UUID getEventId() {
    return eventId;
  }

  public UUID getClassId() {
    return classId;
  }

  public UUID getParentId() {
    return parentId;
  }

  public BigDecimal getTotalAmount() {
    return totalAmount;
  }

  public List<LineItem> getLineItems() {
    return lineItems != null ? lineItems : List.of();
  }
}

package io.b2mash.eventops.aggregation;

import io.b2mash.eventops.supplierorder.OrderContentItem;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Shop orders of one event that still need a supplier order.
 *
 * @param deadline internal day by which the supplier order has to be placed
 * @param daysUntilDeadline whole days from today to the deadline, negative when overdue
 * @param items quantities per sku, summed over all orders
 */
public record EventOrderGroup(
    UUID eventId,
    String eventCode,
    String schoolName,
    LocalDate eventDate,
    LocalDate deadline,
    long daysUntilDeadline,
    boolean overdue,
    int totalOrders,
    BigDecimal totalRevenue,
    List<OrderContentItem> items,
    List<UUID> orderIds) {}

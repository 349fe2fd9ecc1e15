package io.b2mash.eventops.task;

import io.b2mash.eventops.supplierorder.OrderContentItem;
import java.util.List;
import java.util.UUID;

/** Caller-supplied detail copied onto the aggregate order a completion creates. */
public record OrderEnrichment(List<UUID> sourceOrderIds, List<OrderContentItem> contents) {

  public OrderEnrichment {
    sourceOrderIds = sourceOrderIds != null ? List.copyOf(sourceOrderIds) : List.of();
    contents = contents != null ? List.copyOf(contents) : List.of();
  }

  public static OrderEnrichment none() {
    return new OrderEnrichment(List.of(), List.of());
  }
}

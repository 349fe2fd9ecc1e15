package io.b2mash.eventops.schedule;

import java.util.Comparator;
import java.util.function.ToLongFunction;

/** Sort order for deadline lists: overdue items first, then fewest days left. */
public final class UrgencyOrder {

  private UrgencyOrder() {}

  public static <T> Comparator<T> mostUrgentFirst(ToLongFunction<T> daysUntilDeadline) {
    Comparator<T> overdueFirst =
        Comparator.comparingInt((T item) -> daysUntilDeadline.applyAsLong(item) < 0 ? 0 : 1);
    return overdueFirst.thenComparingLong(daysUntilDeadline);
  }
}

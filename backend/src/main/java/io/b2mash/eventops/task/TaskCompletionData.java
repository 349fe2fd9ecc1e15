package io.b2mash.eventops.task;

import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/** What the staff member entered when completing a task. All fields are optional. */
public record TaskCompletionData(
    @PositiveOrZero BigDecimal amount,
    @Size(max = 2000) String invoiceUrl,
    Boolean confirmed,
    @Size(max = 5000) String notes) {

  public static TaskCompletionData empty() {
    return new TaskCompletionData(null, null, null, null);
  }

  /** Serialized form stored on the task; absent fields are omitted. */
  public Map<String, Object> toMap() {
    var map = new LinkedHashMap<String, Object>();
    if (amount != null) {
      map.put("amount", amount);
    }
    if (invoiceUrl != null) {
      map.put("invoice_url", invoiceUrl);
    }
    if (confirmed != null) {
      map.put("confirmed", confirmed);
    }
    if (notes != null) {
      map.put("notes", notes);
    }
    return map;
  }
}

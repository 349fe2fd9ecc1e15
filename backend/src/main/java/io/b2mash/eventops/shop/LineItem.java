package io.b2mash.eventops.shop;

import java.math.BigDecimal;

/** One line of a shop order, stored as JSON on the order row. */
public record LineItem(String variantId, String productTitle, int quantity, BigDecimal total) {

  /** Variant id without the shop's global-id prefix. */
  public String numericVariantId() {
    if (variantId == null) {
      return "";
    }
    int slash = variantId.lastIndexOf('/');
    return slash >= 0 ? variantId.substring(slash + 1) : variantId;
  }
}

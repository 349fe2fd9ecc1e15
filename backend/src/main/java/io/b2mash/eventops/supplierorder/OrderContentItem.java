package io.b2mash.eventops.supplierorder;

/** One position of an aggregate supplier order, e.g. {@code tshirt-122/128 x 14}. */
public record OrderContentItem(String sku, String name, int quantity) {}

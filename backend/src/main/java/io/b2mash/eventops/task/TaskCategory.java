package io.b2mash.eventops.task;

public enum TaskCategory {
  PAPER_ORDER,
  CLOTHING_ORDER,
  SHIPPING
}

package io.b2mash.eventops.integration.email;

public enum EmailDeliveryStatus {
  SENT,
  FAILED,
  SKIPPED
}

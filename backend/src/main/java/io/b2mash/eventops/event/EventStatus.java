package io.b2mash.eventops.event;

/** Lifecycle status of a school event. Events are never hard-deleted. */
public enum EventStatus {
  ACTIVE,
  CANCELLED,
  DELETED
}

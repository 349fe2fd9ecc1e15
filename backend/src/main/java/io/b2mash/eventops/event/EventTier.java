package io.b2mash.eventops.event;

/** Product tier of an event, used to select applicable email templates. */
public enum EventTier {
  PLUS,
  MINIMUSIKERTAG,
  SCHULSONG
}

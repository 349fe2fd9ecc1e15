package io.b2mash.eventops.notification.template;

/** Recipient role a campaign template targets. A template may target several. */
public enum Audience {
  TEACHER,
  PARENT,
  NON_BUYER
}

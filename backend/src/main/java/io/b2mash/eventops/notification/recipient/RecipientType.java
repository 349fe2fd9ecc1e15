package io.b2mash.eventops.notification.recipient;

/** Recipient kind as written to the delivery log. */
public enum RecipientType {
  TEACHER("teacher"),
  PARENT("parent"),
  NON_BUYER("non-buyer");

  private final String logValue;

  RecipientType(String logValue) {
    this.logValue = logValue;
  }

  public String logValue() {
    return logValue;
  }

  /** Parent-side mail carries an unsubscribe link; teacher mail does not. */
  public boolean isParentFacing() {
    return this != TEACHER;
  }
}

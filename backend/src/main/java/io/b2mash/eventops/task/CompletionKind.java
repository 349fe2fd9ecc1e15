package io.b2mash.eventops.task;

/** What the staff member has to enter when completing a task. */
public enum CompletionKind {
  /** An order amount, optionally with invoice link. */
  MONETARY,
  CHECKBOX,
  SUBMIT_ONLY
}

package io.b2mash.eventops.automation;

import io.b2mash.eventops.notification.template.RenderedEmail;

public record TestEmailResult(
    boolean success, String messageId, String error, RenderedEmail renderedPreview) {

  static TestEmailResult failure(String error) {
    return new TestEmailResult(false, null, error, null);
  }
}

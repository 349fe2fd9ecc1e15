package io.b2mash.eventops.integration.email;

import java.util.Map;
import java.util.Objects;

/**
 * Provider-agnostic email payload.
 *
 * @param headers extra MIME headers such as {@code List-Unsubscribe}; may be empty
 */
public record EmailMessage(
    String to,
    String subject,
    String htmlBody,
    String plainTextBody,
    String replyTo,
    Map<String, String> headers) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    headers = headers != null ? Map.copyOf(headers) : Map.of();
  }
}

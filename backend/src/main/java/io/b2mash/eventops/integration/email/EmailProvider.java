package io.b2mash.eventops.integration.email;

/** Port for handing a message to an external mail provider. */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"), recorded on every delivery log entry. */
  String providerId();

  /**
   * Sends one message. Provider failures are reported through the result, not thrown; the provider
   * only confirms synchronous acceptance.
   */
  SendResult sendEmail(EmailMessage message);
}

package io.b2mash.eventops.integration.email;

import io.b2mash.eventops.contact.ParentContactRepository;
import io.b2mash.eventops.exception.InvalidStateException;
import io.b2mash.eventops.exception.ResourceNotFoundException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.UUID;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Signed one-click unsubscribe links for parent campaign mail. A token is the base64url payload
 * {@code <parentId>:campaigns} followed by its HMAC-SHA256 signature.
 */
@Service
public class UnsubscribeService {

  private static final Logger log = LoggerFactory.getLogger(UnsubscribeService.class);
  private static final String HMAC_ALGORITHM = "HmacSHA256";
  private static final String SCOPE = "campaigns";

  private final String unsubscribeSecret;
  private final String appBaseUrl;
  private final ParentContactRepository parentContactRepository;

  public UnsubscribeService(
      @Value("${eventops.email.unsubscribe-secret:}") String unsubscribeSecret,
      @Value("${eventops.app.base-url:http://localhost:3000}") String appBaseUrl,
      ParentContactRepository parentContactRepository) {
    this.unsubscribeSecret = unsubscribeSecret;
    this.appBaseUrl = appBaseUrl;
    this.parentContactRepository = parentContactRepository;
  }

  public String generateToken(UUID parentId) {
    validateSecretConfigured();
    var encoder = Base64.getUrlEncoder().withoutPadding();
    byte[] payloadBytes = (parentId + ":" + SCOPE).getBytes(StandardCharsets.UTF_8);
    return encoder.encodeToString(payloadBytes) + ":" + encoder.encodeToString(hmac(payloadBytes));
  }

  public String unsubscribeUrl(UUID parentId) {
    return appBaseUrl + "/api/email/unsubscribe?token=" + generateToken(parentId);
  }

  public UUID verifyToken(String token) {
    validateSecretConfigured();
    int separatorIndex = token.lastIndexOf(':');
    if (separatorIndex < 0) {
      throw new InvalidStateException("Invalid Token", "Malformed unsubscribe token");
    }

    byte[] payloadBytes;
    byte[] providedHmac;
    try {
      var decoder = Base64.getUrlDecoder();
      payloadBytes = decoder.decode(token.substring(0, separatorIndex));
      providedHmac = decoder.decode(token.substring(separatorIndex + 1));
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid Token", "Malformed unsubscribe token");
    }

    if (!MessageDigest.isEqual(hmac(payloadBytes), providedHmac)) {
      throw new InvalidStateException("Invalid Token", "Invalid unsubscribe token");
    }

    String[] parts = new String(payloadBytes, StandardCharsets.UTF_8).split(":", 2);
    if (parts.length != 2 || !SCOPE.equals(parts[1])) {
      throw new InvalidStateException("Invalid Token", "Malformed unsubscribe token payload");
    }
    try {
      return UUID.fromString(parts[0]);
    } catch (IllegalArgumentException e) {
      throw new InvalidStateException("Invalid Token", "Malformed unsubscribe token payload");
    }
  }

  /** Opts the parent named by the token out of campaign mail and returns a confirmation page. */
  @Transactional
  public String processUnsubscribe(String token) {
    UUID parentId = verifyToken(token);
    var parent =
        parentContactRepository
            .findById(parentId)
            .orElseThrow(() -> new ResourceNotFoundException("Parent", parentId));
    parent.optOutOfCampaigns();
    parentContactRepository.save(parent);
    log.info("Parent {} unsubscribed from campaign emails", parentId);
    return CONFIRMATION_HTML;
  }

  private byte[] hmac(byte[] data) {
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(
          new SecretKeySpec(unsubscribeSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to compute unsubscribe HMAC", e);
    }
  }

  private void validateSecretConfigured() {
    if (unsubscribeSecret == null || unsubscribeSecret.isBlank()) {
      log.warn("Unsubscribe secret is not configured (eventops.email.unsubscribe-secret)");
      throw new InvalidStateException(
          "Not Configured", "Unsubscribe functionality is not configured");
    }
  }

  private static final String CONFIRMATION_HTML =
      """
      <!DOCTYPE html>
      <html lang="de">
      <head>
        <meta charset="UTF-8">
        <title>Abgemeldet</title>
        <style>
          body {
            font-family: sans-serif; max-width: 600px; margin: 80px auto;
            text-align: center; color: #333;
          }
          h1 { font-size: 1.5rem; margin-bottom: 1rem; }
          p  { color: #666; }
        </style>
      </head>
      <body>
        <h1>Du wurdest abgemeldet</h1>
        <p>Du erhältst keine weiteren Info-E-Mails zu Minimusiker-Veranstaltungen.</p>
      </body>
      </html>
      """;
}

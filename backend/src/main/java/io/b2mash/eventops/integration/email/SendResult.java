package io.b2mash.eventops.integration.email;

public record SendResult(boolean success, String providerMessageId, String errorMessage) {

  public static SendResult failure(String errorMessage) {
    return new SendResult(false, null, errorMessage);
  }
}

package io.b2mash.eventops.notification.template;

public record RenderedEmail(String subject, String htmlBody, String plainTextBody) {}

package io.b2mash.eventops.automation;

import io.b2mash.eventops.integration.email.SendResult;

/** Result of one campaign send attempt, including whether the hourly cap refused it. */
public record CampaignSendOutcome(SendResult result, String providerSlug, boolean rateLimited) {}

package io.b2mash.eventops.automation;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.eventops.integration.email.EmailDeliveryLogService;
import io.b2mash.eventops.integration.email.EmailRateLimiter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AutomationController.class)
class AutomationControllerTest {

  @Autowired private MockMvc mockMvc;
  @MockBean private NotificationTriggerService triggerService;
  @MockBean private EmailDeliveryLogService deliveryLogService;
  @MockBean private CampaignEmailSender emailSender;

  @Test
  void rateLimit_reportsHourlyUsageOfProvider() throws Exception {
    when(emailSender.providerSlug()).thenReturn("smtp");
    when(emailSender.rateLimitStatus())
        .thenReturn(new EmailRateLimiter.RateLimitStatus(500, 500, false));

    mockMvc
        .perform(get("/api/internal/automation/rate-limit"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.provider").value("smtp"))
        .andExpect(jsonPath("$.sentThisHour").value(500))
        .andExpect(jsonPath("$.hourlyLimit").value(500))
        .andExpect(jsonPath("$.allowed").value(false));
  }
}

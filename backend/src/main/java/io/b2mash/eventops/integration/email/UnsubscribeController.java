package io.b2mash.eventops.integration.email;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/email")
public class UnsubscribeController {

  private final UnsubscribeService unsubscribeService;

  public UnsubscribeController(UnsubscribeService unsubscribeService) {
    this.unsubscribeService = unsubscribeService;
  }

  @GetMapping("/unsubscribe")
  public ResponseEntity<String> unsubscribe(@RequestParam String token) {
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_HTML)
        .body(unsubscribeService.processUnsubscribe(token));
  }

  /** RFC 8058 one-click endpoint, called by mail clients via {@code List-Unsubscribe-Post}. */
  @PostMapping("/unsubscribe")
  public ResponseEntity<Void> oneClickUnsubscribe(@RequestParam String token) {
    unsubscribeService.processUnsubscribe(token);
    return ResponseEntity.noContent().build();
  }
}

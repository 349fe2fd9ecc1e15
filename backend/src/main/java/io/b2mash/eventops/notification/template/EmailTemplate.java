package io.b2mash.eventops.notification.template;

import io.b2mash.eventops.event.EventTier;
import io.b2mash.eventops.event.SchoolEvent;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A campaign email fired relative to the event date. Authored outside this service; only the
 * active flag is changed here.
 */
@Entity
@Table(name = "email_templates")
public class EmailTemplate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "slug", nullable = false, length = 100, unique = true)
  private String slug;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "audiences", columnDefinition = "jsonb", nullable = false)
  private List<Audience> audiences = new ArrayList<>();

  /** Signed day offset from the event date; negative fires before the event. */
  @Column(name = "trigger_offset_days", nullable = false)
  private int triggerOffsetDays;

  /** Hour of day (0-23, platform-home time) at which the template fires. */
  @Column(name = "trigger_hour", nullable = false)
  private int triggerHour;

  @Column(name = "subject", nullable = false, length = 500)
  private String subject;

  @Column(name = "body_html", nullable = false, columnDefinition = "TEXT")
  private String bodyHtml;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Enumerated(EnumType.STRING)
  @Column(name = "tier", length = 30)
  private EventTier tier;

  @Column(name = "only_under_100", nullable = false)
  private boolean onlyUnder100;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected EmailTemplate() {}

  public EmailTemplate(
      String slug,
      String name,
      List<Audience> audiences,
      int triggerOffsetDays,
      int triggerHour,
      String subject,
      String bodyHtml) {
    this.slug = slug;
    this.name = name;
    this.audiences = audiences != null ? new ArrayList<>(audiences) : new ArrayList<>();
    this.triggerOffsetDays = triggerOffsetDays;
    this.triggerHour = triggerHour;
    this.subject = subject;
    this.bodyHtml = bodyHtml;
    this.active = true;
    this.updatedAt = Instant.now();
  }

  public void restrictTo(EventTier tier, boolean onlyUnder100) {
    this.tier = tier;
    this.onlyUnder100 = onlyUnder100;
    this.updatedAt = Instant.now();
  }

  public void setActive(boolean active) {
    this.active = active;
    this.updatedAt = Instant.now();
  }

  /** Tier must match exactly when the template names one; the size filter is optional. */
  public boolean appliesTo(SchoolEvent event) {
    if (tier != null && event.getTier() != tier) {
      return false;
    }
    return !onlyUnder100 || event.isUnder100();
  }

  public UUID getId() {
    return id;
  }

  public String getSlug() {
    return slug;
  }

  public String getName() {
    return name;
  }

  public List<Audience> getAudiences() {
    return audiences != null ? audiences : List.of();
  }

  public int getTriggerOffsetDays() {
    return triggerOffsetDays;
  }

  public int getTriggerHour() {
    return triggerHour;
  }

  public String getSubject() {
    return subject;
  }

  public String getBodyHtml() {
    return bodyHtml;
  }

  public boolean isActive() {
    return active;
  }

  public EventTier getTier() {
    return tier;
  }

  public boolean isOnlyUnder100() {
    return onlyUnder100;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

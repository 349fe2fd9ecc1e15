package io.b2mash.eventops.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "school_events")
public class SchoolEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_code", nullable = false, length = 100, unique = true)
  private String eventCode;

  @Column(name = "school_name", nullable = false, length = 300)
  private String schoolName;

  @Column(name = "event_date")
  private LocalDate eventDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private EventStatus status;

  @Column(name = "is_plus", nullable = false)
  private boolean plus;

  @Column(name = "is_minimusikertag", nullable = false)
  private boolean minimusikertag;

  @Column(name = "is_schulsong", nullable = false)
  private boolean schulsong;

  @Column(name = "is_kita", nullable = false)
  private boolean kita;

  @Column(name = "is_under_100", nullable = false)
  private boolean under100;

  @Column(name = "access_code", length = 50)
  private String accessCode;

  @Column(name = "contact_name", length = 200)
  private String contactName;

  @Column(name = "contact_email", length = 320)
  private String contactEmail;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "teacher_ids", columnDefinition = "jsonb")
  private List<UUID> teacherIds = new ArrayList<>();

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "staff_ids", columnDefinition = "jsonb")
  private List<UUID> staffIds = new ArrayList<>();

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected SchoolEvent() {}

  public SchoolEvent(String eventCode, String schoolName, LocalDate eventDate) {
    this.eventCode = eventCode;
    this.schoolName = schoolName;
    this.eventDate = eventDate;
    this.status = EventStatus.ACTIVE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void setTierFlags(boolean plus, boolean minimusikertag, boolean schulsong) {
    this.plus = plus;
    this.minimusikertag = minimusikertag;
    this.schulsong = schulsong;
    this.updatedAt = Instant.now();
  }

  public void setSizeAndKind(boolean under100, boolean kita) {
    this.under100 = under100;
    this.kita = kita;
    this.updatedAt = Instant.now();
  }

  public void setAccessCode(String accessCode) {
    this.accessCode = accessCode;
    this.updatedAt = Instant.now();
  }

  public void setBookingContact(String contactName, String contactEmail) {
    this.contactName = contactName;
    this.contactEmail = contactEmail;
    this.updatedAt = Instant.now();
  }

  public void setTeacherIds(List<UUID> teacherIds) {
    this.teacherIds = teacherIds != null ? new ArrayList<>(teacherIds) : new ArrayList<>();
    this.updatedAt = Instant.now();
  }

  public void setStaffIds(List<UUID> staffIds) {
    this.staffIds = staffIds != null ? new ArrayList<>(staffIds) : new ArrayList<>();
    this.updatedAt = Instant.now();
  }

  public void reschedule(LocalDate newDate) {
    this.eventDate = newDate;
    this.updatedAt = Instant.now();
  }

  public void cancel() {
    this.status = EventStatus.CANCELLED;
    this.updatedAt = Instant.now();
  }

  public boolean isActive() {
    return status == EventStatus.ACTIVE;
  }

  /** Derived tier: PLUS wins over Minimusikertag, which wins over Schulsong. */
  public EventTier getTier() {
    if (plus) {
      return EventTier.PLUS;
    }
    if (minimusikertag) {
      return EventTier.MINIMUSIKERTAG;
    }
    if (schulsong) {
      return EventTier.SCHULSONG;
    }
    return EventTier.MINIMUSIKERTAG;
  }

  public UUID getId() {
    return id;
  }

  public String getEventCode() {
    return eventCode;
  }

  public String getSchoolName() {
    return schoolName;
  }

  public LocalDate getEventDate() {
    return eventDate;
  }

  public EventStatus getStatus() {
    return status;
  }

  public boolean isPlus() {
    return plus;
  }

  public boolean isMinimusikertag() {
    return minimusikertag;
  }

  public boolean isSchulsong() {
    return schulsong;
  }

  public boolean isKita() {
    return kita;
  }

  public boolean isUnder100() {
    return under100;
  }

  public String getAccessCode() {
    return accessCode;
  }

  public String getContactName() {
    return contactName;
  }

  public String getContactEmail() {
    return contactEmail;
  }

  public List<UUID> getTeacherIds() {
    return teacherIds != null ? teacherIds : List.of();
  }

  public List<UUID> getStaffIds() {
    return staffIds != null ? staffIds : List.of();
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}

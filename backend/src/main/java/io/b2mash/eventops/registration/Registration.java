package io.b2mash.eventops.registration;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A child registered for an event by a parent. Placeholder registrations reserve a class slot
 * before any parent signs up and carry no parent link.
 */
@Entity
@Table(name = "registrations")
public class Registration {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_id", nullable = false)
  private UUID eventId;

  @Column(name = "class_id")
  private UUID classId;

  @Column(name = "parent_id")
  private UUID parentId;

  @Column(name = "child_name", length = 200)
  private String childName;

  @Column(name = "is_placeholder", nullable = false)
  private boolean placeholder;

  @Column(name = "registered_at", nullable = false, updatable = false)
  private Instant registeredAt;

  protected Registration() {}

  public Registration(
      UUID eventId, UUID classId, UUID parentId, String childName, boolean placeholder) {
    this.eventId = eventId;
    this.classId = classId;
    this.parentId = parentId;
    this.childName = childName;
    this.placeholder = placeholder;
    this.registeredAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getEventId() {
    return eventId;
  }

  public UUID getClassId() {
    return classId;
  }

  public UUID getParentId() {
    return parentId;
  }

  public String getChildName() {
    return childName;
  }

  public boolean isPlaceholder() {
    return placeholder;
  }

  public Instant getRegisteredAt() {
    return registeredAt;
  }
}

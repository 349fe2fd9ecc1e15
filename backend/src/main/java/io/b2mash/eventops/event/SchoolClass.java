package io.b2mash.eventops.event;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;

/** A class taking part in an event. Purchase orders may link to an event only through a class. */
@Entity
@Table(name = "school_classes")
public class SchoolClass {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_id", nullable = false)
  private UUID eventId;

  @Column(name = "class_name", nullable = false, length = 200)
  private String className;

  protected SchoolClass() {}

  public SchoolClass(UUID eventId, String className) {
    this.eventId = eventId;
    this.className = className;
  }

  public UUID getId() {
    return id;
  }

  public UUID getEventId() {
    return eventId;
  }

  public String getClassName() {
    return className;
  }
}

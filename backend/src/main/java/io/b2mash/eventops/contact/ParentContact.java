package io.b2mash.eventops.contact;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "parents")
public class ParentContact {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "email", length = 320)
  private String email;

  @Column(name = "first_name", length = 200)
  private String firstName;

  @Column(name = "email_campaigns_opt_out", nullable = false)
  private boolean emailCampaignsOptOut;

  @Column(name = "opted_out_at")
  private Instant optedOutAt;

  protected ParentContact() {}

  public ParentContact(String email, String firstName) {
    this.email = email;
    this.firstName = firstName;
  }

  /** Stops campaign mail for this parent. Repeated calls keep the first timestamp. */
  public void optOutOfCampaigns() {
    if (!emailCampaignsOptOut) {
      this.emailCampaignsOptOut = true;
      this.optedOutAt = Instant.now();
    }
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getFirstName() {
    return firstName;
  }

  public boolean isEmailCampaignsOptOut() {
    return emailCampaignsOptOut;
  }

  public Instant getOptedOutAt() {
    return optedOutAt;
  }
}

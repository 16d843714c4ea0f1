package io.veomenu.backend.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A verified account. Users are only created by a successful registration verification; there is
 * no password column because every login is passwordless.
 */
@Entity
@Table(name = "users")
public class User {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "email", nullable = false, unique = true, length = 255)
  private String email;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "phone", length = 20)
  private String phone;

  @Column(name = "phone_verified", nullable = false)
  private boolean phoneVerified;

  @Column(name = "language", nullable = false, length = 10)
  private String language;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "date_joined", nullable = false, updatable = false)
  private Instant dateJoined;

  @Column(name = "last_login")
  private Instant lastLogin;

  protected User() {}

  public User(String email, String name, String phone, String language, Instant dateJoined) {
    this.email = email;
    this.name = name;
    this.phone = phone;
    this.language = language != null ? language : "en";
    this.active = true;
    this.dateJoined = dateJoined;
  }

  /** Applies the non-null fields. The phone only changes through {@link #confirmPhone}. */
  public void updateProfile(String name, String language) {
    if (name != null) {
      this.name = name;
    }
    if (language != null) {
      this.language = language;
    }
  }

  /** Records a phone number the user proved they receive texts on. */
  public void confirmPhone(String phone) {
    this.phone = phone;
    this.phoneVerified = true;
  }

  public void recordLogin(Instant at) {
    this.lastLogin = at;
  }

  public void deactivate() {
    this.active = false;
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public String getPhone() {
    return phone;
  }

  public boolean isPhoneVerified() {
    return phoneVerified;
  }

  public String getLanguage() {
    return language;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getDateJoined() {
    return dateJoined;
  }

  public Instant getLastLogin() {
    return lastLogin;
  }
}

package io.veomenu.backend.session;

/** Client details captured when a session is created. */
public record DeviceMetadata(String userAgent, String ipAddress) {

  public static DeviceMetadata unknown() {
    return new DeviceMetadata(null, null);
  }

  public String deviceType() {
    return userAgent != null && userAgent.contains("Mobile") ? "mobile" : "desktop";
  }
}

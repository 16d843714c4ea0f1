package io.veomenu.backend.security;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Client address recorded on magic links, registration challenges and sessions. Proxy headers are
 * applied to {@link HttpServletRequest#getRemoteAddr()} by {@code server.forward-headers-strategy}
 * before this runs, so the remote address is the only input.
 */
public final class ClientIpResolver {

  /** Width of the {@code created_ip} and {@code ip_address} columns; fits any IPv6 text form. */
  static final int MAX_LENGTH = 45;

  private ClientIpResolver() {}

  /**
   * @return the client address, or null when it is missing or too long to be an IP address
   */
  public static String resolve(HttpServletRequest request) {
    String address = request.getRemoteAddr();
    if (address == null) {
      return null;
    }
    address = address.trim();
    if (address.isEmpty() || address.length() > MAX_LENGTH) {
      return null;
    }
    return address;
  }
}

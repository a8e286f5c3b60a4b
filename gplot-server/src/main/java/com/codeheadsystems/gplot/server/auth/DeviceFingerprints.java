package com.codeheadsystems.gplot.server.auth;

import com.codeheadsystems.gplot.server.util.Digests;

/**
 * Derives device fingerprints used to bind tokens to a client.
 */
public final class DeviceFingerprints {

  private static final String UNKNOWN = "unknown";

  private DeviceFingerprints() {
  }

  /**
   * SHA-256 hex of {@code "userAgent:clientAddress"}, with {@code unknown} for missing parts.
   *
   * @param userAgent     the User-Agent header, may be null
   * @param clientAddress the remote address, may be null
   * @return the fingerprint
   */
  public static String of(String userAgent, String clientAddress) {
    String agent = userAgent == null || userAgent.isEmpty() ? UNKNOWN : userAgent;
    String address = clientAddress == null || clientAddress.isEmpty() ? UNKNOWN : clientAddress;
    return Digests.sha256Hex(agent + ":" + address);
  }
}

package com.codeheadsystems.gplot.server.util;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

/**
 * SHA-256 helpers for values that are safe to log or persist.
 */
public final class Digests {

  private Digests() {
  }

  /**
   * Lower-case hex SHA-256 of the given bytes.
   *
   * @param input the input
   * @return the hex digest
   */
  public static String sha256Hex(byte[] input) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(out);
  }

  /**
   * Lower-case hex SHA-256 of the UTF-8 encoding of the given string.
   *
   * @param input the input
   * @return the hex digest
   */
  public static String sha256Hex(String input) {
    return sha256Hex(input.getBytes(StandardCharsets.UTF_8));
  }
}

package com.codeheadsystems.gplot.server.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Whole-file replacement through a sibling temp file.
 */
public final class AtomicFiles {

  private AtomicFiles() {
  }

  /**
   * Writes the bytes to a temp file next to the target, then moves it over the target.
   * Falls back to a plain replacing move where the file system has no atomic rename.
   *
   * @param target the file to replace
   * @param bytes  the new content
   * @throws IOException if the write or move fails
   */
  public static void write(Path target, byte[] bytes) throws IOException {
    Path dir = target.toAbsolutePath().getParent();
    Files.createDirectories(dir);
    Path temp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
    try {
      Files.write(temp, bytes);
      try {
        Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }
}

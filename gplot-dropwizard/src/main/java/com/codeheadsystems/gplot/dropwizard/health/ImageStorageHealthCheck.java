package com.codeheadsystems.gplot.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Health check that verifies the image storage directory exists and is writable.
 */
public class ImageStorageHealthCheck extends HealthCheck {

  private final Path storageDir;

  /**
   * Instantiates a new image storage health check.
   *
   * @param storageDir the storage directory
   */
  public ImageStorageHealthCheck(Path storageDir) {
    this.storageDir = storageDir;
  }

  @Override
  protected Result check() {
    if (!Files.isDirectory(storageDir)) {
      return Result.unhealthy("Storage directory %s does not exist", storageDir);
    }
    if (!Files.isWritable(storageDir)) {
      return Result.unhealthy("Storage directory %s is not writable", storageDir);
    }
    return Result.healthy("storage directory=%s", storageDir);
  }
}

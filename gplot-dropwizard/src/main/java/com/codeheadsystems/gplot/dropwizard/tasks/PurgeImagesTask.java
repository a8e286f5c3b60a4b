package com.codeheadsystems.gplot.dropwizard.tasks;

import com.codeheadsystems.gplot.server.storage.ImageStorage;
import io.dropwizard.servlets.tasks.Task;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Admin task deleting stored images older than {@code ageDays}, optionally within one group.
 * <pre>
 *   curl -X POST 'http://localhost:8081/tasks/purge-images?ageDays=30&amp;group=team1'
 * </pre>
 */
public class PurgeImagesTask extends Task {

  private static final Logger log = LoggerFactory.getLogger(PurgeImagesTask.class);

  private final ImageStorage imageStorage;

  public PurgeImagesTask(ImageStorage imageStorage) {
    super("purge-images");
    this.imageStorage = imageStorage;
  }

  @Override
  public void execute(Map<String, List<String>> parameters, PrintWriter output) {
    Integer ageDays = TaskParameters.intValue(parameters, "ageDays");
    if (ageDays == null || ageDays < 0) {
      output.println("Usage: purge-images?ageDays=<days>[&group=<group>]");
      return;
    }
    String group = TaskParameters.value(parameters, "group");
    int deleted = imageStorage.purge(ageDays, group);
    log.info("Admin purge removed {} image(s) (ageDays={}, group={})", deleted, ageDays, group);
    output.println("Purged " + deleted + " image(s)");
  }
}

package com.codeheadsystems.gplot.testserver.cli;

import com.codeheadsystems.gplot.server.exceptions.StorageException;
import com.codeheadsystems.gplot.server.storage.FileImageStorage;
import com.codeheadsystems.gplot.server.storage.ImageMetadata;
import com.codeheadsystems.gplot.server.storage.ImageStorage;
import com.codeheadsystems.gplot.server.storage.JsonMetadataRepository;
import com.codeheadsystems.gplot.server.storage.MetadataRepository;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line administration of an image storage directory.
 *
 * <pre>
 * Usage:
 *   StorageCli list  [--dir &lt;path&gt;] [--group &lt;group&gt;]
 *   StorageCli purge [--dir &lt;path&gt;] [--group &lt;group&gt;] [--age-days &lt;days&gt;]
 * </pre>
 *
 * <p>Without {@code --group} both commands act across every group. {@code purge} with an age of
 * 0 (the default) removes every image in scope.
 */
public class StorageCli {

  private static final String DEFAULT_DIR = "data/storage";
  private static final long MAX_IMAGE_BYTES = 10L * 1024 * 1024;

  private final PrintStream out;
  private final PrintStream err;

  StorageCli(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(new StorageCli(System.out, System.err).run(args));
  }

  /**
   * Runs one command.
   *
   * @param args command-line arguments
   * @return process exit code
   */
  int run(String[] args) {
    String dir = DEFAULT_DIR;
    String group = null;
    int ageDays = 0;
    List<String> positional = new ArrayList<>();

    try {
      for (int i = 0; i < args.length; i++) {
        switch (args[i]) {
          case "--dir"      -> dir     = args[++i];
          case "--group"    -> group   = args[++i];
          case "--age-days" -> ageDays = Integer.parseInt(args[++i]);
          default           -> positional.add(args[i]);
        }
      }
    } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
      printUsage();
      return 1;
    }

    if (positional.size() != 1 || ageDays < 0) {
      printUsage();
      return 1;
    }

    Path storageDir = Path.of(dir);
    try {
      switch (positional.get(0)) {
        case "list" -> {
          list(new JsonMetadataRepository(storageDir.resolve(FileImageStorage.METADATA_FILE)), group);
          return 0;
        }
        case "purge" -> {
          ImageStorage storage = FileImageStorage.create(storageDir, MAX_IMAGE_BYTES);
          int deleted = storage.purge(ageDays, group);
          out.println("Purged " + deleted + " image(s)"
              + (group == null ? "" : " from group " + group)
              + (ageDays == 0 ? "" : " older than " + ageDays + " day(s)"));
          return 0;
        }
        default -> {
          err.println("Unknown command: " + positional.get(0));
          printUsage();
          return 1;
        }
      }
    } catch (StorageException e) {
      err.println("Storage error: " + e.getMessage());
      return 1;
    }
  }

  private void list(MetadataRepository metadata, String group) {
    List<ImageMetadata> images = metadata.filterByAge(0, group);
    out.printf("%-36s  %-6s  %10s  %-24s  %s%n", "GUID", "FORMAT", "BYTES", "CREATED", "GROUP");
    for (ImageMetadata image : images) {
      out.printf("%-36s  %-6s  %10d  %-24s  %s%n", image.guid(), image.format(), image.sizeBytes(),
          image.createdAt() == null ? "-" : image.createdAt(), image.group() == null ? "-" : image.group());
    }
    out.println(images.size() + " image(s)");
  }

  private void printUsage() {
    err.println("Usage: StorageCli <list|purge> [options]");
    err.println();
    err.println("Options:");
    err.println("  --dir <path>        Storage directory        (default: " + DEFAULT_DIR + ")");
    err.println("  --group <group>     Restrict to one group    (default: all groups)");
    err.println("  --age-days <days>   Purge images older than  (default: 0, everything)");
  }
}

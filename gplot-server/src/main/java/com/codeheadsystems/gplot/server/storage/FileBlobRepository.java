package com.codeheadsystems.gplot.server.storage;

import com.codeheadsystems.gplot.server.exceptions.StorageException;
import com.codeheadsystems.gplot.server.exceptions.ValidationException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BlobRepository} storing each blob as {@code <dir>/<guid>.<format>}.
 */
public class FileBlobRepository implements BlobRepository {

  private static final Logger log = LoggerFactory.getLogger(FileBlobRepository.class);

  // Lookup order for findFormat and format-less operations.
  private static final List<String> FORMAT_ORDER = List.of("png", "jpg", "jpeg", "svg", "pdf");

  private final Path directory;

  /**
   * Opens the repository, creating the directory if needed.
   *
   * @param directory blob directory
   */
  public FileBlobRepository(Path directory) {
    this.directory = directory;
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new StorageException("Failed to create storage directory " + directory, e);
    }
    log.info("Blob repository initialized at {}", directory);
  }

  @Override
  public void save(String guid, byte[] data, String format) {
    Path path = pathFor(Guids.require(guid), normalize(format));
    try {
      Files.write(path, data);
      log.debug("Saved blob {} ({} bytes)", path.getFileName(), data.length);
    } catch (IOException e) {
      log.error("Failed to save blob {}", path, e);
      throw new StorageException("Failed to save blob " + guid, e);
    }
  }

  @Override
  public Optional<byte[]> get(String guid, String format) {
    Path path = pathFor(Guids.require(guid), normalize(format));
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readAllBytes(path));
    } catch (IOException e) {
      log.error("Failed to read blob {}", path, e);
      throw new StorageException("Failed to read blob " + guid, e);
    }
  }

  @Override
  public boolean delete(String guid, String format) {
    String id = Guids.require(guid);
    List<String> formats = format == null ? FORMAT_ORDER : List.of(normalize(format));
    boolean deleted = false;
    for (String f : formats) {
      Path path = pathFor(id, f);
      try {
        if (Files.deleteIfExists(path)) {
          log.debug("Deleted blob {}", path.getFileName());
          deleted = true;
        }
      } catch (IOException e) {
        log.error("Failed to delete blob {}", path, e);
        throw new StorageException("Failed to delete blob " + guid, e);
      }
    }
    return deleted;
  }

  @Override
  public boolean exists(String guid, String format) {
    String id = Guids.require(guid);
    if (format == null) {
      return findFormat(id).isPresent();
    }
    return Files.isRegularFile(pathFor(id, normalize(format)));
  }

  @Override
  public List<String> listAll() {
    try (Stream<Path> files = Files.list(directory)) {
      TreeSet<String> guids = new TreeSet<>();
      files.filter(Files::isRegularFile)
          .map(p -> p.getFileName().toString())
          .filter(name -> name.lastIndexOf('.') > 0)
          .map(name -> name.substring(0, name.lastIndexOf('.')))
          .filter(Guids::isValid)
          .forEach(guids::add);
      return List.copyOf(guids);
    } catch (IOException | UncheckedIOException e) {
      log.error("Failed to list blobs in {}", directory, e);
      throw new StorageException("Failed to list blobs", e);
    }
  }

  @Override
  public Optional<String> findFormat(String guid) {
    String id = Guids.require(guid);
    return FORMAT_ORDER.stream()
        .filter(f -> Files.isRegularFile(pathFor(id, f)))
        .findFirst();
  }

  private Path pathFor(String guid, String format) {
    return directory.resolve(guid + "." + format);
  }

  private static String normalize(String format) {
    if (format == null) {
      throw new ValidationException("Format is required");
    }
    String lower = format.toLowerCase(Locale.ROOT);
    if (!SUPPORTED_FORMATS.contains(lower)) {
      throw new ValidationException("Unsupported format: " + format);
    }
    return lower;
  }

  public Path getDirectory() {
    return directory;
  }
}

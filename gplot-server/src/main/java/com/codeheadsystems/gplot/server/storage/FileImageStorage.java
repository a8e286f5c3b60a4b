package com.codeheadsystems.gplot.server.storage;

import com.codeheadsystems.gplot.server.exceptions.PermissionDeniedException;
import com.codeheadsystems.gplot.server.exceptions.StorageException;
import com.codeheadsystems.gplot.server.exceptions.ValidationException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ImageStorage} composed of a {@link BlobRepository} and a {@link MetadataRepository}.
 * <p>
 * Metadata mutations are serialized on one lock held for the whole logical operation, so a
 * purge never observes a half-finished save or delete. Blob reads and writes for different
 * guids run outside the lock.
 */
public class FileImageStorage implements ImageStorage {

  /**
   * Name of the metadata index inside the storage directory.
   */
  public static final String METADATA_FILE = "metadata.json";

  private static final Logger log = LoggerFactory.getLogger(FileImageStorage.class);

  private final BlobRepository blobs;
  private final MetadataRepository metadata;
  private final Clock clock;
  private final long maxImageBytes;
  private final Object metadataLock = new Object();

  /**
   * Instantiates a new File image storage.
   *
   * @param blobs         blob repository
   * @param metadata      metadata repository
   * @param clock         source of creation timestamps
   * @param maxImageBytes largest accepted image
   */
  public FileImageStorage(BlobRepository blobs, MetadataRepository metadata, Clock clock, long maxImageBytes) {
    this.blobs = blobs;
    this.metadata = metadata;
    this.clock = clock;
    this.maxImageBytes = maxImageBytes;
  }

  /**
   * Storage rooted at a directory, holding blobs and {@value #METADATA_FILE}.
   *
   * @param storageDir    the directory
   * @param maxImageBytes largest accepted image
   * @return the storage
   */
  public static FileImageStorage create(Path storageDir, long maxImageBytes) {
    return new FileImageStorage(
        new FileBlobRepository(storageDir),
        new JsonMetadataRepository(storageDir.resolve(METADATA_FILE)),
        Clock.systemUTC(),
        maxImageBytes);
  }

  @Override
  public String saveImage(byte[] data, String format, String group) {
    if (data == null || data.length == 0) {
      throw new ValidationException("Image data is empty");
    }
    if (data.length > maxImageBytes) {
      throw new ValidationException("Image exceeds " + maxImageBytes + " bytes");
    }
    String normalized = format == null ? null : format.toLowerCase(Locale.ROOT);
    String guid = Guids.newGuid();
    blobs.save(guid, data, normalized);
    try {
      synchronized (metadataLock) {
        metadata.save(new ImageMetadata(guid, normalized, data.length, clock.instant(), group));
      }
    } catch (StorageException e) {
      log.error("Metadata write failed after blob write, blob {} is orphaned", guid);
      throw e;
    }
    log.debug("Saved image {} format={} size={} group={}", guid, normalized, data.length, group);
    return guid;
  }

  @Override
  public Optional<StoredImage> getImage(String guid, String group) {
    String id = Guids.require(guid);
    Optional<ImageMetadata> entry;
    synchronized (metadataLock) {
      entry = metadata.get(id);
    }
    if (entry.isEmpty()) {
      if (group != null) {
        return Optional.empty();
      }
      return blobs.findFormat(id)
          .flatMap(format -> blobs.get(id, format).map(bytes -> new StoredImage(bytes, format)));
    }
    checkGroup(entry.get(), group);
    String format = entry.get().format();
    return blobs.get(id, format).map(bytes -> new StoredImage(bytes, format));
  }

  @Override
  public boolean deleteImage(String guid, String group) {
    String id = Guids.require(guid);
    synchronized (metadataLock) {
      Optional<ImageMetadata> entry = metadata.get(id);
      if (entry.isEmpty() && group != null) {
        return false;
      }
      entry.ifPresent(e -> checkGroup(e, group));
      boolean blobDeleted = blobs.delete(id, null);
      boolean metadataDeleted = metadata.delete(id);
      log.debug("Deleted image {} blob={} metadata={}", id, blobDeleted, metadataDeleted);
      return blobDeleted || metadataDeleted;
    }
  }

  @Override
  public List<String> listImages(String group) {
    synchronized (metadataLock) {
      return metadata.listAll(group);
    }
  }

  @Override
  public boolean exists(String guid, String group) {
    if (!Guids.isValid(guid)) {
      return false;
    }
    String id = Guids.require(guid);
    Optional<ImageMetadata> entry;
    synchronized (metadataLock) {
      entry = metadata.get(id);
    }
    if (entry.isEmpty()) {
      return group == null && blobs.exists(id, null);
    }
    if (group != null && !group.equals(entry.get().group())) {
      return false;
    }
    return blobs.exists(id, null);
  }

  @Override
  public int purge(int ageDays, String group) {
    if (ageDays < 0) {
      throw new ValidationException("ageDays must not be negative: " + ageDays);
    }
    int deleted = 0;
    synchronized (metadataLock) {
      Set<String> seen = new HashSet<>();
      for (ImageMetadata entry : metadata.filterByAge(ageDays, group)) {
        seen.add(entry.guid());
        if (Guids.isValid(entry.guid())) {
          blobs.delete(entry.guid(), null);
        }
        if (metadata.delete(entry.guid())) {
          deleted++;
        }
      }
      for (String guid : metadata.listAll(group)) {
        if (seen.contains(guid)) {
          continue;
        }
        if (!Guids.isValid(guid) || !blobs.exists(guid, null)) {
          log.warn("Removing orphaned metadata {}", guid);
          if (metadata.delete(guid)) {
            deleted++;
          }
        }
      }
    }
    log.info("Purged {} image(s) ageDays={} group={}", deleted, ageDays, group);
    return deleted;
  }

  private void checkGroup(ImageMetadata entry, String group) {
    if (group != null && !Objects.equals(group, entry.group())) {
      throw new PermissionDeniedException(entry.guid(), group);
    }
  }
}

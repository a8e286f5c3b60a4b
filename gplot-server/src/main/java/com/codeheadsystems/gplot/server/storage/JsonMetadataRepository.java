package com.codeheadsystems.gplot.server.storage;

import com.codeheadsystems.gplot.server.exceptions.StorageException;
import com.codeheadsystems.gplot.server.exceptions.ValidationException;
import com.codeheadsystems.gplot.server.util.AtomicFiles;
import com.codeheadsystems.gplot.server.util.Timestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetadataRepository} held in memory and written in full to a JSON file after every
 * mutation.
 * <pre>
 * {"&lt;guid&gt;": {"format": "png", "size": 1234, "created_at": "...", "group": "team1", ...}}
 * </pre>
 * Loaded once at construction. A malformed file is logged and treated as empty. Unknown fields
 * of an entry survive rewrites. A failed write rolls the in-memory change back and throws
 * {@link StorageException}.
 */
public class JsonMetadataRepository implements MetadataRepository {

  private static final Logger log = LoggerFactory.getLogger(JsonMetadataRepository.class);

  private static final String FORMAT = "format";
  private static final String SIZE = "size";
  private static final String CREATED_AT = "created_at";
  private static final String GROUP = "group";
  private static final Set<String> KNOWN_FIELDS = Set.of(FORMAT, SIZE, CREATED_AT, GROUP);

  private final Path file;
  private final Clock clock;
  private final ObjectMapper objectMapper;
  private final Map<String, ObjectNode> entries;

  public JsonMetadataRepository(Path file) {
    this(file, Clock.systemUTC());
  }

  /**
   * Opens the index.
   *
   * @param file  the metadata file
   * @param clock time source for age filtering
   */
  public JsonMetadataRepository(Path file, Clock clock) {
    this.file = file;
    this.clock = clock;
    this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    this.entries = load();
    log.info("Metadata index at {} holds {} entr(ies)", file, entries.size());
  }

  private Map<String, ObjectNode> load() {
    Map<String, ObjectNode> result = new LinkedHashMap<>();
    if (!Files.exists(file)) {
      return result;
    }
    try {
      JsonNode root = objectMapper.readTree(file.toFile());
      if (root == null || !root.isObject()) {
        log.warn("Metadata index {} has unexpected structure, starting empty", file);
        return result;
      }
      root.fields().forEachRemaining(entry -> {
        if (entry.getValue().isObject()) {
          result.put(entry.getKey(), (ObjectNode) entry.getValue());
        } else {
          log.warn("Skipping malformed metadata entry {}", entry.getKey());
        }
      });
    } catch (JsonProcessingException e) {
      log.warn("Metadata index {} is malformed, starting empty: {}", file, e.getOriginalMessage());
    } catch (IOException e) {
      log.warn("Metadata index {} could not be read, starting empty: {}", file, e.getMessage());
    }
    return result;
  }

  @Override
  public synchronized void save(ImageMetadata metadata) {
    ObjectNode previous = entries.put(metadata.guid(), toNode(metadata));
    try {
      persist();
    } catch (StorageException e) {
      if (previous == null) {
        entries.remove(metadata.guid());
      } else {
        entries.put(metadata.guid(), previous);
      }
      throw e;
    }
    log.debug("Saved metadata {}", metadata.guid());
  }

  @Override
  public synchronized Optional<ImageMetadata> get(String guid) {
    return Optional.ofNullable(entries.get(guid)).map(node -> toMetadata(guid, node));
  }

  @Override
  public synchronized boolean delete(String guid) {
    ObjectNode removed = entries.remove(guid);
    if (removed == null) {
      return false;
    }
    try {
      persist();
    } catch (StorageException e) {
      entries.put(guid, removed);
      throw e;
    }
    log.debug("Deleted metadata {}", guid);
    return true;
  }

  @Override
  public synchronized List<String> listAll(String group) {
    return entries.entrySet().stream()
        .filter(e -> group == null || group.equals(groupOf(e.getValue())))
        .map(Map.Entry::getKey)
        .toList();
  }

  @Override
  public synchronized boolean exists(String guid) {
    return entries.containsKey(guid);
  }

  @Override
  public synchronized List<ImageMetadata> filterByAge(int ageDays, String group) {
    if (ageDays < 0) {
      throw new ValidationException("ageDays must not be negative: " + ageDays);
    }
    Instant cutoff = clock.instant().minus(Duration.ofDays(ageDays));
    List<ImageMetadata> result = new ArrayList<>();
    entries.forEach((guid, node) -> {
      if (group != null && !group.equals(groupOf(node))) {
        return;
      }
      ImageMetadata metadata = toMetadata(guid, node);
      if (ageDays == 0 || metadata.createdAt() == null || metadata.createdAt().isBefore(cutoff)) {
        result.add(metadata);
      }
    });
    return result;
  }

  private void persist() {
    ObjectNode root = objectMapper.createObjectNode();
    entries.forEach(root::set);
    try {
      AtomicFiles.write(file, objectMapper.writeValueAsBytes(root));
    } catch (IOException e) {
      log.error("Failed to write metadata index {}", file, e);
      throw new StorageException("Failed to save metadata", e);
    }
  }

  private static String groupOf(ObjectNode node) {
    JsonNode group = node.get(GROUP);
    return group == null || group.isNull() ? null : group.asText();
  }

  private ObjectNode toNode(ImageMetadata metadata) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put(FORMAT, metadata.format());
    node.put(SIZE, metadata.sizeBytes());
    node.put(CREATED_AT, Objects.toString(metadata.createdAt(), null));
    if (metadata.group() != null) {
      node.put(GROUP, metadata.group());
    }
    metadata.extra().forEach((key, value) -> {
      if (!KNOWN_FIELDS.contains(key)) {
        node.set(key, objectMapper.valueToTree(value));
      }
    });
    return node;
  }

  private ImageMetadata toMetadata(String guid, ObjectNode node) {
    Map<String, Object> extra = new LinkedHashMap<>();
    node.fields().forEachRemaining(field -> {
      if (!KNOWN_FIELDS.contains(field.getKey()) && !field.getValue().isNull()) {
        extra.put(field.getKey(), objectMapper.convertValue(field.getValue(), new TypeReference<Object>() {
        }));
      }
    });
    JsonNode createdAt = node.get(CREATED_AT);
    return new ImageMetadata(
        guid,
        node.path(FORMAT).asText("png"),
        node.path(SIZE).asLong(0),
        createdAt == null || !createdAt.isTextual() ? null : Timestamps.parse(createdAt.asText()).orElse(null),
        groupOf(node),
        extra);
  }

  public Path getFile() {
    return file;
  }
}

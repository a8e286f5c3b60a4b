package com.codeheadsystems.gplot.server.store;

import com.codeheadsystems.gplot.server.exceptions.StorageException;
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
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TokenStore} persisted as a single JSON object keyed by token id.
 * <pre>
 * {"&lt;jti&gt;": {"group": "...", "issued_at": "...", "expires_at": "...",
 *               "revoked": false, "fingerprint": null, ...}}
 * </pre>
 * The file is the source of truth shared between processes. Every write re-reads the file,
 * applies the change and replaces the file through a temp file, all under an in-process lock,
 * so records created by another process since the last read are kept. Fields this class does
 * not know are preserved. A missing or malformed file reads as an empty store.
 * <p>
 * Writers in different processes are not coordinated; a single process is expected to own
 * writes while others read.
 */
public class JsonFileTokenStore implements TokenStore {

  private static final Logger log = LoggerFactory.getLogger(JsonFileTokenStore.class);

  private static final String GROUP = "group";
  private static final String ISSUED_AT = "issued_at";
  private static final String EXPIRES_AT = "expires_at";
  private static final String REVOKED = "revoked";
  private static final String FINGERPRINT = "fingerprint";
  private static final Set<String> KNOWN_FIELDS = Set.of(GROUP, ISSUED_AT, EXPIRES_AT, REVOKED, FINGERPRINT);

  private final Path file;
  private final ObjectMapper objectMapper;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile Map<String, ObjectNode> tokens = Map.of();

  /**
   * Opens the store, reading the file if it exists.
   *
   * @param file the token store file; parent directories are created on first write
   */
  public JsonFileTokenStore(Path file) {
    this.file = file;
    this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    reload();
    log.info("Token store at {} holds {} token(s)", file, tokens.size());
  }

  @Override
  public void store(TokenRecord record) {
    mutate(current -> {
      ObjectNode node = current.containsKey(record.tokenId())
          ? current.get(record.tokenId()).deepCopy()
          : objectMapper.createObjectNode();
      record.extra().forEach((key, value) -> {
        if (!KNOWN_FIELDS.contains(key)) {
          node.set(key, objectMapper.valueToTree(value));
        }
      });
      node.put(GROUP, record.group());
      node.put(ISSUED_AT, record.issuedAt().toString());
      node.put(EXPIRES_AT, record.expiresAt().toString());
      node.put(REVOKED, record.revoked());
      node.put(FINGERPRINT, record.fingerprint());
      current.put(record.tokenId(), node);
      return true;
    });
    log.debug("Stored token id={} group={}", record.tokenId(), record.group());
  }

  @Override
  public Optional<TokenRecord> load(String tokenId) {
    ObjectNode node = tokens.get(tokenId);
    return node == null ? Optional.empty() : Optional.of(toRecord(tokenId, node));
  }

  @Override
  public boolean revoke(String tokenId) {
    boolean changed = mutate(current -> {
      ObjectNode node = current.get(tokenId);
      if (node == null || node.path(REVOKED).asBoolean(false)) {
        return false;
      }
      node.put(REVOKED, true);
      return true;
    });
    log.debug("Revoke token id={} changed={}", tokenId, changed);
    return changed;
  }

  @Override
  public List<TokenRecord> list() {
    return tokens.entrySet().stream()
        .map(e -> toRecord(e.getKey(), e.getValue()))
        .toList();
  }

  @Override
  public void reload() {
    lock.lock();
    try {
      tokens = read();
    } finally {
      lock.unlock();
    }
  }

  private boolean mutate(Function<Map<String, ObjectNode>, Boolean> change) {
    lock.lock();
    try {
      Map<String, ObjectNode> current = read();
      boolean changed = change.apply(current);
      if (changed) {
        write(current);
      }
      tokens = current;
      return changed;
    } finally {
      lock.unlock();
    }
  }

  private Map<String, ObjectNode> read() {
    if (!Files.exists(file)) {
      return new LinkedHashMap<>();
    }
    try {
      JsonNode root = objectMapper.readTree(file.toFile());
      if (root == null || !root.isObject()) {
        log.warn("Token store {} is not a JSON object, starting empty", file);
        return new LinkedHashMap<>();
      }
      Map<String, ObjectNode> result = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> entry = fields.next();
        if (entry.getValue().isObject()) {
          result.put(entry.getKey(), (ObjectNode) entry.getValue());
        } else {
          log.warn("Skipping malformed token entry {} in {}", entry.getKey(), file);
        }
      }
      return result;
    } catch (JsonProcessingException e) {
      log.warn("Token store {} is malformed, starting empty: {}", file, e.getOriginalMessage());
      return new LinkedHashMap<>();
    } catch (IOException e) {
      throw new StorageException("Failed to read token store " + file, e);
    }
  }

  private void write(Map<String, ObjectNode> current) {
    ObjectNode root = objectMapper.createObjectNode();
    current.forEach(root::set);
    try {
      AtomicFiles.write(file, objectMapper.writeValueAsBytes(root));
    } catch (IOException e) {
      log.error("Failed to write token store {}", file, e);
      throw new StorageException("Failed to write token store " + file, e);
    }
  }

  private TokenRecord toRecord(String tokenId, ObjectNode node) {
    Map<String, Object> extra = new LinkedHashMap<>();
    node.fields().forEachRemaining(field -> {
      if (!KNOWN_FIELDS.contains(field.getKey()) && !field.getValue().isNull()) {
        extra.put(field.getKey(), objectMapper.convertValue(field.getValue(), new TypeReference<Object>() {
        }));
      }
    });
    JsonNode fingerprint = node.get(FINGERPRINT);
    return new TokenRecord(
        tokenId,
        node.path(GROUP).isTextual() ? node.get(GROUP).asText() : null,
        instant(node, ISSUED_AT),
        instant(node, EXPIRES_AT),
        node.path(REVOKED).asBoolean(false),
        fingerprint == null || fingerprint.isNull() ? null : fingerprint.asText(),
        extra);
  }

  private Instant instant(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (value.isNumber()) {
      return Instant.ofEpochMilli((long) (value.asDouble() * 1000));
    }
    return Timestamps.parse(value.asText()).orElse(null);
  }

  public Path getFile() {
    return file;
  }
}

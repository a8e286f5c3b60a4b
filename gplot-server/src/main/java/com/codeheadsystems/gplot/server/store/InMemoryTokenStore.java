package com.codeheadsystems.gplot.server.store;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link TokenStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Tokens are lost on restart and are not visible to other processes. Suitable for
 * development and testing only.
 */
public class InMemoryTokenStore implements TokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTokenStore.class);

  private final ConcurrentHashMap<String, TokenRecord> store = new ConcurrentHashMap<>();

  @Override
  public void store(TokenRecord record) {
    store.put(record.tokenId(), record);
    log.debug("Stored token id={}", record.tokenId());
  }

  @Override
  public Optional<TokenRecord> load(String tokenId) {
    return Optional.ofNullable(store.get(tokenId));
  }

  @Override
  public boolean revoke(String tokenId) {
    boolean[] revoked = {false};
    store.computeIfPresent(tokenId, (id, existing) -> {
      if (existing.revoked()) {
        return existing;
      }
      revoked[0] = true;
      return existing.asRevoked();
    });
    log.debug("Revoke token id={} changed={}", tokenId, revoked[0]);
    return revoked[0];
  }

  @Override
  public List<TokenRecord> list() {
    return List.copyOf(store.values());
  }
}

package com.codeheadsystems.gplot.dropwizard;

import com.codeheadsystems.gplot.server.security.SecurityLevel;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Dropwizard configuration for the gplot image and render service.
 * <p>
 * For production, supply {@code jwtSecret} so that tokens survive restarts and can be shared with
 * the token administration CLI through the token store file. Omitting it causes a random secret
 * to be generated on each startup (dev/test only).
 * <p>
 * Generate a secret with: {@code openssl rand -hex 32}
 */
public class GplotConfiguration extends Configuration {

  /**
   * When false no bearer-token filter is installed and every caller acts without a group.
   */
  private boolean requireAuth = true;

  /**
   * HMAC-SHA256 signing secret for JWT tokens.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecret = "";

  /**
   * JWT issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "gplot";

  /**
   * Root data directory. Storage and token store paths default to locations beneath it.
   */
  @NotEmpty
  private String dataDir = "data";

  /**
   * Directory holding blob files and {@code metadata.json}. Empty means {@code {dataDir}/storage}.
   */
  private String storageDir = "";

  /**
   * Shared token store file. Empty means {@code {dataDir}/auth/tokens.json}.
   */
  private String tokenStorePath = "";

  /**
   * Upper bound on the size of a stored image.
   */
  @Min(1)
  private long maxImageBytes = 10L * 1024 * 1024;

  @Valid
  @NotNull
  private RateLimitConfiguration rateLimit = new RateLimitConfiguration();

  @Valid
  @NotNull
  private AuditConfiguration audit = new AuditConfiguration();

  @JsonProperty
  public boolean isRequireAuth() {
    return requireAuth;
  }

  @JsonProperty
  public void setRequireAuth(boolean requireAuth) {
    this.requireAuth = requireAuth;
  }

  @JsonProperty
  public String getJwtSecret() {
    return jwtSecret;
  }

  @JsonProperty
  public void setJwtSecret(String jwtSecret) {
    this.jwtSecret = jwtSecret;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public String getDataDir() {
    return dataDir;
  }

  @JsonProperty
  public void setDataDir(String dataDir) {
    this.dataDir = dataDir;
  }

  @JsonProperty
  public String getStorageDir() {
    return storageDir;
  }

  @JsonProperty
  public void setStorageDir(String storageDir) {
    this.storageDir = storageDir;
  }

  @JsonProperty
  public String getTokenStorePath() {
    return tokenStorePath;
  }

  @JsonProperty
  public void setTokenStorePath(String tokenStorePath) {
    this.tokenStorePath = tokenStorePath;
  }

  @JsonProperty
  public long getMaxImageBytes() {
    return maxImageBytes;
  }

  @JsonProperty
  public void setMaxImageBytes(long maxImageBytes) {
    this.maxImageBytes = maxImageBytes;
  }

  @JsonProperty
  public RateLimitConfiguration getRateLimit() {
    return rateLimit;
  }

  @JsonProperty
  public void setRateLimit(RateLimitConfiguration rateLimit) {
    this.rateLimit = rateLimit;
  }

  @JsonProperty
  public AuditConfiguration getAudit() {
    return audit;
  }

  @JsonProperty
  public void setAudit(AuditConfiguration audit) {
    this.audit = audit;
  }

  /**
   * The storage directory, falling back to {@code {dataDir}/storage}.
   *
   * @return the resolved path
   */
  @JsonIgnore
  public Path resolveStorageDir() {
    return isBlank(storageDir) ? Path.of(dataDir, "storage") : Path.of(storageDir);
  }

  /**
   * The token store file, falling back to {@code {dataDir}/auth/tokens.json}.
   *
   * @return the resolved path
   */
  @JsonIgnore
  public Path resolveTokenStorePath() {
    return isBlank(tokenStorePath) ? Path.of(dataDir, "auth", "tokens.json") : Path.of(tokenStorePath);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /**
   * Token-bucket rate limiting applied to every request.
   */
  public static class RateLimitConfiguration {

    private boolean enabled = true;

    @Min(1)
    private int defaultLimit = 100;

    @Min(1)
    private long windowSeconds = 60;

    @Valid
    @NotNull
    private Map<String, EndpointLimitConfiguration> endpointLimits = new HashMap<>();

    @JsonProperty
    public boolean isEnabled() {
      return enabled;
    }

    @JsonProperty
    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    @JsonProperty
    public int getDefaultLimit() {
      return defaultLimit;
    }

    @JsonProperty
    public void setDefaultLimit(int defaultLimit) {
      this.defaultLimit = defaultLimit;
    }

    @JsonProperty
    public long getWindowSeconds() {
      return windowSeconds;
    }

    @JsonProperty
    public void setWindowSeconds(long windowSeconds) {
      this.windowSeconds = windowSeconds;
    }

    /**
     * Per-endpoint overrides keyed by the first path segment, e.g. {@code /render}.
     *
     * @return the overrides
     */
    @JsonProperty
    public Map<String, EndpointLimitConfiguration> getEndpointLimits() {
      return endpointLimits;
    }

    @JsonProperty
    public void setEndpointLimits(Map<String, EndpointLimitConfiguration> endpointLimits) {
      this.endpointLimits = endpointLimits;
    }
  }

  /**
   * A per-endpoint limit. A zero window means the default window.
   */
  public static class EndpointLimitConfiguration {

    @Min(1)
    private int limit = 1;

    @Min(0)
    private long windowSeconds = 0;

    @JsonProperty
    public int getLimit() {
      return limit;
    }

    @JsonProperty
    public void setLimit(int limit) {
      this.limit = limit;
    }

    @JsonProperty
    public long getWindowSeconds() {
      return windowSeconds;
    }

    @JsonProperty
    public void setWindowSeconds(long windowSeconds) {
      this.windowSeconds = windowSeconds;
    }
  }

  /**
   * Security audit sinks.
   */
  public static class AuditConfiguration {

    /**
     * JSON-lines audit file. Empty disables the file sink.
     */
    private String logFile = "";

    private boolean console = true;

    @NotNull
    private SecurityLevel minLevel = SecurityLevel.INFO;

    @JsonProperty
    public String getLogFile() {
      return logFile;
    }

    @JsonProperty
    public void setLogFile(String logFile) {
      this.logFile = logFile;
    }

    @JsonProperty
    public boolean isConsole() {
      return console;
    }

    @JsonProperty
    public void setConsole(boolean console) {
      this.console = console;
    }

    @JsonProperty
    public SecurityLevel getMinLevel() {
      return minLevel;
    }

    @JsonProperty
    public void setMinLevel(SecurityLevel minLevel) {
      this.minLevel = minLevel;
    }

    /**
     * The audit file, or null when the file sink is disabled.
     *
     * @return the path or null
     */
    @JsonIgnore
    public Path resolveLogFile() {
      return isBlank(logFile) ? null : Path.of(logFile);
    }
  }
}

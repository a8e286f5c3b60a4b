package com.codeheadsystems.gplot.dropwizard;

import com.codeheadsystems.gplot.dropwizard.GplotConfiguration.AuditConfiguration;
import com.codeheadsystems.gplot.dropwizard.GplotConfiguration.RateLimitConfiguration;
import com.codeheadsystems.gplot.dropwizard.auth.GplotAuthFilter;
import com.codeheadsystems.gplot.dropwizard.auth.GplotAuthenticator;
import com.codeheadsystems.gplot.dropwizard.auth.GplotPrincipal;
import com.codeheadsystems.gplot.dropwizard.filter.RateLimitFilter;
import com.codeheadsystems.gplot.dropwizard.filter.RemoteAddressFilter;
import com.codeheadsystems.gplot.dropwizard.health.ImageStorageHealthCheck;
import com.codeheadsystems.gplot.dropwizard.tasks.CleanupRateLimitBucketsTask;
import com.codeheadsystems.gplot.dropwizard.tasks.PurgeImagesTask;
import com.codeheadsystems.gplot.dropwizard.tasks.RevokeTokenTask;
import com.codeheadsystems.gplot.server.auth.AuthManager;
import com.codeheadsystems.gplot.server.manager.RenderManager;
import com.codeheadsystems.gplot.server.render.GraphRenderer;
import com.codeheadsystems.gplot.server.resource.ImageResource;
import com.codeheadsystems.gplot.server.resource.RenderResource;
import com.codeheadsystems.gplot.server.security.RateLimiter;
import com.codeheadsystems.gplot.server.security.Sanitizer;
import com.codeheadsystems.gplot.server.security.SecurityAuditor;
import com.codeheadsystems.gplot.server.storage.FileImageStorage;
import com.codeheadsystems.gplot.server.storage.ImageStorage;
import com.codeheadsystems.gplot.server.store.InMemoryTokenStore;
import com.codeheadsystems.gplot.server.store.JsonFileTokenStore;
import com.codeheadsystems.gplot.server.store.TokenStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.servlet.DispatcherType;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.EnumSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the gplot image storage, render endpoint and token
 * authentication into an existing Dropwizard application.
 * <p>
 * Registers the image and render resources, the rate-limit and bearer-token filters, the
 * {@code image-storage} health check and the maintenance admin tasks. Requires a
 * {@link GplotConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with an in-memory token store and no renderer (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new GplotBundle<>());
 * }</pre>
 * <p>
 * Or supply a renderer and let the bundle open the shared token store named by
 * {@code tokenStorePath}:
 * <pre>{@code
 *   bootstrap.addBundle(new GplotBundle<>(myRenderer));
 * }</pre>
 * When no renderer is supplied, {@code POST /render} is not registered.
 */
@Singleton
public class GplotBundle<C extends GplotConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(GplotBundle.class);

  private final TokenStore tokenStore;
  private final GraphRenderer renderer;

  private AuthManager authManager;
  private RateLimiter rateLimiter;
  private ImageStorage imageStorage;
  private SecurityAuditor auditor;

  /**
   * Creates a bundle backed by an in-memory token store and without a renderer.
   * <p>
   * For dev/test only: issued tokens are lost on restart and cannot be administered from the
   * token CLI.
   */
  public GplotBundle() {
    this.tokenStore = new InMemoryTokenStore();
    this.renderer = null;
    log.warn("""
        #################################################################
        # WARNING: Using an ephemeral in-memory token store. Tokens are #
        # lost on restart and invisible to other processes.             #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle with a renderer, using the token store file from the configuration.
   *
   * @param renderer the graph renderer
   */
  public GplotBundle(GraphRenderer renderer) {
    this(null, renderer);
  }

  /**
   * Creates a bundle backed by the supplied token store and renderer.
   * A null token store opens the file named by {@code tokenStorePath}; a null renderer leaves
   * the render endpoint unregistered.
   *
   * @param tokenStore the token store, or null
   * @param renderer   the renderer, or null
   */
  @Inject
  public GplotBundle(TokenStore tokenStore, GraphRenderer renderer) {
    this.tokenStore = tokenStore;
    this.renderer = renderer;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    auditor = buildAuditor(configuration.getAudit());
    rateLimiter = buildRateLimiter(configuration.getRateLimit());
    Path storageDir = configuration.resolveStorageDir();
    imageStorage = FileImageStorage.create(storageDir, configuration.getMaxImageBytes());
    authManager = buildAuthManager(configuration);

    environment.servlets()
        .addFilter(RemoteAddressFilter.class.getSimpleName(), new RemoteAddressFilter())
        .addMappingForUrlPatterns(EnumSet.of(DispatcherType.REQUEST), false, "/*");
    environment.jersey().register(new RateLimitFilter(rateLimiter, auditor));

    environment.jersey().register(new ImageResource(imageStorage, auditor));
    if (renderer != null) {
      RenderManager renderManager = new RenderManager(renderer, imageStorage, new Sanitizer());
      environment.jersey().register(new RenderResource(renderManager, auditor));
    } else {
      log.info("No graph renderer supplied; POST /render is disabled");
    }
    environment.healthChecks().register("image-storage", new ImageStorageHealthCheck(storageDir));

    if (configuration.isRequireAuth()) {
      // JWT auth filter
      GplotAuthenticator authenticator = new GplotAuthenticator(authManager, auditor);
      environment.jersey().register(new AuthDynamicFeature(
          new GplotAuthFilter.Builder<GplotPrincipal>()
              .setAuthenticator(authenticator)
              .setPrefix("Bearer")
              .buildAuthFilter()));
      environment.jersey().register(new AuthValueFactoryProvider.Binder<>(GplotPrincipal.class));
    } else {
      log.warn("Authentication disabled: every caller can read and purge every group's images");
    }

    environment.admin().addTask(new PurgeImagesTask(imageStorage));
    environment.admin().addTask(new CleanupRateLimitBucketsTask(rateLimiter));
    environment.admin().addTask(new RevokeTokenTask(authManager, auditor));
  }

  /**
   * The token manager built by {@link #run}, for applications issuing tokens in-process.
   *
   * @return the auth manager, or null before the bundle has run
   */
  public AuthManager getAuthManager() {
    return authManager;
  }

  /**
   * The image storage built by {@link #run}.
   *
   * @return the image storage, or null before the bundle has run
   */
  public ImageStorage getImageStorage() {
    return imageStorage;
  }

  /**
   * The rate limiter built by {@link #run}.
   *
   * @return the rate limiter, or null before the bundle has run
   */
  public RateLimiter getRateLimiter() {
    return rateLimiter;
  }

  /**
   * The security auditor built by {@link #run}.
   *
   * @return the auditor, or null before the bundle has run
   */
  public SecurityAuditor getAuditor() {
    return auditor;
  }

  private AuthManager buildAuthManager(C configuration) {
    String secret = configuration.getJwtSecret();
    byte[] secretBytes;
    if (secret == null || secret.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secretBytes = new byte[32];
      new SecureRandom().nextBytes(secretBytes);
    } else {
      secretBytes = secret.getBytes(StandardCharsets.UTF_8);
    }
    TokenStore store = tokenStore != null
        ? tokenStore
        : new JsonFileTokenStore(configuration.resolveTokenStorePath());
    AuthManager manager = new AuthManager(secretBytes, configuration.getJwtIssuer(), store, Clock.systemUTC());
    log.info("Token authentication ready, secret {}", manager.getSecretFingerprint());
    return manager;
  }

  private static RateLimiter buildRateLimiter(RateLimitConfiguration config) {
    RateLimiter limiter = new RateLimiter(config.getDefaultLimit(), config.getWindowSeconds(), config.isEnabled());
    config.getEndpointLimits().forEach((endpoint, limit) -> {
      if (limit.getWindowSeconds() > 0) {
        limiter.setEndpointLimit(endpoint, limit.getLimit(), limit.getWindowSeconds());
      } else {
        limiter.setEndpointLimit(endpoint, limit.getLimit());
      }
    });
    return limiter;
  }

  private static SecurityAuditor buildAuditor(AuditConfiguration config) {
    return new SecurityAuditor(config.resolveLogFile(), config.isConsole(), config.getMinLevel());
  }
}

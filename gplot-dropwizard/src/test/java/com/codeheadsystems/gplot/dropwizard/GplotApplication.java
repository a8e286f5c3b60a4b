package com.codeheadsystems.gplot.dropwizard;

import com.codeheadsystems.gplot.server.render.GraphRenderer;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import java.nio.charset.StandardCharsets;

/**
 * Minimal Dropwizard application used only in integration tests.
 * Not part of the library's public API.
 */
public class GplotApplication extends Application<GplotConfiguration> {

  /**
   * Renders a tiny SVG document echoing the chart type and title.
   */
  static final GraphRenderer STUB_RENDERER = spec ->
      ("<svg><title>" + spec.chartType() + ":" + spec.title() + "</title></svg>")
          .getBytes(StandardCharsets.UTF_8);

  private final GplotBundle<GplotConfiguration> bundle = new GplotBundle<>(null, STUB_RENDERER);

  public static void main(String[] args) throws Exception {
    new GplotApplication().run(args);
  }

  @Override
  public String getName() {
    return "gplot-test";
  }

  @Override
  public void initialize(Bootstrap<GplotConfiguration> bootstrap) {
    bootstrap.addBundle(bundle);
  }

  @Override
  public void run(GplotConfiguration configuration, Environment environment) {
    // Test-only protected endpoint exposing the authenticated principal
    environment.jersey().register(new WhoAmIResource());
  }

  GplotBundle<GplotConfiguration> bundle() {
    return bundle;
  }
}

package com.codeheadsystems.gplot.testserver;

import com.codeheadsystems.gplot.dropwizard.GplotBundle;
import com.codeheadsystems.gplot.dropwizard.GplotConfiguration;
import io.dropwizard.configuration.EnvironmentVariableSubstitutor;
import io.dropwizard.configuration.SubstitutingSourceProvider;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Runnable Dropwizard application for local use of the image endpoints and the admin tasks.
 * Tokens live in the shared token store file named by {@code tokenStorePath}, so tokens issued
 * with {@link com.codeheadsystems.gplot.testserver.cli.TokenCli} against the same file and
 * secret are accepted without a restart.
 * <p>
 * No graph renderer ships with this server, so {@code POST /render} is not registered.
 * <pre>
 *   java -cp ... com.codeheadsystems.gplot.testserver.GplotTestServerApplication server config/config.yml
 * </pre>
 */
public class GplotTestServerApplication extends Application<GplotConfiguration> {

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new GplotTestServerApplication().run(args);
  }

  @Override
  public String getName() {
    return "gplot-testserver";
  }

  @Override
  public void initialize(Bootstrap<GplotConfiguration> bootstrap) {
    // Allow ${ENV_VAR:-default} substitution in config YAML files so environment
    // variables can override individual keys without replacing the entire config file.
    bootstrap.setConfigurationSourceProvider(
        new SubstitutingSourceProvider(
            bootstrap.getConfigurationSourceProvider(),
            new EnvironmentVariableSubstitutor(false)
        )
    );
    // Null token store: the bundle opens the file at tokenStorePath so the CLI shares it.
    bootstrap.addBundle(new GplotBundle<>(null, null));
  }

  @Override
  public void run(GplotConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle
  }
}

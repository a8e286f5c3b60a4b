package com.codeheadsystems.gplot.testserver.cli;

import com.codeheadsystems.gplot.server.auth.AuthManager;
import com.codeheadsystems.gplot.server.auth.TokenInfo;
import com.codeheadsystems.gplot.server.auth.TokenVerificationException;
import com.codeheadsystems.gplot.server.store.JsonFileTokenStore;
import com.codeheadsystems.gplot.server.store.TokenRecord;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line token administration over a shared token store file.
 *
 * <pre>
 * Usage:
 *   TokenCli create &lt;group&gt; [--expires &lt;seconds&gt;] [--fingerprint &lt;fp&gt;] [options]
 *   TokenCli verify &lt;token&gt; [--fingerprint &lt;fp&gt;] [options]
 *   TokenCli revoke &lt;tokenId&gt; [options]
 *   TokenCli list [options]
 *   TokenCli fingerprint [options]
 *
 * Options:
 *   --store &lt;path&gt;     Token store file   (default: data/auth/tokens.json)
 *   --secret &lt;secret&gt;  Signing secret     (default: $GPLOT_JWT_SECRET)
 *   --issuer &lt;issuer&gt;  JWT issuer         (default: gplot)
 * </pre>
 *
 * <p>A running server sharing the same store file and secret sees tokens created or revoked
 * here on the next request that presents them.
 */
public class TokenCli {

  static final String SECRET_ENV = "GPLOT_JWT_SECRET";
  private static final String DEFAULT_STORE = "data/auth/tokens.json";
  private static final String DEFAULT_ISSUER = "gplot";
  private static final long DEFAULT_EXPIRES_SECONDS = 30L * 24 * 3600;

  private final PrintStream out;
  private final PrintStream err;
  private final Map<String, String> env;

  TokenCli(PrintStream out, PrintStream err, Map<String, String> env) {
    this.out = out;
    this.err = err;
    this.env = env;
  }

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    System.exit(new TokenCli(System.out, System.err, System.getenv()).run(args));
  }

  /**
   * Runs one command.
   *
   * @param args command-line arguments
   * @return process exit code: 0 success, 1 usage or lookup failure, 2 verification failure
   */
  int run(String[] args) {
    String store = DEFAULT_STORE;
    String secret = env.get(SECRET_ENV);
    String issuer = DEFAULT_ISSUER;
    String fingerprint = null;
    long expires = DEFAULT_EXPIRES_SECONDS;
    List<String> positional = new ArrayList<>();

    try {
      for (int i = 0; i < args.length; i++) {
        switch (args[i]) {
          case "--store"       -> store       = args[++i];
          case "--secret"      -> secret      = args[++i];
          case "--issuer"      -> issuer      = args[++i];
          case "--fingerprint" -> fingerprint = args[++i];
          case "--expires"     -> expires     = Long.parseLong(args[++i]);
          default              -> positional.add(args[i]);
        }
      }
    } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
      printUsage();
      return 1;
    }

    if (positional.isEmpty()) {
      printUsage();
      return 1;
    }
    if (secret == null || secret.isEmpty()) {
      err.println("No secret: pass --secret or set " + SECRET_ENV);
      return 1;
    }

    AuthManager authManager = new AuthManager(secret, issuer, new JsonFileTokenStore(Path.of(store)));
    String command = positional.get(0);
    String argument = positional.size() > 1 ? positional.get(1) : null;

    try {
      switch (command) {
        case "create" -> {
          if (argument == null) {
            printUsage();
            return 1;
          }
          String token = authManager.createToken(argument, expires, fingerprint);
          out.println(token);
          return 0;
        }
        case "verify" -> {
          if (argument == null) {
            printUsage();
            return 1;
          }
          return verify(authManager, argument, fingerprint);
        }
        case "revoke" -> {
          if (argument == null) {
            printUsage();
            return 1;
          }
          if (authManager.revokeToken(argument)) {
            out.println("Revoked " + argument);
            return 0;
          }
          err.println("No live token " + argument);
          return 1;
        }
        case "list" -> {
          list(authManager.listTokens());
          return 0;
        }
        case "fingerprint" -> {
          out.println(authManager.getSecretFingerprint());
          return 0;
        }
        default -> {
          err.println("Unknown command: " + command);
          printUsage();
          return 1;
        }
      }
    } catch (IllegalArgumentException e) {
      err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private int verify(AuthManager authManager, String token, String fingerprint) {
    try {
      TokenInfo info = authManager.verifyToken(token, fingerprint);
      out.println("valid");
      out.println("  group      : " + info.group());
      out.println("  token id   : " + info.tokenId());
      out.println("  issued at  : " + info.issuedAt());
      out.println("  expires at : " + info.expiresAt());
      return 0;
    } catch (TokenVerificationException e) {
      err.println("invalid: " + e.getReason().name().toLowerCase(Locale.ROOT));
      return 2;
    }
  }

  private void list(List<TokenRecord> records) {
    out.printf("%-36s  %-16s  %-20s  %-20s  %s%n", "TOKEN ID", "GROUP", "ISSUED", "EXPIRES", "STATE");
    for (TokenRecord record : records) {
      String state = record.revoked() ? "revoked" : record.fingerprint() != null ? "bound" : "active";
      out.printf("%-36s  %-16s  %-20s  %-20s  %s%n",
          record.tokenId(), record.group(), record.issuedAt(), record.expiresAt(), state);
    }
  }

  private void printUsage() {
    err.println("Usage: TokenCli <command> [argument] [options]");
    err.println();
    err.println("Commands:");
    err.println("  create <group>     Issue a token for a group and print it");
    err.println("  verify <token>     Verify a token against the shared store");
    err.println("  revoke <tokenId>   Revoke a token by its id");
    err.println("  list               List every token in the store");
    err.println("  fingerprint        Print a safe-to-log fingerprint of the secret");
    err.println();
    err.println("Options:");
    err.println("  --store <path>        Token store file  (default: " + DEFAULT_STORE + ")");
    err.println("  --secret <secret>     Signing secret    (default: $" + SECRET_ENV + ")");
    err.println("  --issuer <issuer>     JWT issuer        (default: " + DEFAULT_ISSUER + ")");
    err.println("  --expires <seconds>   Token lifetime    (default: " + DEFAULT_EXPIRES_SECONDS + ")");
    err.println("  --fingerprint <fp>    Device fingerprint to bind or verify against");
  }
}

package com.codeheadsystems.gplot.server.security;

import com.codeheadsystems.gplot.server.exceptions.SanitizationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Boundary input cleaning for render parameters, paths, free text and URLs.
 * <p>
 * Every failure raises {@link SanitizationException}. In strict mode over-long strings are
 * rejected; in lenient mode they are truncated. Pattern checks apply in both modes.
 */
public class Sanitizer {

  public static final Set<String> ALLOWED_CHART_TYPES = Set.of("line", "scatter", "bar");
  public static final Set<String> ALLOWED_FORMATS = Set.of("png", "jpg", "jpeg", "svg", "pdf");
  public static final Set<String> ALLOWED_THEMES = Set.of("light", "dark", "bizlight", "bizdark");
  public static final Set<String> ALLOWED_SCALES = Set.of("linear", "log", "symlog", "logit");

  private static final List<Pattern> PATH_TRAVERSAL_PATTERNS = compile(
      "\\.\\.", "~", "/etc", "/proc", "/sys", "\\\\");

  private static final List<Pattern> SQL_INJECTION_PATTERNS = compile(
      "\\b(SELECT|INSERT|UPDATE|DELETE|DROP|CREATE|ALTER|EXEC|EXECUTE)\\b",
      "(--|#|/\\*|\\*/)",
      "\\bOR\\b.*=.*\\bOR\\b",
      "\\bUNION\\b.*\\bSELECT\\b");

  private static final List<Pattern> XSS_PATTERNS = compile(
      "<script[^>]*>.*?</script>",
      "javascript:",
      "onerror\\s*=",
      "onload\\s*=",
      "onclick\\s*=");

  private final boolean strict;

  public Sanitizer() {
    this(true);
  }

  /**
   * Instantiates a new Sanitizer.
   *
   * @param strict reject over-long input instead of truncating it
   */
  public Sanitizer(boolean strict) {
    this.strict = strict;
  }

  private static List<Pattern> compile(String... regexes) {
    return Arrays.stream(regexes)
        .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE | Pattern.DOTALL))
        .toList();
  }

  public String sanitizeChartType(String chartType) {
    return oneOf("chart type", chartType, ALLOWED_CHART_TYPES);
  }

  public String sanitizeFormat(String format) {
    return oneOf("format", format, ALLOWED_FORMATS);
  }

  public String sanitizeTheme(String theme) {
    return oneOf("theme", theme, ALLOWED_THEMES);
  }

  public String sanitizeScale(String scale) {
    return oneOf("scale", scale, ALLOWED_SCALES);
  }

  private String oneOf(String kind, String value, Set<String> allowed) {
    if (value == null) {
      throw new SanitizationException("Missing " + kind);
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (!allowed.contains(normalized)) {
      throw new SanitizationException("Invalid " + kind + ": " + normalized
          + ". Allowed: " + String.join(", ", new TreeSet<>(allowed)));
    }
    return normalized;
  }

  /**
   * Rejects traversal patterns, resolves the path and, when a base directory is given,
   * requires the result to lie inside it.
   *
   * @param path      user-supplied path
   * @param baseDir   required parent, may be null
   * @param mustExist whether the path must already exist
   * @return the normalized absolute path
   */
  public Path sanitizePath(String path, Path baseDir, boolean mustExist) {
    if (path == null) {
      throw new SanitizationException("Missing path");
    }
    for (Pattern pattern : PATH_TRAVERSAL_PATTERNS) {
      if (pattern.matcher(path).find()) {
        throw new SanitizationException("Suspicious path pattern detected: " + pattern.pattern());
      }
    }
    Path resolved;
    try {
      resolved = Path.of(path).toAbsolutePath().normalize();
    } catch (InvalidPathException e) {
      throw new SanitizationException("Invalid path: " + e.getMessage());
    }
    if (baseDir != null && !resolved.startsWith(baseDir.toAbsolutePath().normalize())) {
      throw new SanitizationException("Path " + path + " is outside base directory " + baseDir);
    }
    if (mustExist && !resolved.toFile().exists()) {
      throw new SanitizationException("Path does not exist: " + path);
    }
    return resolved;
  }

  /**
   * Checks length and rejects SQL and script injection patterns.
   *
   * @param text          user text
   * @param maxLength     maximum length
   * @param allowNewlines when false, CR and LF become spaces
   * @return the trimmed text
   */
  public String sanitizeString(String text, int maxLength, boolean allowNewlines) {
    if (text == null) {
      throw new SanitizationException("Missing text");
    }
    String value = text;
    if (value.length() > maxLength) {
      if (strict) {
        throw new SanitizationException("String too long: " + value.length() + " > " + maxLength);
      }
      value = value.substring(0, maxLength);
    }
    for (Pattern pattern : SQL_INJECTION_PATTERNS) {
      if (pattern.matcher(value).find()) {
        throw new SanitizationException("Suspicious SQL pattern detected");
      }
    }
    for (Pattern pattern : XSS_PATTERNS) {
      if (pattern.matcher(value).find()) {
        throw new SanitizationException("Suspicious XSS pattern detected");
      }
    }
    if (!allowNewlines) {
      value = value.replace('\n', ' ').replace('\r', ' ');
    }
    return value.trim();
  }

  public String sanitizeString(String text) {
    return sanitizeString(text, 1000, true);
  }

  /**
   * Sanitizes text and escapes it for an SVG text node or attribute.
   *
   * @param text user text
   * @return escaped text
   */
  public String sanitizeForSvg(String text) {
    String value = sanitizeString(text, 500, false);
    StringBuilder out = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      switch (c) {
        case '&' -> out.append("&amp;");
        case '<' -> out.append("&lt;");
        case '>' -> out.append("&gt;");
        case '"' -> out.append("&quot;");
        case '\'' -> out.append("&#x27;");
        default -> out.append(c);
      }
    }
    return out.toString();
  }

  /**
   * Range check; either bound may be null.
   *
   * @param value the value
   * @param min   inclusive minimum
   * @param max   inclusive maximum
   * @return the value
   */
  public double sanitizeNumericRange(double value, Double min, Double max) {
    if (Double.isNaN(value)) {
      throw new SanitizationException("Value must be numeric");
    }
    if (min != null && value < min) {
      throw new SanitizationException("Value " + value + " below minimum " + min);
    }
    if (max != null && value > max) {
      throw new SanitizationException("Value " + value + " above maximum " + max);
    }
    return value;
  }

  /**
   * Accepts only http and https URLs that do not point at loopback or private ranges.
   *
   * @param url the url
   * @return the url unchanged
   */
  public String sanitizeUrl(String url) {
    if (url == null) {
      throw new SanitizationException("Missing URL");
    }
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new SanitizationException("Invalid URL: " + e.getMessage());
    }
    String scheme = uri.getScheme();
    if (!"http".equals(scheme) && !"https".equals(scheme)) {
      throw new SanitizationException("Invalid URL scheme: " + scheme + ". Only http/https allowed");
    }
    String host = uri.getHost();
    if (host != null) {
      String lower = host.toLowerCase(Locale.ROOT);
      if (lower.equals("localhost") || lower.equals("127.0.0.1") || lower.equals("::1")
          || lower.equals("[::1]")) {
        throw new SanitizationException("Localhost URLs not allowed");
      }
      if (lower.startsWith("10.") || lower.startsWith("172.16.") || lower.startsWith("192.168.")) {
        throw new SanitizationException("Private IP addresses not allowed");
      }
    }
    return url;
  }

  /**
   * Rejects maps containing keys outside the allowed set. A null allowed set permits all keys.
   *
   * @param data        the map
   * @param allowedKeys permitted keys
   * @param <V>         value type
   * @return the same map
   */
  public <V> Map<String, V> sanitizeKeys(Map<String, V> data, Collection<String> allowedKeys) {
    if (data == null) {
      throw new SanitizationException("Missing data");
    }
    if (allowedKeys != null) {
      for (String key : data.keySet()) {
        if (!allowedKeys.contains(key)) {
          throw new SanitizationException("Disallowed key: " + key
              + ". Allowed: " + String.join(", ", allowedKeys));
        }
      }
    }
    return data;
  }

  public boolean isStrict() {
    return strict;
  }
}

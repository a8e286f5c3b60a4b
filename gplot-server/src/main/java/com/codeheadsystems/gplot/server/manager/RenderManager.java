package com.codeheadsystems.gplot.server.manager;

import com.codeheadsystems.gplot.model.render.RenderRequest;
import com.codeheadsystems.gplot.model.render.RenderResponse;
import com.codeheadsystems.gplot.server.exceptions.SanitizationException;
import com.codeheadsystems.gplot.server.render.GraphRenderer;
import com.codeheadsystems.gplot.server.render.GraphSpec;
import com.codeheadsystems.gplot.server.security.Sanitizer;
import com.codeheadsystems.gplot.server.storage.ImageStorage;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic render orchestration.
 * <p>
 * Sanitizes the request, renders it, and either returns the image inline or stores it for
 * the caller's group and returns its identifier.
 * <p>
 * Exception contract (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link SanitizationException} (an {@link IllegalArgumentException}): bad input, 400</li>
 *   <li>{@link com.codeheadsystems.gplot.server.exceptions.StorageException}: storage failed, 500</li>
 * </ul>
 */
public class RenderManager {

  private static final Logger log = LoggerFactory.getLogger(RenderManager.class);
  private static final int MAX_POINTS = 10_000;
  private static final String DEFAULT_THEME = "light";
  private static final String DEFAULT_FORMAT = "png";

  private final GraphRenderer renderer;
  private final ImageStorage imageStorage;
  private final Sanitizer sanitizer;

  /**
   * Instantiates a new Render manager.
   *
   * @param renderer     chart renderer
   * @param imageStorage storage for proxy mode
   * @param sanitizer    input sanitizer
   */
  public RenderManager(GraphRenderer renderer, ImageStorage imageStorage, Sanitizer sanitizer) {
    this.renderer = renderer;
    this.imageStorage = imageStorage;
    this.sanitizer = sanitizer;
  }

  /**
   * Renders a request.
   *
   * @param request the request
   * @param group   the caller's group, may be null
   * @return inline or proxy response
   */
  public RenderResponse render(RenderRequest request, String group) {
    if (request == null) {
      throw new SanitizationException("Missing render request");
    }
    GraphSpec spec = toSpec(request);
    byte[] image = renderer.render(spec);
    log.debug("Rendered {} chart as {} ({} bytes)", spec.chartType(), spec.format(), image.length);
    if (request.proxy()) {
      String guid = imageStorage.saveImage(image, spec.format(), group);
      return RenderResponse.proxy(spec.format(), guid);
    }
    return RenderResponse.inline(spec.format(), Base64.getEncoder().encodeToString(image));
  }

  private GraphSpec toSpec(RenderRequest request) {
    List<Double> x = request.x();
    List<Double> y = request.y();
    if (x == null || y == null || x.isEmpty()) {
      throw new SanitizationException("x and y values are required");
    }
    if (x.size() != y.size()) {
      throw new SanitizationException("x and y must have the same length: " + x.size() + " != " + y.size());
    }
    if (x.size() > MAX_POINTS) {
      throw new SanitizationException("Too many points: " + x.size() + " > " + MAX_POINTS);
    }
    if (x.contains(null) || y.contains(null)) {
      throw new SanitizationException("x and y must not contain nulls");
    }
    return new GraphSpec(
        sanitizer.sanitizeChartType(request.chartType()),
        request.title() == null ? "" : sanitizer.sanitizeForSvg(request.title()),
        x,
        y,
        request.xLabel() == null ? null : sanitizer.sanitizeForSvg(request.xLabel()),
        request.yLabel() == null ? null : sanitizer.sanitizeForSvg(request.yLabel()),
        sanitizer.sanitizeFormat(request.format() == null ? DEFAULT_FORMAT : request.format()),
        sanitizer.sanitizeTheme(request.theme() == null ? DEFAULT_THEME : request.theme()));
  }
}

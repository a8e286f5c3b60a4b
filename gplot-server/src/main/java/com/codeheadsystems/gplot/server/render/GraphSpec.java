package com.codeheadsystems.gplot.server.render;

import java.util.List;

/**
 * Sanitized chart description handed to a {@link GraphRenderer}.
 *
 * @param chartType line, scatter or bar
 * @param title     escaped title
 * @param x         x values
 * @param y         y values, same length as x
 * @param xLabel    escaped x label, may be null
 * @param yLabel    escaped y label, may be null
 * @param format    output format
 * @param theme     theme name
 */
public record GraphSpec(
    String chartType,
    String title,
    List<Double> x,
    List<Double> y,
    String xLabel,
    String yLabel,
    String format,
    String theme) {

  public GraphSpec {
    x = List.copyOf(x);
    y = List.copyOf(y);
  }
}

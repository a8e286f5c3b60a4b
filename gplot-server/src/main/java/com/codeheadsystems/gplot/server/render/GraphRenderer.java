package com.codeheadsystems.gplot.server.render;

/**
 * Draws a chart. Implementations may be slow and CPU bound; they are never called while a
 * storage or rate-limit lock is held.
 */
@FunctionalInterface
public interface GraphRenderer {

  /**
   * Renders the chart.
   *
   * @param spec the chart
   * @return image bytes in {@link GraphSpec#format()}
   */
  byte[] render(GraphSpec spec);
}

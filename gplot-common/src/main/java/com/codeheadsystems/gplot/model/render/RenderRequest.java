package com.codeheadsystems.gplot.model.render;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Wire model for a chart render request.
 * <p>
 * Used by: {@code POST /render}
 *
 * @param chartType chart type: {@code line}, {@code scatter} or {@code bar}
 * @param title     chart title
 * @param x         x-axis values
 * @param y         y-axis values, same length as {@code x}
 * @param xLabel    optional x-axis label
 * @param yLabel    optional y-axis label
 * @param format    output format: {@code png}, {@code jpg}, {@code jpeg}, {@code svg} or {@code pdf}
 * @param theme     optional theme name; defaults to {@code light}
 * @param proxy     when true the image is stored server-side and only its identifier is returned
 */
public record RenderRequest(
    @JsonProperty("chartType") String chartType,
    @JsonProperty("title") String title,
    @JsonProperty("x") List<Double> x,
    @JsonProperty("y") List<Double> y,
    @JsonProperty("xLabel") String xLabel,
    @JsonProperty("yLabel") String yLabel,
    @JsonProperty("format") String format,
    @JsonProperty("theme") String theme,
    @JsonProperty("proxy") boolean proxy) {
}

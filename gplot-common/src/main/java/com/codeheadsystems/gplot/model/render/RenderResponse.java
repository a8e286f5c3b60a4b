package com.codeheadsystems.gplot.model.render;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a render result.
 * <p>
 * Exactly one delivery mode is populated: inline ({@code imageBase64}) or proxy
 * ({@code guid} and {@code imagePath}).
 *
 * @param format      format of the rendered image
 * @param imageBase64 base64-encoded image bytes, inline mode only
 * @param guid        identifier of the stored image, proxy mode only
 * @param imagePath   relative path the image can be fetched from, proxy mode only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RenderResponse(
    @JsonProperty("format") String format,
    @JsonProperty("imageBase64") String imageBase64,
    @JsonProperty("guid") String guid,
    @JsonProperty("imagePath") String imagePath) {

  /**
   * Inline render response.
   *
   * @param format      the format
   * @param imageBase64 the base64 image
   * @return the render response
   */
  public static RenderResponse inline(String format, String imageBase64) {
    return new RenderResponse(format, imageBase64, null, null);
  }

  /**
   * Proxy render response.
   *
   * @param format the format
   * @param guid   the stored image identifier
   * @return the render response
   */
  public static RenderResponse proxy(String format, String guid) {
    return new RenderResponse(format, null, guid, "/images/" + guid);
  }
}

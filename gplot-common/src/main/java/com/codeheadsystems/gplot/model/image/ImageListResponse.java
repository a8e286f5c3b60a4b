package com.codeheadsystems.gplot.model.image;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Identifiers of the stored images visible to the caller.
 * <p>
 * Used by: {@code GET /images} response
 *
 * @param guids image identifiers, scoped to the caller's group when the caller has one
 */
public record ImageListResponse(@JsonProperty("guids") List<String> guids) {

  /**
   * Defensive copy so the response cannot be mutated after construction.
   */
  public ImageListResponse {
    guids = guids == null ? List.of() : List.copyOf(guids);
  }
}

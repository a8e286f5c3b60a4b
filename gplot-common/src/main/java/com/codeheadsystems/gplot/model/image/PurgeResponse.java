package com.codeheadsystems.gplot.model.image;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a purge.
 *
 * @param deleted number of metadata records removed, including orphaned ones
 */
public record PurgeResponse(@JsonProperty("deleted") int deleted) {
}

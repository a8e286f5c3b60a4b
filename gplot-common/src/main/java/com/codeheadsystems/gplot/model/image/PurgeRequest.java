package com.codeheadsystems.gplot.model.image;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request to purge stored images older than a number of days.
 * <p>
 * Used by: {@code POST /images/purge}
 *
 * @param ageDays minimum age in days of the images to delete; {@code 0} deletes every image
 *                within the caller's group regardless of age. Null when the field is absent,
 *                which the endpoint rejects.
 */
public record PurgeRequest(@JsonProperty("ageDays") Integer ageDays) {
}

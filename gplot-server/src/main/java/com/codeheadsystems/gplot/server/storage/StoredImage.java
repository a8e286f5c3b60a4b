package com.codeheadsystems.gplot.server.storage;

/**
 * Bytes and format of a retrieved image.
 *
 * @param data   image bytes
 * @param format image format
 */
public record StoredImage(byte[] data, String format) {
}

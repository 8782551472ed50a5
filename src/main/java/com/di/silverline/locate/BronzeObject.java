package com.di.silverline.locate;

import java.time.Instant;

/**
 * One object found under a bronze partition prefix.
 *
 * @param uri       full {@code gs://bucket/name} URI
 * @param name      object name within the bucket
 * @param createdAt arrival time as recorded by the store; may be {@code null}
 */
public record BronzeObject(String uri, String name, long sizeBytes, Instant createdAt) {
}

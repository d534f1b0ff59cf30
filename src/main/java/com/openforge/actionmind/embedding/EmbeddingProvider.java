package com.openforge.actionmind.embedding;

import java.util.Optional;

/**
 * Turns text into a fixed-dimension dense vector.
 *
 * An empty result means "provider unavailable" (disabled, unreachable, too
 * slow, or broken response). Callers treat it as having no opinion; it is
 * never an error.
 */
@FunctionalInterface
public interface EmbeddingProvider {

    Optional<float[]> embed(String text);
}

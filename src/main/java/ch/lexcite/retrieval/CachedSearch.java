package ch.lexcite.retrieval;

import java.util.List;

/**
 * Cache payload of a search listing.
 */
public record CachedSearch<T>(List<T> results, long total, ResultSource origin) {
}

package ch.lexcite.client;

import java.util.Optional;

import org.jetbrains.annotations.Nullable;

/**
 * Result of looking up a single record by identifier. Absence is a normal outcome.
 */
public record LookupResult<T>(boolean found, @Nullable T record) {

    public static <T> LookupResult<T> found(T record) {
        return new LookupResult<>(true, record);
    }

    public static <T> LookupResult<T> notFound() {
        return new LookupResult<>(false, null);
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(record);
    }
}

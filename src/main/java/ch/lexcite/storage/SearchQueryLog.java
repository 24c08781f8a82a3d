package ch.lexcite.storage;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

/**
 * Append-only log of external searches, kept for analytics.
 */
public interface SearchQueryLog {

    CompletableFuture<Void> record(@NotNull SearchQueryEntry entry);

    /**
     * @return most recent entries first
     */
    CompletableFuture<List<SearchQueryEntry>> recent(int limit);
}

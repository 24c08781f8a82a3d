package ch.lexcite.storage;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

/**
 * Durable store of fetched decisions, independent of the cache lifetime.
 */
public interface DecisionStore {

    /**
     * Inserts or updates a decision by its external identifier.
     *
     * <p>Scalar fields take the incoming values. {@code lastFetchedAt} is set by
     * the store and strictly increases across upserts of the same identifier.</p>
     *
     * @param record decision to persist
     * @return the persisted decision
     */
    CompletableFuture<DecisionRecord> upsert(@NotNull DecisionRecord record);

    /**
     * Upserts all decisions in one transaction.
     *
     * @return number of decisions written
     */
    CompletableFuture<Integer> upsertAll(@NotNull List<DecisionRecord> records);

    CompletableFuture<Optional<DecisionRecord>> findByExternalId(@NotNull String externalId);

    /**
     * Finds a decision by its official citation, compared case-insensitively.
     */
    CompletableFuture<Optional<DecisionRecord>> findByCitation(@NotNull String citation);

    /**
     * @return matching decisions, newest first, with the total match count
     */
    CompletableFuture<SearchPage<DecisionRecord>> search(@NotNull DecisionQuery query);

    CompletableFuture<Long> count();
}

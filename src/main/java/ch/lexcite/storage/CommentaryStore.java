package ch.lexcite.storage;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.NotNull;

/**
 * Durable store of fetched commentaries.
 */
public interface CommentaryStore {

    CompletableFuture<CommentaryRecord> upsert(@NotNull CommentaryRecord record);

    CompletableFuture<Integer> upsertAll(@NotNull List<CommentaryRecord> records);

    CompletableFuture<Optional<CommentaryRecord>> findByExternalId(@NotNull String externalId);
}

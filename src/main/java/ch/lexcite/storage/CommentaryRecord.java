package ch.lexcite.storage;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * A legal commentary as persisted and returned by the retrieval tools.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommentaryRecord(
    String externalId,
    @Nullable String title,
    List<String> authors,
    @Nullable String legislativeAct,
    @Nullable String language,
    @Nullable String summary,
    @Nullable String content,
    @Nullable String sourceUrl,
    @Nullable String updated,
    @Nullable Instant lastFetchedAt
) {

    public CommentaryRecord {
        Objects.requireNonNull(externalId, "externalId must not be null");
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public CommentaryRecord withLastFetchedAt(Instant fetchedAt) {
        return new CommentaryRecord(externalId, title, authors, legislativeAct, language, summary, content, sourceUrl,
            updated, fetchedAt);
    }
}

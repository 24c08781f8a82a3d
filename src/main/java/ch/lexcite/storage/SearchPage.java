package ch.lexcite.storage;

import java.util.List;

/**
 * One page of search results.
 *
 * @param records results on this page
 * @param total   total number of matches across all pages
 */
public record SearchPage<T>(List<T> records, long total) {

    public SearchPage {
        records = List.copyOf(records);
    }

    public static <T> SearchPage<T> empty() {
        return new SearchPage<>(List.of(), 0);
    }
}

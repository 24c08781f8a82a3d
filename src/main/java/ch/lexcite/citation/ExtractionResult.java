package ch.lexcite.citation;

import java.util.List;
import java.util.Map;

/**
 * Citations found in a text together with summary counts.
 */
public record ExtractionResult(List<ExtractedCitation> citations, Statistics statistics) {

    public ExtractionResult {
        citations = List.copyOf(citations);
    }

    /**
     * @param total   number of occurrences
     * @param byType  occurrences per citation type value
     * @param valid   occurrences that validated
     * @param invalid occurrences that failed validation
     */
    public record Statistics(int total, Map<String, Integer> byType, int valid, int invalid) {

        public Statistics {
            byType = Map.copyOf(byType);
        }
    }
}

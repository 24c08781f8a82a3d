package ch.lexcite.citation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.NotNull;

/**
 * Locates citations in documents and reports their positions.
 */
@ApplicationScoped
public class CitationExtractor {

    private final CitationValidator validator;

    @Inject
    public CitationExtractor(CitationValidator validator) {
        this.validator = validator;
    }

    public CitationExtractor() {
        this(new CitationValidator());
    }

    /**
     * Extracts every citation occurrence.
     *
     * @param text         document text
     * @param includeTypes citation kinds to keep; empty or null keeps all
     * @param validate     whether to validate each occurrence
     * @return occurrences in text order and statistics
     */
    @NotNull
    public ExtractionResult extract(String text, Set<CitationType> includeTypes, boolean validate) {
        List<ExtractedCitation> citations = new ArrayList<>();
        Map<String, Integer> byType = new LinkedHashMap<>();
        int valid = 0;
        int invalid = 0;

        for (CitationScanner.Span span : CitationScanner.scan(text)) {
            if (includeTypes != null && !includeTypes.isEmpty() && !includeTypes.contains(span.type())) {
                continue;
            }
            Language language = CitationGrammar.detectLanguage(span.text());
            Boolean isValid = null;
            String normalized = null;
            if (validate) {
                ValidationResult result = validator.validate(span.text());
                isValid = result.valid();
                normalized = result.normalized();
                language = result.language();
                if (result.valid()) {
                    valid++;
                } else {
                    invalid++;
                }
            }
            citations.add(new ExtractedCitation(span.text(), span.type(), language, span.start(), span.end(),
                isValid, normalized));
            byType.merge(span.type().value(), 1, Integer::sum);
        }
        return new ExtractionResult(citations,
            new ExtractionResult.Statistics(citations.size(), byType, valid, invalid));
    }
}

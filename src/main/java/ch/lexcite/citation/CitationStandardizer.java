package ch.lexcite.citation;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

/**
 * Rewrites every citation in a document into a single language and style.
 */
@ApplicationScoped
public class CitationStandardizer {

    private static final Logger LOG = Logger.getLogger(CitationStandardizer.class);

    private final CitationValidator validator;
    private final CitationFormatter formatter;

    @Inject
    public CitationStandardizer(CitationValidator validator, CitationFormatter formatter) {
        this.validator = validator;
        this.formatter = formatter;
    }

    public CitationStandardizer() {
        this(new CitationValidator(), new CitationFormatter());
    }

    @NotNull
    public StandardizationResult standardize(String text, @NotNull Language target, @NotNull StandardizeStyle style) {
        String input = text == null ? "" : text;
        List<CitationScanner.Span> spans = CitationScanner.scan(input);
        List<StandardizationResult.Replacement> replacements = new ArrayList<>();
        int skipped = 0;

        for (CitationScanner.Span span : spans) {
            ValidationResult result = validator.validate(span.text());
            if (!result.valid() || result.citation() == null) {
                skipped++;
                continue;
            }
            String rendered;
            try {
                FormattedCitation formatted = formatter.format(result.citation(), target, style.formatOptions());
                rendered = formatted.fullReference() != null ? formatted.fullReference() : formatted.citation();
            } catch (CitationFormatException e) {
                LOG.debugf("Leaving '%s' unchanged: %s", span.text(), e.getMessage());
                skipped++;
                continue;
            }
            if (!rendered.equals(span.text())) {
                replacements.add(new StandardizationResult.Replacement(span.text(), rendered, span.start(), span.end(),
                    span.type()));
            }
        }

        // Apply from the end so earlier offsets stay valid
        StringBuilder output = new StringBuilder(input);
        for (int i = replacements.size() - 1; i >= 0; i--) {
            StandardizationResult.Replacement replacement = replacements.get(i);
            output.replace(replacement.start(), replacement.end(), replacement.replacement());
        }
        return new StandardizationResult(output.toString(), target, style, replacements, spans.size(),
            spans.size() - skipped, skipped);
    }
}

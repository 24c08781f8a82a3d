package ch.lexcite.citation;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jetbrains.annotations.Nullable;

/**
 * Resolves a statute article to its SR number and Fedlex address.
 */
@ApplicationScoped
public class ProvisionLocator {

    static final String FEDLEX_BASE_URL = "https://www.fedlex.admin.ch/eli/cc/";

    private static final Pattern ARTICLE = Pattern.compile(
        "^(\\d{1,4})(bis|ter|quater|quinquies|sexies|septies|octies|[a-z])?$", Pattern.CASE_INSENSITIVE);

    private final CitationFormatter formatter;

    @Inject
    public ProvisionLocator(CitationFormatter formatter) {
        this.formatter = formatter;
    }

    public ProvisionLocator() {
        this(new CitationFormatter());
    }

    /**
     * @param statute   statute abbreviation in any language
     * @param article   article number, optionally with suffix ("261bis")
     * @param paragraph paragraph, or null
     * @param letter    letter, or null
     * @param language  language of the reference and the Fedlex page
     * @return the provision location
     * @throws IllegalArgumentException for unknown statutes or malformed article numbers
     */
    public ProvisionReference locate(String statute, String article, @Nullable Integer paragraph,
                                     @Nullable String letter, Language language) {
        StatuteCode code = StatuteCode.fromAbbreviation(statute)
            .orElseThrow(() -> new IllegalArgumentException("Unknown statute code: " + statute));
        Matcher matcher = ARTICLE.matcher(article == null ? "" : article.trim());
        if (!matcher.matches() || Integer.parseInt(matcher.group(1)) < 1) {
            throw new IllegalArgumentException("Invalid article number: " + article);
        }

        Statute provision = Statute.builder(code, Integer.parseInt(matcher.group(1)))
            .articleSuffix(matcher.group(2) == null ? null : matcher.group(2).toLowerCase(Locale.ROOT))
            .paragraph(paragraph)
            .letter(letter == null || letter.isBlank() ? null : letter.trim().toLowerCase(Locale.ROOT))
            .sourceLanguage(language)
            .build();
        FormattedCitation formatted = formatter.format(provision, language);
        String srNumber = code.srNumber();
        return new ProvisionReference(
            code,
            code.abbreviation(language).orElseThrow(),
            srNumber,
            formatted.citation(),
            code.fullName(language).orElse(null),
            FEDLEX_BASE_URL + srNumber + "/" + language.code(),
            language);
    }
}

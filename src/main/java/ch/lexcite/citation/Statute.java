package ch.lexcite.citation;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Reference to an article of a federal statute, e.g. {@code Art. 97 Abs. 1 OR}.
 *
 * <p>Paragraph, letter and number are optional and independent of each other;
 * an absent component is {@code null}.</p>
 *
 * @param code          canonical statute code
 * @param article       article number
 * @param articleSuffix suffix such as "a" or "bis", or null
 * @param paragraph     paragraph (Abs./al./cpv./para.), or null
 * @param letter        letter (lit./let./lett.), or null
 * @param number        number (Ziff./ch./n./no.), or null
 * @param sourceLanguage language implied by the input
 * @param rawText       original input
 */
public record Statute(
    StatuteCode code,
    int article,
    @Nullable String articleSuffix,
    @Nullable Integer paragraph,
    @Nullable String letter,
    @Nullable Integer number,
    Language sourceLanguage,
    String rawText
) implements Citation {

    public Statute {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
        Objects.requireNonNull(rawText, "rawText must not be null");
        if (article <= 0) {
            throw new IllegalArgumentException("article must be positive, got: " + article);
        }
    }

    /**
     * @return article number including its suffix, e.g. "261bis"
     */
    public String articleLabel() {
        return articleSuffix == null ? String.valueOf(article) : article + articleSuffix;
    }

    @Override
    public CitationType type() {
        return CitationType.STATUTE;
    }

    /**
     * Creates a new builder for the given statute and article.
     */
    public static Builder builder(@NotNull StatuteCode code, int article) {
        return new Builder(code, article);
    }

    /**
     * Builder for statute references.
     */
    public static final class Builder {
        private final StatuteCode code;
        private final int article;
        private String articleSuffix;
        private Integer paragraph;
        private String letter;
        private Integer number;
        private Language sourceLanguage = Language.DE;
        private String rawText;

        private Builder(StatuteCode code, int article) {
            this.code = code;
            this.article = article;
        }

        public Builder articleSuffix(@Nullable String articleSuffix) {
            this.articleSuffix = articleSuffix;
            return this;
        }

        public Builder paragraph(@Nullable Integer paragraph) {
            this.paragraph = paragraph;
            return this;
        }

        public Builder letter(@Nullable String letter) {
            this.letter = letter;
            return this;
        }

        public Builder number(@Nullable Integer number) {
            this.number = number;
            return this;
        }

        public Builder sourceLanguage(@NotNull Language sourceLanguage) {
            this.sourceLanguage = sourceLanguage;
            return this;
        }

        public Builder rawText(@NotNull String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Statute build() {
            String raw = rawText != null ? rawText
                : "Art. " + article + (articleSuffix != null ? articleSuffix : "") + " "
                    + code.abbreviation(Language.DE).orElse(code.name());
            return new Statute(code, article, articleSuffix, paragraph, letter, number, sourceLanguage, raw);
        }
    }
}

package ch.lexcite.storage;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * A court decision as persisted and returned by the retrieval tools.
 *
 * <p>The external identifier assigned by the source is the upsert identity.
 * Legal areas are kept as a sorted set.</p>
 *
 * @param externalId    identifier assigned by the source
 * @param courtLevel    federal or cantonal
 * @param court         court name
 * @param canton        two-letter canton code, or "CH" for federal courts
 * @param citation      official citation (e.g. "BGE 147 IV 73") or case number
 * @param chamber       chamber numeral or court division
 * @param title         decision title
 * @param summary       headnote or abstract
 * @param decisionDate  ISO-8601 date
 * @param language      language code of the decision
 * @param legalAreas    legal areas
 * @param fullText      full text, often absent in listings
 * @param sourceUrl     link to the decision at the source
 * @param lastFetchedAt last time the record was fetched, set by the store
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DecisionRecord(
    String externalId,
    CourtLevel courtLevel,
    @Nullable String court,
    @Nullable String canton,
    @Nullable String citation,
    @Nullable String chamber,
    @Nullable String title,
    @Nullable String summary,
    @Nullable String decisionDate,
    @Nullable String language,
    Set<String> legalAreas,
    @Nullable String fullText,
    @Nullable String sourceUrl,
    @Nullable Instant lastFetchedAt
) {

    public DecisionRecord {
        Objects.requireNonNull(externalId, "externalId must not be null");
        Objects.requireNonNull(courtLevel, "courtLevel must not be null");
        legalAreas = legalAreas == null ? Set.of() : Set.copyOf(new TreeSet<>(legalAreas));
    }

    public DecisionRecord withLastFetchedAt(Instant fetchedAt) {
        return new DecisionRecord(externalId, courtLevel, court, canton, citation, chamber, title, summary,
            decisionDate, language, legalAreas, fullText, sourceUrl, fetchedAt);
    }

    public static Builder builder(String externalId, CourtLevel courtLevel) {
        return new Builder(externalId, courtLevel);
    }

    public static final class Builder {
        private final String externalId;
        private final CourtLevel courtLevel;
        private String court;
        private String canton;
        private String citation;
        private String chamber;
        private String title;
        private String summary;
        private String decisionDate;
        private String language;
        private Set<String> legalAreas = Set.of();
        private String fullText;
        private String sourceUrl;
        private Instant lastFetchedAt;

        private Builder(String externalId, CourtLevel courtLevel) {
            this.externalId = externalId;
            this.courtLevel = courtLevel;
        }

        public Builder court(String court) {
            this.court = court;
            return this;
        }

        public Builder canton(String canton) {
            this.canton = canton;
            return this;
        }

        public Builder citation(String citation) {
            this.citation = citation;
            return this;
        }

        public Builder chamber(String chamber) {
            this.chamber = chamber;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder decisionDate(String decisionDate) {
            this.decisionDate = decisionDate;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder legalAreas(Set<String> legalAreas) {
            this.legalAreas = legalAreas;
            return this;
        }

        public Builder fullText(String fullText) {
            this.fullText = fullText;
            return this;
        }

        public Builder sourceUrl(String sourceUrl) {
            this.sourceUrl = sourceUrl;
            return this;
        }

        public Builder lastFetchedAt(Instant lastFetchedAt) {
            this.lastFetchedAt = lastFetchedAt;
            return this;
        }

        public DecisionRecord build() {
            return new DecisionRecord(externalId, courtLevel, court, canton, citation, chamber, title, summary,
                decisionDate, language, legalAreas, fullText, sourceUrl, lastFetchedAt);
        }
    }
}

package ch.lexcite.client.commentary;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A statute for which commentaries are published.
 *
 * @param id             source identifier (UUID), used to filter commentary searches
 * @param name           title of the act
 * @param abbreviation   main abbreviation
 * @param abbreviationDe German abbreviation
 * @param abbreviationFr French abbreviation
 * @param abbreviationIt Italian abbreviation
 * @param language       language of the entry
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LegislativeAct(
    String id,
    String name,
    String abbreviation,
    @JsonProperty("abbreviation_de") String abbreviationDe,
    @JsonProperty("abbreviation_fr") String abbreviationFr,
    @JsonProperty("abbreviation_it") String abbreviationIt,
    String language
) {

    /**
     * @return every non-blank abbreviation of the act
     */
    public List<String> abbreviations() {
        List<String> all = new ArrayList<>();
        for (String candidate : new String[] {abbreviation, abbreviationDe, abbreviationFr, abbreviationIt}) {
            if (candidate != null && !candidate.isBlank()) {
                all.add(candidate);
            }
        }
        return all;
    }
}

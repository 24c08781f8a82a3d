package ch.lexcite.citation;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConvertResponse(
    String original,
    Language sourceLanguage,
    FormattedCitation converted,
    Map<String, String> translations
) {
}

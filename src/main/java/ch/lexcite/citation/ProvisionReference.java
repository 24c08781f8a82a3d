package ch.lexcite.citation;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jetbrains.annotations.Nullable;

/**
 * Location of a statutory provision in the federal classified compilation.
 *
 * @param statute      canonical statute code
 * @param abbreviation abbreviation in the requested language
 * @param srNumber     SR number
 * @param reference    formatted provision reference
 * @param fullName     official statute title, where known
 * @param fedlexUrl    consolidated version on Fedlex
 * @param language     requested language
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProvisionReference(
    StatuteCode statute,
    String abbreviation,
    String srNumber,
    String reference,
    @Nullable String fullName,
    String fedlexUrl,
    Language language
) {
}

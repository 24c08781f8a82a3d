package ch.lexcite.citation;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

/**
 * Citation tools.
 *
 * <h2>Endpoints:</h2>
 * <ul>
 *   <li>{@code POST /citations/validate} - Validate and normalize a citation</li>
 *   <li>{@code POST /citations/parse} - Parse a citation, with suggestions when malformed</li>
 *   <li>{@code POST /citations/format} - Render a citation in a target language</li>
 *   <li>{@code POST /citations/convert} - Convert a citation, optionally into every language</li>
 *   <li>{@code POST /citations/extract} - Find citations in a text</li>
 *   <li>{@code POST /citations/standardize} - Rewrite all citations of a text</li>
 *   <li>{@code POST /citations/provision} - Locate a statutory provision</li>
 * </ul>
 */
@Path("/citations")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class CitationResources {

    private static final Logger LOG = Logger.getLogger(CitationResources.class);

    @Inject
    CitationValidator validator;

    @Inject
    CitationParser parser;

    @Inject
    CitationFormatter formatter;

    @Inject
    CitationExtractor extractor;

    @Inject
    CitationStandardizer standardizer;

    @Inject
    ProvisionLocator provisionLocator;

    @POST
    @Path("/validate")
    public ValidationResult validate(@Valid final CitationRequest request) {
        return validator.validate(request.citation());
    }

    @POST
    @Path("/parse")
    public ParsedCitation parse(@Valid final CitationRequest request) {
        return parser.parse(request.citation());
    }

    @POST
    @Path("/format")
    public FormattedCitation format(@Valid final FormatRequest request) {
        Language target = Language.fromCode(request.targetLanguage());
        ParsedCitation parsed = requireValid(request.citation());
        return formatter.format(parsed.citation(), target, request.options());
    }

    @POST
    @Path("/convert")
    public ConvertResponse convert(@Valid final ConvertRequest request) {
        Language target = Language.fromCode(request.targetLanguage());
        ParsedCitation parsed = requireValid(request.citation());
        FormattedCitation converted = formatter.format(parsed.citation(), target);

        Map<String, String> translations = null;
        if (Boolean.TRUE.equals(request.allTranslations())) {
            translations = new LinkedHashMap<>();
            for (Map.Entry<Language, FormattedCitation> entry : formatter.getAllTranslations(parsed.citation()).entrySet()) {
                translations.put(entry.getKey().code(), entry.getValue().citation());
            }
        }
        return new ConvertResponse(parsed.rawText(), parsed.language(), converted, translations);
    }

    @POST
    @Path("/extract")
    public ExtractionResult extract(@Valid final ExtractRequest request) {
        Set<CitationType> types = EnumSet.noneOf(CitationType.class);
        List<String> requested = request.includeTypes() == null ? List.of() : request.includeTypes();
        for (String type : requested) {
            types.add(CitationType.fromValue(type));
        }
        ExtractionResult result = extractor.extract(request.text(), types, !Boolean.FALSE.equals(request.validate()));
        LOG.debugf("Extracted %d citations", result.statistics().total());
        return result;
    }

    @POST
    @Path("/standardize")
    public StandardizationResult standardize(@Valid final StandardizeRequest request) {
        Language target = Language.fromCode(request.targetLanguage());
        StandardizationResult result = standardizer.standardize(request.text(), target,
            StandardizeStyle.fromValue(request.style()));
        LOG.infof("Standardized %d of %d citations to %s", result.standardized(), result.found(), target.code());
        return result;
    }

    @POST
    @Path("/provision")
    public ProvisionReference provision(@Valid final ProvisionRequest request) {
        Language language = request.language() == null ? Language.DE : Language.fromCode(request.language());
        return provisionLocator.locate(request.statute(), request.article(), request.paragraph(), request.letter(),
            language);
    }

    private ParsedCitation requireValid(String citation) {
        ParsedCitation parsed = parser.parse(citation);
        if (!parsed.valid()) {
            throw new InvalidCitationException(parsed);
        }
        return parsed;
    }
}

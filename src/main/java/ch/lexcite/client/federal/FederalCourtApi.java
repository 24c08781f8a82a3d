package ch.lexcite.client.federal;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the Federal Supreme Court decision API.
 *
 * <pre>
 * quarkus.rest-client."federal-court".url=https://www.bger.ch/api
 * quarkus.rest-client."federal-court".read-timeout=10000
 * </pre>
 */
@RegisterRestClient(configKey = "federal-court")
@RegisterProvider(FederalCourtResponseExceptionMapper.class)
@ClientHeaderParam(name = "Authorization", value = "{lookupAuth}")
@ClientHeaderParam(name = "User-Agent", value = "{lookupUserAgent}")
@Path("/decisions")
@Produces(MediaType.APPLICATION_JSON)
public interface FederalCourtApi {

    @GET
    @Path("/search")
    DecisionPage search(
        @QueryParam("q") String query,
        @QueryParam("lang") String language,
        @QueryParam("chamber") String chamber,
        @QueryParam("legalArea") String legalArea,
        @QueryParam("dateFrom") String dateFrom,
        @QueryParam("dateTo") String dateTo,
        @QueryParam("limit") Integer limit,
        @QueryParam("offset") Integer offset
    );

    /**
     * Fetches a published decision by its position in the official series.
     */
    @GET
    @Path("/bge/{volume}/{chamber}/{page}")
    DecisionEnvelope byCitation(
        @PathParam("volume") int volume,
        @PathParam("chamber") String chamber,
        @PathParam("page") int page
    );

    @GET
    @Path("/{id}")
    DecisionEnvelope byId(@PathParam("id") String id);

    @GET
    @Path("/recent")
    DecisionPage recent(@QueryParam("limit") Integer limit, @QueryParam("chamber") String chamber);

    default String lookupAuth() {
        return ConfigProvider.getConfig()
            .getOptionalValue("lexcite.sources.federal.api-key", String.class)
            .map(key -> "Bearer " + key)
            .orElse(null);
    }

    default String lookupUserAgent() {
        return ConfigProvider.getConfig()
            .getOptionalValue("lexcite.sources.federal.user-agent", String.class)
            .orElse("lexcite/1.0");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Decision(
        String decisionId,
        String bgeReference,
        String title,
        String summary,
        String decisionDate,
        String language,
        String chamber,
        List<String> legalAreas,
        String fullText,
        String sourceUrl,
        List<String> relatedDecisions,
        Metadata metadata
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Metadata(
        String fileNumber,
        List<String> judges,
        List<String> keywords
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DecisionEnvelope(Decision data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DecisionPage(List<Decision> data, Meta meta) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Meta(Long total, Integer page, Integer limit) {}
}

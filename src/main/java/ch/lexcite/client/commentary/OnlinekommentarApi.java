package ch.lexcite.client.commentary;

import com.fasterxml.jackson.databind.JsonNode;
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
 * REST client for onlinekommentar.ch. No authentication is required.
 *
 * <p>The API answers either with a {@code {success, data, error}} envelope or
 * with the bare payload, so responses are read as trees.</p>
 *
 * <pre>
 * quarkus.rest-client.onlinekommentar.url=https://onlinekommentar.ch/api
 * quarkus.rest-client.onlinekommentar.read-timeout=30000
 * </pre>
 */
@RegisterRestClient(configKey = "onlinekommentar")
@RegisterProvider(OnlinekommentarResponseExceptionMapper.class)
@ClientHeaderParam(name = "User-Agent", value = "{lookupUserAgent}")
@Produces(MediaType.APPLICATION_JSON)
public interface OnlinekommentarApi {

    @GET
    @Path("/commentaries")
    JsonNode search(
        @QueryParam("search") String search,
        @QueryParam("language") String language,
        @QueryParam("legislative_act") String legislativeAct,
        @QueryParam("sort") String sort,
        @QueryParam("page") Integer page
    );

    @GET
    @Path("/commentaries/{id}")
    JsonNode commentary(@PathParam("id") String id);

    @GET
    @Path("/legislative-acts")
    JsonNode legislativeActs(@QueryParam("language") String language);

    default String lookupUserAgent() {
        return ConfigProvider.getConfig()
            .getOptionalValue("lexcite.sources.commentary.user-agent", String.class)
            .orElse("lexcite/1.0");
    }
}

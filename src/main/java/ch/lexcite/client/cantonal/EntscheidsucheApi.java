package ch.lexcite.client.cantonal;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.rest.client.annotation.ClientHeaderParam;
import org.eclipse.microprofile.rest.client.annotation.RegisterProvider;
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

/**
 * REST client for the entscheidsuche.ch Elasticsearch front end.
 *
 * <p>Responses are read as trees: title and abstract are keyed by language and
 * {@code hits.total} is either a number or an object, depending on the index.</p>
 *
 * <pre>
 * quarkus.rest-client.entscheidsuche.url=https://entscheidsuche.ch
 * quarkus.rest-client.entscheidsuche.read-timeout=15000
 * </pre>
 */
@RegisterRestClient(configKey = "entscheidsuche")
@RegisterProvider(EntscheidsucheResponseExceptionMapper.class)
@ClientHeaderParam(name = "User-Agent", value = "{lookupUserAgent}")
public interface EntscheidsucheApi {

    @POST
    @Path("/_search.php")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    JsonNode search(JsonNode query);

    /**
     * Fetches the metadata document of one decision.
     *
     * @param spider    court identifier, e.g. {@code ZH_OG}
     * @param signature document signature, e.g. {@code ZH_OG_001_LB200012_2020-06-04}
     */
    @GET
    @Path("/docs/{spider}/{signature}.json")
    @Produces(MediaType.APPLICATION_JSON)
    JsonNode document(@PathParam("spider") String spider, @PathParam("signature") String signature);

    default String lookupUserAgent() {
        return ConfigProvider.getConfig()
            .getOptionalValue("lexcite.sources.cantonal.user-agent", String.class)
            .orElse("lexcite/1.0");
    }
}

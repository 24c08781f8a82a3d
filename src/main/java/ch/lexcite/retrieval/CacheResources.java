package ch.lexcite.retrieval;

import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import ch.lexcite.storage.CacheEntry;
import ch.lexcite.storage.CacheStats;
import ch.lexcite.storage.CacheStore;
import ch.lexcite.storage.SearchQueryEntry;
import ch.lexcite.storage.SearchQueryLog;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;

/**
 * Cache and query log diagnostics.
 *
 * <h2>Endpoints:</h2>
 * <ul>
 *   <li>{@code GET /cache/stats} - Entry counts per type, expired entries, total hits</li>
 *   <li>{@code GET /cache/entries?limit=10} - Most accessed entries</li>
 *   <li>{@code DELETE /cache?prefix=federal_search:} - Invalidate a namespace, or everything without prefix</li>
 *   <li>{@code GET /cache/queries?limit=20} - Most recent external searches</li>
 * </ul>
 */
@Path("/cache")
@Produces(MediaType.APPLICATION_JSON)
public class CacheResources {

    private static final Logger LOG = Logger.getLogger(CacheResources.class);

    @Inject
    CacheStore cacheStore;

    @Inject
    SearchQueryLog queryLog;

    @GET
    @Path("/stats")
    public CacheStats stats() {
        return RetrievalOrchestrator.await(cacheStore.stats());
    }

    @GET
    @Path("/entries")
    public List<CacheEntry> mostAccessed(@QueryParam("limit") @DefaultValue("10") @Min(1) @Max(100) final int limit) {
        return RetrievalOrchestrator.await(cacheStore.mostAccessed(limit));
    }

    @DELETE
    public Map<String, Integer> invalidate(@QueryParam("prefix") final String prefix) {
        final int removed = prefix == null || prefix.isBlank()
            ? RetrievalOrchestrator.await(cacheStore.clear())
            : RetrievalOrchestrator.await(cacheStore.deleteByPrefix(prefix));
        LOG.infof("Invalidated %d cache entries (prefix: %s)", removed, prefix == null ? "<all>" : prefix);
        return Map.of("removed", removed);
    }

    @GET
    @Path("/queries")
    public List<SearchQueryEntry> recentQueries(
            @QueryParam("limit") @DefaultValue("20") @Min(1) @Max(200) final int limit) {
        return RetrievalOrchestrator.await(queryLog.recent(limit));
    }
}

package ch.lexcite.client;

import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Per-source client settings.
 *
 * <pre>
 * lexcite.sources.federal.requests-per-minute=10
 * lexcite.sources.cantonal.requests-per-minute=10
 * lexcite.sources.commentary.requests-per-minute=60
 * lexcite.sources.federal.api-key=...
 * </pre>
 *
 * Base URLs and timeouts are configured on the REST clients themselves.
 */
@ConfigMapping(prefix = "lexcite.sources")
public interface SourcesConfig {

    Source federal();

    Source cantonal();

    Source commentary();

    interface Source {

        @WithDefault("10")
        int requestsPerMinute();

        Optional<String> apiKey();

        @WithDefault("lexcite/1.0")
        String userAgent();
    }
}

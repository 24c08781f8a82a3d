package ch.lexcite.client;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.rest.client.ext.ResponseExceptionMapper;
import org.jboss.logging.Logger;

/**
 * Turns error responses of a source REST client into {@link ExternalServiceException}s.
 * One subclass is registered per source.
 */
public abstract class SourceResponseExceptionMapper implements ResponseExceptionMapper<ExternalServiceException> {

    private static final Logger LOG = Logger.getLogger(SourceResponseExceptionMapper.class);

    private static final int MAX_BODY_LENGTH = 500;

    /**
     * @return source name used in failures and logs
     */
    protected abstract String service();

    @Override
    public ExternalServiceException toThrowable(Response response) {
        if (response.getStatus() < 400) {
            return null;
        }

        String body = null;
        try {
            if (response.hasEntity()) {
                body = response.readEntity(String.class);
            }
        } catch (ProcessingException | IllegalStateException e) {
            LOG.warnf("Failed to read %s error response body: %s", service(), e.getMessage());
        }
        if (body != null && body.length() > MAX_BODY_LENGTH) {
            body = body.substring(0, MAX_BODY_LENGTH) + "...";
        }

        LOG.debugf("%s returned %d %s: %s", service(), response.getStatus(),
            response.getStatusInfo().getReasonPhrase(), body == null ? "(empty)" : body);

        return ExternalFailureClassifier.fromStatus(service(), null, response.getStatus(),
            response.getHeaderString(HttpHeaders.RETRY_AFTER), body);
    }

    @Override
    public int getPriority() {
        return 4000;
    }
}

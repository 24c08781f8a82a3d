package ch.lexcite.client.cantonal;

import ch.lexcite.client.SourceResponseExceptionMapper;

public class EntscheidsucheResponseExceptionMapper extends SourceResponseExceptionMapper {

    @Override
    protected String service() {
        return CantonalCourtClient.SERVICE;
    }
}

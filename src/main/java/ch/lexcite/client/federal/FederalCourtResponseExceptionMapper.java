package ch.lexcite.client.federal;

import ch.lexcite.client.SourceResponseExceptionMapper;

public class FederalCourtResponseExceptionMapper extends SourceResponseExceptionMapper {

    @Override
    protected String service() {
        return FederalCourtClient.SERVICE;
    }
}

package ch.lexcite.client.commentary;

import ch.lexcite.client.SourceResponseExceptionMapper;

public class OnlinekommentarResponseExceptionMapper extends SourceResponseExceptionMapper {

    @Override
    protected String service() {
        return CommentaryClient.SERVICE;
    }
}

package io.waypoint.core.error;

/**
 * Two records would occupy the same terminal position in one route group, e.g. {@code /user/:id} and
 * {@code /user/:uid}.
 */
public final class DuplicateRouteException extends RouteDefinitionException {

    private static final long serialVersionUID = 1L;

    private final long existingRecordId;

    public DuplicateRouteException(String message, String pattern, long existingRecordId) {
        super(message, pattern);
        this.existingRecordId = existingRecordId;
    }

    public long existingRecordId() {
        return existingRecordId;
    }
}

package fun.fengwk.fleet.core.service.extraction;

/**
 * Exception thrown when the portal does not know the client key. Never retried.
 *
 * @author fengwk
 */
public class UnknownClientKeyException extends RuntimeException {

    public UnknownClientKeyException(String externalKey) {
        super("unknown client key: " + externalKey);
    }

}

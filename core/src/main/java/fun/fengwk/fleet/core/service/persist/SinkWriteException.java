package fun.fengwk.fleet.core.service.persist;

/**
 * Exception thrown when a sink cannot store a result.
 *
 * @author fengwk
 */
public class SinkWriteException extends RuntimeException {

    public SinkWriteException(String message) {
        super(message);
    }

    public SinkWriteException(String message, Throwable cause) {
        super(message, cause);
    }

}

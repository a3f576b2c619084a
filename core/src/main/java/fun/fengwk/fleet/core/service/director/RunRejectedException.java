package fun.fengwk.fleet.core.service.director;

/**
 * Exception thrown when a batch cannot be accepted, either because another run is active or the
 * director is shut down.
 *
 * @author fengwk
 */
public class RunRejectedException extends RuntimeException {

    public RunRejectedException(String message) {
        super(message);
    }

}

package fun.fengwk.fleet.core.service.director;

/**
 * @author fengwk
 */
public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("run not found: " + runId);
    }

}

package fun.fengwk.fleet.core.service.persist;

/**
 * Downstream store for completed job results.
 *
 * @author fengwk
 */
public interface ResultSink {

    /**
     * Name used in configuration and logs.
     */
    String name();

    /**
     * Write one result. Implementations throw on failure and must tolerate rewriting the same key.
     */
    void write(JobResultRecord record);

    default boolean isHealthy() {
        return true;
    }

}

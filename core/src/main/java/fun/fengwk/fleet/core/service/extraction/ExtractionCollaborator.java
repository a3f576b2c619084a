package fun.fengwk.fleet.core.service.extraction;

/**
 * Portal-specific extraction logic, called once per phase of a job attempt.
 *
 * <p>Implementations report expected failures through {@link PhaseResult#failure}. Thrown
 * exceptions are classified by {@link ExtractionErrorClassifier}. A phase that runs past the job's
 * soft timeout is interrupted, so implementations should not swallow interrupts.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface ExtractionCollaborator {

    PhaseResult execute(ExtractionPhase phase, ExtractionContext context) throws Exception;

}

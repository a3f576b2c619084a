package fun.fengwk.fleet.core.service.job.worker;

import fun.fengwk.fleet.core.service.job.Job;

/**
 * Notified when a worker stops because of an error outside a job attempt.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface WorkerFaultListener {

    void onWorkerFault(String workerId, Job job, Throwable error);

}

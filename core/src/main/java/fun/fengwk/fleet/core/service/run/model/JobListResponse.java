package fun.fengwk.fleet.core.service.run.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class JobListResponse {

    private int statusCode;
    private String runId;
    private String stateFilter;
    private List<JobView> jobs;
    private String error;

}

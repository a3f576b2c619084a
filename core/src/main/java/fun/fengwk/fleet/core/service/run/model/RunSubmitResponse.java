package fun.fengwk.fleet.core.service.run.model;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class RunSubmitResponse {

    private int statusCode;
    private String runId;
    private int jobCount;
    private String error;

}

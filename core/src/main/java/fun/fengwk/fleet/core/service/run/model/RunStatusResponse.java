package fun.fengwk.fleet.core.service.run.model;

import fun.fengwk.fleet.core.service.metrics.RunMetrics;
import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class RunStatusResponse {

    private int statusCode;
    private RunMetrics metrics;
    private String error;

}

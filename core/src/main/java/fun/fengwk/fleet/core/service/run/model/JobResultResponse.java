package fun.fengwk.fleet.core.service.run.model;

import fun.fengwk.fleet.core.service.persist.JobResultRecord;
import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class JobResultResponse {

    private int statusCode;
    private String externalKey;
    private JobResultRecord record;
    private String error;

}

package fun.fengwk.fleet.core.service.run.model;

import lombok.Builder;
import lombok.Data;

/**
 * Reply to a cancel, pause or resume command.
 *
 * @author fengwk
 */
@Data
@Builder
public class RunCommandResponse {

    private int statusCode;
    private String runId;
    private String command;

    /**
     * False when the run was not in a state the command applies to.
     */
    private boolean accepted;

    private String state;
    private String error;

}

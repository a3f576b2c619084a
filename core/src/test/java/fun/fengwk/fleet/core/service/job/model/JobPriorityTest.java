package fun.fengwk.fleet.core.service.job.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class JobPriorityTest {

    @Test
    public void shouldParseCaseInsensitively() {
        assertThat(JobPriority.fromValue("critical")).isEqualTo(JobPriority.CRITICAL);
        assertThat(JobPriority.fromValue(" Low ")).isEqualTo(JobPriority.LOW);
    }

    @Test
    public void shouldDefaultBlankToMedium() {
        assertThat(JobPriority.fromValue(null)).isEqualTo(JobPriority.MEDIUM);
        assertThat(JobPriority.fromValue("  ")).isEqualTo(JobPriority.MEDIUM);
    }

    @Test
    public void shouldRejectUnknownPriority() {
        assertThatThrownBy(() -> JobPriority.fromValue("urgent"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("urgent");
    }

}

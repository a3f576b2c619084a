package fun.fengwk.fleet.core.service.job.model;

import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * Dequeue priority of a job, highest first.
 *
 * @author fengwk
 */
public enum JobPriority {

    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    BACKGROUND;

    /**
     * Parse a priority case-insensitively. Blank means {@link #MEDIUM}.
     *
     * @throws IllegalArgumentException the value names no priority
     */
    public static JobPriority fromValue(String value) {
        if (!StringUtils.hasText(value)) {
            return MEDIUM;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (JobPriority priority : values()) {
            if (priority.name().equals(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("unknown job priority: " + value);
    }

}

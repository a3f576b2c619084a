package fun.fengwk.fleet.core.configuration;

import fun.fengwk.fleet.core.cli.BatchRunCommand;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * @author fengwk
 */
@Configuration
public class CliConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public BatchRunCommand.ExitHandler batchExitHandler() {
        return System::exit;
    }

}

package fun.fengwk.fleet.core.configuration;

import fun.fengwk.fleet.core.service.persist.PersistenceCoordinator;
import fun.fengwk.fleet.core.service.persist.PersistenceProperties;
import fun.fengwk.fleet.core.service.persist.ResultSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * @author fengwk
 */
@Slf4j
@Configuration
public class FleetConfiguration {

    @Bean
    public Clock fleetClock() {
        return Clock.systemUTC();
    }

    /**
     * Coordinator over the sinks enabled in {@code fleet.persist.sinks}, in configured order.
     */
    @Bean
    public PersistenceCoordinator persistenceCoordinator(PersistenceProperties persistenceProperties, List<ResultSink> sinks) {
        return new PersistenceCoordinator(
            selectSinks(persistenceProperties.getSinks(), sinks),
            persistenceProperties.getMaxAttempts(),
            persistenceProperties.getInitialBackoffMs(),
            persistenceProperties.getMaxBackoffMs()
        );
    }

    static List<ResultSink> selectSinks(List<String> enabled, List<ResultSink> available) {
        Map<String, ResultSink> byName = available.stream()
            .collect(Collectors.toMap(ResultSink::name, Function.identity()));
        List<ResultSink> selected = new ArrayList<>();
        for (String name : enabled) {
            ResultSink sink = byName.get(name.trim());
            if (sink == null) {
                throw new IllegalArgumentException("unknown result sink: " + name + ", available: " + byName.keySet());
            }
            if (!selected.contains(sink)) {
                selected.add(sink);
            }
        }
        log.info("result sinks enabled: {}", selected.stream().map(ResultSink::name).toList());
        return selected;
    }

}

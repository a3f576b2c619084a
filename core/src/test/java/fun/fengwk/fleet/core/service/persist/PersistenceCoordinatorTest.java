package fun.fengwk.fleet.core.service.persist;

import fun.fengwk.fleet.core.service.job.Job;
import fun.fengwk.fleet.core.service.job.model.FailureKind;
import fun.fengwk.fleet.core.service.persist.sink.InMemoryResultSink;
import fun.fengwk.fleet.core.testing.TestJobs;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class PersistenceCoordinatorTest {

    private final Clock clock = Clock.systemUTC();

    @Test
    public void shouldWriteToEverySink() {
        InMemoryResultSink memory = new InMemoryResultSink();
        ResultSink other = namedSink("other");
        PersistenceCoordinator coordinator = new PersistenceCoordinator(List.of(memory, other), 3, 0L, 0L);
        Job job = TestJobs.completed("EXE-1", "B100", clock, 2, 1);

        PersistenceReport report = coordinator.persist(job);

        assertThat(report.isFullyWritten()).isTrue();
        assertThat(report.getWrittenSinks()).containsExactly("memory", "other");
        assertThat(memory.find("B100")).hasValueSatisfying(record -> {
            assertThat(record.getRunId()).isEqualTo("EXE-1");
            assertThat(record.getFields()).hasSize(2);
            assertThat(record.getArtifacts()).hasSize(1);
            assertThat(record.getAttempts()).isEqualTo(1);
        });
    }

    @Test
    public void shouldRetryFlakySinkUntilItSucceeds() {
        ResultSink flaky = namedSink("flaky");
        doThrow(new SinkWriteException("db busy"))
            .doThrow(new SinkWriteException("db busy"))
            .doNothing()
            .when(flaky).write(any());
        PersistenceCoordinator coordinator = new PersistenceCoordinator(List.of(flaky), 3, 1L, 4L);

        PersistenceReport report = coordinator.persist(TestJobs.completed("EXE-1", "B100", clock, 1, 0));

        assertThat(report.isFullyWritten()).isTrue();
        verify(flaky, times(3)).write(any());
    }

    @Test
    public void shouldReportSinkThatKeepsFailingWithoutStoppingOthers() {
        ResultSink broken = namedSink("broken");
        doThrow(new SinkWriteException("disk full")).when(broken).write(any());
        InMemoryResultSink memory = new InMemoryResultSink();
        PersistenceCoordinator coordinator = new PersistenceCoordinator(List.of(broken, memory), 2, 0L, 0L);
        Job job = TestJobs.completed("EXE-1", "B100", clock, 1, 0);

        PersistenceReport report = coordinator.persist(job);

        assertThat(report.isFullyWritten()).isFalse();
        assertThat(report.getFailedSinks()).containsEntry("broken", "disk full");
        assertThat(report.getWrittenSinks()).containsExactly("memory");
        assertThat(memory.size()).isEqualTo(1);
        verify(broken, times(2)).write(any());
    }

    @Test
    public void shouldSkipUnhealthySinksAfterInitialize() {
        ResultSink unhealthy = namedSink("unhealthy");
        when(unhealthy.isHealthy()).thenReturn(false);
        ResultSink exploding = namedSink("exploding");
        when(exploding.isHealthy()).thenThrow(new IllegalStateException("no connection"));
        InMemoryResultSink memory = new InMemoryResultSink();
        PersistenceCoordinator coordinator = new PersistenceCoordinator(
            List.of(unhealthy, exploding, memory), 1, 0L, 0L);

        coordinator.initialize();
        coordinator.persist(TestJobs.completed("EXE-1", "B100", clock, 1, 0));

        assertThat(coordinator.activeSinkNames()).containsExactly("memory");
        verify(unhealthy, never()).write(any());
        verify(exploding, never()).write(any());
    }

    @Test
    public void shouldRejectJobWithoutResult() {
        PersistenceCoordinator coordinator = new PersistenceCoordinator(List.of(new InMemoryResultSink()), 1, 0L, 0L);
        Job failed = TestJobs.failed("EXE-1", "B100", clock, FailureKind.FATAL);

        assertThatThrownBy(() -> coordinator.persist(failed)).isInstanceOf(IllegalArgumentException.class);
    }

    private static ResultSink namedSink(String name) {
        ResultSink sink = mock(ResultSink.class);
        when(sink.name()).thenReturn(name);
        when(sink.isHealthy()).thenReturn(true);
        doNothing().when(sink).write(any());
        return sink;
    }

}

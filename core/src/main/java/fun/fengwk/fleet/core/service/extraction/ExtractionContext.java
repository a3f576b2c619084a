package fun.fengwk.fleet.core.service.extraction;

import com.microsoft.playwright.Page;
import fun.fengwk.fleet.core.service.browser.pool.BrowserSession;
import fun.fengwk.fleet.core.service.job.Job;
import fun.fengwk.fleet.core.service.job.model.JobResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-attempt context handed to the extraction collaborator.
 *
 * <p>Owns at most one page of the leased session, opened lazily and closed with the context.
 * Once {@link #detach() detached} after a timed-out phase, late writes from that phase are ignored.
 *
 * @author fengwk
 */
@Slf4j
public class ExtractionContext implements AutoCloseable {

    private final Job job;
    private final BrowserSession session;
    private final Map<String, String> fields = new LinkedHashMap<>();
    private final List<String> artifacts = new ArrayList<>();

    private volatile Page page;
    private volatile boolean detached;

    public ExtractionContext(Job job, BrowserSession session) {
        this.job = job;
        this.session = session;
    }

    public String getExternalKey() {
        return job.getExternalKey();
    }

    public String getRunId() {
        return job.getRunId();
    }

    public String getDisplayName() {
        return job.getDisplayName();
    }

    /**
     * 1-based number of the current attempt.
     */
    public int getAttempt() {
        return job.getAttemptCount();
    }

    public int getTotalSteps() {
        return job.getProgress().getTotal();
    }

    public BrowserSession getSession() {
        return session;
    }

    /**
     * Page of this attempt, opened on first use.
     */
    public synchronized Page page() {
        ensureAttached();
        if (page == null) {
            page = session.newPage();
        }
        return page;
    }

    public synchronized void putField(String name, String value) {
        if (detached) {
            return;
        }
        fields.put(name, value);
    }

    public synchronized void removeField(String name) {
        if (detached) {
            return;
        }
        fields.remove(name);
    }

    public synchronized void addArtifact(String reference) {
        if (detached) {
            return;
        }
        artifacts.add(reference);
    }

    public synchronized Map<String, String> getFields() {
        return new LinkedHashMap<>(fields);
    }

    public synchronized List<String> getArtifacts() {
        return new ArrayList<>(artifacts);
    }

    /**
     * Report absolute progress of the current attempt.
     */
    public void reportProgress(int completedSteps) {
        if (detached) {
            return;
        }
        job.lifecycle().reportProgress(completedSteps);
    }

    public boolean isDetached() {
        return detached;
    }

    public synchronized JobResult toResult() {
        return JobResult.builder()
            .fields(fields)
            .artifacts(artifacts)
            .build();
    }

    /**
     * Stop accepting writes from a phase that is still running after its timeout.
     */
    public void detach() {
        detached = true;
    }

    @Override
    public void close() {
        // Not synchronized: a phase stuck in newPage() must not block teardown.
        Page opened = page;
        page = null;
        if (opened == null) {
            return;
        }
        try {
            opened.close();
        } catch (RuntimeException ex) {
            log.debug("close page failed, runId={}, key={}, error={}", getRunId(), getExternalKey(), ex.getMessage());
        }
    }

    private void ensureAttached() {
        if (detached) {
            throw new IllegalStateException("extraction context is detached, key=" + getExternalKey());
        }
    }

}

package fun.fengwk.fleet.core.service.extraction;

import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import fun.fengwk.fleet.core.service.browser.pool.PlaywrightBrowserSession;
import fun.fengwk.fleet.core.service.job.model.FailureKind;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions thrown by an extraction collaborator to failure kinds.
 *
 * <ul>
 *     <li>Unknown client keys and invalid arguments are fatal.</li>
 *     <li>Timeouts and I/O errors are retryable.</li>
 *     <li>A closed page, browser or driver connection is a resource failure.</li>
 *     <li>Anything else is retryable.</li>
 * </ul>
 *
 * @author fengwk
 */
@Component
public class ExtractionErrorClassifier {

    public FailureKind classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof InterruptedException) {
            return FailureKind.CANCELLED;
        }
        if (cause instanceof UnknownClientKeyException || cause instanceof IllegalArgumentException) {
            return FailureKind.FATAL;
        }
        if (cause instanceof TimeoutError || cause instanceof TimeoutException) {
            return FailureKind.RETRYABLE;
        }
        if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            return FailureKind.RETRYABLE;
        }
        if (cause instanceof PlaywrightException && PlaywrightBrowserSession.isExpectedCloseException(cause)) {
            return FailureKind.RESOURCE;
        }
        return FailureKind.RETRYABLE;
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

}

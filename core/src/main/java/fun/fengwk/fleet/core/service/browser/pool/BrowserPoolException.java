package fun.fengwk.fleet.core.service.browser.pool;

/**
 * Exception thrown when the browser pool cannot serve, initialize or tear down sessions.
 *
 * <p>Teardown failures of individual sessions are attached as suppressed exceptions.
 *
 * @author fengwk
 */
public class BrowserPoolException extends RuntimeException {

    public BrowserPoolException(String message) {
        super(message);
    }

    public BrowserPoolException(String message, Throwable cause) {
        super(message, cause);
    }

}

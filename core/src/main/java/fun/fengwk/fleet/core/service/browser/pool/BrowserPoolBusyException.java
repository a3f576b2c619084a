package fun.fengwk.fleet.core.service.browser.pool;

/**
 * Exception thrown when no browser session becomes free within the acquire timeout.
 */
public class BrowserPoolBusyException extends RuntimeException {

    public BrowserPoolBusyException(String message) {
        super(message);
    }

}

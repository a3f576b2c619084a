package fun.fengwk.fleet.core.service.browser;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Launch and context options for pooled browser sessions.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "fleet.browser")
public class BrowserProperties {

    /**
     * Whether sessions run headless.
     */
    private boolean headless = true;

    /**
     * Extra launch args for browser.
     */
    private List<String> launchArgs = List.of(
        "--disable-dev-shm-usage",
        "--no-sandbox",
        "--disable-setuid-sandbox"
    );

    /**
     * Default Playwright launch args to drop, none unless configured.
     */
    private List<String> ignoreDefaultArgs = List.of();

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    /**
     * Browser executable path.
     */
    private String executablePath = "";

    /**
     * Viewport width of every session context.
     */
    private int viewportWidth = 1920;

    /**
     * Viewport height of every session context.
     */
    private int viewportHeight = 1080;

    /**
     * Fixed user agent for session contexts, empty keeps the browser default.
     */
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    /**
     * Locale for session contexts.
     */
    private String locale = "es-ES";

    /**
     * Timezone id for session contexts.
     */
    private String timezoneId = "Europe/Madrid";

    /**
     * Optional Accept-Language header value.
     */
    private String acceptLanguage = "";

    /**
     * Extra headers for session contexts.
     */
    private Map<String, String> extraHeaders = Map.of();

    /**
     * Proxy server, for example http://proxy:8080.
     */
    private String proxyServer = "";

    private String proxyUsername = "";

    private String proxyPassword = "";

}

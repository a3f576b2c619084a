package fun.fengwk.fleet.core.service.browser.pool;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Proxy;
import fun.fengwk.fleet.core.service.browser.BrowserProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Launches one Chromium browser with one prepared context per session.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PlaywrightBrowserSessionFactory implements BrowserSessionFactory {

    private final BrowserProperties browserProperties;

    @Override
    public BrowserSession create(String sessionId) {
        Playwright playwright = null;
        Browser browser = null;
        BrowserContext context = null;
        try {
            playwright = Playwright.create();
            browser = playwright.chromium().launch(buildLaunchOptions());
            context = browser.newContext(buildContextOptions());
            log.debug("created browser session: {}", sessionId);
            return new PlaywrightBrowserSession(sessionId, playwright, browser, context);
        } catch (RuntimeException ex) {
            log.warn("create browser session failed, sessionId={}, error={}", sessionId, ex.getMessage(), ex);
            // Creation failure must release all partially initialized resources.
            closeQuietly(context);
            closeQuietly(browser);
            closeQuietly(playwright);
            throw ex;
        }
    }

    private BrowserType.LaunchOptions buildLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
            .setHeadless(browserProperties.isHeadless());

        if (browserProperties.getIgnoreDefaultArgs() != null && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }
        if (StringUtils.hasText(browserProperties.getExecutablePath())) {
            options.setExecutablePath(Paths.get(browserProperties.getExecutablePath()));
        }
        if (StringUtils.hasText(browserProperties.getProxyServer())) {
            Proxy proxy = new Proxy(browserProperties.getProxyServer());
            if (StringUtils.hasText(browserProperties.getProxyUsername())) {
                proxy.setUsername(browserProperties.getProxyUsername());
            }
            if (StringUtils.hasText(browserProperties.getProxyPassword())) {
                proxy.setPassword(browserProperties.getProxyPassword());
            }
            options.setProxy(proxy);
        }
        return options;
    }

    private Browser.NewContextOptions buildContextOptions() {
        Browser.NewContextOptions options = new Browser.NewContextOptions()
            .setViewportSize(browserProperties.getViewportWidth(), browserProperties.getViewportHeight());

        if (StringUtils.hasText(browserProperties.getUserAgent())) {
            options.setUserAgent(browserProperties.getUserAgent());
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.hasText(browserProperties.getTimezoneId())) {
            options.setTimezoneId(browserProperties.getTimezoneId());
        }

        Map<String, String> headers = new HashMap<>();
        if (browserProperties.getExtraHeaders() != null) {
            browserProperties.getExtraHeaders().forEach((key, value) -> {
                if (StringUtils.hasText(key) && StringUtils.hasText(value)) {
                    headers.put(key, value);
                }
            });
        }
        if (StringUtils.hasText(browserProperties.getAcceptLanguage())) {
            headers.putIfAbsent("Accept-Language", browserProperties.getAcceptLanguage());
        }
        if (!headers.isEmpty()) {
            options.setExtraHTTPHeaders(headers);
        }
        return options;
    }

    private void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ex) {
            log.debug("close partially created browser resource failed", ex);
        }
    }

}

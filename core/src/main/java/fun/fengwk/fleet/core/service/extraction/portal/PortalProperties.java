package fun.fengwk.fleet.core.service.extraction.portal;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Portal extraction configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "fleet.portal")
public class PortalProperties {

    /**
     * Client page url, {@code {key}} is replaced with the url-encoded client key.
     */
    private String clientUrlTemplate = "http://localhost:8080/clients/{key}";

    /**
     * Page navigate timeout in milliseconds.
     */
    private int navigateTimeoutMs = 30000;

    /**
     * CSS selector of each extracted field, by field name.
     */
    private Map<String, String> fieldSelectors = new LinkedHashMap<>(Map.of(
        "name", "[data-field=client-name]",
        "policy", "[data-field=policy-number]",
        "claims", "[data-field=claims-count]"
    ));

    /**
     * CSS selector of downloadable document links.
     */
    private String artifactSelector = "a[data-artifact]";

    /**
     * CSS selector that is only present when the portal does not know the client.
     */
    private String notFoundSelector = "[data-client-not-found]";

    /**
     * Fields a completed job must carry.
     */
    private List<String> requiredFields = List.of("name");

}

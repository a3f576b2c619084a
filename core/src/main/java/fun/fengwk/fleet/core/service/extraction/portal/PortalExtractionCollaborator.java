package fun.fengwk.fleet.core.service.extraction.portal;

import com.microsoft.playwright.Page;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.fleet.core.service.extraction.ExtractionCollaborator;
import fun.fengwk.fleet.core.service.extraction.ExtractionContext;
import fun.fengwk.fleet.core.service.extraction.ExtractionPhase;
import fun.fengwk.fleet.core.service.extraction.PhaseResult;
import fun.fengwk.fleet.core.service.extraction.UnknownClientKeyException;
import fun.fengwk.fleet.core.service.job.model.FailureKind;
import fun.fengwk.fleet.core.service.job.model.JobState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration-driven portal extraction: opens the client page, reads fields and document links
 * from the rendered html and checks the required fields.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PortalExtractionCollaborator implements ExtractionCollaborator {

    static final String TITLE_FIELD = "title";

    private final PortalProperties portalProperties;

    @Override
    public PhaseResult execute(ExtractionPhase phase, ExtractionContext context) {
        switch (phase) {
            case NAVIGATION:
                return navigate(context);
            case EXTRACTION:
                return extract(context);
            case PROCESSING:
                return process(context);
            case VALIDATION:
                return validate(context);
            default:
                throw new IllegalArgumentException("unsupported extraction phase: " + phase);
        }
    }

    private PhaseResult navigate(ExtractionContext context) {
        String url = clientUrl(context.getExternalKey());
        Page page = context.page();
        Response response = page.navigate(url,
            new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout((double) portalProperties.getNavigateTimeoutMs())
        );

        if (response != null) {
            int status = response.status();
            if (status == 404) {
                throw new UnknownClientKeyException(context.getExternalKey());
            }
            if (status >= 500) {
                return PhaseResult.failure(FailureKind.RETRYABLE, "portal responded " + status + " for " + url);
            }
            if (status >= 400) {
                return PhaseResult.failure(FailureKind.FATAL, "portal rejected client page with " + status);
            }
        }

        String notFoundSelector = portalProperties.getNotFoundSelector();
        if (StringUtils.hasText(notFoundSelector) && page.querySelector(notFoundSelector) != null) {
            throw new UnknownClientKeyException(context.getExternalKey());
        }
        log.debug("client page opened, runId={}, key={}, url={}", context.getRunId(), context.getExternalKey(), url);
        return PhaseResult.success();
    }

    private PhaseResult extract(ExtractionContext context) {
        Page page = context.page();
        Document document = Jsoup.parse(page.content(), page.url());

        Map<String, String> selectors = portalProperties.getFieldSelectors();
        int total = context.getTotalSteps();
        int from = JobState.EXTRACTING.checkpoint(total);
        int to = JobState.PROCESSING.checkpoint(total);
        int index = 0;
        for (Map.Entry<String, String> entry : selectors.entrySet()) {
            Element element = document.selectFirst(entry.getValue());
            if (element != null) {
                context.putField(entry.getKey(), element.text());
            }
            index++;
            context.reportProgress(from + (to - from) * index / Math.max(1, selectors.size() + 1));
        }

        if (StringUtils.hasText(portalProperties.getArtifactSelector())) {
            Set<String> links = new LinkedHashSet<>();
            for (Element link : document.select(portalProperties.getArtifactSelector())) {
                String href = link.absUrl("href");
                if (StringUtils.hasText(href)) {
                    links.add(href);
                }
            }
            links.forEach(context::addArtifact);
        }

        String title = document.title();
        if (StringUtils.hasText(title)) {
            context.putField(TITLE_FIELD, title);
        }
        return PhaseResult.success();
    }

    private PhaseResult process(ExtractionContext context) {
        List<String> blankFields = new ArrayList<>();
        for (Map.Entry<String, String> entry : context.getFields().entrySet()) {
            String normalized = normalize(entry.getValue());
            if (normalized.isEmpty()) {
                blankFields.add(entry.getKey());
            } else {
                context.putField(entry.getKey(), normalized);
            }
        }
        blankFields.forEach(context::removeField);
        return PhaseResult.success();
    }

    private PhaseResult validate(ExtractionContext context) {
        Map<String, String> fields = context.getFields();
        if (fields.isEmpty()) {
            // An empty page usually means it had not rendered yet.
            return PhaseResult.failure(FailureKind.RETRYABLE, "no fields extracted");
        }
        List<String> missing = new ArrayList<>();
        for (String required : portalProperties.getRequiredFields()) {
            if (!fields.containsKey(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            return PhaseResult.failure(FailureKind.FATAL, "missing required fields " + missing);
        }
        return PhaseResult.success();
    }

    String clientUrl(String externalKey) {
        String encoded = URLEncoder.encode(externalKey, StandardCharsets.UTF_8);
        return portalProperties.getClientUrlTemplate().replace("{key}", encoded);
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.replace('\u00a0', ' ').replaceAll("\\s+", " ").trim();
    }

}

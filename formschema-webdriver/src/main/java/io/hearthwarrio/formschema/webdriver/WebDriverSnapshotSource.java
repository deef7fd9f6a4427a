package io.hearthwarrio.formschema.webdriver;

import io.hearthwarrio.formschema.core.ElementSnapshotSource;
import io.hearthwarrio.formschema.core.RawElement;
import io.hearthwarrio.formschema.core.SnapshotException;
import io.hearthwarrio.formschema.core.StepKeywordLocator;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ElementSnapshotSource} reading the page currently open in a {@link WebDriver}.
 * <p>
 * Steps are separated, in order of preference, by:
 * <ol>
 *   <li>a container locator registered with {@link #withStepContainer(String, By)}</li>
 *   <li>keywords registered with {@link #withStepKeywords(String, List)} (best-effort scan of all visible controls)</li>
 *   <li>otherwise all visible controls belong to the step</li>
 * </ol>
 * By default "step2" is separated by {@link StepKeywordLocator#PAN_STEP_KEYWORDS}.
 * Navigation between steps is not performed.
 */
public class WebDriverSnapshotSource implements ElementSnapshotSource {

    private static final Logger log = LoggerFactory.getLogger(WebDriverSnapshotSource.class);

    private final WebDriver driver;
    private final WebDriverElementMapper mapper;
    private final Map<String, By> containers = new HashMap<>();
    private final Map<String, StepKeywordLocator> keywordLocators = new HashMap<>();

    public WebDriverSnapshotSource(WebDriver driver) {
        this(driver, new WebDriverElementMapper(driver));
    }

    public WebDriverSnapshotSource(WebDriver driver, WebDriverElementMapper mapper) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.keywordLocators.put("step2", new StepKeywordLocator(StepKeywordLocator.PAN_STEP_KEYWORDS));
    }

    public WebDriverSnapshotSource withStepContainer(String step, By container) {
        containers.put(Objects.requireNonNull(step, "step must not be null"),
                Objects.requireNonNull(container, "container must not be null"));
        return this;
    }

    public WebDriverSnapshotSource withStepKeywords(String step, List<String> keywords) {
        keywordLocators.put(Objects.requireNonNull(step, "step must not be null"), new StepKeywordLocator(keywords));
        return this;
    }

    @Override
    public List<RawElement> snapshot(String stepKey) throws SnapshotException {
        try {
            By container = containers.get(stepKey);
            if (container != null) {
                List<WebElement> roots = driver.findElements(container);
                if (roots.isEmpty()) {
                    throw new SnapshotException("Container for " + stepKey + " not found: " + container);
                }
                List<RawElement> elements = mapper.collectVisibleControls(roots.get(0));
                log.info("Captured {} controls for {} from container", elements.size(), stepKey);
                return elements;
            }

            List<RawElement> all = mapper.collectVisibleControls(null);
            StepKeywordLocator locator = keywordLocators.get(stepKey);
            if (locator == null) {
                log.info("Captured {} controls for {}", all.size(), stepKey);
                return all;
            }
            List<RawElement> selected = locator.select(all);
            log.info("Captured {} of {} controls for {} by keyword scan", selected.size(), all.size(), stepKey);
            return selected;
        } catch (WebDriverException e) {
            throw new SnapshotException("Failed to snapshot " + stepKey, e);
        }
    }
}

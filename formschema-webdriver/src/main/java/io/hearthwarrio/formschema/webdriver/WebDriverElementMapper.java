package io.hearthwarrio.formschema.webdriver;

import io.hearthwarrio.formschema.core.RawElement;
import io.hearthwarrio.formschema.core.SelectOption;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps Selenium {@link WebElement}s of form controls to {@link RawElement} snapshots.
 * <p>
 * This class is not thread-safe and is expected to be used from a single thread.
 */
public class WebDriverElementMapper {

    /**
     * CSS selector for the interactive controls a registration form is made of.
     */
    public static final String CONTROL_SELECTOR = "input, select, textarea, button";

    static final String ENCLOSING_LABEL_SCRIPT = "return arguments[0].closest('label');";

    /**
     * First non-blank text node directly under the control's parent element.
     */
    static final String PARENT_TEXT_SCRIPT =
            "var p = arguments[0].parentElement;" +
            "if (!p) { return ''; }" +
            "for (var i = 0; i < p.childNodes.length; i++) {" +
            "  var n = p.childNodes[i];" +
            "  if (n.nodeType === 3) {" +
            "    var t = (n.textContent || '').trim();" +
            "    if (t) { return t; }" +
            "  }" +
            "}" +
            "return '';";

    private final WebDriver driver;
    private final JavascriptExecutor js;

    /**
     * @param driver Selenium WebDriver instance; must also implement {@link JavascriptExecutor}
     */
    public WebDriverElementMapper(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.js = (JavascriptExecutor) driver;
    }

    /**
     * Collects visible controls under the given search context root.
     *
     * @param root container element, or null for the whole page
     * @return snapshots in document order; empty when the DOM is not accessible
     */
    public List<RawElement> collectVisibleControls(WebElement root) {
        List<WebElement> controls = findControls(root);
        if (controls.isEmpty()) {
            return Collections.emptyList();
        }

        List<RawElement> out = new ArrayList<>(controls.size());
        for (WebElement element : controls) {
            if (isVisible(element)) {
                out.add(toRawElement(element));
            }
        }
        return out;
    }

    /**
     * Builds a {@link RawElement} for a single control.
     *
     * @param element Selenium element
     * @return snapshot
     */
    public RawElement toRawElement(WebElement element) {
        String tagName = safe(element.getTagName()).toLowerCase(Locale.ROOT);
        String type = attr(element, "type");
        if (type.isEmpty() && "select".equals(tagName)) {
            type = "select";
        }
        String id = attr(element, "id");

        String label = resolveAssociatedLabelText(element, id);
        if (label.isEmpty() && ("button".equals(tagName) || "submit".equalsIgnoreCase(type))) {
            label = buttonText(element);
        }

        return new RawElement(
                id,
                attr(element, "name"),
                type,
                tagName,
                attr(element, "class"),
                attr(element, "placeholder"),
                isRequired(element),
                !isEnabled(element),
                attr(element, "value"),
                label,
                "select".equals(tagName) ? readOptions(element) : List.of()
        );
    }

    private List<WebElement> findControls(WebElement root) {
        try {
            return root == null
                    ? driver.findElements(By.cssSelector(CONTROL_SELECTOR))
                    : root.findElements(By.cssSelector(CONTROL_SELECTOR));
        } catch (RuntimeException e) {
            return Collections.emptyList();
        }
    }

    private boolean isVisible(WebElement element) {
        try {
            return element.isDisplayed();
        } catch (RuntimeException e) {
            return false;
        }
    }

    private boolean isEnabled(WebElement element) {
        try {
            return element.isEnabled();
        } catch (RuntimeException e) {
            return true;
        }
    }

    private boolean isRequired(WebElement element) {
        String v = attr(element, "required");
        return !v.isEmpty() && !"false".equalsIgnoreCase(v);
    }

    private List<SelectOption> readOptions(WebElement select) {
        try {
            List<SelectOption> out = new ArrayList<>();
            for (WebElement option : select.findElements(By.tagName("option"))) {
                out.add(new SelectOption(attr(option, "value"), normalizeText(option.getText())));
            }
            return out;
        } catch (RuntimeException e) {
            return List.of();
        }
    }

    private String buttonText(WebElement element) {
        try {
            String text = normalizeText(element.getText());
            return text.isEmpty() ? attr(element, "value") : text;
        } catch (RuntimeException e) {
            return attr(element, "value");
        }
    }

    private String safe(String v) {
        return v == null ? "" : v;
    }

    private String attr(WebElement element, String name) {
        try {
            String v = element.getAttribute(name);
            return v == null ? "" : v.trim();
        } catch (RuntimeException e) {
            return "";
        }
    }

    private String resolveAssociatedLabelText(WebElement element, String id) {
        try {
            if (!id.isBlank()) {
                List<WebElement> labels = driver.findElements(By.cssSelector("label[for='" + cssEscape(id) + "']"));
                for (WebElement label : labels) {
                    String t = normalizeText(label.getText());
                    if (!t.isBlank()) {
                        return t;
                    }
                }
            }

            Object parentLabel = js.executeScript(ENCLOSING_LABEL_SCRIPT, element);
            if (parentLabel instanceof WebElement) {
                String t = normalizeText(((WebElement) parentLabel).getText());
                if (!t.isBlank()) {
                    return t;
                }
            }

            Object parentText = js.executeScript(PARENT_TEXT_SCRIPT, element);
            if (parentText instanceof String) {
                String t = normalizeText((String) parentText);
                if (!t.isBlank()) {
                    return t;
                }
            }
        } catch (RuntimeException e) {
            return "";
        }
        return "";
    }

    private String normalizeText(String s) {
        if (s == null) {
            return "";
        }
        return s.replaceAll("\\s+", " ").trim();
    }

    private String cssEscape(String s) {
        if (s == null || s.isEmpty()) {
            return "";
        }
        return s.replace("\\", "\\\\").replace("'", "\\'");
    }
}

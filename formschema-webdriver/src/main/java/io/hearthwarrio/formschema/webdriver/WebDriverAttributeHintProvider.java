package io.hearthwarrio.formschema.webdriver;

import io.hearthwarrio.formschema.core.AttributeHintProvider;
import io.hearthwarrio.formschema.core.AttributeHints;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link AttributeHintProvider} that evaluates a small script in the browser to read
 * {@code pattern}, {@code minLength}, {@code maxLength} and {@code title} of a control.
 * <p>
 * WebDriver sessions are not thread-safe, so calls from worker threads are serialized on the driver.
 */
public class WebDriverAttributeHintProvider implements AttributeHintProvider {

    static final String HINTS_SCRIPT =
            "var el = (arguments[0] && document.getElementById(arguments[0]))" +
                    " || (arguments[1] && document.querySelector('[name=\"' + CSS.escape(arguments[1]) + '\"]'));" +
                    "if (!el) { return null; }" +
                    "return {pattern: el.pattern || '', minLength: el.minLength || -1," +
                    " maxLength: el.maxLength || -1, title: el.title || ''};";

    private static final String SCRIPTS_SCRIPT =
            "return Array.prototype.map.call(document.querySelectorAll('script:not([src])')," +
                    " function (s) { return s.textContent || ''; });";

    private final WebDriver driver;
    private final JavascriptExecutor js;

    /**
     * @param driver Selenium WebDriver instance; must also implement {@link JavascriptExecutor}
     */
    public WebDriverAttributeHintProvider(WebDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.js = (JavascriptExecutor) driver;
    }

    @Override
    public Optional<AttributeHints> getAttributeHints(String identifier, String name) {
        Object result;
        synchronized (driver) {
            result = js.executeScript(HINTS_SCRIPT, nullToEmpty(identifier), nullToEmpty(name));
        }
        if (!(result instanceof Map)) {
            return Optional.empty();
        }
        Map<?, ?> m = (Map<?, ?>) result;
        return Optional.of(new AttributeHints(
                asString(m.get("pattern")),
                asInteger(m.get("minLength")),
                asInteger(m.get("maxLength")),
                asString(m.get("title"))
        ));
    }

    @Override
    public List<String> inlineScripts() {
        Object result;
        synchronized (driver) {
            result = js.executeScript(SCRIPTS_SCRIPT);
        }
        if (!(result instanceof List)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (Object o : (List<?>) result) {
            if (o != null) {
                out.add(String.valueOf(o));
            }
        }
        return out;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    private static String asString(Object v) {
        return v == null ? null : String.valueOf(v);
    }

    private static Integer asInteger(Object v) {
        if (v instanceof Number) {
            return ((Number) v).intValue();
        }
        return null;
    }
}

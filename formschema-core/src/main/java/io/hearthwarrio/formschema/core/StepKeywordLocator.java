package io.hearthwarrio.formschema.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Best-effort step separation for pages that render several steps at once:
 * keeps the elements whose id, name, classes, label or placeholder mention a step keyword.
 * <p>
 * Keyword matching is both over- and under-inclusive; callers that know the step container
 * should scope by container instead.
 */
public final class StepKeywordLocator {

    /**
     * Default keywords for the PAN verification step.
     */
    public static final List<String> PAN_STEP_KEYWORDS = List.of("pan", "step", "personal");

    private final List<String> keywords;

    public StepKeywordLocator(List<String> keywords) {
        Objects.requireNonNull(keywords, "keywords must not be null");
        List<String> lower = new ArrayList<>();
        for (String k : keywords) {
            if (k != null && !k.isBlank()) {
                lower.add(k.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.keywords = List.copyOf(lower);
    }

    /**
     * @param elements all visible elements of the page (may be null)
     * @return matching elements in input order
     */
    public List<RawElement> select(List<RawElement> elements) {
        if (elements == null || elements.isEmpty() || keywords.isEmpty()) {
            return List.of();
        }
        List<RawElement> out = new ArrayList<>();
        for (RawElement e : elements) {
            if (e != null && matches(e)) {
                out.add(e);
            }
        }
        return out;
    }

    private boolean matches(RawElement e) {
        String text = (e.getIdentifier() + " " + e.getName() + " " + e.getCssClasses() + " "
                + e.getAssociatedLabel() + " " + e.getPlaceholder()).toLowerCase(Locale.ROOT);
        for (String k : keywords) {
            if (text.contains(k)) {
                return true;
            }
        }
        return false;
    }
}

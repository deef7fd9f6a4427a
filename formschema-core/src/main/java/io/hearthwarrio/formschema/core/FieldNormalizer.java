package io.hearthwarrio.formschema.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns raw element snapshots of one step into clean {@link NormalizedField} records.
 * <p>
 * Stateless apart from its keyword lists; safe for concurrent use.
 */
public class FieldNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FieldNormalizer.class);

    /**
     * Substrings (case-insensitive) of id/name/class that mark anti-automation tokens
     * and navigation or search widgets.
     */
    public static final List<String> DEFAULT_DENY_LIST = List.of(
            "captcha",
            "csrf",
            "token",
            "__viewstate",
            "__eventvalidation",
            "search",
            "menu",
            "nav"
    );

    /**
     * Label substrings (case-insensitive) that make a button a submission action.
     */
    public static final List<String> DEFAULT_SUBMIT_KEYWORDS = List.of(
            "submit",
            "validate",
            "generate otp",
            "continue"
    );

    private static final Pattern NON_IDENTIFIER_CHARS = Pattern.compile("[^a-zA-Z0-9_]");
    private static final Pattern GENERATED_PREFIXES =
            Pattern.compile("^(?:ctl\\d+_|ContentPlaceHolder\\d+_)+", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+");
    private static final Pattern TRAILING_MARKERS = Pattern.compile("[\\s*:]+$");

    private final List<String> denyList;
    private final List<String> submitKeywords;

    public FieldNormalizer() {
        this(DEFAULT_DENY_LIST, DEFAULT_SUBMIT_KEYWORDS);
    }

    public FieldNormalizer(List<String> denyList, List<String> submitKeywords) {
        this.denyList = lowerAll(Objects.requireNonNull(denyList, "denyList must not be null"));
        this.submitKeywords = lowerAll(Objects.requireNonNull(submitKeywords, "submitKeywords must not be null"));
    }

    /**
     * Normalizes the raw elements of one step.
     *
     * @param rawElements raw snapshots in page order (null is treated as empty)
     * @param stepName    step the elements belong to
     * @return normalized fields in input order, filtered and deduplicated, indexed from 0
     */
    public List<NormalizedField> normalize(List<RawElement> rawElements, String stepName) {
        List<NormalizedField> out = new ArrayList<>();
        for (SourcedField sf : normalizeElements(rawElements, stepName)) {
            out.add(sf.getField());
        }
        return List.copyOf(out);
    }

    /**
     * Same as {@link #normalize(List, String)} but keeps each field paired with its raw element.
     *
     * @param rawElements raw snapshots in page order (null is treated as empty)
     * @param stepName    step the elements belong to
     * @return surviving fields with their sources
     */
    public List<SourcedField> normalizeElements(List<RawElement> rawElements, String stepName) {
        if (rawElements == null || rawElements.isEmpty()) {
            log.info("No raw elements for {}", stepName);
            return List.of();
        }

        List<SourcedField> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (RawElement element : rawElements) {
            NormalizedField field = toField(element, stepName);
            if (field == null) {
                continue;
            }
            String key = field.getId() + "|" + field.getName() + "|" + field.getKind().wireName();
            if (!seen.add(key)) {
                log.debug("Dropping duplicate field {} in {}", field.getId(), stepName);
                continue;
            }
            out.add(new SourcedField(element, field.withFieldIndex(out.size())));
        }

        log.info("Normalized {} of {} raw elements for {}", out.size(), rawElements.size(), stepName);
        return List.copyOf(out);
    }

    private NormalizedField toField(RawElement element, String stepName) {
        if (element == null) {
            return null;
        }
        String skipReason = skipReason(element);
        if (skipReason != null) {
            log.debug("Skipping {} ({})", element, skipReason);
            return null;
        }

        String rawKind = element.getElementKind().isBlank() ? element.getTagKind() : element.getElementKind();
        FieldKind kind = FieldKind.fromRawKind(rawKind);

        String id = cleanIdentifier(element.getIdentifier());
        String name = cleanIdentifier(element.getName().isBlank() ? element.getIdentifier() : element.getName());
        if (id.isEmpty() && name.isEmpty()) {
            log.debug("Skipping {} (identifiers empty after cleaning)", element);
            return null;
        }

        String label = cleanLabel(element.getAssociatedLabel());
        if (kind == FieldKind.BUTTON && !containsAny(label.toLowerCase(Locale.ROOT), submitKeywords)) {
            log.debug("Skipping non-submit button {}", id.isEmpty() ? name : id);
            return null;
        }

        return new NormalizedField(
                id,
                name,
                kind,
                rawKind.trim().toLowerCase(Locale.ROOT),
                label,
                element.getPlaceholder().trim(),
                element.isRequired(),
                cleanOptions(element.getOptions()),
                stepName,
                0
        );
    }

    private String skipReason(RawElement element) {
        if ("hidden".equalsIgnoreCase(element.getElementKind().trim())) {
            return "hidden";
        }
        if (element.getIdentifier().isBlank()
                && element.getName().isBlank()
                && element.getAssociatedLabel().isBlank()) {
            return "no identifying information";
        }
        String text = (element.getIdentifier() + " " + element.getName() + " " + element.getCssClasses())
                .toLowerCase(Locale.ROOT);
        for (String token : denyList) {
            if (text.contains(token)) {
                return "deny-listed: " + token;
            }
        }
        return null;
    }

    /**
     * Cleans a raw id or name: non-identifier characters become {@code _}, generated
     * {@code ctl<n>_}/{@code ContentPlaceHolder<n>_} prefixes are stripped, the result is lower-cased.
     * Applying it twice yields the same result as applying it once.
     *
     * @param raw raw identifier (may be null)
     * @return cleaned identifier, empty for null input
     */
    public static String cleanIdentifier(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String replaced = NON_IDENTIFIER_CHARS.matcher(raw).replaceAll("_");
        String stripped = GENERATED_PREFIXES.matcher(replaced).replaceFirst("");
        return stripped.toLowerCase(Locale.ROOT);
    }

    /**
     * Collapses whitespace and strips trailing {@code *} / {@code :} markers.
     *
     * @param raw raw label (may be null)
     * @return cleaned label
     */
    public static String cleanLabel(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String collapsed = WHITESPACE_RUNS.matcher(raw).replaceAll(" ");
        return TRAILING_MARKERS.matcher(collapsed).replaceFirst("").trim();
    }

    private static List<SelectOption> cleanOptions(List<SelectOption> options) {
        if (options == null || options.isEmpty()) {
            return List.of();
        }
        List<SelectOption> out = new ArrayList<>();
        for (SelectOption o : options) {
            if (o == null || o.getValue().isEmpty()) {
                continue;
            }
            out.add(new SelectOption(o.getValue(), WHITESPACE_RUNS.matcher(o.getText()).replaceAll(" ").trim()));
        }
        return out;
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String n : needles) {
            if (haystack.contains(n)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> lowerAll(List<String> values) {
        List<String> out = new ArrayList<>();
        for (String v : values) {
            if (v == null) {
                continue;
            }
            String t = v.trim().toLowerCase(Locale.ROOT);
            if (!t.isEmpty()) {
                out.add(t);
            }
        }
        return List.copyOf(out);
    }
}

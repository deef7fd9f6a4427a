package io.hearthwarrio.formschema.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort scan of inline script texts for anchored regex literals ({@code /^...$/flags})
 * declared near a field's identifier.
 */
public class ClientScriptScanner {

    private static final Pattern REGEX_LITERAL = Pattern.compile("/(\\^[^/\\r\\n]+\\$)/[gimsuy]*");

    /**
     * Returns patterns from every script that mentions the field's id or name (case-insensitive),
     * in script order without duplicates.
     *
     * @param field   field to look for
     * @param scripts inline script texts (may be null)
     * @return discovered pattern bodies without delimiters and flags
     */
    public List<String> findPatterns(NormalizedField field, List<String> scripts) {
        if (field == null || scripts == null || scripts.isEmpty()) {
            return List.of();
        }

        List<String> out = new ArrayList<>();
        for (String script : scripts) {
            if (script == null || script.isEmpty() || !mentions(script, field)) {
                continue;
            }
            Matcher m = REGEX_LITERAL.matcher(script);
            while (m.find()) {
                String body = m.group(1);
                if (!out.contains(body)) {
                    out.add(body);
                }
            }
        }
        return out;
    }

    private boolean mentions(String script, NormalizedField field) {
        String lower = script.toLowerCase(Locale.ROOT);
        return (!field.getId().isEmpty() && lower.contains(field.getId()))
                || (!field.getName().isEmpty() && lower.contains(field.getName()));
    }
}

package io.hearthwarrio.formschema.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of steps a schema must contain.
 */
public final class StepCatalog {

    private static final StepCatalog UDYAM = new StepCatalog(List.of(
            new StepDefinition("step1", "Aadhaar Verification", "Aadhaar number verification with OTP"),
            new StepDefinition("step2", "PAN Verification", "PAN verification and personal details")
    ));

    private final Map<String, StepDefinition> steps;

    public StepCatalog(List<StepDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("step catalog must define at least one step");
        }
        Map<String, StepDefinition> m = new LinkedHashMap<>();
        for (StepDefinition d : definitions) {
            if (d == null) {
                continue;
            }
            if (m.putIfAbsent(d.getKey(), d) != null) {
                throw new IllegalArgumentException("Duplicate step key: " + d.getKey());
            }
        }
        this.steps = Collections.unmodifiableMap(m);
    }

    /**
     * @return the two steps of the Udyam registration form
     */
    public static StepCatalog udyamRegistration() {
        return UDYAM;
    }

    public Optional<StepDefinition> find(String key) {
        return Optional.ofNullable(steps.get(key));
    }

    public List<String> keys() {
        return List.copyOf(steps.keySet());
    }

    public List<StepDefinition> definitions() {
        return new ArrayList<>(steps.values());
    }

    public int size() {
        return steps.size();
    }
}

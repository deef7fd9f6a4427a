package io.hearthwarrio.formschema.core;

import java.util.List;
import java.util.Map;

/**
 * Canned raw elements used when a step cannot be read from the page.
 * They pass through normalization and inference like real snapshots.
 */
public final class FallbackStepFields {

    private FallbackStepFields() {
    }

    /**
     * @return PAN number and applicant name controls of the PAN verification step
     */
    public static List<RawElement> panVerificationStep() {
        return List.of(
                new RawElement("pan_number", "panNumber", "text", "input", "", "Enter PAN Number",
                        true, false, "", "PAN Number"),
                new RawElement("applicant_name", "applicantName", "text", "input", "", "Enter Full Name",
                        true, false, "", "Applicant Name")
        );
    }

    /**
     * @return default fallbacks keyed by step: only "step2" has one
     */
    public static Map<String, List<RawElement>> defaults() {
        return Map.of("step2", panVerificationStep());
    }
}

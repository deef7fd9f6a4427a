package io.hearthwarrio.formschema.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StepKeywordLocatorTest {

    @Test
    void selectsElementsMentioningStepKeywords() {
        RawElement aadhaar = new RawElement("txtAadhaar", "aadhaar", "text", "input", "", "", true, false, "", "Aadhaar");
        RawElement pan = new RawElement("txtPan", "pan", "text", "input", "", "", true, false, "", "PAN Number");
        RawElement dob = new RawElement("txtDob", "dob", "text", "input", "personal-info", "", false, false, "", "DOB");

        List<RawElement> selected = new StepKeywordLocator(StepKeywordLocator.PAN_STEP_KEYWORDS)
                .select(List.of(aadhaar, pan, dob));

        assertEquals(List.of(pan, dob), selected);
    }

    @Test
    void emptyKeywordsSelectNothing() {
        RawElement pan = new RawElement("txtPan", "pan", "text", "input", "", "", true, false, "", "PAN");

        assertTrue(new StepKeywordLocator(List.of(" ")).select(List.of(pan)).isEmpty());
    }
}

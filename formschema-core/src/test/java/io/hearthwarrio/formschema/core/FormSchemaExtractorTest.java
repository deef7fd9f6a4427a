package io.hearthwarrio.formschema.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class FormSchemaExtractorTest {

    private static RawElement input(String id, String label, boolean required) {
        return new RawElement(id, id, "text", "input", "", "", required, false, "", label);
    }

    private static Map<String, List<RawElement>> steps(List<RawElement> step1, List<RawElement> step2) {
        Map<String, List<RawElement>> m = new LinkedHashMap<>();
        m.put("step1", step1);
        m.put("step2", step2);
        return m;
    }

    private static ValidationRule firstPattern(NormalizedField f) {
        for (ValidationRule r : f.getValidationRules()) {
            if (r.getRuleType() == RuleType.PATTERN) {
                return r;
            }
        }
        return null;
    }

    @Test
    void buildsSchemaFromRawSteps() {
        Map<String, List<RawElement>> raw = steps(
                List.of(
                        new RawElement("ctl00_ContentPlaceHolder1_txtAadhaarNumber", "aadhaarNumber", "text",
                                "input", "", "", true, false, "", "Aadhaar Number *"),
                        input("txtOwnerName", "Name of Entrepreneur", true),
                        new RawElement("hdnToken", "hdnToken", "hidden", "input", "", "", false, false, "", "")
                ),
                List.of(input("txtPan", "PAN", true))
        );

        FormSchema schema = new FormSchemaExtractor(AttributeHintProvider.none()).extract(raw);

        assertEquals(3, schema.getStatistics().getTotalFields());
        NormalizedField aadhaar = schema.getSteps().get("step1").get(0);
        assertEquals("txtaadhaarnumber", aadhaar.getId());
        assertEquals(FieldCategory.IDENTITY_AADHAAR, aadhaar.getFieldCategory());
        assertTrue(aadhaar.getValidationRules().contains(ValidationRule.required("Aadhaar Number")));
        assertEquals("^[0-9]{12}$", firstPattern(aadhaar).getValue());
        assertEquals(FieldCategory.IDENTITY_PAN, schema.getSteps().get("step2").get(0).getFieldCategory());
    }

    @Test
    void looksUpHintsByRawIdentifiersInParallel() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        AttributeHintProvider provider = (identifier, name) -> {
            bothStarted.countDown();
            try {
                if (!bothStarted.await(1, TimeUnit.SECONDS)) {
                    return Optional.empty();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
            assertTrue(identifier.startsWith("ctl00_"));
            return Optional.of(new AttributeHints("^[A-Z]{3}$", null, null, null));
        };
        Map<String, List<RawElement>> raw = steps(
                List.of(input("ctl00_txtFirst", "First", false), input("ctl00_txtSecond", "Second", false)),
                List.of()
        );

        FormSchema schema = new FormSchemaExtractor(provider).withWorkerThreads(2).extract(raw);

        for (NormalizedField f : schema.getSteps().get("step1")) {
            assertEquals("^[A-Z]{3}$", firstPattern(f).getValue());
        }
    }

    @Test
    void slowLookupTimesOutForThatFieldOnly() {
        AttributeHintProvider provider = (identifier, name) -> {
            if (identifier.equals("txtSlowPin")) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return Optional.of(new AttributeHints("^[0-9]{3}$", null, null, null));
        };
        Map<String, List<RawElement>> raw = steps(
                List.of(input("txtSlowPin", "PIN Code", false), input("txtFast", "Fast", false)),
                List.of()
        );

        FormSchema schema = new FormSchemaExtractor(provider)
                .withHintTimeout(Duration.ofMillis(200))
                .extract(raw);

        List<NormalizedField> step1 = schema.getSteps().get("step1");
        assertEquals("^[0-9]{6}$", firstPattern(step1.get(0)).getValue());
        assertEquals("^[0-9]{3}$", firstPattern(step1.get(1)).getValue());
    }

    @Test
    void failingProviderFallsBackToCategoryRules() {
        AttributeHintProvider provider = (identifier, name) -> {
            throw new IllegalStateException("page closed");
        };
        Map<String, List<RawElement>> raw = steps(List.of(input("txtMobile", "Mobile Number", true)), List.of());

        FormSchema schema = new FormSchemaExtractor(provider).extract(raw);

        NormalizedField mobile = schema.getSteps().get("step1").get(0);
        assertEquals(FieldCategory.CONTACT_MOBILE, mobile.getFieldCategory());
        assertEquals("^[6-9][0-9]{9}$", firstPattern(mobile).getValue());
    }

    @Test
    void memoizesLookupsWithinOneRun() {
        AtomicInteger calls = new AtomicInteger();
        AttributeHintProvider provider = (identifier, name) -> {
            calls.incrementAndGet();
            return Optional.empty();
        };
        RawElement pan = input("txtPan", "PAN", true);
        ExtractionContext context = new ExtractionContext(provider);

        context.lookup(pan);
        context.lookup(pan);

        assertEquals(1, calls.get());
    }

    @Test
    void concurrentLookupsForSameIdentifiersShareOneProviderCall() {
        AtomicInteger calls = new AtomicInteger();
        AttributeHintProvider provider = (identifier, name) -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(200);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.of(new AttributeHints(null, null, null, "Gender"));
        };
        Map<String, List<RawElement>> raw = steps(List.of(
                new RawElement("", "gender", "radio", "input", "", "", true, false, "M", "Male"),
                new RawElement("", "gender", "checkbox", "input", "", "", false, false, "", "Other")
        ), List.of());

        FormSchema schema = new FormSchemaExtractor(provider).withWorkerThreads(2).extract(raw);

        assertEquals(2, schema.getSteps().get("step1").size());
        assertEquals(1, calls.get());
    }

    @Test
    void fieldProcessingFailureKeepsRequiredRuleOnly() {
        CategoryRule broken = field -> {
            throw new IllegalStateException("broken row");
        };
        FormSchemaExtractor extractor = new FormSchemaExtractor(AttributeHintProvider.none())
                .withCategoryRules(List.of(broken));
        ExtractionContext context = extractor.newContext();
        Map<String, List<RawElement>> raw = steps(List.of(input("txtAadhaar", "Aadhaar", true)), List.of());

        FormSchema schema = extractor.extract(raw, context);

        NormalizedField f = schema.getSteps().get("step1").get(0);
        assertEquals(FieldCategory.GENERAL, f.getFieldCategory());
        assertEquals(List.of(ValidationRule.required("Aadhaar")), f.getValidationRules());
        assertEquals(1, context.failures().size());
        assertFalse(context.failures().get(0).isSuccess());
    }

    @Test
    void snapshotsEveryCatalogStep() throws SnapshotException {
        ElementSnapshotSource source = step -> step.equals("step1")
                ? List.of(input("txtAadhaar", "Aadhaar Number", true))
                : List.of(input("txtPan", "PAN Number", true), input("txtEmail", "Email", false));

        FormSchema schema = new FormSchemaExtractor(source, AttributeHintProvider.none()).extract();

        assertEquals(1, schema.getMetadata().getSteps().get("step1").getFieldCount());
        assertEquals(2, schema.getMetadata().getSteps().get("step2").getFieldCount());
    }

    @Test
    void substitutesFallbackFieldsWhenStepSnapshotFails() throws SnapshotException {
        ElementSnapshotSource source = step -> {
            if (step.equals("step2")) {
                throw new SnapshotException("step 2 not rendered");
            }
            return List.of(input("txtAadhaar", "Aadhaar Number", true));
        };

        FormSchema schema = new FormSchemaExtractor(source, AttributeHintProvider.none()).extract();

        List<NormalizedField> step2 = schema.getSteps().get("step2");
        assertEquals(2, step2.size());
        assertEquals("pan_number", step2.get(0).getId());
        assertEquals(FieldCategory.IDENTITY_PAN, step2.get(0).getFieldCategory());
        assertEquals("applicant_name", step2.get(1).getId());
        assertEquals(FieldCategory.PERSONAL_NAME, step2.get(1).getFieldCategory());
    }

    @Test
    void propagatesSnapshotFailureWithoutFallback() {
        ElementSnapshotSource source = step -> {
            throw new SnapshotException("page unavailable");
        };
        FormSchemaExtractor extractor = new FormSchemaExtractor(source, AttributeHintProvider.none(),
                ExtractionSettings.defaults().withFallbackSteps(Map.of()));

        assertThrows(SnapshotException.class, extractor::extract);
    }

    @Test
    void extractWithoutSourceIsRejected() {
        assertThrows(IllegalStateException.class,
                () -> new FormSchemaExtractor(AttributeHintProvider.none()).extract());
    }

    @Test
    void rejectsUnknownStepBeforeDoingWork() {
        Map<String, List<RawElement>> raw = new LinkedHashMap<>();
        raw.put("step9", List.of());

        assertThrows(SchemaSynthesisException.class,
                () -> new FormSchemaExtractor(AttributeHintProvider.none()).extract(raw));
    }

    @Test
    void cancelledContextAbortsExtraction() {
        FormSchemaExtractor extractor = new FormSchemaExtractor(AttributeHintProvider.none());
        ExtractionContext context = extractor.newContext();
        context.cancel();

        assertThrows(ExtractionAbortedException.class,
                () -> extractor.extract(steps(List.of(), List.of()), context));
    }

    @Test
    void rejectsContextOfAnotherProvider() {
        AttributeHintProvider other = (identifier, name) -> Optional.empty();
        FormSchemaExtractor extractor = new FormSchemaExtractor(AttributeHintProvider.none());

        assertThrows(IllegalArgumentException.class,
                () -> extractor.extract(steps(List.of(), List.of()), new ExtractionContext(other)));
    }

    @Test
    void interruptAbortsExtraction() {
        AttributeHintProvider slow = (identifier, name) -> {
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Optional.empty();
        };
        Map<String, List<RawElement>> raw = steps(List.of(input("txtPan", "PAN", true)), List.of());
        FormSchemaExtractor extractor = new FormSchemaExtractor(slow);

        Thread.currentThread().interrupt();
        try {
            assertThrows(ExtractionAbortedException.class, () -> extractor.extract(raw));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}

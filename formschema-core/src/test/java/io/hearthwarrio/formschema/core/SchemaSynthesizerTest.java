package io.hearthwarrio.formschema.core;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaSynthesizerTest {
    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    private final ValidationRuleInferencer inferencer = new ValidationRuleInferencer();
    private final SchemaSynthesizer synthesizer = new SchemaSynthesizer(
            StepCatalog.udyamRegistration(),
            Clock.fixed(NOW, ZoneOffset.UTC),
            SchemaSynthesizer.DEFAULT_VERSION,
            SchemaSynthesizer.DEFAULT_SOURCE_IDENTIFIER
    );

    private NormalizedField inferred(String id, FieldKind kind, String label, boolean required) {
        NormalizedField f = new NormalizedField(id, id, kind, kind.wireName(), label, "", required,
                List.of(), "", 0);
        return inferencer.inferRules(f).applyTo(f);
    }

    private Map<String, List<NormalizedField>> sampleSteps() {
        Map<String, List<NormalizedField>> steps = new LinkedHashMap<>();
        steps.put("step1", List.of(
                inferred("txtaadhaar", FieldKind.TEXT, "Aadhaar Number", true),
                inferred("txtname", FieldKind.TEXT, "Name of Entrepreneur", true)
        ));
        steps.put("step2", List.of(
                inferred("ddltype", FieldKind.SELECT, "Type of Organisation", true),
                inferred("txtpan", FieldKind.TEXT, "PAN", true),
                inferred("txtotp", FieldKind.TEXT, "OTP", false)
        ));
        return steps;
    }

    @Test
    void countsFieldsAndSteps() {
        FormSchema schema = synthesizer.synthesize(sampleSteps());

        assertEquals(5, schema.getStatistics().getTotalFields());
        assertEquals(2, schema.getStatistics().getTotalSteps());
        assertEquals(2, schema.getMetadata().getTotalSteps());
        assertEquals(5, schema.getMetadata().getTotalFields());
        assertEquals(2, schema.getMetadata().getSteps().get("step1").getFieldCount());
        assertEquals(3, schema.getMetadata().getSteps().get("step2").getFieldCount());
    }

    @Test
    void statisticsAreConsistent() {
        FormSchema schema = synthesizer.synthesize(sampleSteps());
        SchemaStatistics stats = schema.getStatistics();

        int byKind = stats.getFieldsByKind().values().stream().mapToInt(Integer::intValue).sum();
        int byCategory = stats.getFieldsByCategory().values().stream().mapToInt(Integer::intValue).sum();
        int byRuleType = stats.getRulesByType().values().stream().mapToInt(Integer::intValue).sum();
        int rules = 0;
        for (List<NormalizedField> fields : schema.getSteps().values()) {
            for (NormalizedField f : fields) {
                rules += f.getValidationRules().size();
            }
        }

        assertEquals(stats.getTotalFields(), byKind);
        assertEquals(stats.getTotalFields(), byCategory);
        assertEquals(rules, stats.getTotalRules());
        assertEquals(rules, byRuleType);
        assertEquals(4, stats.getFieldsByKind().get("text"));
        assertEquals(1, stats.getFieldsByKind().get("select"));
        assertEquals(4, stats.getRulesByType().get("required"));
    }

    @Test
    void everyFieldLandsInExactlyOneBucket() {
        FormSchema schema = synthesizer.synthesize(sampleSteps());
        Map<CategoryGroup, List<NormalizedField>> buckets = schema.getFieldCategories();

        assertEquals(CategoryGroup.values().length, buckets.size());
        List<NormalizedField> all = new ArrayList<>();
        buckets.values().forEach(all::addAll);
        assertEquals(5, all.size());

        assertEquals(2, buckets.get(CategoryGroup.IDENTITY).size());
        assertEquals(1, buckets.get(CategoryGroup.VERIFICATION).size());
        assertEquals(1, buckets.get(CategoryGroup.PERSONAL).size());
        assertEquals(1, buckets.get(CategoryGroup.GENERAL).size());
        assertTrue(buckets.get(CategoryGroup.BUSINESS).isEmpty());
    }

    @Test
    void restampsStepNamesAndIndices() {
        FormSchema schema = synthesizer.synthesize(sampleSteps());

        List<NormalizedField> step2 = schema.getSteps().get("step2");
        for (int i = 0; i < step2.size(); i++) {
            assertEquals("step2", step2.get(i).getStepName());
            assertEquals(i, step2.get(i).getFieldIndex());
        }
    }

    @Test
    void addsUiHintsPerCategory() {
        FormSchema schema = synthesizer.synthesize(sampleSteps());

        UiHints aadhaar = schema.getSteps().get("step1").get(0).getUiHints();
        assertEquals("numeric", aadhaar.getInputMode());
        assertEquals("[0-9]*", aadhaar.getPattern());
        assertEquals(12, aadhaar.getMaxLength());
        assertEquals("Enter 12-digit Aadhaar number", aadhaar.getPlaceholder());

        UiHints name = schema.getSteps().get("step1").get(1).getUiHints();
        assertEquals("name", name.getAutoComplete());
        assertTrue(name.isSpellCheck());

        UiHints pan = schema.getSteps().get("step2").get(1).getUiHints();
        assertEquals("uppercase", pan.getTextTransform());
        assertEquals(10, pan.getMaxLength());

        assertEquals(UiHints.defaults(), schema.getSteps().get("step2").get(0).getUiHints());
    }

    @Test
    void fillsMetadataAndGlobalRules() {
        FormSchema schema = synthesizer.synthesize(sampleSteps());

        assertEquals("1.0.0", schema.getVersion());
        assertEquals(NOW, schema.getGeneratedAt());
        assertEquals("https://udyamregistration.gov.in/UdyamRegistration.aspx", schema.getSourceIdentifier());
        assertEquals("Aadhaar Verification", schema.getMetadata().getSteps().get("step1").getName());
        assertEquals("PAN verification and personal details",
                schema.getMetadata().getSteps().get("step2").getDescription());
        assertEquals(6, schema.getGlobalValidationRules().size());
        assertEquals("^[6-9][0-9]{9}$", schema.getGlobalValidationRules().get("contact-mobile").getPattern());
    }

    @Test
    void addsExpectedFormatPerCategory() {
        FormSchema schema = synthesizer.synthesize(sampleSteps());

        assertEquals("12-digit number", schema.getSteps().get("step1").get(0).getExpectedFormat());
        assertEquals("ABCDE1234F", schema.getSteps().get("step2").get(1).getExpectedFormat());
        assertEquals("6-digit number", schema.getSteps().get("step2").get(2).getExpectedFormat());
        assertNull(schema.getSteps().get("step1").get(1).getExpectedFormat());
        assertNull(schema.getSteps().get("step2").get(0).getExpectedFormat());
    }

    @Test
    void expectedFormatForMobileOnly() {
        Map<String, List<NormalizedField>> steps = new LinkedHashMap<>();
        steps.put("step1", List.of(
                inferred("txtmobile", FieldKind.TEXT, "Mobile Number", true),
                inferred("txtpincode", FieldKind.TEXT, "PIN Code", true)
        ));
        steps.put("step2", List.of());

        FormSchema schema = synthesizer.synthesize(steps);

        assertEquals("10-digit number", schema.getSteps().get("step1").get(0).getExpectedFormat());
        assertNull(schema.getSteps().get("step1").get(1).getExpectedFormat());
    }

    @Test
    void stampsLastUpdatedFromClock() {
        FormSchema schema = synthesizer.synthesize(sampleSteps());

        assertEquals(NOW, schema.getMetadata().getLastUpdated());
        assertEquals(schema.getGeneratedAt(), schema.getMetadata().getLastUpdated());
    }

    @Test
    void emptyStepsYieldZeroCounts() {
        Map<String, List<NormalizedField>> steps = new HashMap<>();
        steps.put("step1", List.of());
        steps.put("step2", List.of());

        FormSchema schema = synthesizer.synthesize(steps);

        assertEquals(0, schema.getStatistics().getTotalFields());
        assertEquals(0, schema.getStatistics().getTotalRules());
        assertEquals(2, schema.getMetadata().getTotalSteps());
    }

    @Test
    void rejectsUnknownStep() {
        Map<String, List<NormalizedField>> steps = sampleSteps();
        steps.put("step3", List.of());

        SchemaSynthesisException ex = assertThrows(SchemaSynthesisException.class,
                () -> synthesizer.synthesize(steps));
        assertTrue(ex.getMessage().contains("step3"));
    }

    @Test
    void rejectsMissingStep() {
        Map<String, List<NormalizedField>> steps = new HashMap<>();
        steps.put("step1", List.of());

        SchemaSynthesisException ex = assertThrows(SchemaSynthesisException.class,
                () -> synthesizer.synthesize(steps));
        assertTrue(ex.getMessage().contains("step2"));
    }

    @Test
    void rejectsNullFieldList() {
        Map<String, List<NormalizedField>> steps = new HashMap<>();
        steps.put("step1", List.of());
        steps.put("step2", null);

        assertThrows(SchemaSynthesisException.class, () -> synthesizer.synthesize(steps));
        assertThrows(SchemaSynthesisException.class, () -> synthesizer.synthesize(null));
    }
}

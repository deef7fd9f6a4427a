package io.hearthwarrio.formschema.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregates per-step fields into one {@link FormSchema}.
 * <p>
 * Single pass, no retries: either a complete schema is returned or a
 * {@link SchemaSynthesisException} is thrown for malformed step data.
 */
public class SchemaSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(SchemaSynthesizer.class);

    public static final String DEFAULT_VERSION = "1.0.0";
    public static final String DEFAULT_SOURCE_IDENTIFIER = "https://udyamregistration.gov.in/UdyamRegistration.aspx";
    public static final String DEFAULT_DESCRIPTION = "Udyam Registration Portal - Steps 1 & 2 Form Schema";
    public static final String EXTRACTION_METHOD = "element-snapshot";

    private final StepCatalog catalog;
    private final Clock clock;
    private final String version;
    private final String sourceIdentifier;
    private final UiHintsPolicy uiHintsPolicy;

    public SchemaSynthesizer() {
        this(StepCatalog.udyamRegistration(), Clock.systemUTC(), DEFAULT_VERSION, DEFAULT_SOURCE_IDENTIFIER);
    }

    public SchemaSynthesizer(StepCatalog catalog, Clock clock, String version, String sourceIdentifier) {
        this(catalog, clock, version, sourceIdentifier, new UiHintsPolicy());
    }

    public SchemaSynthesizer(
            StepCatalog catalog,
            Clock clock,
            String version,
            String sourceIdentifier,
            UiHintsPolicy uiHintsPolicy
    ) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.version = Objects.requireNonNull(version, "version must not be null");
        this.sourceIdentifier = sourceIdentifier == null ? "" : sourceIdentifier;
        this.uiHintsPolicy = Objects.requireNonNull(uiHintsPolicy, "uiHintsPolicy must not be null");
    }

    /**
     * Builds the schema.
     *
     * @param stepFields step key to fields; must contain exactly the catalog's steps
     * @return complete schema
     * @throws SchemaSynthesisException if a step is unknown, missing or has no field list
     */
    public FormSchema synthesize(Map<String, List<NormalizedField>> stepFields) {
        validate(stepFields);

        Map<String, List<NormalizedField>> steps = new LinkedHashMap<>();
        for (StepDefinition step : catalog.definitions()) {
            steps.put(step.getKey(), prepareStep(step.getKey(), stepFields.get(step.getKey())));
        }

        Instant now = clock.instant();
        SchemaMetadata metadata = buildMetadata(steps, now);
        Map<CategoryGroup, List<NormalizedField>> categories = categorize(steps);
        SchemaStatistics statistics = buildStatistics(steps);

        FormSchema schema = new FormSchema(
                version,
                now,
                sourceIdentifier,
                metadata,
                steps,
                PatternLibrary.asMap(),
                categories,
                statistics
        );
        log.info("Synthesized schema {} with {} fields across {} steps",
                version, statistics.getTotalFields(), statistics.getTotalSteps());
        return schema;
    }

    private void validate(Map<String, List<NormalizedField>> stepFields) {
        if (stepFields == null) {
            throw new SchemaSynthesisException("Step map must not be null");
        }
        for (Map.Entry<String, List<NormalizedField>> e : stepFields.entrySet()) {
            if (catalog.find(e.getKey()).isEmpty()) {
                throw new SchemaSynthesisException(
                        "Unrecognized step '" + e.getKey() + "', expected one of " + catalog.keys());
            }
            if (e.getValue() == null) {
                throw new SchemaSynthesisException("Step '" + e.getKey() + "' has no field list");
            }
        }
        for (String key : catalog.keys()) {
            if (!stepFields.containsKey(key)) {
                throw new SchemaSynthesisException("Missing step '" + key + "'");
            }
        }
    }

    private List<NormalizedField> prepareStep(String stepKey, List<NormalizedField> fields) {
        List<NormalizedField> out = new ArrayList<>(fields.size());
        for (NormalizedField f : fields) {
            if (f == null) {
                throw new SchemaSynthesisException("Step '" + stepKey + "' contains a null field");
            }
            NormalizedField restamped = new NormalizedField(
                    f.getId(), f.getName(), f.getKind(), f.getInputType(), f.getLabel(), f.getPlaceholder(),
                    f.isRequired(), f.getOptions(), stepKey, out.size(),
                    f.getFieldCategory(), f.getValidationRules(), f.getUiHints(),
                    PatternLibrary.expectedFormat(f.getFieldCategory()).orElse(null)
            );
            out.add(restamped.withUiHints(uiHintsPolicy.hintsFor(restamped)));
        }
        return out;
    }

    private SchemaMetadata buildMetadata(Map<String, List<NormalizedField>> steps, Instant lastUpdated) {
        Map<String, StepDescriptor> descriptors = new LinkedHashMap<>();
        int total = 0;
        for (StepDefinition step : catalog.definitions()) {
            int count = steps.get(step.getKey()).size();
            total += count;
            descriptors.put(step.getKey(), new StepDescriptor(step.getTitle(), step.getDescription(), count));
        }
        return new SchemaMetadata(steps.size(), total, DEFAULT_DESCRIPTION, EXTRACTION_METHOD, lastUpdated,
                descriptors);
    }

    private Map<CategoryGroup, List<NormalizedField>> categorize(Map<String, List<NormalizedField>> steps) {
        Map<CategoryGroup, List<NormalizedField>> buckets = new EnumMap<>(CategoryGroup.class);
        for (CategoryGroup group : CategoryGroup.values()) {
            buckets.put(group, new ArrayList<>());
        }
        for (List<NormalizedField> fields : steps.values()) {
            for (NormalizedField f : fields) {
                buckets.get(CategoryGroup.of(f.getFieldCategory())).add(f);
            }
        }
        return buckets;
    }

    private SchemaStatistics buildStatistics(Map<String, List<NormalizedField>> steps) {
        int totalFields = 0;
        int totalRules = 0;
        Map<String, Integer> byKind = new LinkedHashMap<>();
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        Map<String, Integer> byRuleType = new LinkedHashMap<>();

        for (List<NormalizedField> fields : steps.values()) {
            totalFields += fields.size();
            for (NormalizedField f : fields) {
                byKind.merge(f.getKind().wireName(), 1, Integer::sum);
                byCategory.merge(f.getFieldCategory().id(), 1, Integer::sum);
                for (ValidationRule r : f.getValidationRules()) {
                    totalRules++;
                    byRuleType.merge(r.getRuleType().wireName(), 1, Integer::sum);
                }
            }
        }

        return new SchemaStatistics(steps.size(), totalFields, byKind, byCategory, totalRules, byRuleType);
    }
}

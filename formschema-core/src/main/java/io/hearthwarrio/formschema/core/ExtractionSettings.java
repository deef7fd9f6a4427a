package io.hearthwarrio.formschema.core;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of one {@link FormSchemaExtractor}.
 * Every {@code with*} method returns a modified copy.
 */
public final class ExtractionSettings {

    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final Duration DEFAULT_HINT_TIMEOUT = Duration.ofSeconds(2);

    private final int workerThreads;
    private final Duration hintTimeout;
    private final String schemaVersion;
    private final String sourceIdentifier;
    private final List<String> denyList;
    private final List<String> submitKeywords;
    private final Map<String, List<RawElement>> fallbackSteps;
    private final StepCatalog stepCatalog;
    private final Clock clock;

    private ExtractionSettings(
            int workerThreads,
            Duration hintTimeout,
            String schemaVersion,
            String sourceIdentifier,
            List<String> denyList,
            List<String> submitKeywords,
            Map<String, List<RawElement>> fallbackSteps,
            StepCatalog stepCatalog,
            Clock clock
    ) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got " + workerThreads);
        }
        Objects.requireNonNull(hintTimeout, "hintTimeout must not be null");
        if (hintTimeout.isNegative() || hintTimeout.isZero()) {
            throw new IllegalArgumentException("hintTimeout must be positive, got " + hintTimeout);
        }
        this.workerThreads = workerThreads;
        this.hintTimeout = hintTimeout;
        this.schemaVersion = Objects.requireNonNull(schemaVersion, "schemaVersion must not be null");
        this.sourceIdentifier = Objects.requireNonNull(sourceIdentifier, "sourceIdentifier must not be null");
        this.denyList = List.copyOf(Objects.requireNonNull(denyList, "denyList must not be null"));
        this.submitKeywords = List.copyOf(Objects.requireNonNull(submitKeywords, "submitKeywords must not be null"));
        this.fallbackSteps = copySteps(Objects.requireNonNull(fallbackSteps, "fallbackSteps must not be null"));
        this.stepCatalog = Objects.requireNonNull(stepCatalog, "stepCatalog must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return settings for the Udyam registration form with the default pool, timeout and keyword lists
     */
    public static ExtractionSettings defaults() {
        return new ExtractionSettings(
                DEFAULT_WORKER_THREADS,
                DEFAULT_HINT_TIMEOUT,
                SchemaSynthesizer.DEFAULT_VERSION,
                SchemaSynthesizer.DEFAULT_SOURCE_IDENTIFIER,
                FieldNormalizer.DEFAULT_DENY_LIST,
                FieldNormalizer.DEFAULT_SUBMIT_KEYWORDS,
                FallbackStepFields.defaults(),
                StepCatalog.udyamRegistration(),
                Clock.systemUTC()
        );
    }

    private static Map<String, List<RawElement>> copySteps(Map<String, List<RawElement>> in) {
        Map<String, List<RawElement>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<RawElement>> e : in.entrySet()) {
            out.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return Map.copyOf(out);
    }

    public ExtractionSettings withWorkerThreads(int threads) {
        return new ExtractionSettings(threads, hintTimeout, schemaVersion, sourceIdentifier, denyList,
                submitKeywords, fallbackSteps, stepCatalog, clock);
    }

    public ExtractionSettings withHintTimeout(Duration timeout) {
        return new ExtractionSettings(workerThreads, timeout, schemaVersion, sourceIdentifier, denyList,
                submitKeywords, fallbackSteps, stepCatalog, clock);
    }

    public ExtractionSettings withSchemaVersion(String version) {
        return new ExtractionSettings(workerThreads, hintTimeout, version, sourceIdentifier, denyList,
                submitKeywords, fallbackSteps, stepCatalog, clock);
    }

    public ExtractionSettings withSourceIdentifier(String identifier) {
        return new ExtractionSettings(workerThreads, hintTimeout, schemaVersion, identifier, denyList,
                submitKeywords, fallbackSteps, stepCatalog, clock);
    }

    public ExtractionSettings withDenyList(List<String> tokens) {
        return new ExtractionSettings(workerThreads, hintTimeout, schemaVersion, sourceIdentifier, tokens,
                submitKeywords, fallbackSteps, stepCatalog, clock);
    }

    public ExtractionSettings withSubmitKeywords(List<String> keywords) {
        return new ExtractionSettings(workerThreads, hintTimeout, schemaVersion, sourceIdentifier, denyList,
                keywords, fallbackSteps, stepCatalog, clock);
    }

    /**
     * @param steps raw elements to substitute per step when its snapshot fails; empty map disables fallbacks
     */
    public ExtractionSettings withFallbackSteps(Map<String, List<RawElement>> steps) {
        return new ExtractionSettings(workerThreads, hintTimeout, schemaVersion, sourceIdentifier, denyList,
                submitKeywords, steps, stepCatalog, clock);
    }

    public ExtractionSettings withStepCatalog(StepCatalog catalog) {
        return new ExtractionSettings(workerThreads, hintTimeout, schemaVersion, sourceIdentifier, denyList,
                submitKeywords, fallbackSteps, catalog, clock);
    }

    public ExtractionSettings withClock(Clock c) {
        return new ExtractionSettings(workerThreads, hintTimeout, schemaVersion, sourceIdentifier, denyList,
                submitKeywords, fallbackSteps, stepCatalog, c);
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public Duration getHintTimeout() {
        return hintTimeout;
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public String getSourceIdentifier() {
        return sourceIdentifier;
    }

    public List<String> getDenyList() {
        return denyList;
    }

    public List<String> getSubmitKeywords() {
        return submitKeywords;
    }

    public Map<String, List<RawElement>> getFallbackSteps() {
        return fallbackSteps;
    }

    public StepCatalog getStepCatalog() {
        return stepCatalog;
    }

    public Clock getClock() {
        return clock;
    }
}

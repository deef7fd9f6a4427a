package io.hearthwarrio.formschema.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the whole pipeline: snapshot per step, normalize, infer rules (with live hint lookups
 * on a bounded worker pool), synthesize.
 * <p>
 * Usage:
 * <pre>{@code
 * FormSchema schema = new FormSchemaExtractor(snapshotSource, hintProvider)
 *         .withWorkerThreads(6)
 *         .withHintTimeout(Duration.ofSeconds(1))
 *         .extract();
 * }</pre>
 * Configuration methods are not thread-safe; configure before extracting.
 */
public class FormSchemaExtractor {

    private static final Logger log = LoggerFactory.getLogger(FormSchemaExtractor.class);

    private final ElementSnapshotSource snapshotSource;
    private final AttributeHintProvider hintProvider;
    private ExtractionSettings settings;
    private FieldClassifier classifier;

    /**
     * Creates an extractor for pre-collected raw steps (see {@link #extract(Map)}).
     *
     * @param hintProvider live hint source; use {@link AttributeHintProvider#none()} when there is none
     */
    public FormSchemaExtractor(AttributeHintProvider hintProvider) {
        this(null, hintProvider, ExtractionSettings.defaults());
    }

    public FormSchemaExtractor(ElementSnapshotSource snapshotSource, AttributeHintProvider hintProvider) {
        this(snapshotSource, hintProvider, ExtractionSettings.defaults());
    }

    public FormSchemaExtractor(
            ElementSnapshotSource snapshotSource,
            AttributeHintProvider hintProvider,
            ExtractionSettings settings
    ) {
        this.snapshotSource = snapshotSource;
        this.hintProvider = Objects.requireNonNull(hintProvider, "hintProvider must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.classifier = new FieldClassifier();
    }

    public FormSchemaExtractor withSettings(ExtractionSettings newSettings) {
        this.settings = Objects.requireNonNull(newSettings, "settings must not be null");
        return this;
    }

    public FormSchemaExtractor withWorkerThreads(int threads) {
        this.settings = settings.withWorkerThreads(threads);
        return this;
    }

    public FormSchemaExtractor withHintTimeout(Duration timeout) {
        this.settings = settings.withHintTimeout(timeout);
        return this;
    }

    /**
     * Replaces the category classification table.
     *
     * @param rules rows (may be null/empty: everything becomes general)
     * @return this extractor for fluent chaining
     */
    public FormSchemaExtractor withCategoryRules(List<? extends CategoryRule> rules) {
        this.classifier = new FieldClassifier(rules);
        return this;
    }

    public ExtractionSettings getSettings() {
        return settings;
    }

    /**
     * Snapshots every catalog step from the configured source and builds the schema.
     *
     * @return schema
     * @throws SnapshotException if a step cannot be read and has no fallback
     */
    public FormSchema extract() throws SnapshotException {
        return extract(newContext());
    }

    /**
     * Creates a run context bound to this extractor's hint provider. Use it to cancel a run
     * or to inspect its failed fields afterwards.
     *
     * @return fresh context
     */
    public ExtractionContext newContext() {
        return new ExtractionContext(hintProvider);
    }

    /**
     * Same as {@link #extract()}, with a run context from {@link #newContext()}.
     *
     * @throws IllegalArgumentException if the context was created for another hint provider
     */
    public FormSchema extract(ExtractionContext context) throws SnapshotException {
        requireOwnContext(context);
        if (snapshotSource == null) {
            throw new IllegalStateException("No snapshot source configured; use extract(Map) instead");
        }
        Map<String, List<RawElement>> rawSteps = new LinkedHashMap<>();
        for (String step : settings.getStepCatalog().keys()) {
            rawSteps.put(step, snapshot(step));
        }
        return extract(rawSteps, context);
    }

    /**
     * Builds the schema from already collected raw elements.
     *
     * @param rawSteps step key to raw elements
     * @return schema
     * @throws SchemaSynthesisException if the step map is malformed
     */
    public FormSchema extract(Map<String, List<RawElement>> rawSteps) {
        return extract(rawSteps, newContext());
    }

    public FormSchema extract(Map<String, List<RawElement>> rawSteps, ExtractionContext context) {
        requireOwnContext(context);
        if (rawSteps == null) {
            throw new SchemaSynthesisException("Step map must not be null");
        }
        StepCatalog catalog = settings.getStepCatalog();
        for (String step : rawSteps.keySet()) {
            if (catalog.find(step).isEmpty()) {
                throw new SchemaSynthesisException(
                        "Unrecognized step '" + step + "', expected one of " + catalog.keys());
            }
        }

        FieldNormalizer normalizer = new FieldNormalizer(settings.getDenyList(), settings.getSubmitKeywords());
        ValidationRuleInferencer inferencer = new ValidationRuleInferencer(classifier, new ClientScriptScanner());
        SchemaSynthesizer synthesizer = new SchemaSynthesizer(
                catalog, settings.getClock(), settings.getSchemaVersion(), settings.getSourceIdentifier());

        ExecutorService pool = Executors.newFixedThreadPool(settings.getWorkerThreads(), new HintThreadFactory());
        try {
            Map<String, List<NormalizedField>> stepFields = new LinkedHashMap<>();
            for (Map.Entry<String, List<RawElement>> e : rawSteps.entrySet()) {
                List<SourcedField> sourced = normalizer.normalizeElements(e.getValue(), e.getKey());
                stepFields.put(e.getKey(), annotateStep(e.getKey(), sourced, inferencer, context, pool));
            }
            FormSchema schema = synthesizer.synthesize(stepFields);
            if (!context.failures().isEmpty()) {
                log.warn("{} field(s) fell back to minimal rules", context.failures().size());
            }
            return schema;
        } finally {
            pool.shutdownNow();
        }
    }

    private List<RawElement> snapshot(String step) throws SnapshotException {
        try {
            List<RawElement> elements = snapshotSource.snapshot(step);
            return elements == null ? List.of() : elements;
        } catch (SnapshotException e) {
            List<RawElement> fallback = settings.getFallbackSteps().get(step);
            if (fallback == null) {
                throw e;
            }
            log.warn("Snapshot of {} failed, using {} fallback elements: {}", step, fallback.size(), e.getMessage());
            return fallback;
        }
    }

    private List<NormalizedField> annotateStep(
            String step,
            List<SourcedField> sourced,
            ValidationRuleInferencer inferencer,
            ExtractionContext context,
            ExecutorService pool
    ) {
        checkCancelled(context, step);

        List<Future<HintLookup>> lookups = new ArrayList<>(sourced.size());
        for (SourcedField sf : sourced) {
            lookups.add(pool.submit(() -> context.lookup(sf.getSource())));
        }

        List<NormalizedField> out = new ArrayList<>(sourced.size());
        try {
            for (int i = 0; i < sourced.size(); i++) {
                checkCancelled(context, step);
                NormalizedField field = sourced.get(i).getField();
                HintLookup lookup = await(lookups.get(i), field, context);

                FieldOutcome outcome = annotate(field, lookup, inferencer);
                if (!outcome.isSuccess()) {
                    context.recordFailure(outcome);
                }
                out.add(outcome.getField());
            }
        } catch (InterruptedException e) {
            cancelAll(lookups);
            Thread.currentThread().interrupt();
            throw new ExtractionAbortedException("Extraction of " + step + " was interrupted", e);
        } catch (ExtractionAbortedException e) {
            cancelAll(lookups);
            throw e;
        }
        return out;
    }

    private HintLookup await(Future<HintLookup> future, NormalizedField field, ExtractionContext context)
            throws InterruptedException {
        try {
            return future.get(settings.getHintTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Hint lookup for {} timed out after {} ms", field.getId(), settings.getHintTimeout().toMillis());
            return HintLookup.failed(e, context.inlineScripts());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Hint lookup for {} failed: {}", field.getId(), cause.getMessage());
            return HintLookup.failed(cause, context.inlineScripts());
        }
    }

    private FieldOutcome annotate(NormalizedField field, HintLookup lookup, ValidationRuleInferencer inferencer) {
        try {
            return FieldOutcome.success(inferencer.inferRules(field, lookup).applyTo(field));
        } catch (RuntimeException e) {
            log.warn("Processing of field {} in {} failed, keeping minimal rules", field.getId(), field.getStepName(), e);
            List<ValidationRule> minimal = field.isRequired()
                    ? List.of(ValidationRule.required(field.title()))
                    : List.of();
            return FieldOutcome.failure(field.withInference(FieldCategory.GENERAL, minimal), e);
        }
    }

    private void requireOwnContext(ExtractionContext context) {
        Objects.requireNonNull(context, "context must not be null");
        if (context.hintProvider() != hintProvider) {
            throw new IllegalArgumentException("context was created for a different hint provider; use newContext()");
        }
    }

    private static void checkCancelled(ExtractionContext context, String step) {
        if (context.isCancelled()) {
            throw new ExtractionAbortedException("Extraction cancelled before finishing " + step, null);
        }
    }

    private static void cancelAll(List<Future<HintLookup>> futures) {
        for (Future<HintLookup> f : futures) {
            f.cancel(true);
        }
    }

    private static final class HintThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "formschema-hints-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}

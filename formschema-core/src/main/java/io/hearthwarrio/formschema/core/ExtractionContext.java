package io.hearthwarrio.formschema.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * State of a single extraction run: memoized hint lookups, the page's inline scripts,
 * recorded per-field failures and the cancellation flag.
 * <p>
 * Thread-safe; hint lookups are made from worker threads. Never shared between runs.
 */
public final class ExtractionContext {

    private static final Logger log = LoggerFactory.getLogger(ExtractionContext.class);

    private final AttributeHintProvider hintProvider;
    private final Map<String, FutureTask<HintLookup>> lookups = new ConcurrentHashMap<>();
    private final List<FieldOutcome> failures = Collections.synchronizedList(new ArrayList<>());
    private volatile List<String> inlineScripts;
    private volatile boolean cancelled;

    public ExtractionContext(AttributeHintProvider hintProvider) {
        this.hintProvider = Objects.requireNonNull(hintProvider, "hintProvider must not be null");
    }

    /**
     * Looks up live hints for the element, reusing an earlier result for the same identifiers.
     * Concurrent lookups with the same identifiers share one provider call.
     * Provider exceptions are converted into a {@link HintLookup.Status#FAILED} lookup.
     *
     * @param source raw element
     * @return lookup outcome, never null
     */
    public HintLookup lookup(RawElement source) {
        String key = source.getIdentifier() + "|" + source.getName();
        FutureTask<HintLookup> task = new FutureTask<>(() -> fetch(source));
        FutureTask<HintLookup> existing = lookups.putIfAbsent(key, task);
        if (existing == null) {
            task.run();
            existing = task;
        }

        try {
            return existing.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HintLookup.failed(e, inlineScripts());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return HintLookup.failed(cause, inlineScripts());
        }
    }

    private HintLookup fetch(RawElement source) {
        try {
            Optional<AttributeHints> hints = hintProvider.getAttributeHints(source.getIdentifier(), source.getName());
            return hints.isPresent()
                    ? HintLookup.available(hints.get(), inlineScripts())
                    : HintLookup.unavailable(inlineScripts());
        } catch (RuntimeException e) {
            log.warn("Hint lookup failed for '{}': {}", source.getIdentifier(), e.getMessage());
            return HintLookup.failed(e, inlineScripts());
        }
    }

    /**
     * Loads the page's inline scripts once per run. A failing provider yields no scripts.
     *
     * @return script texts
     */
    public List<String> inlineScripts() {
        List<String> scripts = inlineScripts;
        if (scripts == null) {
            synchronized (this) {
                scripts = inlineScripts;
                if (scripts == null) {
                    scripts = loadScripts();
                    inlineScripts = scripts;
                }
            }
        }
        return scripts;
    }

    private List<String> loadScripts() {
        try {
            List<String> s = hintProvider.inlineScripts();
            return s == null ? List.of() : List.copyOf(s);
        } catch (RuntimeException e) {
            log.warn("Could not read inline scripts: {}", e.getMessage());
            return List.of();
        }
    }

    AttributeHintProvider hintProvider() {
        return hintProvider;
    }

    void recordFailure(FieldOutcome outcome) {
        failures.add(outcome);
    }

    /**
     * @return failed field outcomes recorded so far
     */
    public List<FieldOutcome> failures() {
        synchronized (failures) {
            return List.copyOf(failures);
        }
    }

    /**
     * Requests that the run stop; outstanding hint lookups are abandoned.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}

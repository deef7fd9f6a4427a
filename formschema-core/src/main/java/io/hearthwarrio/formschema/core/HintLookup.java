package io.hearthwarrio.formschema.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of asking the page for a field's live validation attributes.
 * <p>
 * Inline script texts travel alongside so the inferencer can scan them when live
 * attributes could not be read.
 */
public final class HintLookup {

    /**
     * Lookup state.
     */
    public enum Status {
        /** Live attributes were read. */
        AVAILABLE,
        /** No live attribute source, or the control was not found. */
        UNAVAILABLE,
        /** The lookup threw or timed out. */
        FAILED
    }

    private static final HintLookup UNAVAILABLE_NO_SCRIPTS = new HintLookup(Status.UNAVAILABLE, null, List.of(), null);

    private final Status status;
    private final AttributeHints hints;
    private final List<String> inlineScripts;
    private final Throwable failure;

    private HintLookup(Status status, AttributeHints hints, List<String> inlineScripts, Throwable failure) {
        this.status = status;
        this.hints = hints;
        this.inlineScripts = inlineScripts == null ? List.of() : List.copyOf(inlineScripts);
        this.failure = failure;
    }

    public static HintLookup available(AttributeHints hints, List<String> inlineScripts) {
        return new HintLookup(Status.AVAILABLE, Objects.requireNonNull(hints, "hints must not be null"),
                inlineScripts, null);
    }

    public static HintLookup unavailable() {
        return UNAVAILABLE_NO_SCRIPTS;
    }

    public static HintLookup unavailable(List<String> inlineScripts) {
        return new HintLookup(Status.UNAVAILABLE, null, inlineScripts, null);
    }

    public static HintLookup failed(Throwable failure, List<String> inlineScripts) {
        return new HintLookup(Status.FAILED, null, inlineScripts,
                Objects.requireNonNull(failure, "failure must not be null"));
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return live hints, present only for {@link Status#AVAILABLE}
     */
    public Optional<AttributeHints> getHints() {
        return Optional.ofNullable(hints);
    }

    public List<String> getInlineScripts() {
        return inlineScripts;
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    @Override
    public String toString() {
        return "HintLookup{status=" + status + ", hints=" + hints + ", scripts=" + inlineScripts.size() + '}';
    }
}

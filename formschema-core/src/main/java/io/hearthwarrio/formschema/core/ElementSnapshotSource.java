package io.hearthwarrio.formschema.core;

import java.util.List;

/**
 * Supplies raw element snapshots of the currently rendered page, one step at a time.
 * <p>
 * Implementations live outside the core (for example a Selenium adapter). Navigation between
 * steps, if any, is the implementation's concern.
 */
@FunctionalInterface
public interface ElementSnapshotSource {

    /**
     * @param stepKey step to snapshot (e.g. "step1")
     * @return visible interactive controls of the step in page order
     * @throws SnapshotException if the page cannot be read
     */
    List<RawElement> snapshot(String stepKey) throws SnapshotException;
}

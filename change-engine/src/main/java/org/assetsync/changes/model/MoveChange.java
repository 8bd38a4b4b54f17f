package org.assetsync.changes.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Relocates assets to another collection through a server-side background job.
 *
 * @param assetRefs hrefs of the assets to move, in the order given, duplicates removed
 * @param destination href of the target collection
 */
public record MoveChange(Set<String> assetRefs, String destination) implements Change {
    public MoveChange {
        Objects.requireNonNull(assetRefs, "assetRefs");
        Objects.requireNonNull(destination, "destination");
        if (assetRefs.isEmpty()) {
            throw new IllegalArgumentException("A move needs at least one asset");
        }
        var copy = new LinkedHashSet<String>();
        assetRefs.forEach(ref -> copy.add(Objects.requireNonNull(ref, "asset ref")));
        assetRefs = Collections.unmodifiableSet(copy);
    }

    public static MoveChange of(Iterable<String> assetRefs, String destination) {
        var refs = new LinkedHashSet<String>();
        assetRefs.forEach(refs::add);
        return new MoveChange(refs, destination);
    }

    @Override
    public Kind kind() {
        return Kind.MOVE;
    }
}

package com.umls.sync.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical concept (CUI) node.
 *
 * @param cui             concept unique identifier
 * @param preferredName   canonical display name chosen by the preferred-name rule
 * @param categories      Biolink categories derived from the concept's semantic types
 * @param lastSeenVersion release version that last refreshed the node, {@code null} until stamped
 */
public record Concept(
        String cui,
        String preferredName,
        Set<BiolinkCategory> categories,
        String lastSeenVersion
) {
    public Concept {
        Objects.requireNonNull(cui, "cui is required");
        Objects.requireNonNull(preferredName, "preferredName is required");
        categories = categories == null || categories.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(BiolinkCategory.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(categories));
    }

    public Concept(String cui, String preferredName, Set<BiolinkCategory> categories) {
        this(cui, preferredName, categories, null);
    }

    public Concept withVersion(String version) {
        return new Concept(cui, preferredName, categories, version);
    }
}

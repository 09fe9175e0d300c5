package com.umls.sync.core.model;

import java.util.Objects;

/**
 * Source-vocabulary code node, keyed by the composite {@code SAB:CODE} identifier.
 *
 * @param codeId          composite identifier, see {@link #idOf(String, String)}
 * @param source          source vocabulary abbreviation (SAB)
 * @param name            display string of the row that first produced the code
 * @param lastSeenVersion release version that last refreshed the node, {@code null} until stamped
 */
public record Code(String codeId, String source, String name, String lastSeenVersion) {

    public Code {
        Objects.requireNonNull(codeId, "codeId is required");
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(name, "name is required");
    }

    public Code(String codeId, String source, String name) {
        this(codeId, source, name, null);
    }

    public static String idOf(String source, String code) {
        return source + ":" + code;
    }

    public Code withVersion(String version) {
        return new Code(codeId, source, name, version);
    }
}

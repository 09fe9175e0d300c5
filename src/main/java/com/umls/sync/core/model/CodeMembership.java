package com.umls.sync.core.model;

import java.util.Objects;

/**
 * {@code (:Concept)-[:HAS_CODE]->(:Code)} edge. Unique per (cui, codeId) pair.
 */
public record CodeMembership(String cui, String codeId, String lastSeenVersion) {

    public static final String TYPE = "HAS_CODE";

    public CodeMembership {
        Objects.requireNonNull(cui, "cui is required");
        Objects.requireNonNull(codeId, "codeId is required");
    }

    public CodeMembership(String cui, String codeId) {
        this(cui, codeId, null);
    }

    public CodeMembership withVersion(String version) {
        return new CodeMembership(cui, codeId, version);
    }

    public CodeMembership withCui(String newCui) {
        return new CodeMembership(newCui, codeId, lastSeenVersion);
    }

    public Key key() {
        return new Key(cui, codeId);
    }

    public record Key(String cui, String codeId) {}
}

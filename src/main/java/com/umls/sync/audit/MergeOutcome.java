package com.umls.sync.audit;

/**
 * What happened to one merge instruction.
 */
public enum MergeOutcome {
    /** Memberships and edges moved to the target, the old concept was removed. */
    APPLIED,
    /** The old concept was not in the graph. */
    SKIPPED_MISSING_OLD,
    /** The resolved target was not in the graph; the old concept was left untouched. */
    SKIPPED_MISSING_TARGET,
    /** The instruction resolved to the concept itself. */
    SKIPPED_SELF
}

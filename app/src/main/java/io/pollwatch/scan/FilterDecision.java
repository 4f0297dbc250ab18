package io.pollwatch.scan;

/** Outcome of {@link EntryFilter#classify}: whether an entry is reported and whether the walk descends into it. */
public enum FilterDecision {
    ACCEPT(true, true),
    SKIP(false, true),
    /** Report the directory but none of its descendants. */
    ACCEPT_SKIP_SUBTREE(true, false),
    /** Report neither the directory nor its descendants. */
    SKIP_SUBTREE(false, false);

    private final boolean reported;
    private final boolean descend;

    FilterDecision(boolean reported, boolean descend) {
        this.reported = reported;
        this.descend = descend;
    }

    public boolean isReported() {
        return reported;
    }

    /** Only meaningful for directories. */
    public boolean shouldDescend() {
        return descend;
    }
}

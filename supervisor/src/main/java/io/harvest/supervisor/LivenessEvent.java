package io.harvest.supervisor;

/**
 * What one line of child output says about progress. {@code rows} is only meaningful for
 * {@link Kind#SAVED} and is -1 when the count could not be read.
 */
public record LivenessEvent(Kind kind, long rows) {
    public enum Kind { START_ITEM, COLLECTING, SAVED, OTHER }

    private static final LivenessEvent START = new LivenessEvent(Kind.START_ITEM, -1);
    private static final LivenessEvent COLLECTING = new LivenessEvent(Kind.COLLECTING, -1);
    private static final LivenessEvent OTHER = new LivenessEvent(Kind.OTHER, -1);

    public static LivenessEvent startItem() { return START; }
    public static LivenessEvent collecting() { return COLLECTING; }
    public static LivenessEvent saved(long rows) { return new LivenessEvent(Kind.SAVED, rows); }
    public static LivenessEvent other() { return OTHER; }
}

package io.harvest.supervisor;

/** One line of child output, or the marker that the output stream has ended. */
final class ChildLine {
    private static final ChildLine END = new ChildLine(null);

    private final String text;

    private ChildLine(String text) { this.text = text; }

    static ChildLine of(String text) { return new ChildLine(text); }
    static ChildLine endOfStream() { return END; }

    boolean isEndOfStream() { return this == END; }
    String text() { return text; }
}

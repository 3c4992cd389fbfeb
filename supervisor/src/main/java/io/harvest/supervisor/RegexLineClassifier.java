package io.harvest.supervisor;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes the collector's progress lines. A saved marker wins over a collecting marker, which
 * wins over an item-start marker, so {@code [3/10] X -> collecting...} counts as collecting.
 */
public class RegexLineClassifier implements LineClassifier {
    public static final Pattern START = Pattern.compile("^\\[\\s*\\d+\\s*/\\s*\\d+\\s*]");
    public static final Pattern COLLECTING = Pattern.compile("->\\s*collecting", Pattern.CASE_INSENSITIVE);
    public static final Pattern SAVED = Pattern.compile("\\bsaved\\s+(\\d[\\d,]*)\\s+rows\\b", Pattern.CASE_INSENSITIVE);

    private final Pattern start;
    private final Pattern collecting;
    private final Pattern saved;

    public RegexLineClassifier() {
        this(START, COLLECTING, SAVED);
    }

    /** {@code saved} may expose the row count as group 1. */
    public RegexLineClassifier(Pattern start, Pattern collecting, Pattern saved) {
        this.start = Objects.requireNonNull(start);
        this.collecting = Objects.requireNonNull(collecting);
        this.saved = Objects.requireNonNull(saved);
    }

    @Override
    public LivenessEvent classify(String line) {
        if (line == null) return LivenessEvent.other();
        Matcher m = saved.matcher(line);
        if (m.find()) return LivenessEvent.saved(rows(m));
        if (collecting.matcher(line).find()) return LivenessEvent.collecting();
        if (start.matcher(line).find()) return LivenessEvent.startItem();
        return LivenessEvent.other();
    }

    private static long rows(Matcher m) {
        if (m.groupCount() < 1 || m.group(1) == null) return -1;
        try {
            return Long.parseLong(m.group(1).replace(",", ""));
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}

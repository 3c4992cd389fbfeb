package io.harvest.financial;

import io.harvest.core.WorkItem;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes the code spellings found in listing files ("005930", "5930", "005930.KS",
 * "Samsung (005930)") to a six-digit symbol with market suffix, e.g. {@code 005930.KS}.
 */
public final class InstrumentCodes {
    private static final Pattern PARENTHESIZED = Pattern.compile("\\((\\d{1,6})\\)");

    private InstrumentCodes() {}

    public static Optional<WorkItem> normalize(String raw, Market market) {
        if (raw == null) return Optional.empty();
        String s = raw.trim().toUpperCase(Locale.ROOT);
        if (s.isEmpty()) return Optional.empty();

        String suffix = market.symbolSuffix();
        String digits;
        Matcher m = PARENTHESIZED.matcher(s);
        if (m.find()) {
            digits = m.group(1);
        } else {
            for (Market other : Market.values()) {
                if (s.endsWith(other.symbolSuffix())) {
                    suffix = other.symbolSuffix();
                    s = s.substring(0, s.length() - suffix.length());
                    break;
                }
            }
            digits = s.chars().filter(Character::isDigit)
                    .collect(StringBuilder::new, StringBuilder::appendCodePoint, StringBuilder::append)
                    .toString();
        }
        if (digits.isEmpty() || digits.length() > 6) return Optional.empty();
        return Optional.of(new WorkItem("0".repeat(6 - digits.length()) + digits + suffix));
    }
}

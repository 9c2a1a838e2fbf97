package sequencer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordering key of a migration.
 *
 * <p>Parsed from dotted strings such as {@code 0.2.5}, {@code 20240101.1} or
 * {@code 3}. Segments are split on {@code .}, {@code -} and {@code _}. Numeric
 * segments compare numerically, alphanumeric segments compare lexically and
 * sort after numeric ones, and missing trailing segments count as zero, so
 * {@code 1.2} equals {@code 1.2.0}.
 */
public final class MigrationVersion implements Comparable<MigrationVersion> {

    public static final MigrationVersion ZERO = parse("0");

    private final String text;
    private final List<Object> segments;

    private MigrationVersion(String text, List<Object> segments) {
        this.text = text;
        this.segments = segments;
    }

    /**
     * Parses a version string.
     *
     * @param text the version text
     * @return the parsed version
     * @throws IllegalArgumentException if the text is blank or has an empty segment
     */
    public static MigrationVersion parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Version must not be blank");
        }
        String trimmed = text.strip();
        List<Object> segments = new ArrayList<>();
        for (String part : trimmed.split("[._-]", -1)) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Invalid version: " + text);
            }
            if (part.chars().allMatch(Character::isDigit)) {
                segments.add(Long.parseLong(part));
            } else {
                segments.add(part);
            }
        }
        // trailing zeros carry no ordering information
        int end = segments.size();
        while (end > 1 && Long.valueOf(0L).equals(segments.get(end - 1))) {
            end--;
        }
        return new MigrationVersion(trimmed, Collections.unmodifiableList(new ArrayList<>(segments.subList(0, end))));
    }

    @Override
    public int compareTo(MigrationVersion other) {
        int n = Math.max(segments.size(), other.segments.size());
        for (int i = 0; i < n; i++) {
            Object a = i < segments.size() ? segments.get(i) : 0L;
            Object b = i < other.segments.size() ? other.segments.get(i) : 0L;
            int c = compareSegment(a, b);
            if (c != 0) return c;
        }
        return 0;
    }

    private static int compareSegment(Object a, Object b) {
        if (a instanceof Long x && b instanceof Long y) return Long.compare(x, y);
        if (a instanceof Long) return -1;
        if (b instanceof Long) return 1;
        return ((String) a).compareTo((String) b);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MigrationVersion v && segments.equals(v.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(segments);
    }

    @Override
    public String toString() {
        return text;
    }
}

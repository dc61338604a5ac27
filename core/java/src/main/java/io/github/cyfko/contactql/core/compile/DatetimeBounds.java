package io.github.cyfko.contactql.core.compile;

import io.github.cyfko.contactql.core.utils.DateUtils.UtcRange;

/**
 * Maps a datetime comparator applied to a local day to the instant bounds it selects.
 * <pre>
 *   =   [start, end)
 *   &lt;   (-inf, start)
 *   &lt;=  (-inf, end)
 *   &gt;   [end, +inf)
 *   &gt;=  [start, +inf)
 * </pre>
 * A {@code null} bound is unbounded.
 *
 * @since 1.0.0
 */
public final class DatetimeBounds {

    private DatetimeBounds() {}

    public static UtcRange forComparator(String comparator, UtcRange day) {
        return switch (comparator) {
            case "=" -> day;
            case "<" -> new UtcRange(null, day.start());
            case "<=" -> new UtcRange(null, day.end());
            case ">" -> new UtcRange(day.end(), null);
            case ">=" -> new UtcRange(day.start(), null);
            default -> throw new IllegalArgumentException("Not a datetime comparator: " + comparator);
        };
    }
}

package com.studyflow.core.model;

/**
 * Allowed scheduling tolerance around a visit day, in days.
 *
 * @param minus days allowed before the scheduled day
 * @param plus days allowed after the scheduled day
 */
public record VisitWindow(int minus, int plus) {

    private static final VisitWindow ZERO = new VisitWindow(0, 0);

    public VisitWindow {
        if (minus < 0 || plus < 0) {
            throw new IllegalArgumentException("Window bounds must not be negative: -" + minus + "/+" + plus);
        }
    }

    public static VisitWindow zero() {
        return ZERO;
    }

    public static VisitWindow symmetric(int days) {
        return days == 0 ? ZERO : new VisitWindow(days, days);
    }

    /**
     * Returns the total width of the window ({@code minus + plus}).
     *
     * @return total tolerance in days
     */
    public int total() {
        return minus + plus;
    }

    /**
     * Formats the window the way schedules print it, e.g. {@code ±3/3 days}.
     *
     * @return display string
     */
    public String format() {
        return "±" + minus + "/" + plus + " days";
    }
}

package com.tutorhub.dto;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Half-open interval [start, end) on the local business timeline.
 */
public final class TimeWindow {

    private final LocalDateTime start;
    private final LocalDateTime end;

    public TimeWindow(LocalDateTime start, LocalDateTime end) {
        this.start = Objects.requireNonNull(start, "start required");
        this.end = Objects.requireNonNull(end, "end required");
    }

    public LocalDateTime getStart() { return start; }
    public LocalDateTime getEnd() { return end; }

    public boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return start.isBefore(otherEnd) && otherStart.isBefore(end);
    }

    public boolean contains(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return !otherStart.isBefore(start) && !otherEnd.isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeWindow)) return false;
        TimeWindow that = (TimeWindow) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}

package com.tutorhub.event;

/**
 * Published when an external calendar refresh was refused because it would drop too many events.
 */
public class UnsafeCalendarUpdateEvent {

    private final Long sourceId;
    private final int storedEvents;
    private final int candidateEvents;

    public UnsafeCalendarUpdateEvent(Long sourceId, int storedEvents, int candidateEvents) {
        this.sourceId = sourceId;
        this.storedEvents = storedEvents;
        this.candidateEvents = candidateEvents;
    }

    public Long getSourceId() { return sourceId; }
    public int getStoredEvents() { return storedEvents; }
    public int getCandidateEvents() { return candidateEvents; }

    @Override
    public String toString() {
        return "UnsafeCalendarUpdateEvent{sourceId=" + sourceId +
                ", stored=" + storedEvents + ", candidate=" + candidateEvents + "}";
    }
}

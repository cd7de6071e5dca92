package com.tutorhub.model;

import java.time.Duration;

/**
 * Kinds of lessons a customer can buy.
 * <p>
 * Lessons that require a timeline entry are hosted events (a teacher plans them first,
 * customers join later). The rest get their entry created at scheduling time.
 * A {@code null} sort order keeps the type out of customer-facing listings.
 */
public enum LessonType {

    ORDINARY("Ordinary lesson", "ordinary_lesson", false, 1, 30, 1),
    PAIRED("Paired lesson", "paired_lesson", false, 2, 60, 2),
    TRIAL("Trial lesson", "trial_lesson", false, null, 30, 1),
    MASTER_CLASS("Master class", "master_class", true, 3, 60, 5),
    HAPPY_HOUR("Happy hour", "happy_hour", true, 4, 60, 10);

    private final String displayName;
    private final String internalName;
    private final boolean timelineEntryRequired;
    private final Integer sortOrder;
    private final int defaultDurationMinutes;
    private final int defaultSlots;

    LessonType(String displayName,
               String internalName,
               boolean timelineEntryRequired,
               Integer sortOrder,
               int defaultDurationMinutes,
               int defaultSlots) {
        this.displayName = displayName;
        this.internalName = internalName;
        this.timelineEntryRequired = timelineEntryRequired;
        this.sortOrder = sortOrder;
        this.defaultDurationMinutes = defaultDurationMinutes;
        this.defaultSlots = defaultSlots;
    }

    public String displayName() { return displayName; }
    public String internalName() { return internalName; }
    public boolean timelineEntryRequired() { return timelineEntryRequired; }
    public Integer sortOrder() { return sortOrder; }
    public int defaultSlots() { return defaultSlots; }

    public Duration defaultDuration() {
        return Duration.ofMinutes(defaultDurationMinutes);
    }
}

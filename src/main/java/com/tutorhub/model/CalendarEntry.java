package com.tutorhub.model;

import com.tutorhub.dto.TimeWindow;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A booking on a teacher's timeline. Group lessons carry several entitlements on one entry.
 * {@code takenSlots} mirrors the number of entitlements pointing here and is recounted by
 * {@link com.tutorhub.service.CalendarEntryService} whenever one is attached or detached.
 */
@Entity
@Table(name = "timeline_entry",
        indexes = {
                @Index(name = "idx_timeline_entry_teacher_start", columnList = "teacher_id, start_at")
        })
@Getter
@Setter
public class CalendarEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "teacher_id")
    private Teacher teacher;

    @ManyToOne(optional = false)
    @JoinColumn(name = "lesson_id")
    private Lesson lesson;

    @Enumerated(EnumType.STRING)
    @Column(name = "lesson_type", nullable = false, length = 32)
    private LessonType lessonType;

    @Column(name = "start_at", nullable = false)
    private LocalDateTime start;

    @Column(name = "end_at", nullable = false)
    private LocalDateTime end;

    @Column(name = "allow_overlap", nullable = false)
    private boolean allowOverlap = false;

    @Column(name = "allow_besides_working_hours", nullable = false)
    private boolean allowBesidesWorkingHours = false;

    @Column(nullable = false)
    private int slots = 1;

    @Column(name = "taken_slots", nullable = false)
    private int takenSlots = 0;

    public static CalendarEntry forLesson(Teacher teacher, Lesson lesson, LocalDateTime start) {
        CalendarEntry e = new CalendarEntry();
        e.setTeacher(teacher);
        e.setLesson(lesson);
        e.setStart(start);
        e.deriveFromLesson();
        return e;
    }

    /** Fills lesson type, end and seat count from the lesson where they are not set yet. */
    public void deriveFromLesson() {
        if (lesson == null) return;
        lessonType = lesson.getLessonType();
        if (end == null && start != null) {
            end = start.plus(lesson.getDuration());
        }
        if (id == null && takenSlots == 0) {
            slots = Math.max(1, lesson.getSlots());
        }
    }

    public boolean isFree() {
        return takenSlots < slots;
    }

    public TimeWindow getWindow() {
        return new TimeWindow(start, end);
    }

    @PrePersist
    @PreUpdate
    void validate() {
        deriveFromLesson();
        if (start == null || end == null || !end.isAfter(start)) {
            throw new IllegalStateException("Timeline entry must end after it starts: " + start + "-" + end);
        }
    }
}

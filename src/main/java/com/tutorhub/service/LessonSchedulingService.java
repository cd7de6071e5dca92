package com.tutorhub.service;

import com.tutorhub.exception.CannotBeScheduledException;
import com.tutorhub.exception.CannotBeUnscheduledException;
import com.tutorhub.model.CalendarEntry;
import com.tutorhub.model.Lesson;
import com.tutorhub.model.LessonEntitlement;
import com.tutorhub.model.Teacher;
import com.tutorhub.repository.CalendarEntryRepository;
import com.tutorhub.repository.LessonEntitlementRepository;
import com.tutorhub.repository.TeacherRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Places bought lessons on teacher timelines and takes them off again.
 * <p>
 * Writes lock the teacher row first, so two requests for the same teacher cannot both pass the
 * overlap check and book the same time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LessonSchedulingService {

    private final TeacherRepository teacherRepository;
    private final CalendarEntryRepository calendarEntryRepository;
    private final LessonEntitlementRepository lessonEntitlementRepository;
    private final CalendarEntryService calendarEntryService;
    private final WorkingHoursService workingHoursService;

    @Transactional(readOnly = true)
    public boolean canBeScheduled(LessonEntitlement entitlement, CalendarEntry entry) {
        return rejectionReason(load(entitlement), calendarEntryService.load(entry)) == null;
    }

    /**
     * Attach {@code entry} to {@code entitlement}. An unsaved entry is persisted first, so a caller
     * can build both and schedule them in one call.
     * <p>
     * Both are re-read under the teacher lock, so the instances passed in may be detached or stale.
     *
     * @return the stored entitlement
     * @throws CannotBeScheduledException when {@link #canBeScheduled} is false
     */
    @Transactional
    public LessonEntitlement assign(LessonEntitlement entitlement, CalendarEntry entry) {
        Objects.requireNonNull(entitlement, "entitlement required");
        Objects.requireNonNull(entry, "entry required");
        lockTeacher(entry.getTeacher());

        LessonEntitlement current = load(entitlement);
        CalendarEntry target = calendarEntryService.load(entry);
        String reason = rejectionReason(current, target);
        if (reason != null) {
            throw new CannotBeScheduledException(current + " at " + target.getStart() + ": " + reason);
        }

        if (target.getId() == null) {
            target = calendarEntryRepository.save(target);
        }
        current.setCalendarEntry(target);
        LessonEntitlement saved = lessonEntitlementRepository.save(current);
        calendarEntryService.recountSeats(target);

        log.info("Scheduled {} on entry id={} ({} - {}), seats {}/{}",
                saved, target.getId(), target.getStart(), target.getEnd(), target.getTakenSlots(), target.getSlots());
        return saved;
    }

    @Transactional
    public LessonEntitlement schedule(LessonEntitlement entitlement, Teacher teacher, LocalDateTime start) {
        return schedule(entitlement, teacher, start, true, false);
    }

    /**
     * Schedule a lesson that does not need a pre-planned timeline entry: a new entry is built for
     * {@code teacher} at {@code start}. {@code allowBesidesWorkingHours} is meant for back-office fixes and tests.
     */
    @Transactional
    public LessonEntitlement schedule(LessonEntitlement entitlement,
                                      Teacher teacher,
                                      LocalDateTime start,
                                      boolean allowOverlap,
                                      boolean allowBesidesWorkingHours) {
        Objects.requireNonNull(entitlement, "entitlement required");
        lockTeacher(teacher);

        LessonEntitlement current = load(entitlement);
        Lesson lesson = current.getLesson();
        if (lesson.getLessonType().timelineEntryRequired()) {
            throw new CannotBeScheduledException("Lesson '" + lesson.getName() + "' requires a teacher's timeline entry");
        }

        CalendarEntry entry = CalendarEntry.forLesson(teacher, lesson, start);
        entry.setAllowOverlap(allowOverlap);
        entry.setAllowBesidesWorkingHours(allowBesidesWorkingHours);
        return assign(current, entry);
    }

    /**
     * Take the lesson off its entry. The entry itself stays, other customers may still be on it.
     *
     * @return the stored entitlement
     * @throws CannotBeUnscheduledException when the lesson is not scheduled
     */
    @Transactional
    public LessonEntitlement unschedule(LessonEntitlement entitlement) {
        Objects.requireNonNull(entitlement, "entitlement required");
        LessonEntitlement current = load(entitlement);
        CalendarEntry entry = current.getCalendarEntry();
        if (entry == null) {
            throw new CannotBeUnscheduledException(current + " is not scheduled");
        }
        lockTeacher(entry.getTeacher());

        current.setCalendarEntry(null);
        LessonEntitlement saved = lessonEntitlementRepository.save(current);
        CalendarEntry updated = calendarEntryService.recountSeats(entry);

        log.info("Unscheduled {} from entry id={}, seats {}/{}", saved, updated.getId(), updated.getTakenSlots(), updated.getSlots());
        return saved;
    }

    @Transactional(readOnly = true)
    public boolean isFittingWorkingHours(CalendarEntry entry) {
        return workingHoursService.fits(entry.getTeacher(), entry.getStart(), entry.getEnd());
    }

    /** A seat is left and, unless overlap is allowed, nothing else is booked at that time. */
    @Transactional(readOnly = true)
    public boolean isFree(CalendarEntry entry) {
        if (!entry.isFree()) return false;
        return entry.isAllowOverlap() || !overlapsOtherEntries(entry);
    }

    // null when the entitlement can go on the entry
    private String rejectionReason(LessonEntitlement entitlement, CalendarEntry entry) {
        entry.deriveFromLesson();
        if (entitlement.isScheduled() || entitlement.getCalendarEntry() != null) {
            return "already scheduled";
        }
        if (!isFree(entry)) {
            return "entry is not free";
        }
        if (entitlement.getLessonType() != entry.getLessonType()) {
            return "lesson type " + entitlement.getLessonType() + " does not match entry type " + entry.getLessonType();
        }
        if (!entry.isAllowBesidesWorkingHours() && !isFittingWorkingHours(entry)) {
            return "outside of teacher's working hours";
        }
        return null;
    }

    private boolean overlapsOtherEntries(CalendarEntry entry) {
        return calendarEntryRepository
                .findByTeacherAndStartLessThanAndEndGreaterThanOrderByStartAsc(entry.getTeacher(), entry.getEnd(), entry.getStart())
                .stream()
                .anyMatch(other -> !other.getId().equals(entry.getId()));
    }

    private LessonEntitlement load(LessonEntitlement entitlement) {
        if (entitlement.getId() == null) {
            return entitlement;
        }
        return lessonEntitlementRepository.findById(entitlement.getId())
                .orElseThrow(() -> new IllegalArgumentException("Lesson not found: " + entitlement.getId()));
    }

    private void lockTeacher(Teacher teacher) {
        if (teacher == null || teacher.getId() == null) {
            throw new IllegalArgumentException("Timeline entry must belong to a saved teacher");
        }
        teacherRepository.lockById(teacher.getId())
                .orElseThrow(() -> new IllegalArgumentException("Teacher not found: " + teacher.getId()));
    }
}

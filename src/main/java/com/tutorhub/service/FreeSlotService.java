package com.tutorhub.service;

import com.tutorhub.dto.FreeSlots;
import com.tutorhub.dto.TimeWindow;
import com.tutorhub.model.CalendarEntry;
import com.tutorhub.model.LessonType;
import com.tutorhub.model.Teacher;
import com.tutorhub.repository.CalendarEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class FreeSlotService {

    private final WorkingHoursService workingHoursService;
    private final CalendarEntryRepository calendarEntryRepository;

    @Value("${tutorhub.slots.granularity-minutes:30}")
    private int granularityMinutes = 30;

    public Duration defaultGranularity() {
        return Duration.ofMinutes(granularityMinutes);
    }

    @Transactional(readOnly = true)
    public Optional<FreeSlots> findFreeSlots(Teacher teacher, LocalDate date) {
        return findFreeSlots(teacher, date, defaultGranularity(), null);
    }

    @Transactional(readOnly = true)
    public Optional<FreeSlots> findFreeSlots(Teacher teacher, LocalDate date, LessonType lessonType) {
        return findFreeSlots(teacher, date, defaultGranularity(), lessonType);
    }

    /**
     * Start times within the teacher's working hours for {@code date}, one per {@code granularity},
     * that do not intersect an existing timeline entry. With a {@code lessonType} only entries of that
     * type count, and a slot lasts as long as that lesson type.
     *
     * @return empty when the teacher does not work that day; an empty {@link FreeSlots} when fully booked
     */
    @Transactional(readOnly = true)
    public Optional<FreeSlots> findFreeSlots(Teacher teacher, LocalDate date, Duration granularity, LessonType lessonType) {
        Objects.requireNonNull(teacher, "teacher required");
        Objects.requireNonNull(date, "date required");
        if (granularity == null || granularity.isZero() || granularity.isNegative()) {
            throw new IllegalArgumentException("granularity must be positive");
        }

        Optional<TimeWindow> hours = workingHoursService.forDate(teacher, date);
        if (hours.isEmpty()) {
            return Optional.empty();
        }
        TimeWindow window = hours.get();
        Duration slotLength = lessonType != null ? lessonType.defaultDuration() : granularity;
        List<CalendarEntry> busy = entriesWithin(teacher, window.getStart(), window.getEnd().plus(slotLength), lessonType);

        List<LocalDateTime> free = new ArrayList<>();
        for (LocalDateTime start = window.getStart(); start.isBefore(window.getEnd()); start = start.plus(granularity)) {
            if (!intersectsAny(busy, start, start.plus(slotLength))) {
                free.add(start);
            }
        }
        return Optional.of(new FreeSlots(free));
    }

    /**
     * Hosted entries (e.g. master classes) of the teacher on {@code date} that still have a free seat.
     */
    @Transactional(readOnly = true)
    public List<CalendarEntry> findFreeEntries(Teacher teacher, LocalDate date, LessonType lessonType) {
        Objects.requireNonNull(lessonType, "lessonType required");
        return calendarEntryRepository
                .findByTeacherAndLessonTypeAndStartBetweenOrderByStartAsc(
                        teacher, lessonType, date.atStartOfDay(), date.plusDays(1).atStartOfDay().minusNanos(1))
                .stream()
                .filter(CalendarEntry::isFree)
                .toList();
    }

    private List<CalendarEntry> entriesWithin(Teacher teacher, LocalDateTime from, LocalDateTime to, LessonType lessonType) {
        if (lessonType == null) {
            return calendarEntryRepository
                    .findByTeacherAndStartLessThanAndEndGreaterThanOrderByStartAsc(teacher, to, from);
        }
        return calendarEntryRepository
                .findByTeacherAndLessonTypeAndStartLessThanAndEndGreaterThanOrderByStartAsc(teacher, lessonType, to, from);
    }

    private static boolean intersectsAny(List<CalendarEntry> entries, LocalDateTime start, LocalDateTime end) {
        for (CalendarEntry e : entries) {
            if (e.getWindow().overlaps(start, end)) return true;
        }
        return false;
    }
}

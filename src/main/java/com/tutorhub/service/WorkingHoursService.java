package com.tutorhub.service;

import com.tutorhub.dto.TimeWindow;
import com.tutorhub.model.Teacher;
import com.tutorhub.model.WorkingHours;
import com.tutorhub.repository.WorkingHoursRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Objects;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class WorkingHoursService {

    private final WorkingHoursRepository workingHoursRepository;

    /**
     * Concrete working window of a teacher for a date, or empty when the teacher does not work that weekday.
     */
    @Transactional(readOnly = true)
    public Optional<TimeWindow> forDate(Teacher teacher, LocalDate date) {
        Objects.requireNonNull(teacher, "teacher required");
        Objects.requireNonNull(date, "date required");
        return workingHoursRepository
                .findFirstByTeacherAndWeekdayOrderByIdAsc(teacher, WorkingHours.weekdayOf(date))
                .map(wh -> wh.forDate(date));
    }

    @Transactional(readOnly = true)
    public boolean fits(Teacher teacher, LocalDateTime start, LocalDateTime end) {
        return forDate(teacher, start.toLocalDate())
                .map(window -> window.contains(start, end))
                .orElse(false);
    }

    @Transactional
    public WorkingHours add(Teacher teacher, int weekday, LocalTime start, LocalTime end) {
        if (weekday < 0 || weekday > 6) {
            throw new IllegalArgumentException("weekday must be within 0..6");
        }
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalArgumentException("Working hours must start before they end");
        }
        WorkingHours wh = new WorkingHours();
        wh.setTeacher(teacher);
        wh.setWeekday(weekday);
        wh.setStart(start);
        wh.setEnd(end);
        WorkingHours saved = workingHoursRepository.save(wh);
        log.info("Added working hours {} {}-{} for teacher id={}", weekday, start, end, teacher.getId());
        return saved;
    }
}

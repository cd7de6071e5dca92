package com.tutorhub.repository;

import com.tutorhub.model.CalendarEntry;
import com.tutorhub.model.LessonType;
import com.tutorhub.model.Teacher;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;

public interface CalendarEntryRepository extends JpaRepository<CalendarEntry, Long> {

    /** Entries intersecting [from, to): start &lt; to and end &gt; from. */
    List<CalendarEntry> findByTeacherAndStartLessThanAndEndGreaterThanOrderByStartAsc(
            Teacher teacher, LocalDateTime to, LocalDateTime from);

    List<CalendarEntry> findByTeacherAndLessonTypeAndStartLessThanAndEndGreaterThanOrderByStartAsc(
            Teacher teacher, LessonType lessonType, LocalDateTime to, LocalDateTime from);

    List<CalendarEntry> findByTeacherAndLessonTypeAndStartBetweenOrderByStartAsc(
            Teacher teacher, LessonType lessonType, LocalDateTime startInclusive, LocalDateTime endInclusive);
}

package com.tutorhub.repository;

import com.tutorhub.model.Teacher;
import com.tutorhub.model.WorkingHours;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface WorkingHoursRepository extends JpaRepository<WorkingHours, Long> {

    // lowest id wins when several templates share a weekday
    Optional<WorkingHours> findFirstByTeacherAndWeekdayOrderByIdAsc(Teacher teacher, int weekday);
}

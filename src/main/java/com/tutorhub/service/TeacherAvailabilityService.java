package com.tutorhub.service;

import com.tutorhub.dto.FreeSlots;
import com.tutorhub.model.LessonType;
import com.tutorhub.model.Teacher;
import com.tutorhub.repository.TeacherRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class TeacherAvailabilityService {

    private final TeacherRepository teacherRepository;
    private final FreeSlotService freeSlotService;

    @Transactional(readOnly = true)
    public Set<Teacher> findFreeTeachers(LocalDate date) {
        return findFreeTeachers(date, null);
    }

    /** Teachers (by id) that have at least one free slot on {@code date}. */
    @Transactional(readOnly = true)
    public Set<Teacher> findFreeTeachers(LocalDate date, LessonType lessonType) {
        Set<Teacher> free = new LinkedHashSet<>();
        for (Teacher teacher : teacherRepository.findAllWithWorkingHours()) {
            Optional<FreeSlots> slots = freeSlotService.findFreeSlots(
                    teacher, date, freeSlotService.defaultGranularity(), lessonType);
            if (slots.isPresent() && !slots.get().isEmpty()) {
                free.add(teacher);
            }
        }
        return free;
    }
}

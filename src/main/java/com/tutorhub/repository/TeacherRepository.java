package com.tutorhub.repository;

import com.tutorhub.model.Teacher;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TeacherRepository extends JpaRepository<Teacher, Long> {

    // Teachers with at least one working-hours template
    @Query("SELECT t FROM Teacher t " +
           "WHERE EXISTS (SELECT w.id FROM WorkingHours w WHERE w.teacher = t) " +
           "ORDER BY t.id")
    List<Teacher> findAllWithWorkingHours();

    // Serializes scheduling per teacher
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Teacher t WHERE t.id = :id")
    Optional<Teacher> lockById(@Param("id") Long id);
}

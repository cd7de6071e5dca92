package com.tutorhub.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * A concrete lesson of some {@link LessonType}. Purchases and calendar entries point here.
 */
@Entity
@Table(name = "lesson")
@Getter
@Setter
public class Lesson {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "lesson_type", nullable = false, length = 32)
    private LessonType lessonType;

    @NotBlank
    @Column(nullable = false)
    private String name;

    @Column(name = "internal_name", nullable = false)
    private String internalName;

    @Positive
    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    // seats per calendar entry
    @Column(nullable = false)
    private int slots = 1;

    // set for hosted lessons (master classes, happy hours)
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "host_id")
    private Teacher host;

    public static Lesson of(LessonType type) {
        Lesson l = new Lesson();
        l.setLessonType(type);
        l.setName(type.displayName());
        l.setInternalName(type.internalName());
        l.setDurationMinutes((int) type.defaultDuration().toMinutes());
        l.setSlots(type.defaultSlots());
        return l;
    }

    public Duration getDuration() {
        return Duration.ofMinutes(durationMinutes);
    }
}

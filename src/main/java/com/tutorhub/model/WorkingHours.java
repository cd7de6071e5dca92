package com.tutorhub.model;

import com.tutorhub.dto.TimeWindow;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalTime;

@Entity
@Table(name = "working_hours",
        indexes = {
                @Index(name = "idx_working_hours_teacher_weekday", columnList = "teacher_id, weekday")
        })
@Getter
@Setter
public class WorkingHours {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "teacher_id")
    private Teacher teacher;

    /**
     * 0 = Monday ... 6 = Sunday.
     */
    @Min(0)
    @Max(6)
    @Column(nullable = false)
    private int weekday;

    @NotNull
    @Column(name = "start_time", nullable = false)
    private LocalTime start;

    @NotNull
    @Column(name = "end_time", nullable = false)
    private LocalTime end;

    public static int weekdayOf(LocalDate date) {
        return date.getDayOfWeek().getValue() - 1;
    }

    public TimeWindow forDate(LocalDate date) {
        return new TimeWindow(date.atTime(start), date.atTime(end));
    }

    @PrePersist
    @PreUpdate
    void validate() {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new IllegalStateException("Working hours must start before they end: " + start + "-" + end);
        }
    }
}

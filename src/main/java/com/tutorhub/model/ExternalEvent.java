package com.tutorhub.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "external_event",
        indexes = {
                @Index(name = "idx_external_event_source", columnList = "source_id")
        })
@Getter
@Setter
public class ExternalEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "source_id")
    private ExternalEventSource source;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "teacher_id")
    private Teacher teacher;

    @Column(name = "start_at")
    private LocalDateTime start;

    @Column(name = "end_at")
    private LocalDateTime end;

    @Column(length = 1024)
    private String description;

    // set on instances of a recurring series; the parent holds the rule
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "parent_id")
    private ExternalEvent parent;

    public boolean isRecurringInstance() {
        return parent != null;
    }
}

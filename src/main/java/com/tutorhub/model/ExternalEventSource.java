package com.tutorhub.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * An upstream calendar feed (e.g. a teacher's personal calendar) mirrored into {@link ExternalEvent} rows.
 */
@Entity
@Table(name = "external_event_source")
@Getter
@Setter
public class ExternalEventSource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "teacher_id")
    private Teacher teacher;

    @Column(length = 1024)
    private String url;

    @Column(nullable = false)
    private boolean active = true;

    @Column(name = "last_update")
    private LocalDateTime lastUpdate;
}

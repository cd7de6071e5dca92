package com.tutorhub.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single bought lesson ("class"). It is scheduled once it points to a timeline entry.
 */
@Entity
@Table(name = "purchased_class",
        indexes = {
                @Index(name = "idx_purchased_class_customer", columnList = "customer_id"),
                @Index(name = "idx_purchased_class_subscription", columnList = "subscription_id")
        })
@Getter
@Setter
public class LessonEntitlement {

    public enum BuySource { SINGLE, SUBSCRIPTION }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "customer_id")
    private Customer customer;

    @ManyToOne(optional = false)
    @JoinColumn(name = "lesson_id")
    private Lesson lesson;

    // copy of lesson.lessonType, so listings don't need the join
    @Enumerated(EnumType.STRING)
    @Column(name = "lesson_type", nullable = false, length = 32)
    private LessonType lessonType;

    @Column(name = "buy_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal buyPrice;

    @Column(name = "buy_time", nullable = false, updatable = false)
    private LocalDateTime buyTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "buy_source", nullable = false, length = 16)
    private BuySource buySource = BuySource.SINGLE;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "subscription_id")
    private Subscription subscription;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "timeline_entry_id")
    private CalendarEntry calendarEntry;

    @Column(name = "is_scheduled", nullable = false)
    private boolean scheduled = false;

    @Column(nullable = false)
    private boolean active = true;

    public void setLesson(Lesson lesson) {
        this.lesson = lesson;
        this.lessonType = lesson != null ? lesson.getLessonType() : null;
    }

    public void setCalendarEntry(CalendarEntry calendarEntry) {
        this.calendarEntry = calendarEntry;
        this.scheduled = calendarEntry != null;
    }

    public String getNameForUser() {
        return lesson.getName();
    }

    public boolean isAvailable() {
        return active && calendarEntry == null;
    }

    // scheduled always follows calendarEntry once written
    @PrePersist
    @PreUpdate
    void syncScheduledFlag() {
        if (lesson != null) lessonType = lesson.getLessonType();
        scheduled = calendarEntry != null;
    }

    @Override
    public String toString() {
        String s = lesson.getInternalName() + " for " + customer;
        if (subscription != null) {
            s += " (" + subscription.getProduct().getName() + ")";
        }
        return s;
    }
}

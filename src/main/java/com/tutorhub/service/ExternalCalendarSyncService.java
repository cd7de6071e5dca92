package com.tutorhub.service;

import com.tutorhub.event.UnsafeCalendarUpdateEvent;
import com.tutorhub.model.ExternalEvent;
import com.tutorhub.model.ExternalEventSource;
import com.tutorhub.repository.ExternalEventRepository;
import com.tutorhub.repository.ExternalEventSourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Replaces the stored events of an external calendar with a freshly fetched batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExternalCalendarSyncService {

    // children before parents on delete, parents before children on insert
    private static final Comparator<ExternalEvent> PARENTS_FIRST =
            Comparator.comparing(ExternalEvent::isRecurringInstance);

    private final ExternalEventSourceRepository sourceRepository;
    private final ExternalEventRepository eventRepository;
    private final CalendarSyncSafety calendarSyncSafety;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * @return true when the batch was stored; false when it was refused as unsafe, in which case
     * the stored events stay untouched and an {@link UnsafeCalendarUpdateEvent} is published
     */
    @Transactional
    public boolean replaceEvents(Long sourceId, List<ExternalEvent> candidate) {
        Objects.requireNonNull(candidate, "candidate events required");
        ExternalEventSource source = sourceRepository.findById(sourceId)
                .orElseThrow(() -> new IllegalArgumentException("External event source not found: " + sourceId));

        List<ExternalEvent> stored = eventRepository.findBySourceOrderByIdAsc(source);
        if (!calendarSyncSafety.isSafe(stored, candidate)) {
            log.warn("Refusing to replace {} events of source id={} with {} events", stored.size(), sourceId, candidate.size());
            eventPublisher.publishEvent(new UnsafeCalendarUpdateEvent(sourceId, stored.size(), candidate.size()));
            return false;
        }

        List<ExternalEvent> toDelete = new ArrayList<>(stored);
        toDelete.sort(PARENTS_FIRST.reversed());
        eventRepository.deleteAll(toDelete);
        eventRepository.flush();

        List<ExternalEvent> toInsert = new ArrayList<>(candidate);
        toInsert.sort(PARENTS_FIRST);
        for (ExternalEvent e : toInsert) {
            e.setSource(source);
            e.setTeacher(source.getTeacher());
        }
        eventRepository.saveAll(toInsert);

        source.setLastUpdate(LocalDateTime.now(clock));
        sourceRepository.save(source);
        log.info("Source id={} updated: {} events replaced by {}", sourceId, stored.size(), toInsert.size());
        return true;
    }
}

package com.tutorhub.service;

import com.tutorhub.model.CalendarEntry;
import com.tutorhub.repository.CalendarEntryRepository;
import com.tutorhub.repository.LessonEntitlementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the seat count of timeline entries in line with the entitlements stored against them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalendarEntryService {

    private final CalendarEntryRepository calendarEntryRepository;
    private final LessonEntitlementRepository lessonEntitlementRepository;

    /**
     * Reload {@code entry} in the current transaction with its seat count taken from the database.
     * An unsaved entry is returned as is.
     */
    @Transactional
    public CalendarEntry load(CalendarEntry entry) {
        if (entry.getId() == null) {
            return entry;
        }
        CalendarEntry current = calendarEntryRepository.findById(entry.getId())
                .orElseThrow(() -> new IllegalArgumentException("Timeline entry not found: " + entry.getId()));
        return recountSeats(current);
    }

    /** {@code entry} must be managed; pending entitlement changes are flushed by the count query. */
    @Transactional
    public CalendarEntry recountSeats(CalendarEntry entry) {
        int taken = (int) lessonEntitlementRepository.countByCalendarEntryId(entry.getId());
        if (taken != entry.getTakenSlots()) {
            log.debug("Entry id={} seats {} -> {}", entry.getId(), entry.getTakenSlots(), taken);
            entry.setTakenSlots(taken);
        }
        return calendarEntryRepository.save(entry);
    }

    @Transactional
    public void recountSeatsById(Long entryId) {
        calendarEntryRepository.findById(entryId).ifPresent(entry -> recountSeats(entry));
    }
}

package com.tutorhub.service;

import com.tutorhub.model.CalendarEntry;
import com.tutorhub.model.Customer;
import com.tutorhub.model.Lesson;
import com.tutorhub.model.LessonEntitlement;
import com.tutorhub.model.LessonType;
import com.tutorhub.repository.CalendarEntryRepository;
import com.tutorhub.repository.LessonEntitlementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class LessonEntitlementService {

    private final LessonEntitlementRepository lessonEntitlementRepository;
    private final CalendarEntryRepository calendarEntryRepository;
    private final CalendarEntryService calendarEntryService;
    private final LessonTypeRegistry lessonTypeRegistry;
    private final Clock clock;

    @Value("${tutorhub.planning.days:7}")
    private int planningDays = 7;

    @Transactional
    public LessonEntitlement buySingle(Customer customer, Lesson lesson, BigDecimal price) {
        Objects.requireNonNull(customer, "customer required");
        Objects.requireNonNull(lesson, "lesson required");
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Price must not be negative");
        }

        LessonEntitlement c = new LessonEntitlement();
        c.setCustomer(customer);
        c.setLesson(lesson);
        c.setBuyPrice(price);
        c.setBuySource(LessonEntitlement.BuySource.SINGLE);
        c.setBuyTime(LocalDateTime.now(clock));
        LessonEntitlement saved = lessonEntitlementRepository.save(c);
        log.info("Customer id={} bought {} for {}", customer.getId(), lesson.getInternalName(), price);
        return saved;
    }

    /**
     * Save an entitlement together with an entry attached to it directly. A new entry is written
     * first; the scheduled flag is recomputed from the entry on every write. When the entitlement
     * moves off an entry, that entry gets its seat back.
     * No scheduling rules are checked here, use {@link LessonSchedulingService} for that.
     */
    @Transactional
    public LessonEntitlement save(LessonEntitlement entitlement) {
        Long previousEntryId = entitlement.getId() == null ? null
                : lessonEntitlementRepository.findStoredCalendarEntryId(entitlement.getId()).orElse(null);

        CalendarEntry entry = entitlement.getCalendarEntry();
        if (entry != null && entry.getId() == null) {
            entitlement.setCalendarEntry(calendarEntryRepository.save(entry));
        }
        if (entitlement.getBuyTime() == null) {
            entitlement.setBuyTime(LocalDateTime.now(clock));
        }
        LessonEntitlement saved = lessonEntitlementRepository.save(entitlement);

        CalendarEntry current = saved.getCalendarEntry();
        if (current != null) {
            calendarEntryService.recountSeats(current);
        }
        if (previousEntryId != null && (current == null || !previousEntryId.equals(current.getId()))) {
            log.debug("{} moved off entry id={}", saved, previousEntryId);
            calendarEntryService.recountSeatsById(previousEntryId);
        }
        return saved;
    }

    /** Lesson types the customer still has unscheduled, active lessons for, in listing order. */
    @Transactional(readOnly = true)
    public List<LessonType> boughtLessonTypes(Customer customer) {
        return lessonTypeRegistry.sortForListing(lessonEntitlementRepository.findUnscheduledLessonTypes(customer));
    }

    @Transactional(readOnly = true)
    public Optional<LessonEntitlement> findAvailable(Customer customer, LessonType lessonType) {
        return lessonEntitlementRepository
                .findFirstByCustomerAndLessonTypeAndActiveTrueAndCalendarEntryIsNullOrderByBuyTimeAscIdAsc(customer, lessonType);
    }

    @Transactional(readOnly = true)
    public List<LessonEntitlement> findSinglePurchases(Customer customer) {
        return lessonEntitlementRepository.findByCustomerAndSubscriptionIsNull(customer);
    }

    /** Dates a customer may plan lessons on: today and the following days. */
    public List<LocalDate> datesForPlanning() {
        LocalDate today = LocalDate.now(clock);
        List<LocalDate> dates = new ArrayList<>(planningDays);
        for (int i = 0; i < planningDays; i++) {
            dates.add(today.plusDays(i));
        }
        return dates;
    }
}

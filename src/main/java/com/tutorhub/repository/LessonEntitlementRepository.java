package com.tutorhub.repository;

import com.tutorhub.model.Customer;
import com.tutorhub.model.LessonEntitlement;
import com.tutorhub.model.LessonType;
import com.tutorhub.model.Subscription;
import jakarta.persistence.QueryHint;
import org.hibernate.jpa.HibernateHints;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface LessonEntitlementRepository extends JpaRepository<LessonEntitlement, Long> {

    List<LessonEntitlement> findBySubscription(Subscription subscription);

    // single purchases only
    List<LessonEntitlement> findByCustomerAndSubscriptionIsNull(Customer customer);

    long countByCalendarEntryId(Long calendarEntryId);

    // entry as stored, without flushing pending changes of the entitlement first
    @QueryHints(@QueryHint(name = HibernateHints.HINT_FLUSH_MODE, value = "COMMIT"))
    @Query("SELECT c.calendarEntry.id FROM LessonEntitlement c WHERE c.id = :id")
    Optional<Long> findStoredCalendarEntryId(@Param("id") Long id);

    Optional<LessonEntitlement> findFirstByCustomerAndLessonTypeAndActiveTrueAndCalendarEntryIsNullOrderByBuyTimeAscIdAsc(
            Customer customer, LessonType lessonType);

    @Query("SELECT DISTINCT c.lessonType FROM LessonEntitlement c " +
           "WHERE c.customer = :customer AND c.active = true AND c.calendarEntry IS NULL")
    List<LessonType> findUnscheduledLessonTypes(@Param("customer") Customer customer);
}

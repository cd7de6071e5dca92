package com.tutorhub.repository;

import com.tutorhub.model.Subscription;
import jakarta.persistence.QueryHint;
import org.hibernate.jpa.HibernateHints;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface SubscriptionRepository extends JpaRepository<Subscription, Long> {

    /**
     * The active flag as currently stored. Pending in-memory changes are not flushed first,
     * so this still returns the pre-change value for a managed, modified subscription.
     */
    @QueryHints(@QueryHint(name = HibernateHints.HINT_FLUSH_MODE, value = "COMMIT"))
    @Query("SELECT s.active FROM Subscription s WHERE s.id = :id")
    Optional<Boolean> findStoredActiveById(@Param("id") Long id);
}

package com.tutorhub.service;

import com.tutorhub.model.Customer;
import com.tutorhub.model.LessonEntitlement;
import com.tutorhub.model.Product;
import com.tutorhub.model.ProductLesson;
import com.tutorhub.model.Subscription;
import com.tutorhub.repository.LessonEntitlementRepository;
import com.tutorhub.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;
    private final LessonEntitlementRepository lessonEntitlementRepository;
    private final Clock clock;

    @Transactional
    public Subscription purchase(Customer customer, Product product, BigDecimal price) {
        Objects.requireNonNull(customer, "customer required");
        Objects.requireNonNull(product, "product required");
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Price must not be negative");
        }

        Subscription s = new Subscription();
        s.setCustomer(customer);
        s.setProduct(product);
        s.setBuyPrice(price);
        return save(s);
    }

    /**
     * Create or update a subscription.
     * <ul>
     *   <li>new: every lesson unit of the product becomes a lesson entitlement of the customer;</li>
     *   <li>existing: when {@code active} differs from the stored value, all lessons of this
     *       subscription follow it.</li>
     * </ul>
     */
    @Transactional
    public Subscription save(Subscription subscription) {
        if (subscription.getId() == null) {
            if (subscription.getBuyTime() == null) {
                subscription.setBuyTime(LocalDateTime.now(clock));
            }
            Subscription saved = subscriptionRepository.save(subscription);
            addLessonsToCustomer(saved);
            return saved;
        }

        boolean wasActive = subscriptionRepository.findStoredActiveById(subscription.getId())
                .orElseThrow(() -> new IllegalArgumentException("Subscription not found: " + subscription.getId()));
        // flushed, so the next save compares against this state
        Subscription saved = subscriptionRepository.saveAndFlush(subscription);
        if (wasActive != saved.isActive()) {
            updateLessons(saved);
        }
        return saved;
    }

    @Transactional
    public Subscription setActive(Long subscriptionId, boolean active) {
        Subscription s = subscriptionRepository.findById(subscriptionId)
                .orElseThrow(() -> new IllegalArgumentException("Subscription not found: " + subscriptionId));
        s.setActive(active);
        return save(s);
    }

    private void addLessonsToCustomer(Subscription subscription) {
        List<ProductLesson> units = new ArrayList<>(subscription.getProduct().getLessons());
        units.sort(Comparator.comparing(pl -> pl.getLesson().getLessonType()));

        List<LessonEntitlement> lessons = new ArrayList<>();
        for (ProductLesson unit : units) {
            for (int i = 0; i < unit.getQuantity(); i++) {
                LessonEntitlement c = new LessonEntitlement();
                c.setLesson(unit.getLesson());
                c.setSubscription(subscription);
                c.setCustomer(subscription.getCustomer());
                c.setBuyPrice(subscription.getBuyPrice());
                c.setBuyTime(subscription.getBuyTime());
                c.setBuySource(LessonEntitlement.BuySource.SUBSCRIPTION);
                c.setActive(subscription.isActive());
                lessons.add(c);
            }
        }
        List<LessonEntitlement> saved = lessonEntitlementRepository.saveAll(lessons);
        subscription.getEntitlements().addAll(saved);
        log.info("Subscription id={} ({}) gave customer id={} {} lessons",
                subscription.getId(), subscription.getProduct().getName(), subscription.getCustomer().getId(), saved.size());
    }

    private void updateLessons(Subscription subscription) {
        List<LessonEntitlement> lessons = lessonEntitlementRepository.findBySubscription(subscription);
        for (LessonEntitlement c : lessons) {
            c.setActive(subscription.isActive());
        }
        lessonEntitlementRepository.saveAll(lessons);
        log.info("Subscription id={} is now {}, updated {} lessons",
                subscription.getId(), subscription.isActive() ? "active" : "inactive", lessons.size());
    }
}

package com.tutorhub.service;

import com.tutorhub.model.ExternalEvent;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Guards an external calendar refresh against a broken upstream feed that suddenly returns far fewer events.
 * <p>
 * A refresh may not shrink the stored batch below half of its non-recurring events. Recurring
 * instances are left out of that count: editing one series rule upstream can legitimately turn
 * many instances into a few.
 */
@Component
public class CalendarSyncSafety {

    public boolean isSafe(List<ExternalEvent> stored, List<ExternalEvent> candidate) {
        int old = stored.size();
        int fresh = candidate.size();

        if (fresh >= old) {
            return true;
        }
        if (fresh == 0) {
            return false;
        }

        long nonRecurring = stored.stream()
                .filter(e -> !e.isRecurringInstance())
                .count();
        return fresh * 2L >= nonRecurring;
    }
}

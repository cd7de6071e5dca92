package com.tutorhub.service;

import com.tutorhub.event.UnsafeCalendarUpdateEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Receiving end of the unsafe-update signal. Delivery to staff (mail, chat) hooks in here.
 */
@Component
@Slf4j
public class CalendarUpdateNotifier {

    @EventListener
    public void onUnsafeCalendarUpdate(UnsafeCalendarUpdateEvent event) {
        log.warn("Unsafe calendar update for source id={}: upstream returned {} events, {} stored; update skipped",
                event.getSourceId(), event.getCandidateEvents(), event.getStoredEvents());
    }
}

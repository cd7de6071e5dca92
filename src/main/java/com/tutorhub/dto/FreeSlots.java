package com.tutorhub.dto;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Free slot start times of one teacher on one date, in chronological order.
 * Each lookup builds a fresh instance; it can be iterated any number of times.
 */
public final class FreeSlots implements Iterable<LocalDateTime> {

    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("HH:mm");

    private final List<LocalDateTime> slots;

    public FreeSlots(List<LocalDateTime> slots) {
        this.slots = List.copyOf(slots);
    }

    public int size() { return slots.size(); }
    public boolean isEmpty() { return slots.isEmpty(); }
    public LocalDateTime get(int index) { return slots.get(index); }
    public List<LocalDateTime> asList() { return slots; }

    public LocalDateTime first() {
        return slots.isEmpty() ? null : slots.get(0);
    }

    public LocalDateTime last() {
        return slots.isEmpty() ? null : slots.get(slots.size() - 1);
    }

    /** "HH:mm" label to slot start, keeping chronological order. */
    public Map<String, LocalDateTime> asDisplayMap() {
        Map<String, LocalDateTime> out = new LinkedHashMap<>();
        for (LocalDateTime s : slots) {
            out.put(s.format(DISPLAY), s);
        }
        return Collections.unmodifiableMap(out);
    }

    @Override
    public Iterator<LocalDateTime> iterator() {
        return slots.iterator();
    }

    @Override
    public String toString() {
        return asDisplayMap().keySet().toString();
    }
}

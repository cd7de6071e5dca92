package com.tutorhub.service;

import com.tutorhub.model.LessonType;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

@Component
public class LessonTypeRegistry {

    private static final Comparator<LessonType> BY_SORT_ORDER = Comparator.comparing(LessonType::sortOrder);

    /** Drops types without a sort order and orders the rest. */
    public List<LessonType> sortForListing(Collection<LessonType> types) {
        return types.stream()
                .distinct()
                .filter(t -> t.sortOrder() != null)
                .sorted(BY_SORT_ORDER)
                .toList();
    }
}

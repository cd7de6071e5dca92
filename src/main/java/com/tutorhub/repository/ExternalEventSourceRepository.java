package com.tutorhub.repository;

import com.tutorhub.model.ExternalEventSource;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ExternalEventSourceRepository extends JpaRepository<ExternalEventSource, Long> {
}

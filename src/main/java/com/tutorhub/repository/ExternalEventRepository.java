package com.tutorhub.repository;

import com.tutorhub.model.ExternalEvent;
import com.tutorhub.model.ExternalEventSource;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ExternalEventRepository extends JpaRepository<ExternalEvent, Long> {

    List<ExternalEvent> findBySourceOrderByIdAsc(ExternalEventSource source);
}

package com.tutorhub.service;

import com.tutorhub.model.Customer;
import com.tutorhub.repository.CustomerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

    private final CustomerRepository customerRepository;
    private final Clock clock;

    /** New customer, arrived now in business time. */
    @Transactional
    public Customer register(String firstName, String lastName, String email) {
        Customer customer = new Customer();
        customer.setFirstName(firstName);
        customer.setLastName(lastName);
        customer.setEmail(email);
        customer.setDateArrived(LocalDateTime.now(clock));
        Customer saved = customerRepository.save(customer);
        log.info("Customer id={} ({}) registered", saved.getId(), saved.getFullName());
        return saved;
    }
}

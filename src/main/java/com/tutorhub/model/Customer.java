package com.tutorhub.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

@Entity
@Table(name = "customer")
@Getter
@Setter
public class Customer {

    // A1..C3
    public enum Level { A1, A2, A3, B1, B2, B3, C1, C2, C3 }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank(message = "First name is required")
    @Column(name = "first_name", nullable = false, length = 140)
    private String firstName;

    @NotBlank(message = "Last name is required")
    @Column(name = "last_name", nullable = false, length = 140)
    private String lastName;

    @Email(message = "Invalid email format")
    private String email;

    @Column(name = "date_arrived", nullable = false, updatable = false)
    private LocalDateTime dateArrived;

    @Enumerated(EnumType.STRING)
    @Column(name = "starting_level", length = 2, nullable = false)
    private Level startingLevel = Level.A1;

    @Enumerated(EnumType.STRING)
    @Column(name = "current_level", length = 2, nullable = false)
    private Level currentLevel = Level.A1;

    public String getFullName() {
        return firstName + " " + lastName;
    }

    @Override
    public String toString() {
        return getFullName();
    }
}

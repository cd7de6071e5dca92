package com.tutorhub.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "subscription")
@Getter
@Setter
public class Subscription {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "customer_id")
    private Customer customer;

    @ManyToOne(optional = false)
    @JoinColumn(name = "product_id")
    private Product product;

    @Column(name = "buy_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal buyPrice;

    @Column(name = "buy_time", nullable = false, updatable = false)
    private LocalDateTime buyTime;

    @Column(nullable = false)
    private boolean active = true;

    @OneToMany(mappedBy = "subscription", cascade = CascadeType.REMOVE)
    private List<LessonEntitlement> entitlements = new ArrayList<>();

    public String getNameForUser() {
        return product.getName();
    }
}

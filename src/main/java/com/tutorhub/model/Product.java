package com.tutorhub.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * A sellable bundle of lessons.
 */
@Entity
@Table(name = "product")
@Getter
@Setter
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private boolean active = true;

    @OneToMany(mappedBy = "product", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<ProductLesson> lessons = new ArrayList<>();

    public void addLesson(Lesson lesson, int quantity) {
        ProductLesson pl = new ProductLesson();
        pl.setProduct(this);
        pl.setLesson(lesson);
        pl.setQuantity(quantity);
        lessons.add(pl);
    }
}

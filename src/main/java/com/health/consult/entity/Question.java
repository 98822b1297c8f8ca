package com.health.consult.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog entry of a condition's intake questionnaire. {@code orderIndex} fixes the
 * position of the question within its condition.
 */
@Entity
@Table(name = "question", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"condition_id", "order_index"})
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "condition_id", nullable = false, length = 50)
    private String conditionId;

    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    @Column(name = "question_text", nullable = false, length = 500)
    private String questionText;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 2000)
    @Builder.Default
    private List<String> options = new ArrayList<>();
}

package com.health.consult.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Copy of a catalog question taken when a chat session starts. Later catalog edits
 * do not reach sessions that already hold a copy.
 */
@Embeddable
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionQuestion {

    @Column(name = "question_id", nullable = false)
    private Long questionId;

    @Column(name = "question_text", nullable = false, length = 500)
    private String questionText;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, length = 2000)
    @Builder.Default
    private List<String> options = new ArrayList<>();

    public static SessionQuestion of(Question q) {
        return SessionQuestion.builder()
                .questionId(q.getId())
                .questionText(q.getQuestionText())
                .options(new ArrayList<>(q.getOptions()))
                .build();
    }
}

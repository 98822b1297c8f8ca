package com.health.consult.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A patient's run through a condition's intake questionnaire. Answers always form a
 * prefix of {@link #questions}; the session completes when the prefix is the whole list.
 */
@Entity
@Table(name = "chat_session", indexes = {
    @Index(name = "idx_chat_session_patient", columnList = "patient_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatSession {

    public enum Status { ACTIVE, COMPLETED }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "patient_id", nullable = false)
    private Long patientId;

    @Column(name = "professional_id", nullable = false)
    private Long professionalId;

    @Column(name = "condition_id", nullable = false, length = 50)
    private String conditionId;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    @Builder.Default
    private Status status = Status.ACTIVE;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "chat_session_question", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<SessionQuestion> questions = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "chat_session_answer", joinColumns = @JoinColumn(name = "session_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<ChatAnswer> answers = new ArrayList<>();

    @Version
    private Long version;

    /** The first question without an answer, empty once every question is answered. */
    public Optional<SessionQuestion> nextQuestion() {
        int answered = answers.size();
        return answered < questions.size() ? Optional.of(questions.get(answered)) : Optional.empty();
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}

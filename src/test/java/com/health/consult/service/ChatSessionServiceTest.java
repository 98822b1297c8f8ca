package com.health.consult.service;

import com.health.consult.entity.ChatAnswer;
import com.health.consult.entity.ChatSession;
import com.health.consult.entity.Professional;
import com.health.consult.entity.Question;
import com.health.consult.entity.SessionQuestion;
import com.health.consult.exception.ConsultationException;
import com.health.consult.exception.ErrorCode;
import com.health.consult.repository.AppointmentRepository;
import com.health.consult.repository.ChatSessionRepository;
import com.health.consult.repository.ProfessionalRepository;
import com.health.consult.repository.QuestionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatSessionServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    @Mock
    private ChatSessionRepository sessionRepository;
    @Mock
    private QuestionRepository questionRepository;
    @Mock
    private ProfessionalRepository professionalRepository;
    @Mock
    private AppointmentRepository appointmentRepository;

    private ChatSessionService service;

    @BeforeEach
    void setUp() {
        service = new ChatSessionService(sessionRepository, questionRepository, professionalRepository,
                appointmentRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Professional approvedDietitian() {
        return Professional.builder()
                .id(7L)
                .name("Dr. Priya Sharma")
                .specialty("Nutritionist")
                .defaultFee(new BigDecimal("500"))
                .conditionIds(Set.of("diabetes"))
                .status(Professional.Status.APPROVED)
                .build();
    }

    private static List<Question> diabetesQuestions() {
        return List.of(
                Question.builder().id(101L).conditionId("diabetes").orderIndex(1)
                        .questionText("Q1").options(List.of("Yes", "No")).build(),
                Question.builder().id(102L).conditionId("diabetes").orderIndex(2)
                        .questionText("Q2").options(List.of("Yes", "No")).build(),
                Question.builder().id(103L).conditionId("diabetes").orderIndex(3)
                        .questionText("Q3").options(List.of("Yes", "No")).build()
        );
    }

    private static ChatSession activeSession(Long id) {
        List<SessionQuestion> snapshot = new ArrayList<>();
        for (Question q : diabetesQuestions()) {
            snapshot.add(SessionQuestion.of(q));
        }
        return ChatSession.builder()
                .id(id)
                .patientId(1L)
                .professionalId(7L)
                .conditionId("diabetes")
                .startedAt(NOW)
                .questions(snapshot)
                .build();
    }

    @Test
    void startSnapshotsQuestionsInCatalogOrderAndCreatesIndependentSessions() {
        AtomicLong ids = new AtomicLong(1);
        when(professionalRepository.findById(7L)).thenReturn(Optional.of(approvedDietitian()));
        when(questionRepository.findByConditionIdOrderByOrderIndexAsc("diabetes")).thenReturn(diabetesQuestions());
        when(sessionRepository.save(any(ChatSession.class))).thenAnswer(inv -> {
            ChatSession s = inv.getArgument(0);
            s.setId(ids.getAndIncrement());
            return s;
        });

        ChatSessionService.StartedSession first = service.start(1L, 7L, "diabetes");
        ChatSessionService.StartedSession second = service.start(1L, 7L, "diabetes");

        assertThat(first.questions()).extracting(SessionQuestion::getQuestionId).containsExactly(101L, 102L, 103L);
        assertThat(first.session().getStatus()).isEqualTo(ChatSession.Status.ACTIVE);
        assertThat(first.session().getStartedAt()).isEqualTo(NOW);
        assertThat(first.session().getAnswers()).isEmpty();
        assertThat(second.session().getId()).isNotEqualTo(first.session().getId());
    }

    @Test
    void startFailsWhenProfessionalDoesNotOfferCondition() {
        when(professionalRepository.findById(7L)).thenReturn(Optional.of(approvedDietitian()));

        assertThatThrownBy(() -> service.start(1L, 7L, "pcos"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NOT_FOUND);
        verify(sessionRepository, never()).save(any());
    }

    @Test
    void startFailsWhenProfessionalNotApproved() {
        Professional pending = approvedDietitian();
        pending.setStatus(Professional.Status.PENDING);
        when(professionalRepository.findById(7L)).thenReturn(Optional.of(pending));

        assertThatThrownBy(() -> service.start(1L, 7L, "diabetes"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NOT_FOUND);
    }

    @Test
    void startFailsWhenConditionHasNoQuestions() {
        when(professionalRepository.findById(7L)).thenReturn(Optional.of(approvedDietitian()));
        when(questionRepository.findByConditionIdOrderByOrderIndexAsc("diabetes")).thenReturn(List.of());

        assertThatThrownBy(() -> service.start(1L, 7L, "diabetes"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NOT_FOUND);
    }

    @Test
    void answersMustFollowQuestionOrderAndLastAnswerCompletesSession() {
        ChatSession session = activeSession(5L);
        when(sessionRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(session));
        when(sessionRepository.save(any(ChatSession.class))).thenAnswer(inv -> inv.getArgument(0));

        service.answer(5L, 1L, 101L, "Yes");
        assertThat(session.getStatus()).isEqualTo(ChatSession.Status.ACTIVE);

        assertThatThrownBy(() -> service.answer(5L, 1L, 103L, "No"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.SEQUENCE_VIOLATION);

        service.answer(5L, 1L, 102L, "No");
        assertThat(session.getStatus()).isEqualTo(ChatSession.Status.ACTIVE);

        service.answer(5L, 1L, 103L, "No");
        assertThat(session.getStatus()).isEqualTo(ChatSession.Status.COMPLETED);
        assertThat(session.getCompletedAt()).isEqualTo(NOW);
        assertThat(session.getAnswers()).extracting(ChatAnswer::getQuestionId).containsExactly(101L, 102L, 103L);
    }

    @Test
    void answeringTheSameQuestionTwiceIsASequenceViolation() {
        ChatSession session = activeSession(5L);
        when(sessionRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(session));
        when(sessionRepository.save(any(ChatSession.class))).thenAnswer(inv -> inv.getArgument(0));

        service.answer(5L, 1L, 101L, "Yes");

        assertThatThrownBy(() -> service.answer(5L, 1L, 101L, "No"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.SEQUENCE_VIOLATION);
        assertThat(session.getAnswers()).hasSize(1);
    }

    @Test
    void freeTextAnswerIsRejected() {
        when(sessionRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(activeSession(5L)));

        assertThatThrownBy(() -> service.answer(5L, 1L, 101L, "sometimes"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_ANSWER);
    }

    @Test
    void completedSessionRejectsFurtherAnswers() {
        ChatSession session = activeSession(5L);
        session.setStatus(ChatSession.Status.COMPLETED);
        when(sessionRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> service.answer(5L, 1L, 101L, "Yes"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_STATE);
    }

    @Test
    void unknownSessionIsNotFound() {
        when(sessionRepository.findByIdForUpdate(99L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.answer(99L, 1L, 101L, "Yes"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.NOT_FOUND);
    }

    @Test
    void historyIsVisibleToOwnerAndLinkedProfessionalOnly() {
        ChatSession session = activeSession(5L);
        when(sessionRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(session));
        when(sessionRepository.save(any(ChatSession.class))).thenAnswer(inv -> inv.getArgument(0));
        service.answer(5L, 1L, 101L, "Yes");

        when(sessionRepository.findById(5L)).thenReturn(Optional.of(session));
        when(appointmentRepository.existsByChatSessionIdAndProfessionalId(5L, 7L)).thenReturn(true);
        when(appointmentRepository.existsByChatSessionIdAndProfessionalId(5L, 8L)).thenReturn(false);

        List<ChatSessionService.AnsweredQuestion> forPatient = service.getAnswers(5L, Viewer.patient(1L));
        assertThat(forPatient).hasSize(1);
        assertThat(forPatient.get(0).question().getQuestionText()).isEqualTo("Q1");
        assertThat(forPatient.get(0).answer().getAnswerText()).isEqualTo("Yes");

        assertThat(service.getAnswers(5L, Viewer.professional(7L))).hasSize(1);

        assertThatThrownBy(() -> service.getAnswers(5L, Viewer.professional(8L)))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.FORBIDDEN);
        assertThatThrownBy(() -> service.getAnswers(5L, Viewer.patient(2L)))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.FORBIDDEN);
    }

    @Test
    void onlyOwningPatientMayAnswerOrReadSession() {
        ChatSession session = activeSession(5L);
        when(sessionRepository.findByIdForUpdate(5L)).thenReturn(Optional.of(session));
        when(sessionRepository.findById(5L)).thenReturn(Optional.of(session));

        assertThatThrownBy(() -> service.answer(5L, 2L, 101L, "Yes"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.FORBIDDEN);
        assertThat(session.getAnswers()).isEmpty();

        assertThatThrownBy(() -> service.getSession(5L, 2L))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.FORBIDDEN);
        assertThat(service.getSession(5L, 1L)).isSameAs(session);
    }
}

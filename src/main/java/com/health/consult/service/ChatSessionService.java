package com.health.consult.service;

import com.health.consult.entity.ChatAnswer;
import com.health.consult.entity.ChatSession;
import com.health.consult.entity.Professional;
import com.health.consult.entity.Question;
import com.health.consult.entity.SessionQuestion;
import com.health.consult.exception.ConsultationException;
import com.health.consult.repository.AppointmentRepository;
import com.health.consult.repository.ChatSessionRepository;
import com.health.consult.repository.ProfessionalRepository;
import com.health.consult.repository.QuestionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives a patient through the scripted intake questionnaire of a condition.
 * Answers are accepted strictly in question order and the session completes
 * on the last accepted answer.
 */
@Service
public class ChatSessionService {

    private static final Logger log = LoggerFactory.getLogger(ChatSessionService.class);

    private final ChatSessionRepository sessionRepository;
    private final QuestionRepository questionRepository;
    private final ProfessionalRepository professionalRepository;
    private final AppointmentRepository appointmentRepository;
    private final Clock clock;

    public ChatSessionService(ChatSessionRepository sessionRepository,
                              QuestionRepository questionRepository,
                              ProfessionalRepository professionalRepository,
                              AppointmentRepository appointmentRepository,
                              Clock clock) {
        this.sessionRepository = sessionRepository;
        this.questionRepository = questionRepository;
        this.professionalRepository = professionalRepository;
        this.appointmentRepository = appointmentRepository;
        this.clock = clock;
    }

    // =========================================================
    // START
    // =========================================================
    @Transactional
    public StartedSession start(Long patientId, Long professionalId, String conditionId) {
        Professional professional = professionalRepository.findById(professionalId)
                .orElseThrow(() -> ConsultationException.notFound("Professional not found: " + professionalId));

        if (!professional.offers(conditionId)) {
            log.warn("Start rejected: professional {} not available for condition {}", professionalId, conditionId);
            throw ConsultationException.notFound("Professional not available for condition " + conditionId);
        }

        List<Question> catalog = questionRepository.findByConditionIdOrderByOrderIndexAsc(conditionId);
        if (catalog.isEmpty()) {
            log.warn("Start rejected: no questions for condition {}", conditionId);
            throw ConsultationException.notFound("No questionnaire for condition " + conditionId);
        }

        List<SessionQuestion> snapshot = new ArrayList<>();
        for (Question q : catalog) {
            snapshot.add(SessionQuestion.of(q));
        }

        ChatSession session = ChatSession.builder()
                .patientId(patientId)
                .professionalId(professionalId)
                .conditionId(conditionId)
                .startedAt(Instant.now(clock))
                .status(ChatSession.Status.ACTIVE)
                .questions(snapshot)
                .build();
        session = sessionRepository.save(session);

        log.info("Chat session started: session={} patient={} professional={} condition={} questions={}",
                session.getId(), patientId, professionalId, conditionId, snapshot.size());
        return new StartedSession(session, List.copyOf(session.getQuestions()));
    }

    // =========================================================
    // ANSWER
    // =========================================================
    @Transactional
    public ChatSession answer(Long sessionId, Long patientId, Long questionId, String answerText) {
        ChatSession session = sessionRepository.findByIdForUpdate(sessionId)
                .orElseThrow(() -> ConsultationException.notFound("Chat session not found: " + sessionId));
        requireOwner(session, patientId);

        if (session.isCompleted()) {
            log.warn("Answer rejected: session {} already completed", sessionId);
            throw ConsultationException.invalidState("Chat session " + sessionId + " is already completed");
        }

        SessionQuestion next = session.nextQuestion()
                .orElseThrow(() -> ConsultationException.invalidState("Chat session " + sessionId + " has no open question"));

        if (!Objects.equals(next.getQuestionId(), questionId)) {
            log.warn("Answer rejected: session {} expects question {} but got {}", sessionId, next.getQuestionId(), questionId);
            throw ConsultationException.sequenceViolation(
                    "Question " + questionId + " is not the next question; expected " + next.getQuestionId());
        }

        if (answerText == null || !next.getOptions().contains(answerText)) {
            log.warn("Answer rejected: '{}' is not an option of question {}", answerText, questionId);
            throw ConsultationException.invalidAnswer(
                    "Answer must be one of " + next.getOptions());
        }

        Instant now = Instant.now(clock);
        session.getAnswers().add(ChatAnswer.builder()
                .questionId(questionId)
                .answerText(answerText)
                .answeredAt(now)
                .build());

        if (session.getAnswers().size() == session.getQuestions().size()) {
            session.setStatus(ChatSession.Status.COMPLETED);
            session.setCompletedAt(now);
            log.info("Chat session completed: session={} answers={}", sessionId, session.getAnswers().size());
        } else {
            log.info("Answer recorded: session={} question={} ({}/{})",
                    sessionId, questionId, session.getAnswers().size(), session.getQuestions().size());
        }
        return sessionRepository.save(session);
    }

    // =========================================================
    // MEDICAL HISTORY
    // =========================================================

    /**
     * Answers paired with their questions, in questionnaire order. Readable by the
     * owning patient and by the professional of an appointment linked to the session.
     */
    @Transactional(readOnly = true)
    public List<AnsweredQuestion> getAnswers(Long sessionId, Viewer viewer) {
        ChatSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> ConsultationException.notFound("Chat session not found: " + sessionId));

        if (!canView(session, viewer)) {
            log.warn("History read rejected: session={} viewer={}", sessionId, viewer);
            throw ConsultationException.forbidden("Not allowed to view chat session " + sessionId);
        }

        List<AnsweredQuestion> result = new ArrayList<>();
        List<ChatAnswer> answers = session.getAnswers();
        for (int i = 0; i < answers.size(); i++) {
            result.add(new AnsweredQuestion(session.getQuestions().get(i), answers.get(i)));
        }
        return result;
    }

    @Transactional(readOnly = true)
    public ChatSession getSession(Long sessionId, Long patientId) {
        ChatSession session = sessionRepository.findById(sessionId)
                .orElseThrow(() -> ConsultationException.notFound("Chat session not found: " + sessionId));
        requireOwner(session, patientId);
        return session;
    }

    private void requireOwner(ChatSession session, Long patientId) {
        if (!Objects.equals(session.getPatientId(), patientId)) {
            log.warn("Session access rejected: session={} patient={}", session.getId(), patientId);
            throw ConsultationException.forbidden("Chat session " + session.getId() + " belongs to another patient");
        }
    }

    private boolean canView(ChatSession session, Viewer viewer) {
        switch (viewer.role()) {
            case PATIENT:
                return Objects.equals(session.getPatientId(), viewer.id());
            case PROFESSIONAL:
                return appointmentRepository.existsByChatSessionIdAndProfessionalId(session.getId(), viewer.id());
            default:
                return false;
        }
    }

    public record StartedSession(ChatSession session, List<SessionQuestion> questions) {
    }

    public record AnsweredQuestion(SessionQuestion question, ChatAnswer answer) {
    }
}

package com.health.consult;

import com.health.consult.entity.Appointment;
import com.health.consult.entity.ChatSession;
import com.health.consult.entity.FeeChangeRequest;
import com.health.consult.entity.Professional;
import com.health.consult.entity.Question;
import com.health.consult.entity.SessionQuestion;
import com.health.consult.exception.ConsultationException;
import com.health.consult.exception.ErrorCode;
import com.health.consult.repository.ProfessionalRepository;
import com.health.consult.repository.QuestionRepository;
import com.health.consult.service.AppointmentService;
import com.health.consult.service.ChatSessionService;
import com.health.consult.service.FeeChangeService;
import com.health.consult.service.Viewer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class ConsultationWorkflowIntegrationTest {

    @Autowired
    private ChatSessionService chatSessionService;
    @Autowired
    private AppointmentService appointmentService;
    @Autowired
    private FeeChangeService feeChangeService;
    @Autowired
    private ProfessionalRepository professionalRepository;
    @Autowired
    private QuestionRepository questionRepository;
    @Autowired
    private MockMvc mockMvc;

    private Professional professional;

    @BeforeEach
    void setUp() {
        professional = professionalRepository.save(Professional.builder()
                .name("Dr. Priya Sharma")
                .specialty("Nutritionist")
                .defaultFee(new BigDecimal("500"))
                .conditionIds(new HashSet<>(Set.of("diabetes")))
                .status(Professional.Status.APPROVED)
                .build());

        if (!questionRepository.existsByConditionId("diabetes")) {
            questionRepository.saveAll(List.of(
                    Question.builder().conditionId("diabetes").orderIndex(1)
                            .questionText("Do you check your sugar daily?").options(List.of("Yes", "No")).build(),
                    Question.builder().conditionId("diabetes").orderIndex(2)
                            .questionText("Are you on insulin?").options(List.of("Yes", "No")).build(),
                    Question.builder().conditionId("diabetes").orderIndex(3)
                            .questionText("Any family history?").options(List.of("Yes", "No")).build()
            ));
        }
    }

    private static Instant tomorrow() {
        return Instant.now().plus(Duration.ofDays(1));
    }

    @Test
    void intakeBookingAndPaymentScenario() {
        ChatSessionService.StartedSession started = chatSessionService.start(1L, professional.getId(), "diabetes");
        List<Long> q = started.questions().stream().map(SessionQuestion::getQuestionId).toList();
        Long sessionId = started.session().getId();
        assertThat(q).hasSize(3);

        assertThat(chatSessionService.answer(sessionId, 1L, q.get(0), "Yes").getStatus()).isEqualTo(ChatSession.Status.ACTIVE);
        assertThatThrownBy(() -> chatSessionService.answer(sessionId, 1L, q.get(2), "No"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.SEQUENCE_VIOLATION);
        chatSessionService.answer(sessionId, 1L, q.get(1), "No");
        assertThat(chatSessionService.answer(sessionId, 1L, q.get(2), "No").getStatus()).isEqualTo(ChatSession.Status.COMPLETED);

        Appointment appt = appointmentService.book(1L, professional.getId(), "diabetes", sessionId, tomorrow());
        assertThat(appt.getConsultationFee()).isEqualByComparingTo("500");

        Appointment paid = appointmentService.recordPayment(appt.getId(), new BigDecimal("500"));
        assertThat(paid.isPaid()).isTrue();
        assertThat(paid.getMeetingLink()).startsWith("https://meet.test/");

        assertThatThrownBy(() -> appointmentService.recordPayment(appt.getId(), new BigDecimal("500")))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.ALREADY_PAID);

        List<ChatSessionService.AnsweredQuestion> history =
                chatSessionService.getAnswers(sessionId, Viewer.professional(professional.getId()));
        assertThat(history).extracting(a -> a.answer().getAnswerText()).containsExactly("Yes", "No", "No");
    }

    @Test
    void sessionCannotBeBookedWithAnotherProfessional() {
        Professional other = professionalRepository.save(Professional.builder()
                .name("Rahul Verma")
                .specialty("Fitness Trainer")
                .defaultFee(new BigDecimal("600"))
                .conditionIds(new HashSet<>(Set.of("diabetes")))
                .status(Professional.Status.APPROVED)
                .build());

        ChatSessionService.StartedSession started = chatSessionService.start(6L, professional.getId(), "diabetes");
        Long sessionId = started.session().getId();
        chatSessionService.answer(sessionId, 6L, started.questions().get(0).getQuestionId(), "Yes");

        assertThatThrownBy(() -> appointmentService.book(6L, other.getId(), "diabetes", sessionId, tomorrow()))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.INVALID_STATE);
        assertThatThrownBy(() -> chatSessionService.getAnswers(sessionId, Viewer.professional(other.getId())))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.FORBIDDEN);

        Appointment appt = appointmentService.book(6L, professional.getId(), "diabetes", sessionId, tomorrow());
        assertThat(appt.getChatSessionId()).isEqualTo(sessionId);
    }

    @Test
    void approvedFeeAppliesToLaterBookingsOnly() {
        Appointment before = appointmentService.book(2L, professional.getId(), "diabetes", null, tomorrow());

        FeeChangeRequest request = feeChangeService.requestChange(professional.getId(), new BigDecimal("800"), "Added sessions");
        assertThat(request.getCurrentFee()).isEqualByComparingTo("500");
        assertThatThrownBy(() -> feeChangeService.requestChange(professional.getId(), new BigDecimal("900"), "Again"))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.CONFLICTING_REQUEST);

        feeChangeService.approve(request.getId(), 99L, "ok");

        Appointment after = appointmentService.book(2L, professional.getId(), "diabetes", null, tomorrow());
        assertThat(after.getConsultationFee()).isEqualByComparingTo("800");
        assertThat(appointmentService.get(before.getId()).getConsultationFee()).isEqualByComparingTo("500");
        assertThat(feeChangeService.activeFee(professional.getId())).isEqualByComparingTo("800");

        assertThatThrownBy(() -> appointmentService.recordPayment(before.getId(), new BigDecimal("800")))
                .isInstanceOf(ConsultationException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.AMOUNT_MISMATCH);
    }

    @Test
    void questionEditsDoNotReachStartedSessions() {
        ChatSessionService.StartedSession started = chatSessionService.start(3L, professional.getId(), "diabetes");
        Question first = questionRepository.findByConditionIdOrderByOrderIndexAsc("diabetes").get(0);
        String original = first.getQuestionText();
        first.setQuestionText("Edited after start");
        questionRepository.save(first);

        ChatSession reloaded = chatSessionService.getSession(started.session().getId(), 3L);
        assertThat(reloaded.getQuestions().get(0).getQuestionText()).isEqualTo(original);

        first.setQuestionText(original);
        questionRepository.save(first);
    }

    @Test
    void errorsMapToDistinctHttpResponses() throws Exception {
        Appointment appt = appointmentService.book(4L, professional.getId(), "diabetes", null, tomorrow());

        mockMvc.perform(post("/api/v1/appointments/{id}/payment", appt.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 650}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("AMOUNT_MISMATCH"));

        mockMvc.perform(post("/api/v1/appointments/{id}/payment", appt.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 500}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paymentStatus").value("PAID"));

        mockMvc.perform(post("/api/v1/appointments/{id}/payment", appt.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 500}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("ALREADY_PAID"));

        mockMvc.perform(post("/api/v1/appointments/{id}/payment", 987654L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\": 500}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void startEndpointReturnsWholeQuestionFlow() throws Exception {
        mockMvc.perform(post("/api/v1/chat/start")
                        .param("patientId", "5")
                        .param("professionalId", professional.getId().toString())
                        .param("conditionId", "diabetes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.questions.length()").value(3))
                .andExpect(jsonPath("$.questions[0].position").value(1));

        mockMvc.perform(post("/api/v1/chat/start")
                        .param("patientId", "5")
                        .param("professionalId", professional.getId().toString())
                        .param("conditionId", "unknown-condition"))
                .andExpect(status().isNotFound());
    }

    @Test
    void callerIdentityIsRequiredAndChecked() throws Exception {
        ChatSessionService.StartedSession started = chatSessionService.start(7L, professional.getId(), "diabetes");
        Long sessionId = started.session().getId();
        Long firstQuestion = started.questions().get(0).getQuestionId();

        mockMvc.perform(post("/api/v1/chat/{id}/answers", sessionId)
                        .param("patientId", "8")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\": " + firstQuestion + ", \"answer\": \"Yes\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("FORBIDDEN"));

        mockMvc.perform(get("/api/v1/chat/{id}", sessionId).param("patientId", "8"))
                .andExpect(status().isForbidden());

        mockMvc.perform(post("/api/v1/chat/{id}/answers", sessionId)
                        .param("patientId", "7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\": " + firstQuestion + ", \"answer\": \"Yes\"}"))
                .andExpect(status().isOk());

        Appointment appt = appointmentService.book(7L, professional.getId(), "diabetes", sessionId, tomorrow());
        mockMvc.perform(get("/api/v1/appointments/{id}/join", appt.getId()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }
}

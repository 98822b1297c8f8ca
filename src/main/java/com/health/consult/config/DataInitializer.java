package com.health.consult.config;

import com.health.consult.entity.Professional;
import com.health.consult.entity.Question;
import com.health.consult.repository.ProfessionalRepository;
import com.health.consult.repository.QuestionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Idempotent seeder: inserts demo professionals and intake questionnaires if not
 * present. Safe to re-run.
 */
@Component
@ConditionalOnProperty(name = "consult.seed.enabled", havingValue = "true", matchIfMissing = true)
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private static final List<String> AGE = List.of("18-25", "26-35", "36-45", "46-55", "55+");
    private static final List<String> DURATION = List.of("Less than 3 months", "3-6 months", "6-12 months", "More than 1 year");
    private static final List<String> YES_NO = List.of("Yes", "No");

    private final ProfessionalRepository professionalRepository;
    private final QuestionRepository questionRepository;

    public DataInitializer(ProfessionalRepository professionalRepository,
                           QuestionRepository questionRepository) {
        this.professionalRepository = professionalRepository;
        this.questionRepository = questionRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    @Transactional
    public void seed() {
        if (professionalRepository.count() == 0) {
            log.info("Seeding professionals...");
            professionalRepository.save(professional("Dr. Priya Sharma", "Nutritionist", "500", "diabetes", "pcos", "hypertension"));
            professionalRepository.save(professional("Rahul Verma", "Fitness Trainer", "600", "diabetes", "hypertension"));
            professionalRepository.save(professional("Anjali Iyer", "Yoga Instructor", "400", "pcos", "hypertension"));
        }

        Map<String, List<Question>> questionnaires = new LinkedHashMap<>();
        questionnaires.put("diabetes", List.of(
                question("diabetes", 1, "What is your age?", AGE),
                question("diabetes", 2, "Are you currently on diabetes medication?", YES_NO),
                question("diabetes", 3, "How long have you been diagnosed?", DURATION)
        ));
        questionnaires.put("pcos", List.of(
                question("pcos", 1, "What is your age?", AGE),
                question("pcos", 2, "Are your menstrual cycles irregular?", YES_NO),
                question("pcos", 3, "How long have you been experiencing symptoms?", DURATION)
        ));
        questionnaires.put("hypertension", List.of(
                question("hypertension", 1, "What is your age?", AGE),
                question("hypertension", 2, "Do you monitor your blood pressure at home?", YES_NO),
                question("hypertension", 3, "What is your primary health goal?",
                        List.of("Symptom management", "Weight loss", "Lifestyle improvement", "Medical guidance"))
        ));

        questionnaires.forEach((conditionId, questions) -> {
            if (!questionRepository.existsByConditionId(conditionId)) {
                questionRepository.saveAll(questions);
                log.info("Added {} intake questions for {}", questions.size(), conditionId);
            }
        });
        log.info("DataInitializer: professionals={}, questionnaires ready", professionalRepository.count());
    }

    private static Professional professional(String name, String specialty, String fee, String... conditions) {
        return Professional.builder()
                .name(name)
                .specialty(specialty)
                .defaultFee(new BigDecimal(fee))
                .conditionIds(new HashSet<>(Set.of(conditions)))
                .status(Professional.Status.APPROVED)
                .build();
    }

    private static Question question(String conditionId, int order, String text, List<String> options) {
        return Question.builder()
                .conditionId(conditionId)
                .orderIndex(order)
                .questionText(text)
                .options(options)
                .build();
    }
}

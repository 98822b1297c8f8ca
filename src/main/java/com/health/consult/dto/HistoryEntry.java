package com.health.consult.dto;

import com.health.consult.service.ChatSessionService;

import java.time.Instant;

public record HistoryEntry(Long questionId, String question, String answer, Instant answeredAt) {

    public static HistoryEntry of(ChatSessionService.AnsweredQuestion aq) {
        return new HistoryEntry(
                aq.question().getQuestionId(),
                aq.question().getQuestionText(),
                aq.answer().getAnswerText(),
                aq.answer().getAnsweredAt()
        );
    }
}

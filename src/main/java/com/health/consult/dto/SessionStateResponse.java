package com.health.consult.dto;

import com.health.consult.entity.ChatSession;
import com.health.consult.entity.SessionQuestion;

public record SessionStateResponse(Long sessionId,
                                   ChatSession.Status status,
                                   int answered,
                                   int total,
                                   Long nextQuestionId) {

    public static SessionStateResponse of(ChatSession session) {
        return new SessionStateResponse(
                session.getId(),
                session.getStatus(),
                session.getAnswers().size(),
                session.getQuestions().size(),
                session.nextQuestion().map(SessionQuestion::getQuestionId).orElse(null)
        );
    }
}

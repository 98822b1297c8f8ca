package com.health.consult.dto;

import com.health.consult.entity.ChatSession;
import com.health.consult.entity.SessionQuestion;
import com.health.consult.service.ChatSessionService;

import java.util.ArrayList;
import java.util.List;

/**
 * Session id plus the full question flow, so a client renders every step without
 * fetching questions one by one.
 */
public record SessionStartResponse(Long sessionId,
                                   ChatSession.Status status,
                                   List<QuestionView> questions) {

    public record QuestionView(Long id, int position, String text, List<String> options) {
    }

    public static SessionStartResponse of(ChatSessionService.StartedSession started) {
        List<SessionQuestion> questions = started.questions();
        List<QuestionView> views = new ArrayList<>();
        for (int i = 0; i < questions.size(); i++) {
            SessionQuestion q = questions.get(i);
            views.add(new QuestionView(q.getQuestionId(), i + 1, q.getQuestionText(), List.copyOf(q.getOptions())));
        }
        return new SessionStartResponse(started.session().getId(), started.session().getStatus(), views);
    }
}

package com.health.consult.controller;

import com.health.consult.dto.AnswerRequest;
import com.health.consult.dto.HistoryEntry;
import com.health.consult.dto.SessionStartResponse;
import com.health.consult.dto.SessionStateResponse;
import com.health.consult.entity.ChatSession;
import com.health.consult.service.ChatSessionService;
import com.health.consult.service.Viewer;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1/chat")
public class ChatController {

    private final ChatSessionService chatSessionService;

    public ChatController(ChatSessionService chatSessionService) {
        this.chatSessionService = chatSessionService;
    }

    @PostMapping("/start")
    public SessionStartResponse start(@RequestParam Long patientId,
                                      @RequestParam Long professionalId,
                                      @RequestParam String conditionId) {
        return SessionStartResponse.of(chatSessionService.start(patientId, professionalId, conditionId));
    }

    @PostMapping("/{sessionId}/answers")
    public SessionStateResponse answer(@PathVariable Long sessionId,
                                       @RequestParam Long patientId,
                                       @RequestBody AnswerRequest request) {
        ChatSession session = chatSessionService.answer(sessionId, patientId, request.getQuestionId(), request.getAnswer());
        return SessionStateResponse.of(session);
    }

    @GetMapping("/{sessionId}")
    public SessionStateResponse state(@PathVariable Long sessionId, @RequestParam Long patientId) {
        return SessionStateResponse.of(chatSessionService.getSession(sessionId, patientId));
    }

    @GetMapping("/{sessionId}/answers")
    public List<HistoryEntry> answers(@PathVariable Long sessionId, @RequestParam Long patientId) {
        return chatSessionService.getAnswers(sessionId, Viewer.patient(patientId)).stream()
                .map(HistoryEntry::of)
                .collect(Collectors.toList());
    }
}

package com.ai.storeassistant.controller;

import com.ai.storeassistant.conversation.TurnResult;
import com.ai.storeassistant.dto.ChatReply;
import com.ai.storeassistant.dto.ChatRequest;
import com.ai.storeassistant.dto.SessionSnapshotDto;
import com.ai.storeassistant.service.ConversationEngine;
import com.ai.storeassistant.service.ConversationHistoryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ChatController {

    private final ConversationEngine conversationEngine;
    private final ConversationHistoryService historyService;

    public ChatController(ConversationEngine conversationEngine, ConversationHistoryService historyService) {
        this.conversationEngine = conversationEngine;
        this.historyService = historyService;
    }

    @PostMapping("/chat")
    public ChatReply chat(@RequestBody ChatRequest request) {
        TurnResult result = conversationEngine.handleTurn(request.getSessionId(), request.getMessage());
        return ChatReply.from(result);
    }

    @GetMapping("/sessions/{sessionId}")
    public ResponseEntity<SessionSnapshotDto> session(@PathVariable String sessionId) {
        return historyService.getSnapshot(sessionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/sessions/{sessionId}/messages")
    public List<SessionSnapshotDto.Message> messages(@PathVariable String sessionId) {
        return historyService.getTranscript(sessionId);
    }
}

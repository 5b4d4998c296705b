package com.smurthy.ai.derma.controllers;

import com.smurthy.ai.derma.dto.ChatRequest;
import com.smurthy.ai.derma.dto.ChatResponse;
import com.smurthy.ai.derma.dto.HistoryEntry;
import com.smurthy.ai.derma.orchestration.SkincareOrchestrator;
import com.smurthy.ai.derma.orchestration.TurnResult;
import com.smurthy.ai.derma.service.ChatService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Chat endpoint
 *
 * EXAMPLE QUERIES:
 * - "Recommend a moisturizer under 1200 for oily skin" → catalog-lookup
 * - "How do I build a routine for acne-prone skin?" → document-lookup
 * - "latest acne research 2025" → general-knowledge
 */
@RestController
@RequestMapping("/api")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final ChatService chatService;
    private final SkincareOrchestrator orchestrator;

    public ChatController(ChatService chatService, SkincareOrchestrator orchestrator) {
        this.chatService = chatService;
        this.orchestrator = orchestrator;
    }

    @PostMapping("/chat")
    public ResponseEntity<?> chat(@RequestBody ChatRequest request) {
        if (request == null || !StringUtils.hasText(request.query())) {
            return ResponseEntity.badRequest().body(Map.of("error", "Query cannot be empty."));
        }
        log.info("Chat request for session '{}'", request.sessionId());
        TurnResult result = chatService.chat(request.sessionId(), request.query());
        return ResponseEntity.ok(ChatResponse.from(result));
    }

    @GetMapping("/chat/{sessionId}/history")
    public List<HistoryEntry> history(@PathVariable String sessionId,
                                      @RequestParam(defaultValue = "10") int limit) {
        return chatService.history(sessionId, Math.max(1, limit)).stream()
                .map(HistoryEntry::from)
                .collect(Collectors.toList());
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        return orchestrator.healthCheck();
    }
}

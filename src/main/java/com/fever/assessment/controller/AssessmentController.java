package com.fever.assessment.controller;

import com.fever.assessment.dto.AnswerRequest;
import com.fever.assessment.dto.ConversationView;
import com.fever.assessment.dto.QuestionView;
import com.fever.assessment.service.AssessmentService;
import jakarta.validation.Valid;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping
public class AssessmentController {
  private static final String BUSY = "BUSY";

  private final AssessmentService assessmentService;

  public AssessmentController(AssessmentService assessmentService) {
    this.assessmentService = assessmentService;
  }

  @PostMapping(path = "/api/assessment/conversations", produces = MediaType.APPLICATION_JSON_VALUE)
  public CompletableFuture<ResponseEntity<ConversationView>> start() {
    return assessmentService.start()
        .thenApply(view -> ResponseEntity.status(HttpStatus.CREATED).body(view));
  }

  @PostMapping(path = "/api/assessment/conversations/{conversationId}/answers",
      consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
  public CompletableFuture<ResponseEntity<ConversationView>> answer(
      @PathVariable String conversationId, @Valid @RequestBody AnswerRequest request) {
    return assessmentService.answer(conversationId, request.getAnswer())
        .thenApply(AssessmentController::toResponse);
  }

  @PostMapping(path = "/api/assessment/conversations/{conversationId}/restart",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public CompletableFuture<ResponseEntity<ConversationView>> restart(
      @PathVariable String conversationId) {
    return assessmentService.restart(conversationId).thenApply(ResponseEntity::ok);
  }

  @GetMapping(path = "/api/assessment/conversations/{conversationId}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<ConversationView> view(@PathVariable String conversationId) {
    return ResponseEntity.ok(assessmentService.view(conversationId));
  }

  @DeleteMapping(path = "/api/assessment/conversations/{conversationId}")
  public ResponseEntity<Void> discard(@PathVariable String conversationId) {
    assessmentService.discard(conversationId);
    return ResponseEntity.noContent().build();
  }

  @GetMapping(path = "/api/assessment/questions/{step}", produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<QuestionView> question(@PathVariable String step) {
    return assessmentService.question(step)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, String> health() {
    return Map.of("status", "UP");
  }

  private static ResponseEntity<ConversationView> toResponse(ConversationView view) {
    if (BUSY.equals(view.getStatus())) {
      return ResponseEntity.status(HttpStatus.CONFLICT).body(view);
    }
    return ResponseEntity.ok(view);
  }
}

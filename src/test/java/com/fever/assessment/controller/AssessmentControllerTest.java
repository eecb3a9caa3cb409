package com.fever.assessment.controller;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fever.assessment.catalog.QuestionCatalog;
import com.fever.assessment.conversation.SessionControllerFactory;
import com.fever.assessment.conversation.StepVocabulary;
import com.fever.assessment.dto.ConversationView;
import com.fever.assessment.engine.DialogueEngine;
import com.fever.assessment.remote.LocalOnlyAuthority;
import com.fever.assessment.report.LoggingReportSink;
import com.fever.assessment.service.AssessmentService;
import com.fever.assessment.service.ConversationRegistry;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

public class AssessmentControllerTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;

  @BeforeEach
  public void setUp() {
    QuestionCatalog catalog = new QuestionCatalog();
    SessionControllerFactory factory = new SessionControllerFactory(new DialogueEngine(catalog),
        new LocalOnlyAuthority(), new LoggingReportSink(), Runnable::run, new StepVocabulary(), 1000);
    AssessmentService service = new AssessmentService(factory, new ConversationRegistry(30), catalog);
    this.mockMvc = MockMvcBuilders.standaloneSetup(new AssessmentController(service))
        .setControllerAdvice(new ApiExceptionHandler())
        .build();
    this.objectMapper = new ObjectMapper();
  }

  @Test
  @DisplayName("a conversation runs from the start question to a completed analysis")
  public void fullConversation() throws Exception {
    MvcResult started = mockMvc.perform(post("/api/assessment/conversations"))
        .andExpect(request().asyncStarted())
        .andReturn();
    String body = mockMvc.perform(asyncDispatch(started))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.mode").value("local"))
        .andExpect(jsonPath("$.state").value("ACTIVE"))
        .andExpect(jsonPath("$.current_step").value("start"))
        .andExpect(jsonPath("$.message").value(QuestionCatalog.START_PROMPT))
        .andExpect(jsonPath("$.question.type").value("yes_no"))
        .andReturn().getResponse().getContentAsString();
    String conversationId = objectMapper.readTree(body).get("conversation_id").asText();

    answer(conversationId, "Yes")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.current_step").value("fever_duration"));
    answer(conversationId, "3-4 days")
        .andExpect(jsonPath("$.current_step").value("temperature"));
    answer(conversationId, "39.5")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.completed").value(true))
        .andExpect(jsonPath("$.state").value("COMPLETED"))
        .andExpect(jsonPath("$.analysis.risk_score").value(75))
        .andExpect(jsonPath("$.analysis.risk_level").value("high"))
        .andExpect(jsonPath("$.analysis.suspected_fever_type").value("Viral Fever"));

    answer(conversationId, "no")
        .andExpect(jsonPath("$.status").value("IGNORED"));

    mockMvc.perform(get("/api/assessment/conversations/{id}", conversationId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.analysis.risk_score").value(75));

    MvcResult restarted = mockMvc.perform(post("/api/assessment/conversations/{id}/restart", conversationId))
        .andExpect(request().asyncStarted())
        .andReturn();
    mockMvc.perform(asyncDispatch(restarted))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.conversation_id").value(conversationId))
        .andExpect(jsonPath("$.current_step").value("start"))
        .andExpect(jsonPath("$.completed").value(false));

    mockMvc.perform(delete("/api/assessment/conversations/{id}", conversationId))
        .andExpect(status().isNoContent());
    mockMvc.perform(get("/api/assessment/conversations/{id}", conversationId))
        .andExpect(status().isNotFound());
  }

  @Test
  public void unrecognizedAnswerIsReprompted() throws Exception {
    MvcResult started = mockMvc.perform(post("/api/assessment/conversations")).andReturn();
    String body = mockMvc.perform(asyncDispatch(started)).andReturn().getResponse().getContentAsString();
    String conversationId = objectMapper.readTree(body).get("conversation_id").asText();

    answer(conversationId, "maybe")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("REPROMPT"))
        .andExpect(jsonPath("$.current_step").value("start"))
        .andExpect(jsonPath("$.message").value("Please answer with Yes or No."));
  }

  @Test
  public void unknownConversationIsNotFound() throws Exception {
    mockMvc.perform(post("/api/assessment/conversations/{id}/answers", "missing")
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(Map.of("answer", "yes"))))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("Not Found"));
  }

  @Test
  public void missingAnswerIsBadRequest() throws Exception {
    mockMvc.perform(post("/api/assessment/conversations/{id}/answers", "any")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  public void questionLookup() throws Exception {
    mockMvc.perform(get("/api/assessment/questions/{step}", "fever_duration"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.key").value("fever_duration"))
        .andExpect(jsonPath("$.type").value("choice"))
        .andExpect(jsonPath("$.options[1]").value("1-3 days"));
    mockMvc.perform(get("/api/assessment/questions/{step}", "complete"))
        .andExpect(status().isNotFound());
  }

  @Test
  public void health() throws Exception {
    mockMvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UP"));
  }

  @Test
  @DisplayName("an answer submitted while another is in flight gets 409")
  public void busyAnswerIsConflict() throws Exception {
    AssessmentService service = mock(AssessmentService.class);
    ConversationView busy = new ConversationView();
    busy.setConversation_id("c-1");
    busy.setStatus("BUSY");
    when(service.answer("c-1", "yes")).thenReturn(CompletableFuture.completedFuture(busy));
    MockMvc busyMvc = MockMvcBuilders.standaloneSetup(new AssessmentController(service)).build();

    MvcResult result = busyMvc.perform(post("/api/assessment/conversations/{id}/answers", "c-1")
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(Map.of("answer", "yes"))))
        .andExpect(request().asyncStarted())
        .andReturn();
    busyMvc.perform(asyncDispatch(result))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.status").value("BUSY"));
  }

  private ResultActions answer(String conversationId, String text) throws Exception {
    MvcResult result = mockMvc.perform(post("/api/assessment/conversations/{id}/answers", conversationId)
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(Map.of("answer", text))))
        .andExpect(request().asyncStarted())
        .andReturn();
    return mockMvc.perform(asyncDispatch(result));
  }
}

package com.flamingo.ai.adaptiverag.api.rest;

import com.flamingo.ai.adaptiverag.api.dto.request.WorkflowRequest;
import com.flamingo.ai.adaptiverag.api.dto.response.WorkflowResponse;
import com.flamingo.ai.adaptiverag.workflow.AdaptiveRagWorkflow;
import com.flamingo.ai.adaptiverag.workflow.WorkflowOptions;
import com.flamingo.ai.adaptiverag.workflow.WorkflowResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller exposing the adaptive RAG workflow. */
@RestController
@RequestMapping("/api/workflow")
@RequiredArgsConstructor
@Slf4j
public class WorkflowController {

  private final AdaptiveRagWorkflow workflow;

  /** Runs the workflow for one question and returns the answer with its trace. */
  @PostMapping("/run")
  public ResponseEntity<WorkflowResponse> run(@Valid @RequestBody WorkflowRequest request) {
    log.info("Workflow request: question='{}'", request.getQuestion());
    WorkflowOptions options = request.toOptions(workflow.defaultOptions());
    WorkflowResult result = workflow.run(request.getQuestion(), options);
    return ResponseEntity.ok(WorkflowResponse.fromResult(request.getQuestion(), result));
  }
}

package com.flamingo.ai.adaptiverag.workflow.stage;

import com.flamingo.ai.adaptiverag.workflow.StageResult;
import com.flamingo.ai.adaptiverag.workflow.WorkflowState;
import com.flamingo.ai.adaptiverag.workflow.WorkflowStep;

/**
 * One node of the workflow graph. A stage reads and updates the request state and reports the
 * outcome that selects the next edge; it never decides the successor itself.
 */
public interface WorkflowStage {

  /** The step this stage implements. */
  WorkflowStep step();

  StageResult execute(WorkflowState state);
}

package com.flamingo.ai.adaptiverag.agent.dto;

/** Binary relevance verdict for one retrieved item. */
public record RelevanceGrade(boolean relevant) {}

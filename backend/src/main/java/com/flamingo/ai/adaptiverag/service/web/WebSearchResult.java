package com.flamingo.ai.adaptiverag.service.web;

/** One web search hit. {@code url} may be null. */
public record WebSearchResult(String content, String title, String url) {}

package com.knowledgeplatform.knowledge.client.dto;

/**
 * One item of the academic resources feed. Only the summary is consumed; other
 * fields in the item are ignored.
 */
public record AcademicSummary(String summary) {}

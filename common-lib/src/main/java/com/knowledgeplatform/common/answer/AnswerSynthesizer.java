package com.knowledgeplatform.common.answer;

/**
 * Produces the user-facing answer from the assembled topic context.
 * Opaque to the retrieval pipeline; swap the bean to plug in a real model.
 */
@FunctionalInterface
public interface AnswerSynthesizer {

    String answer(String context, String question);
}

package com.knowledgeplatform.common.answer;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Placeholder answerer that picks the context line sharing the most words with the
 * question. Falls back to the first non-blank line when nothing overlaps.
 *
 * <p>Deterministic: ties go to the earliest line.
 */
public final class ExtractiveAnswerSynthesizer implements AnswerSynthesizer {

    static final String EMPTY_CONTEXT_ANSWER = "No content is available for this sector yet.";

    @Override
    public String answer(String context, String question) {
        if (context == null || context.isBlank()) {
            return EMPTY_CONTEXT_ANSWER;
        }
        Set<String> questionTerms = terms(question);

        String best = null;
        int bestOverlap = 0;
        for (String line : context.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            if (best == null) {
                best = line;
            }
            Set<String> lineTerms = terms(line);
            lineTerms.retainAll(questionTerms);
            if (lineTerms.size() > bestOverlap) {
                bestOverlap = lineTerms.size();
                best = line;
            }
        }
        return best == null ? EMPTY_CONTEXT_ANSWER : best.strip();
    }

    private static Set<String> terms(String text) {
        Set<String> terms = new HashSet<>();
        if (text == null) {
            return terms;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 2) {
                terms.add(token);
            }
        }
        return terms;
    }
}

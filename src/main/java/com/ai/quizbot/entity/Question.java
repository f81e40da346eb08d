package com.ai.quizbot.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One quiz question as loaded from the question table. All fallbacks (missing
 * prompt, blank options, missing explanations) are resolved before construction.
 */
@Getter
@ToString
public class Question {

    public static final int MAX_OPTIONS = 4;

    private final int index;

    private final String text;

    /** Option number (1..4) to option text, in source order. */
    private final Map<Integer, String> options;

    /** 1-based; 0 when the source value could not be read. */
    private final int correctOption;

    private final Map<Integer, String> explanations;

    @Builder
    private Question(int index, String text, Map<Integer, String> options, int correctOption,
                     Map<Integer, String> explanations) {
        this.index = index;
        this.text = text != null ? text : "";
        this.options = options != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(options))
                : Collections.emptyMap();
        this.correctOption = correctOption;
        this.explanations = explanations != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(explanations))
                : Collections.emptyMap();
    }

    public int optionCount() {
        return options.size();
    }

    /** True when {@code replyId} names one of this question's options. */
    public boolean hasOption(String replyId) {
        if (replyId == null) return false;
        for (Integer option : options.keySet()) {
            if (String.valueOf(option).equals(replyId)) return true;
        }
        return false;
    }

    public boolean isCorrect(String replyId) {
        return options.containsKey(correctOption) && String.valueOf(correctOption).equals(replyId);
    }

    public Optional<String> correctOptionText() {
        return Optional.ofNullable(options.get(correctOption));
    }

    public Optional<String> explanationFor(int option) {
        return Optional.ofNullable(explanations.get(option));
    }

    public Optional<String> explanationFor(String replyId) {
        try {
            return explanationFor(Integer.parseInt(replyId));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}

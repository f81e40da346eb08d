package com.ai.quizbot.service;

import com.ai.quizbot.component.ResponsePhrases;
import com.ai.quizbot.entity.Question;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw table rows (header to cell text, in column order) into typed
 * questions, resolving every fallback rule once at load time.
 */
@Component
public class QuestionRowMapper {

    private static final Logger log = LoggerFactory.getLogger(QuestionRowMapper.class);

    static final String QUESTION_COLUMN = "Question";
    static final String OPTION_COLUMN = "Option ";
    static final String CORRECT_OPTION_COLUMN = "Correct Option";
    static final String EXPLANATION_COLUMN = "Explanation ";

    private final ResponsePhrases phrases;

    public QuestionRowMapper(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    public List<Question> map(List<Map<String, String>> rows) {
        List<Question> questions = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, String> row = rows.get(i);
            if (isBlank(row)) {
                continue;
            }
            Question q = mapRow(questions.size(), row, i + 2);
            if (q != null) {
                questions.add(q);
            }
        }
        return questions;
    }

    private Question mapRow(int index, Map<String, String> row, int sourceLine) {
        String text = cell(row, QUESTION_COLUMN);
        if (StringUtils.isBlank(text)) {
            text = firstColumn(row);
        }
        if (StringUtils.isBlank(text)) {
            log.warn("Skipping row {}: no question text", sourceLine);
            return null;
        }

        Map<Integer, String> options = new LinkedHashMap<>();
        for (int n = 1; n <= Question.MAX_OPTIONS; n++) {
            String option = cell(row, OPTION_COLUMN + n);
            if (StringUtils.isNotBlank(option)) {
                options.put(n, option.trim());
            }
        }
        if (options.isEmpty()) {
            log.warn("Skipping row {}: no options", sourceLine);
            return null;
        }

        int correct = parseOptionNumber(cell(row, CORRECT_OPTION_COLUMN));
        if (!options.containsKey(correct)) {
            log.warn("Row {}: correct option '{}' does not match any option; answers will never score",
                    sourceLine, cell(row, CORRECT_OPTION_COLUMN));
        }

        Map<Integer, String> explanations = new LinkedHashMap<>();
        for (Integer n : options.keySet()) {
            String explanation = cell(row, EXPLANATION_COLUMN + n);
            explanations.put(n, StringUtils.isNotBlank(explanation) ? explanation.trim() : phrases.noExplanation());
        }

        return Question.builder()
                .index(index)
                .text(text.trim())
                .options(options)
                .correctOption(correct)
                .explanations(explanations)
                .build();
    }

    /** Accepts "2" as well as spreadsheet-style numerics such as "2.0"; 0 when unreadable. */
    static int parseOptionNumber(String raw) {
        if (StringUtils.isBlank(raw)) return 0;
        String value = raw.trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            try {
                double d = Double.parseDouble(value);
                return d == Math.rint(d) ? (int) d : 0;
            } catch (NumberFormatException ignored) {
                return 0;
            }
        }
    }

    private static String cell(Map<String, String> row, String header) {
        for (Map.Entry<String, String> e : row.entrySet()) {
            if (e.getKey() != null && e.getKey().trim().equalsIgnoreCase(header)) {
                return e.getValue();
            }
        }
        return null;
    }

    private static String firstColumn(Map<String, String> row) {
        return row.isEmpty() ? null : row.values().iterator().next();
    }

    private static boolean isBlank(Map<String, String> row) {
        return row == null || row.values().stream().allMatch(StringUtils::isBlank);
    }
}

package com.ai.quizbot.config;

import com.ai.quizbot.exception.ContentUnavailableException;
import com.ai.quizbot.service.QuestionBank;
import com.ai.quizbot.service.QuestionSourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the question table once at startup. A missing or broken source leaves
 * the bot running with an empty bank; users then get a "no content" notice.
 */
@Configuration
public class QuestionBankConfig {

    private static final Logger log = LoggerFactory.getLogger(QuestionBankConfig.class);

    @Bean
    public QuestionBank questionBank(QuestionSourceLoader loader,
                                     @Value("${quiz.source:file:AEFI_Training_Sample.xlsx}") String source) {
        try {
            return new QuestionBank(loader.load(source));
        } catch (ContentUnavailableException e) {
            log.warn("Could not load questions, starting with an empty bank: {}", e.getMessage(), e);
            return QuestionBank.empty();
        }
    }
}

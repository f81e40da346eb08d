package com.ai.quizbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.ai.quizbot")
public class QuizBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(QuizBotApplication.class, args);
    }
}

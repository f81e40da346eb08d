package com.ai.quizbot.service;

import com.ai.quizbot.exception.MessageSendException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.test.util.ReflectionTestUtils;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.SocketTimeoutException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WhatsAppMessengerTimeoutTest {

    @Test
    void stalledProviderFailsAfterReadTimeout() throws Exception {
        // Accepts the TCP connection through the backlog but never answers.
        try (ServerSocket silent = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
            WhatsAppMessenger messenger = new WhatsAppMessenger(
                    new RestTemplateBuilder(), Duration.ofSeconds(1), Duration.ofMillis(200));
            ReflectionTestUtils.setField(messenger, "token", "test-token");
            ReflectionTestUtils.setField(messenger, "phoneNumberId", "1234567890");
            ReflectionTestUtils.setField(messenger, "apiBaseUrl", "http://127.0.0.1:" + silent.getLocalPort());

            long started = System.nanoTime();
            assertThatThrownBy(() -> messenger.sendText("91", "hello"))
                    .isInstanceOf(MessageSendException.class)
                    .hasRootCauseInstanceOf(SocketTimeoutException.class);

            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
        }
    }
}

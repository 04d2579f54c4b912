package com.transparency.assessment.llm;

import com.transparency.assessment.thread.MdcAwareExecutor;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TimedChatClientTest {
    private static final TimedChatClient.ChatOptions OPTIONS =
            new TimedChatClient.ChatOptions("test-model", 0.1, 50, Duration.ofMillis(300));

    private ChatModel chatModel;
    private MdcAwareExecutor executor;
    private TimedChatClient client;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        executor = new MdcAwareExecutor(2, "llm-test");
        client = new TimedChatClient(chatModel, executor);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        MDC.clear();
        executor.shutdown();
    }

    @Test
    void returnsStrippedReplyText() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(reply("  91\n"));

        assertEquals("91", client.complete("Score this", OPTIONS));

        ArgumentCaptor<ChatRequest> request = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(request.capture());
        assertEquals("test-model", request.getValue().parameters().modelName());
        assertEquals(50, request.getValue().parameters().maxOutputTokens());
    }

    @Test
    void slowModelTimesOut() {
        when(chatModel.chat(any(ChatRequest.class))).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return reply("40");
        });

        long started = System.nanoTime();
        LlmCallException e = assertThrows(LlmCallException.class, () -> client.complete("Score this", OPTIONS));
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertTrue(e.getMessage().contains("timed out"));
        assertTrue(elapsedMillis < 3_000, "waited " + elapsedMillis + " ms");
    }

    @Test
    void modelFailureIsWrapped() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new IllegalStateException("rate limited"));

        LlmCallException e = assertThrows(LlmCallException.class, () -> client.complete("Score this", OPTIONS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertTrue(e.getMessage().contains("rate limited"));
    }

    @Test
    void blankReplyIsAFailure() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(reply("   "));

        assertThrows(LlmCallException.class, () -> client.complete("Score this", OPTIONS));
    }

    @Test
    void callerMdcIsVisibleOnWorkerThread() {
        AtomicReference<String> seen = new AtomicReference<>();
        when(chatModel.chat(any(ChatRequest.class))).thenAnswer(invocation -> {
            seen.set(MDC.get("sessionId"));
            return reply("60");
        });

        MDC.put("sessionId", "session-42");
        client.complete("Score this", OPTIONS);

        assertEquals("session-42", seen.get());
    }

    private static ChatResponse reply(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }
}

package com.transparency.assessment.llm;

import com.transparency.assessment.thread.MdcAwareExecutor;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class TimedChatClient {
    private static final Logger log = LoggerFactory.getLogger(TimedChatClient.class);

    private final ChatModel chatModel;
    private final MdcAwareExecutor executor;

    public TimedChatClient(ChatModel chatModel, MdcAwareExecutor executor) {
        this.chatModel = chatModel;
        this.executor = executor;
    }

    public String complete(String prompt, ChatOptions options) {
        ChatRequest request = ChatRequest.builder()
                .messages(UserMessage.from(prompt))
                .parameters(ChatRequestParameters.builder()
                        .modelName(options.modelName())
                        .temperature(options.temperature())
                        .maxOutputTokens(options.maxTokens())
                        .build())
                .build();

        long started = System.nanoTime();
        Future<ChatResponse> call = executor.submit(() -> chatModel.chat(request));
        try {
            ChatResponse response = call.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
            log.debug("LLM call to {} finished in {} ms", options.modelName(),
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
            return textOf(response);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new LlmCallException("LLM call to " + options.modelName() + " timed out after "
                    + options.timeout().toMillis() + " ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmCallException("Interrupted while waiting for " + options.modelName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new LlmCallException("LLM call to " + options.modelName() + " failed: " + cause.getMessage(), cause);
        }
    }

    private String textOf(ChatResponse response) {
        AiMessage message = response == null ? null : response.aiMessage();
        String text = message == null ? null : message.text();
        if (text == null || text.isBlank()) {
            throw new LlmCallException("LLM returned an empty reply");
        }
        return text.strip();
    }

    public record ChatOptions(String modelName, double temperature, int maxTokens, Duration timeout) {}
}

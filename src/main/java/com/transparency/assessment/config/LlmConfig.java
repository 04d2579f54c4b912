package com.transparency.assessment.config;

import com.transparency.assessment.llm.TimedChatClient;
import com.transparency.assessment.thread.MdcAwareExecutor;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmConfig {
    public static final String SCORING_CLIENT = "scoringChatClient";
    public static final String REPORT_CLIENT = "reportChatClient";

    /** One OpenAI-compatible client; model name and sampling are chosen per request. */
    @Bean
    public ChatModel chatModel(AssessmentProperties properties) {
        AssessmentProperties.Llm llm = properties.llm();
        return OpenAiChatModel.builder()
                .baseUrl(llm.baseUrl())
                .apiKey(llm.apiKey())
                .modelName(llm.scoringModel())
                .timeout(llm.timeout())
                .build();
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor scoringExecutor(AssessmentProperties properties) {
        return new MdcAwareExecutor(properties.executor().scoringPoolSize(), "llm-scoring");
    }

    @Bean(destroyMethod = "shutdown")
    public MdcAwareExecutor reportExecutor(AssessmentProperties properties) {
        return new MdcAwareExecutor(properties.executor().reportPoolSize(), "llm-report");
    }

    @Bean(SCORING_CLIENT)
    public TimedChatClient scoringChatClient(ChatModel chatModel,
                                             @Qualifier("scoringExecutor") MdcAwareExecutor executor) {
        return new TimedChatClient(chatModel, executor);
    }

    @Bean(REPORT_CLIENT)
    public TimedChatClient reportChatClient(ChatModel chatModel,
                                            @Qualifier("reportExecutor") MdcAwareExecutor executor) {
        return new TimedChatClient(chatModel, executor);
    }
}

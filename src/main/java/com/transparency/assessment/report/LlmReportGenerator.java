package com.transparency.assessment.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.transparency.assessment.assessment.AssessmentModels.AnswerRecord;
import com.transparency.assessment.assessment.AssessmentModels.AssessmentSession;
import com.transparency.assessment.config.AssessmentProperties;
import com.transparency.assessment.config.LlmConfig;
import com.transparency.assessment.domain.DomainModels.Product;
import com.transparency.assessment.llm.LlmCallException;
import com.transparency.assessment.llm.TimedChatClient;
import com.transparency.assessment.llm.TimedChatClient.ChatOptions;
import com.transparency.assessment.report.ReportModels.ReportRequest;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class LlmReportGenerator implements ReportGenerator {
    static final String DOCTYPE = "<!DOCTYPE html>";

    private static final String PROMPT = """
            As a regulatory compliance expert and technical writer, write a complete HTML transparency \
            assessment report from the following product assessment data.

            ASSESSMENT DATA:
            {{data}}

            The report must contain:
            - a header with product details and assessment metadata
            - an executive summary with the overall transparency score, or a note that the assessment is still in progress
            - a short description of the assessment method
            - a section per answered question with the response, its score and specific findings
            - a scoring table
            - a regulatory compliance assessment against Indian consumer safety standards
            - recommendations for improvement and a conclusion

            Only discuss questions that have a response. Use embedded CSS and a print-friendly layout.
            Return the complete document, starting with <!DOCTYPE html> and ending with </html>.
            """;

    private final TimedChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final ChatOptions options;

    public LlmReportGenerator(@Qualifier(LlmConfig.REPORT_CLIENT) TimedChatClient chatClient,
                              ObjectMapper objectMapper,
                              AssessmentProperties properties) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        AssessmentProperties.Report report = properties.report();
        this.options = new ChatOptions(properties.llm().reportModel(), report.temperature(),
                report.maxTokens(), report.timeout());
    }

    @Override
    public String generate(ReportRequest request) {
        String reply;
        try {
            reply = chatClient.complete(PROMPT.replace("{{data}}", toJson(request)), options);
        } catch (LlmCallException e) {
            throw new ReportGenerationException(e.getMessage(), e);
        }

        String html = extractHtml(reply);
        if (!html.regionMatches(true, 0, DOCTYPE, 0, DOCTYPE.length()) || !html.endsWith("</html>")) {
            throw new ReportGenerationException("Generated report is not a complete HTML document");
        }
        return html;
    }

    String toJson(ReportRequest request) {
        Product product = request.product();
        AssessmentSession session = request.session();

        Map<String, Object> productData = new LinkedHashMap<>();
        productData.put("company_name", product.companyName());
        productData.put("product_name", product.productName());
        productData.put("product_id", product.productKey());
        productData.put("description", product.description());
        productData.put("domain", product.domain());

        Map<String, Object> sessionData = new LinkedHashMap<>();
        sessionData.put("session_id", session.sessionId());
        sessionData.put("status", session.status().value());
        sessionData.put("created_at", session.createdAt().toString());
        sessionData.put("updated_at", session.updatedAt().toString());
        sessionData.put("current_question", session.currentQuestionIndex());

        List<Map<String, Object>> responses = session.answers().stream().map(this::responseData).toList();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("product", productData);
        data.put("session", sessionData);
        data.put("responses", responses);
        data.put("scores", session.scores());
        data.put("final_score", session.finalScore());
        data.put("questions", request.questions());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new ReportGenerationException("Could not serialize assessment data", e);
        }
    }

    /** Strips a markdown code fence around the document if the model added one. */
    static String extractHtml(String reply) {
        String text = reply.strip();
        if (text.regionMatches(true, 0, DOCTYPE, 0, DOCTYPE.length())) {
            return text;
        }
        int fence = text.indexOf("```html");
        int start = fence >= 0 ? fence + "```html".length() : text.indexOf("```") + 3;
        int end = text.lastIndexOf("```");
        if (start >= 3 && end > start) {
            return text.substring(start, end).strip();
        }
        return text;
    }

    private Map<String, Object> responseData(AnswerRecord answer) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("question_number", answer.questionIndex());
        row.put("question", answer.questionText());
        row.put("response", answer.answerText());
        row.put("score", answer.score());
        row.put("fallback_score", answer.fallbackScore());
        row.put("timestamp", answer.answeredAt().toString());
        return row;
    }
}

package com.transparency.assessment.assessment;

import com.transparency.assessment.domain.DomainModels.Question;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.IntStream;

@Component
public class QuestionBank {
    private static final List<String> TRANSPARENCY_QUESTIONS = List.of(
            "Please provide detailed information about all ingredients/components used in your product. "
                    + "Are there any potentially harmful substances that consumers should be aware of?",
            "What quality control measures and testing procedures do you implement during manufacturing? "
                    + "Please share your quality certifications and compliance standards.",
            "Are there any known side effects, risks, or contraindications associated with your product? "
                    + "How do you communicate these to consumers?",
            "Please describe your product's environmental impact and disposal methods. "
                    + "What sustainable practices do you follow in production?",
            "What is your product's shelf life, storage requirements, and proper usage instructions? "
                    + "How do you ensure consumers receive accurate information?",
            "Do you have a system for tracking adverse events, consumer complaints, and product recalls? "
                    + "How transparent are you about product issues and their resolution?"
    );

    private final List<Question> questions;

    public QuestionBank() {
        this(TRANSPARENCY_QUESTIONS);
    }

    QuestionBank(List<String> texts) {
        if (texts.isEmpty()) {
            throw new IllegalArgumentException("Question bank must not be empty");
        }
        this.questions = IntStream.range(0, texts.size())
                .mapToObj(i -> new Question(i + 1, texts.get(i)))
                .toList();
    }

    public int size() {
        return questions.size();
    }

    public Question question(int index) {
        if (index < 1 || index > questions.size()) {
            throw new IllegalArgumentException("Question index out of range: " + index);
        }
        return questions.get(index - 1);
    }

    public Question first() {
        return questions.get(0);
    }

    /** Question texts from {@code fromIndex} through the last question; empty once past the end. */
    public List<String> remainingFrom(int fromIndex) {
        if (fromIndex > questions.size()) {
            return List.of();
        }
        return questions.subList(Math.max(fromIndex, 1) - 1, questions.size()).stream()
                .map(Question::text)
                .toList();
    }

    public List<Question> all() {
        return questions;
    }
}

package com.transparency.assessment.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Arrays;

public class DomainModels {
    public record Product(String productKey,
                          String companyName,
                          String productName,
                          String description,
                          String domain,
                          Instant createdAt) {}

    public record Question(int index, String text) {}

    public enum SessionStatus {
        ACTIVE("active"),
        COMPLETED("completed");

        private final String value;

        SessionStatus(String value) {
            this.value = value;
        }

        @JsonValue
        public String value() {
            return value;
        }

        public static SessionStatus fromValue(String value) {
            return Arrays.stream(values())
                    .filter(s -> s.value.equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown session status: " + value));
        }
    }
}

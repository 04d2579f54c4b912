package com.transparency.assessment.scoring;

final class ScoringPrompts {
    private static final String RUBRIC = """
            As an expert in Indian consumer safety regulations with deep knowledge of BIS standards, \
            FSSAI guidelines, the Consumer Protection Act 2019, Drug Controller regulations and industry \
            best practice, evaluate this transparency response.

            Question {{index}}: {{question}}
            Response: {{answer}}

            Score the response against four weighted dimensions:

            1. COMPLETENESS OF INFORMATION (30 points)
               - Is every part of the question addressed, with enough technical depth?
               - Are quantities, concentrations and units specific?
               - Are certifications and standards named (ISO numbers, BIS codes, FSSAI licence numbers)?

            2. HONESTY AND TRANSPARENCY (25 points)
               - Does the response admit limitations and uncertainty?
               - Are risks and negative aspects disclosed together with mitigations?
               - Is the tone factual rather than promotional?

            3. COMPLIANCE WITH INDIAN CONSUMER SAFETY GUIDELINES (25 points)
               - Are the applicable regulatory frameworks cited accurately?
               - Does it align with Consumer Protection Act 2019 disclosure and grievance requirements?
               - Is there evidence of compliance such as licences, certificates or third-party audits?

            4. CLARITY AND ACCESSIBILITY (20 points)
               - Is jargon explained and the language readable?
               - Are instructions actionable for consumers?
               - Is critical safety information prominent?

            Consider the product domain (food, pharma, electronics, cosmetics) when weighing each dimension.

            Calibration:
            - 95-100: exceptional transparency exceeding regulatory requirements
            - 85-94: strong transparency meeting all regulatory standards
            - 75-84: adequate transparency with basic compliance and some gaps
            - 65-74: minimal transparency with significant deficiencies
            - below 65: inadequate transparency and compliance failures

            Reply with only the final integer score between 1 and 100.
            """;

    private ScoringPrompts() {}

    static String render(int questionIndex, String question, String answer) {
        return RUBRIC
                .replace("{{index}}", Integer.toString(questionIndex))
                .replace("{{question}}", question)
                .replace("{{answer}}", answer);
    }
}

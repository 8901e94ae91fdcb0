package com.queryforge.service;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Rejects questions that are empty, oversized or carry statement-injection fragments.
 */
@Component
public class InputShapeValidator {

    public static final int MAX_QUESTION_LENGTH = 1000;

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile(";\\s*(DROP|DELETE|INSERT|UPDATE)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("EXEC\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("xp_cmdshell", Pattern.CASE_INSENSITIVE),
            Pattern.compile("sp_executesql", Pattern.CASE_INSENSITIVE)
    );

    /**
     * Validate question and dialect. Stops at the first failing check.
     *
     * @param question sanitized question
     * @param dialect dialect label
     * @return check result
     */
    public InputCheck validate(String question, String dialect) {
        if (question == null || question.isBlank()) {
            return InputCheck.rejected("Question cannot be empty");
        }
        if (question.length() > MAX_QUESTION_LENGTH) {
            return InputCheck.rejected("Question is too long (max " + MAX_QUESTION_LENGTH + " characters)");
        }
        if (dialect == null || dialect.isBlank()) {
            return InputCheck.rejected("Database type must be specified");
        }
        for (Pattern p : DANGEROUS_PATTERNS) {
            if (p.matcher(question).find()) {
                return InputCheck.rejected("Question contains potentially unsafe content");
            }
        }
        return InputCheck.ok();
    }
}

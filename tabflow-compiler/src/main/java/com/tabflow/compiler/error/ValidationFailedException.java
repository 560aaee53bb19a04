package com.tabflow.compiler.error;

import com.tabflow.compiler.validation.ValidationIssue;
import com.tabflow.compiler.validation.ValidationResult;

import java.util.stream.Collectors;

/**
 * Thrown in strict mode when validation reports at least one fatal error.
 * Stops compilation before a hierarchy is synthesized; the full result (errors and warnings) is attached.
 */
public final class ValidationFailedException extends WorkflowCompilationException {

    private final ValidationResult validationResult;

    public ValidationFailedException(ValidationResult validationResult) {
        super(message(validationResult), firstLocation(validationResult));
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    private static String message(ValidationResult result) {
        if (result == null || result.getErrors().isEmpty()) return "Workflow validation failed";
        return "Workflow validation failed: " + result.getErrors().stream()
                .map(ValidationIssue::getMessage)
                .collect(Collectors.joining("; "));
    }

    private static ErrorLocation firstLocation(ValidationResult result) {
        if (result == null || result.getErrors().isEmpty()) return ErrorLocation.UNKNOWN;
        return result.getErrors().get(0).getLocation();
    }
}

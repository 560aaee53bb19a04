package com.tabflow.compiler.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of workflow validation: fatal errors and non-fatal warnings, each in the order found.
 * Valid when there are no errors.
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(List.of(), List.of());

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    private ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
        this.warnings = warnings != null ? Collections.unmodifiableList(new ArrayList<>(warnings)) : List.of();
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    public static ValidationResult of(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        return new ValidationResult(errors, warnings);
    }

    /** Splits issues by {@link ValidationIssue#isError()}, keeping order within each list. */
    public static ValidationResult of(List<ValidationIssue> issues) {
        List<ValidationIssue> errors = new ArrayList<>();
        List<ValidationIssue> warnings = new ArrayList<>();
        for (ValidationIssue issue : issues) {
            if (issue.isError()) {
                errors.add(issue);
            } else {
                warnings.add(issue);
            }
        }
        return new ValidationResult(errors, warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationIssue> getErrors() {
        return errors;
    }

    public List<ValidationIssue> getWarnings() {
        return warnings;
    }

    /** Errors and warnings of the given kind. */
    public List<ValidationIssue> getIssues(IssueKind kind) {
        List<ValidationIssue> out = new ArrayList<>();
        for (ValidationIssue i : errors) {
            if (i.getKind() == kind) out.add(i);
        }
        for (ValidationIssue i : warnings) {
            if (i.getKind() == kind) out.add(i);
        }
        return out;
    }

    @Override
    public String toString() {
        return "ValidationResult{errors=" + errors.size() + ", warnings=" + warnings.size() + "}";
    }
}

package com.questhub.engineservice.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验结论：无原因即通过。
 */
public final class ValidationResult {

    private static final ValidationResult OK = new ValidationResult(Collections.emptyList());

    private final List<String> reasons;

    private ValidationResult(List<String> reasons) {
        this.reasons = reasons;
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult fail(String... reasons) {
        return new ValidationResult(List.of(reasons));
    }

    public static ValidationResult of(List<String> reasons) {
        return reasons.isEmpty() ? OK : new ValidationResult(List.copyOf(reasons));
    }

    public boolean isValid() {
        return reasons.isEmpty();
    }

    public List<String> reasons() {
        return reasons;
    }

    public ValidationResult merge(ValidationResult other) {
        if (other.isValid()) {
            return this;
        }
        if (isValid()) {
            return other;
        }
        List<String> all = new ArrayList<>(reasons);
        all.addAll(other.reasons);
        return new ValidationResult(List.copyOf(all));
    }
}

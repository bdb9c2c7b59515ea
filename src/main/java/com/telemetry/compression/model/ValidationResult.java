package com.telemetry.compression.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 压缩参数校验结果
 */
public class ValidationResult implements Serializable {
    private boolean valid;
    private final List<String> errors;
    private final List<String> warnings;

    public ValidationResult() {
        this.valid = true;
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public void addError(String error) {
        this.errors.add(error);
        this.valid = false;
    }

    public void addWarning(String warning) {
        this.warnings.add(warning);
    }

    /** 合法时不做任何事，否则抛出包含全部错误的异常 */
    public void throwIfInvalid(String subject) {
        if (!valid) {
            throw new IllegalArgumentException("Invalid " + subject + ": " + errors);
        }
    }

    public boolean isValid() { return valid; }
    public List<String> getErrors() { return errors; }
    public List<String> getWarnings() { return warnings; }
}

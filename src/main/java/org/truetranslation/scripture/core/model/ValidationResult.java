package org.truetranslation.scripture.core.model;

public class ValidationResult {
    private static final ValidationResult VALID = new ValidationResult(true, null, null);

    private final boolean valid;
    private final String error;
    private final ParsedReference autoCorrection;

    private ValidationResult(boolean valid, String error, ParsedReference autoCorrection) {
        this.valid = valid;
        this.error = error;
        this.autoCorrection = autoCorrection;
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult invalid(String error) {
        return new ValidationResult(false, error, null);
    }

    public static ValidationResult invalid(String error, ParsedReference autoCorrection) {
        return new ValidationResult(false, error, autoCorrection);
    }

    public boolean isValid() { return valid; }
    public String getError() { return error; }
    public ParsedReference getAutoCorrection() { return autoCorrection; }
    public boolean hasAutoCorrection() { return autoCorrection != null; }

    @Override
    public String toString() {
        return valid ? "ValidationResult{valid}"
                : "ValidationResult{invalid, error='" + error + "', autoCorrection=" + autoCorrection + '}';
    }
}

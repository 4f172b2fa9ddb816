package ou.capstone.fantasy.validation;

import java.util.List;

/**
 * Result of validating a league document.
 */
public final class ValidationResult {
    private final boolean ok;
    private final String message;
    private final List<String> problems;

    private ValidationResult(boolean ok, String message, List<String> problems) {
        this.ok = ok;
        this.message = message;
        this.problems = (problems == null) ? List.of() : List.copyOf(problems);
    }

    public static ValidationResult success() {
        return new ValidationResult(true, "OK", List.of());
    }

    public static ValidationResult error(String message, List<String> problems) {
        return new ValidationResult(false, message, problems);
    }

    public boolean isOk() {
        return ok;
    }

    public String message() {
        return message;
    }

    public List<String> problems() {
        return problems;
    }

    @Override
    public String toString() {
        return ok ? message : message + " " + problems;
    }
}

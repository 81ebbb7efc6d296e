package io.opsmesh.bridge;

public class ValidatorException extends Exception {
    private final boolean transientFailure;

    public ValidatorException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public ValidatorException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static ValidatorException transientFailure(String message, Throwable cause) {
        return new ValidatorException(message, true, cause);
    }

    public static ValidatorException permanent(String message) {
        return new ValidatorException(message, false);
    }

    public boolean transientFailure() {
        return transientFailure;
    }
}

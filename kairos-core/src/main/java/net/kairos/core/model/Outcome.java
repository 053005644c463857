package net.kairos.core.model;

public record Outcome(boolean success, FailureKind failure, Throwable error) {

    private static final Outcome SUCCESS = new Outcome(true, null, null);

    public static Outcome succeeded() {
        return SUCCESS;
    }

    public static Outcome failed(FailureKind kind, Throwable error) {
        return new Outcome(false, kind, error);
    }

    /** Text stored in {@code failReason}. */
    public String reason() {
        if (success) return null;
        String message = error == null ? null : error.getMessage();
        return message == null || message.isBlank()
                ? failure.name()
                : message;
    }
}

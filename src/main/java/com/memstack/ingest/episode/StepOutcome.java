package com.memstack.ingest.episode;

/**
 * Result of one pipeline step.
 *
 * @param step step name
 * @param type what happened
 * @param message detail for logs, may be null
 * @param error failure cause for ADVISORY_FAILURE and FATAL
 */
public record StepOutcome(String step, Type type, String message, Throwable error) {

    public enum Type {
        SUCCESS,
        SKIPPED,
        /**
         * Step failed but the task still counts as successful.
         */
        ADVISORY_FAILURE,
        /**
         * Step failed and the task fails with it.
         */
        FATAL
    }

    public static StepOutcome success(String step) {
        return new StepOutcome(step, Type.SUCCESS, null, null);
    }

    public static StepOutcome success(String step, String message) {
        return new StepOutcome(step, Type.SUCCESS, message, null);
    }

    public static StepOutcome skipped(String step, String reason) {
        return new StepOutcome(step, Type.SKIPPED, reason, null);
    }

    public static StepOutcome advisoryFailure(String step, Throwable error) {
        return new StepOutcome(step, Type.ADVISORY_FAILURE, error.getMessage(), error);
    }

    public static StepOutcome fatal(String step, Throwable error) {
        return new StepOutcome(step, Type.FATAL, error.getMessage(), error);
    }

    public boolean isFatal() {
        return type == Type.FATAL;
    }
}

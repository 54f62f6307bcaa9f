package io.checkpoint.subscription;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Failure recorded on a subscription in {@link Status#ERROR}.
 *
 * @param errorMessage   message of the failure
 * @param previousStatus status the subscription had before it failed, may be {@code null}
 * @param errorTrace     stack trace or other diagnostic context
 */
public record SubscriptionError(String errorMessage, Status previousStatus, String errorTrace) {

    public SubscriptionError {
        Objects.requireNonNull(errorMessage, "errorMessage");
        Objects.requireNonNull(errorTrace, "errorTrace");
    }

    /**
     * Captures a throwable, rendering its full stack trace.
     *
     * @param throwable      the failure
     * @param previousStatus status before the failure, may be {@code null}
     * @return the error record
     */
    public static SubscriptionError fromThrowable(Throwable throwable, Status previousStatus) {
        Objects.requireNonNull(throwable, "throwable");
        StringWriter trace = new StringWriter();
        throwable.printStackTrace(new PrintWriter(trace));
        String message = throwable.getMessage() != null
                ? throwable.getMessage()
                : throwable.getClass().getName();
        return new SubscriptionError(message, previousStatus, trace.toString());
    }
}

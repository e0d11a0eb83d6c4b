package io.pulse4j.core.exception;

/**
 * Wraps an error raised by a job handler. Never thrown out of {@code Job.run()}; it is
 * recorded on the job and handed to event listeners.
 */
public class JobHandlerException extends PulseException {

    private final String jobName;

    public JobHandlerException(String jobName, Throwable cause) {
        super("Job handler failed name=" + jobName + ": " + describe(cause), cause);
        this.jobName = jobName;
    }

    public String jobName() {
        return jobName;
    }

    /**
     * Message used as the job's fail reason: the cause message, or its class name when empty.
     */
    public static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return (message == null || message.isBlank()) ? cause.getClass().getName() : message;
    }
}

package io.pulse4j;

/**
 * Work performed when a job named {@link #name()} runs.
 *
 * <p>The handler receives the running job: its payload is {@link Job#getData()}, and long
 * handlers call {@link Job#touch(Integer)} to keep their claim alive and report progress.
 */
public interface JobHandler<T> {
    String name();

    Class<T> dataClass();

    /**
     * @return a value stored as the job result when the job saves results; may be null
     * @throws Exception any failure; recorded on the job, never propagated to the scheduler
     */
    Object execute(Job<T> job) throws Exception;
}

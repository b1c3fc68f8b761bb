package dk.cloudcreate.imkitchen.common;

/**
 * Common process life cycle interface, implemented by long-running background components
 * such as the continuous projection runner
 */
public interface Lifecycle {
    /**
     * Start the processing. This operation must be idempotent, such that duplicate calls
     * to {@link #start()} for an already started process (where {@link #isStarted()} returns true)
     * are ignored
     */
    void start();

    /**
     * Stop the processing. This operation must be idempotent, such that duplicate calls
     * to {@link #stop()} for an already stopped process (where {@link #isStarted()} returns false)
     * are ignored
     */
    void stop();

    /**
     * @return true if the process is started otherwise false
     */
    boolean isStarted();
}

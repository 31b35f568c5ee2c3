package dev.chainevents.components.common;

/**
 * Start/stop contract shared by the long running components (event queues, consumers, listeners and pollers)
 */
public interface Lifecycle {
    /**
     * Start the component. Calling {@link #start()} on a component where {@link #isStarted()} already
     * returns true is ignored
     */
    void start();

    /**
     * Stop the component and release any threads or connections it holds. Calling {@link #stop()} on a component
     * where {@link #isStarted()} returns false is ignored
     */
    void stop();

    /**
     * @return true if the component has been started and not yet stopped
     */
    boolean isStarted();
}

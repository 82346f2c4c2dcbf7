package org.fleetfeast.datapipeline.api.services;

/**
 * Lifecycle contract for every long-running service managed by the
 * {@link org.fleetfeast.datapipeline.ServiceManager}.
 */
public interface IService {

    enum State {
        STOPPED,
        RUNNING,
        PAUSED,
        ERROR
    }

    /**
     * Whether the service thread may be interrupted right away on shutdown.
     * {@code PROCESSING} marks a section (for example a state-store write) that
     * should finish before the thread is interrupted.
     */
    enum ShutdownPhase {
        WAITING,
        PROCESSING
    }

    void start();

    void stop();

    void pause();

    void resume();

    State getCurrentState();

    ShutdownPhase getShutdownPhase();
}

package com.cso.logstream;

/**
 * Durable-publish client over one message bus connection. Implementations own the reconnect
 * policy and apply the stream prefix to every base subject passed to {@link #publish}.
 * <p>
 * One client is shared by both log writers of a task and by the deployment handlers;
 * implementations must be safe for concurrent use.
 */
public interface EventBusClient extends AutoCloseable {

    /**
     * Publishes one JSON payload and waits for the bus acknowledgement.
     *
     * @param baseSubject subject without prefix (e.g. {@code build.log.<deploymentId>})
     * @param payload     serializable payload
     * @throws BusException when serialization fails or the publish is not acknowledged
     */
    void publish(String baseSubject, Object payload) throws BusException;

    /** Publishes an IN_PROGRESS status change for the job. */
    default void publishDeploymentStarted(int jobId) throws BusException {
        publish(Subjects.DEPLOYMENT_STATUS_CHANGED, new DeploymentStatusPayload(jobId, DeploymentStatus.IN_PROGRESS));
    }

    default void publishDeploymentSucceeded(DeploymentEventPayload payload) throws BusException {
        publish(Subjects.DEPLOYMENT_SUCCEEDED, payload);
    }

    default void publishDeploymentFailed(DeploymentEventPayload payload) throws BusException {
        publish(Subjects.DEPLOYMENT_FAILED, payload);
    }

    default void publishJobDestroyed(JobDestroyedPayload payload) throws BusException {
        publish(Subjects.JOB_DESTROYED, payload);
    }

    default void publishBuildLog(BuildLogPayload payload) throws BusException {
        publish(Subjects.buildLog(payload.getDeploymentId()), payload);
    }

    default void publishBuildLogEnd(BuildLogEndPayload payload) throws BusException {
        publish(Subjects.buildLogEnd(payload.getDeploymentId()), payload);
    }

    /** Drains pending messages and closes the connection. Never throws. */
    @Override
    void close();
}

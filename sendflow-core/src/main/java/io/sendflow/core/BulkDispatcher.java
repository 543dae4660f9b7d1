package io.sendflow.core;

/**
 * Drives a group send to completion as a tracked job.
 */
public interface BulkDispatcher {

    /**
     * Resolves the group's contacts, creates a job and starts sending in the background.
     *
     * @return id of the created job, available for polling before sending finishes
     * @throws io.sendflow.core.exception.NotFoundException if the group does not exist
     */
    String dispatch(String groupId, String message);
}

package tech.clusterauth.agent.sync;

/**
 * What {@link ResourceSynchronizer#createOrUpdate} did to the store.
 */
public enum SyncOutcome {
    CREATED,
    UPDATED,
    UNCHANGED
}

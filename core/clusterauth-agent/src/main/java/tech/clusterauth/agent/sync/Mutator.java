package tech.clusterauth.agent.sync;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Copies the mutable fields of a desired object onto a target of the same kind.
 *
 * <p>The target is either the freshly fetched server copy or, on creation, the desired
 * object itself. Implementations must only touch the fields they own so that
 * server-managed fields (resourceVersion, uid, managedFields, ...) survive the update.
 *
 * @param <T> the concrete object kind
 */
@FunctionalInterface
public interface Mutator<T extends HasMetadata> {

    void mutate(T desired, T target);
}

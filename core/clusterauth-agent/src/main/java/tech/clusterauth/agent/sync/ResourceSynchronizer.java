package tech.clusterauth.agent.sync;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.KubernetesClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.clusterauth.agent.ResourceKey;
import tech.clusterauth.agent.Spoke;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Create-or-update primitive for a single spoke object.
 *
 * <p>Fetches the object by identity. If absent, the desired object is created as-is.
 * If present, the {@link Mutator} copies the owned fields onto the fetched copy and
 * labels are replaced with the desired labels; the update is skipped when nothing
 * changed, so repeating a call with the same desired state performs no write.
 *
 * <p>Never deletes. Store failures surface unchanged as
 * {@link io.fabric8.kubernetes.client.KubernetesClientException}; a concurrent
 * modification between fetch and update fails with a 409 conflict, since the update
 * carries the fetched resourceVersion.
 */
@ApplicationScoped
public class ResourceSynchronizer {

    private static final Logger LOG = Logger.getLogger(ResourceSynchronizer.class);

    private final KubernetesClient client;

    @Inject
    public ResourceSynchronizer(@Spoke KubernetesClient client) {
        this.client = client;
    }

    public <T extends HasMetadata> SyncOutcome createOrUpdate(T desired, Mutator<T> mutator) {
        Objects.requireNonNull(desired.getMetadata(), "desired object has no metadata");
        ResourceKey key = ResourceKey.of(desired);
        String kind = desired.getKind();

        T existing = client.resource(desired).get();
        if (existing == null) {
            client.resource(desired).create();
            LOG.infof("Created %s %s", kind, key);
            return SyncOutcome.CREATED;
        }

        T before = client.getKubernetesSerialization().clone(existing);
        mutator.mutate(desired, existing);
        copyLabels(desired.getMetadata(), existing.getMetadata());

        if (before.equals(existing)) {
            LOG.debugf("%s %s already up to date", kind, key);
            return SyncOutcome.UNCHANGED;
        }

        client.resource(existing).update();
        LOG.infof("Updated %s %s", kind, key);
        return SyncOutcome.UPDATED;
    }

    private static void copyLabels(ObjectMeta desired, ObjectMeta target) {
        Map<String, String> labels = desired.getLabels();
        target.setLabels(labels == null ? null : new HashMap<>(labels));
    }
}

package tech.clusterauth.agent.binding;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.rbac.ClusterRole;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.clusterauth.agent.ResourceKey;
import tech.clusterauth.agent.Spoke;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Removes every spoke object materialized for a grant.
 *
 * <p>Objects are found by label-set equality with the grant, never by stored
 * references. Swept kinds: ServiceAccounts, ClusterRoles, ClusterRoleBindings and
 * namespaced RoleBindings, across all namespaces.
 *
 * <p>A failed listing is logged and treated as "nothing found" for that kind. A failed
 * delete propagates and aborts the sweep; the caller keeps its finalizer and retries.
 */
@ApplicationScoped
public class CleanupSweeper {

    private static final Logger LOG = Logger.getLogger(CleanupSweeper.class);

    private static final List<Class<? extends HasMetadata>> SWEPT_KINDS = List.of(
        ServiceAccount.class,
        ClusterRole.class,
        ClusterRoleBinding.class,
        RoleBinding.class
    );

    private final KubernetesClient client;

    @Inject
    public CleanupSweeper(@Spoke KubernetesClient client) {
        this.client = client;
    }

    /**
     * @throws IllegalArgumentException if {@code labels} is empty; an empty selector matches every object
     * @throws KubernetesClientException if a delete fails
     */
    public SweepReport sweep(Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("Refusing to sweep with an empty label selector");
        }

        Map<String, Integer> deleted = new LinkedHashMap<>();
        Set<String> unlisted = new LinkedHashSet<>();
        for (Class<? extends HasMetadata> kind : SWEPT_KINDS) {
            String kindName = HasMetadata.getKind(kind);
            List<? extends HasMetadata> matches;
            try {
                matches = list(kind, labels);
            } catch (KubernetesClientException e) {
                LOG.warnf("Listing %s with labels %s failed, skipping: %s", kindName, labels, e.getMessage());
                unlisted.add(kindName);
                continue;
            }

            for (HasMetadata item : matches) {
                client.resource(item).delete();
                LOG.infof("Deleted %s %s", kindName, ResourceKey.of(item));
            }
            deleted.put(kindName, matches.size());
        }
        return new SweepReport(deleted, unlisted);
    }

    /**
     * The selector narrows the listing to objects carrying at least {@code labels};
     * only objects whose label set is exactly {@code labels} belong to the grant.
     */
    private <T extends HasMetadata> List<T> list(Class<T> kind, Map<String, String> labels) {
        List<T> candidates = Namespaced.class.isAssignableFrom(kind)
            ? client.resources(kind).inAnyNamespace().withLabels(labels).list().getItems()
            : client.resources(kind).withLabels(labels).list().getItems();
        return candidates.stream()
            .filter(item -> labels.equals(item.getMetadata().getLabels()))
            .collect(Collectors.toList());
    }
}

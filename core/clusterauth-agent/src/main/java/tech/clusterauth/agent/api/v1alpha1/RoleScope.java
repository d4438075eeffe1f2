package tech.clusterauth.agent.api.v1alpha1;

import java.util.List;

/**
 * Where a grant's role applies on the spoke.
 *
 * <ul>
 *   <li>{@link ClusterWide} - one ClusterRoleBinding to a ClusterRole</li>
 *   <li>{@link Namespaced} - one RoleBinding to a Role in each listed namespace, in order</li>
 * </ul>
 */
public sealed interface RoleScope permits RoleScope.ClusterWide, RoleScope.Namespaced {

    record ClusterWide() implements RoleScope {
    }

    record Namespaced(List<String> namespaces) implements RoleScope {
        public Namespaced {
            namespaces = List.copyOf(namespaces);
        }
    }

    static RoleScope clusterWide() {
        return new ClusterWide();
    }

    static RoleScope namespaced(List<String> namespaces) {
        return new Namespaced(namespaces);
    }
}

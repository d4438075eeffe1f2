package tech.clusterauth.agent.api.v1alpha1;

import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Cluster-scoped role authored on the hub, propagated to the spoke as a ClusterRole
 * with the same name, labels and rules.
 */
@Group(ApiGroup.NAME)
@Version(ApiGroup.VERSION)
@Kind("ManagedClusterRole")
@Plural("managedclusterroles")
public class ManagedClusterRole extends CustomResource<ManagedClusterRoleSpec, Void> {

    public ManagedClusterRole() {
    }

    public ManagedClusterRole(ManagedClusterRoleSpec spec) {
        setSpec(spec);
    }
}

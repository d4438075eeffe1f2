package tech.clusterauth.agent.api.v1alpha1;

import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;

/**
 * Hub-resident access grant.
 *
 * <p>Declares one subject (only the first entry of {@code spec.subjects} is honored)
 * and one role reference, either cluster-wide or scoped to a list of namespaces.
 * The grant's labels are copied onto every object materialized on the spoke and are
 * the only association used to find those objects again on deletion.
 */
@Group(ApiGroup.NAME)
@Version(ApiGroup.VERSION)
@Kind("ManagedClusterRoleBinding")
@Plural("managedclusterrolebindings")
public class ManagedClusterRoleBinding
        extends CustomResource<ManagedClusterRoleBindingSpec, Void>
        implements Namespaced {

    public ManagedClusterRoleBinding() {
    }

    public ManagedClusterRoleBinding(ManagedClusterRoleBindingSpec spec) {
        setSpec(spec);
    }
}

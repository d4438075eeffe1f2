package tech.clusterauth.agent.binding;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.rbac.ClusterRole;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBinding;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBuilder;
import io.fabric8.kubernetes.api.model.rbac.PolicyRuleBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleBinding;
import io.fabric8.kubernetes.api.model.rbac.RoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.Subject;
import io.fabric8.kubernetes.api.model.rbac.SubjectBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.clusterauth.agent.AgentConfig;
import tech.clusterauth.agent.api.v1alpha1.RoleScope;
import tech.clusterauth.agent.sync.Mutator;
import tech.clusterauth.agent.sync.ResourceSynchronizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

/**
 * Computes and synchronizes the spoke RBAC objects for an active grant.
 *
 * <p>Objects are written in dependency order, so a binding never references a role
 * that does not exist yet:
 * <ol>
 *   <li>impersonation ClusterRole - {@code impersonate} on {@code users/<subject>}</li>
 *   <li>impersonation ClusterRoleBinding - binds the impersonator service account to it</li>
 *   <li>grant binding(s) - the subject as a {@code User}, bound to the requested role,
 *       cluster-wide or once per target namespace</li>
 * </ol>
 * The first failure aborts the remaining steps; the next reconciliation starts over
 * and the already-written objects come back {@code UNCHANGED}.
 */
@ApplicationScoped
public class PermissionMaterializer {

    private static final Logger LOG = Logger.getLogger(PermissionMaterializer.class);

    static final String RBAC_GROUP = "rbac.authorization.k8s.io";
    static final String IMPERSONATE_VERB = "impersonate";
    static final String USERS_RESOURCE = "users";

    private static final Mutator<ClusterRole> CLUSTER_ROLE_RULES =
        (desired, target) -> target.setRules(desired.getRules());

    private static final Mutator<ClusterRoleBinding> CLUSTER_ROLE_BINDING_REFS = (desired, target) -> {
        target.setSubjects(desired.getSubjects());
        target.setRoleRef(desired.getRoleRef());
    };

    private static final Mutator<RoleBinding> ROLE_BINDING_REFS = (desired, target) -> {
        target.setSubjects(desired.getSubjects());
        target.setRoleRef(desired.getRoleRef());
    };

    private final ResourceSynchronizer synchronizer;
    private final String impersonatorName;
    private final String impersonatorNamespace;

    @Inject
    public PermissionMaterializer(ResourceSynchronizer synchronizer, AgentConfig config) {
        this(synchronizer, config.impersonator().name(), config.impersonator().namespace());
    }

    public PermissionMaterializer(ResourceSynchronizer synchronizer, String impersonatorName, String impersonatorNamespace) {
        this.synchronizer = synchronizer;
        this.impersonatorName = impersonatorName;
        this.impersonatorNamespace = impersonatorNamespace;
    }

    public void materialize(ValidatedGrant grant) {
        synchronizer.createOrUpdate(impersonationRole(grant), CLUSTER_ROLE_RULES);
        synchronizer.createOrUpdate(impersonationBinding(grant), CLUSTER_ROLE_BINDING_REFS);

        if (grant.scope() instanceof RoleScope.Namespaced namespaced) {
            if (namespaced.namespaces().isEmpty()) {
                LOG.warnf("Grant %s is scoped to an empty namespace list, no role binding created", grant.name());
            }
            for (String namespace : namespaced.namespaces()) {
                synchronizer.createOrUpdate(namespacedGrantBinding(grant, namespace), ROLE_BINDING_REFS);
            }
        } else {
            synchronizer.createOrUpdate(clusterGrantBinding(grant), CLUSTER_ROLE_BINDING_REFS);
        }

        LOG.debugf("Materialized grant %s for subject %s", grant.name(), grant.subject());
    }

    /**
     * Every object {@link #materialize} writes, in write order.
     */
    public List<HasMetadata> desiredObjects(ValidatedGrant grant) {
        List<HasMetadata> objects = new ArrayList<>();
        objects.add(impersonationRole(grant));
        objects.add(impersonationBinding(grant));
        if (grant.scope() instanceof RoleScope.Namespaced namespaced) {
            for (String namespace : namespaced.namespaces()) {
                objects.add(namespacedGrantBinding(grant, namespace));
            }
        } else {
            objects.add(clusterGrantBinding(grant));
        }
        return objects;
    }

    ClusterRole impersonationRole(ValidatedGrant grant) {
        return new ClusterRoleBuilder()
            .withNewMetadata()
                .withName(ImpersonationNames.roleName(grant.subject(), grant.hubOwnerId()))
                .withLabels(new HashMap<>(grant.labels()))
            .endMetadata()
            .withRules(new PolicyRuleBuilder()
                .withApiGroups("")
                .withResources(USERS_RESOURCE)
                .withVerbs(IMPERSONATE_VERB)
                .withResourceNames(grant.subject())
                .build())
            .build();
    }

    ClusterRoleBinding impersonationBinding(ValidatedGrant grant) {
        return new ClusterRoleBindingBuilder()
            .withNewMetadata()
                .withName(ImpersonationNames.bindingName(grant.subject(), grant.hubOwnerId()))
                .withLabels(new HashMap<>(grant.labels()))
            .endMetadata()
            .withSubjects(new SubjectBuilder()
                .withKind("ServiceAccount")
                .withName(impersonatorName)
                .withNamespace(impersonatorNamespace)
                .build())
            .withNewRoleRef()
                .withApiGroup(RBAC_GROUP)
                .withKind("ClusterRole")
                .withName(ImpersonationNames.roleName(grant.subject(), grant.hubOwnerId()))
            .endRoleRef()
            .build();
    }

    ClusterRoleBinding clusterGrantBinding(ValidatedGrant grant) {
        return new ClusterRoleBindingBuilder()
            .withNewMetadata()
                .withName(grant.name())
                .withLabels(new HashMap<>(grant.labels()))
            .endMetadata()
            .withSubjects(userSubject(grant))
            .withNewRoleRef()
                .withApiGroup(RBAC_GROUP)
                .withKind("ClusterRole")
                .withName(grant.roleName())
            .endRoleRef()
            .build();
    }

    RoleBinding namespacedGrantBinding(ValidatedGrant grant, String namespace) {
        return new RoleBindingBuilder()
            .withNewMetadata()
                .withName(grant.name())
                .withNamespace(namespace)
                .withLabels(new HashMap<>(grant.labels()))
            .endMetadata()
            .withSubjects(userSubject(grant))
            .withNewRoleRef()
                .withApiGroup(RBAC_GROUP)
                .withKind("Role")
                .withName(grant.roleName())
            .endRoleRef()
            .build();
    }

    // The API server defaults User subjects to the RBAC group; set it up front so a
    // re-read object compares equal to the desired one.
    private static Subject userSubject(ValidatedGrant grant) {
        return new SubjectBuilder()
            .withApiGroup(RBAC_GROUP)
            .withKind("User")
            .withName(grant.subject())
            .build();
    }
}

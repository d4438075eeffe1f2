package tech.clusterauth.agent.binding;

import io.fabric8.kubernetes.api.model.rbac.Subject;
import tech.clusterauth.agent.InvalidResourceException;
import tech.clusterauth.agent.ResourceKey;
import tech.clusterauth.agent.api.v1alpha1.ApiGroup;
import tech.clusterauth.agent.api.v1alpha1.ManagedClusterRoleBinding;
import tech.clusterauth.agent.api.v1alpha1.ManagedClusterRoleBindingSpec;

import java.util.List;
import java.util.Map;

/**
 * Checks a grant carries everything materialization needs, and extracts it.
 */
public final class GrantValidator {

    private GrantValidator() {
    }

    /**
     * @return the validated view of the grant
     * @throws InvalidResourceException when the grant cannot be materialized
     */
    public static ValidatedGrant validate(ManagedClusterRoleBinding grant) {
        ResourceKey key = ResourceKey.of(grant);
        ManagedClusterRoleBindingSpec spec = grant.getSpec();
        if (spec == null) {
            throw new InvalidResourceException(key, "spec is missing");
        }

        List<Subject> subjects = spec.getSubjects();
        if (subjects == null || subjects.isEmpty()) {
            throw new InvalidResourceException(key, "spec.subjects must contain exactly one subject");
        }
        String subject = subjects.get(0).getName();
        if (subject == null || subject.isBlank()) {
            throw new InvalidResourceException(key, "spec.subjects[0].name is empty");
        }

        if (spec.getRoleRef() == null || spec.getRoleRef().getName() == null || spec.getRoleRef().getName().isBlank()) {
            throw new InvalidResourceException(key, "spec.roleRef.name is empty");
        }

        Map<String, String> labels = grant.getMetadata().getLabels();
        if (labels == null || labels.isEmpty()) {
            throw new InvalidResourceException(key, "grant has no labels; spoke objects could not be cleaned up");
        }
        String hubOwnerId = labels.get(ApiGroup.HUB_OWNER_ID_LABEL);
        if (hubOwnerId == null || hubOwnerId.isBlank()) {
            throw new InvalidResourceException(key, "label " + ApiGroup.HUB_OWNER_ID_LABEL + " is missing");
        }

        return new ValidatedGrant(
            grant.getMetadata().getName(),
            subject,
            hubOwnerId,
            spec.getRoleRef().getName(),
            spec.getRoleRef().scope(),
            Map.copyOf(labels)
        );
    }
}

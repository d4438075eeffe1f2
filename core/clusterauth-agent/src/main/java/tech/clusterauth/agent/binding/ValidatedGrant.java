package tech.clusterauth.agent.binding;

import tech.clusterauth.agent.api.v1alpha1.RoleScope;

import java.util.Map;

/**
 * A grant that passed {@link GrantValidator}: exactly one subject, a role name,
 * a hub owner and a non-empty label set.
 */
public record ValidatedGrant(
    String name,
    String subject,
    String hubOwnerId,
    String roleName,
    RoleScope scope,
    Map<String, String> labels
) {
}

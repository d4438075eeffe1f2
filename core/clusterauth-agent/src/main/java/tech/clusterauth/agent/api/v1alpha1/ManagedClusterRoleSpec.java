package tech.clusterauth.agent.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.rbac.PolicyRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ManagedClusterRoleSpec {

    private List<PolicyRule> rules = new ArrayList<>();

    public ManagedClusterRoleSpec() {
    }

    public ManagedClusterRoleSpec(List<PolicyRule> rules) {
        this.rules = rules;
    }

    public List<PolicyRule> getRules() {
        return rules;
    }

    public void setRules(List<PolicyRule> rules) {
        this.rules = rules;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ManagedClusterRoleSpec)) return false;
        return Objects.equals(rules, ((ManagedClusterRoleSpec) o).rules);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(rules);
    }
}

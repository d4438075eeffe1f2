package tech.clusterauth.agent.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.fabric8.kubernetes.api.model.rbac.Subject;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class ManagedClusterRoleBindingSpec {

    private List<Subject> subjects = new ArrayList<>();
    private ScopedRoleRef roleRef;

    public ManagedClusterRoleBindingSpec() {
    }

    public ManagedClusterRoleBindingSpec(List<Subject> subjects, ScopedRoleRef roleRef) {
        this.subjects = subjects;
        this.roleRef = roleRef;
    }

    public List<Subject> getSubjects() {
        return subjects;
    }

    public void setSubjects(List<Subject> subjects) {
        this.subjects = subjects;
    }

    public ScopedRoleRef getRoleRef() {
        return roleRef;
    }

    public void setRoleRef(ScopedRoleRef roleRef) {
        this.roleRef = roleRef;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ManagedClusterRoleBindingSpec)) return false;
        ManagedClusterRoleBindingSpec that = (ManagedClusterRoleBindingSpec) o;
        return Objects.equals(subjects, that.subjects) && Objects.equals(roleRef, that.roleRef);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjects, roleRef);
    }
}

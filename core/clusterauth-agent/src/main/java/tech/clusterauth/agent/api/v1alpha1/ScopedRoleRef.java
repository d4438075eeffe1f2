package tech.clusterauth.agent.api.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Reference to the role a grant hands out.
 *
 * <p>{@code namespaces} left unset means the role is bound cluster-wide as a
 * ClusterRole; a list means one namespaced RoleBinding per entry, referencing a Role.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScopedRoleRef {

    private String apiGroup;
    private String kind;
    private String name;
    private List<String> namespaces;

    public ScopedRoleRef() {
    }

    public ScopedRoleRef(String name, List<String> namespaces) {
        this.name = name;
        this.namespaces = namespaces;
    }

    public String getApiGroup() {
        return apiGroup;
    }

    public void setApiGroup(String apiGroup) {
        this.apiGroup = apiGroup;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getNamespaces() {
        return namespaces;
    }

    public void setNamespaces(List<String> namespaces) {
        this.namespaces = namespaces;
    }

    @JsonIgnore
    public RoleScope scope() {
        if (namespaces == null) {
            return RoleScope.clusterWide();
        }
        return RoleScope.namespaced(namespaces);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScopedRoleRef)) return false;
        ScopedRoleRef that = (ScopedRoleRef) o;
        return Objects.equals(apiGroup, that.apiGroup)
            && Objects.equals(kind, that.kind)
            && Objects.equals(name, that.name)
            && Objects.equals(namespaces, that.namespaces);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiGroup, kind, name, namespaces);
    }
}

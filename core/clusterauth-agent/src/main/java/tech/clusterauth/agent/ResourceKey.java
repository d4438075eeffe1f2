package tech.clusterauth.agent;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.Objects;

/**
 * Identity of a Kubernetes object: namespace (null for cluster-scoped objects) and name.
 */
public record ResourceKey(String namespace, String name) {

    public ResourceKey {
        Objects.requireNonNull(name, "name");
    }

    public static ResourceKey clusterScoped(String name) {
        return new ResourceKey(null, name);
    }

    public static ResourceKey of(HasMetadata resource) {
        return new ResourceKey(resource.getMetadata().getNamespace(), resource.getMetadata().getName());
    }

    public boolean isClusterScoped() {
        return namespace == null;
    }

    @Override
    public String toString() {
        return namespace == null ? name : namespace + "/" + name;
    }
}

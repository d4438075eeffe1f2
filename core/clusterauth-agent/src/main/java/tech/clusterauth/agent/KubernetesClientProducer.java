package tech.clusterauth.agent;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Produces the hub and spoke clients.
 *
 * <p>The hub client is the default {@link KubernetesClient} bean, replacing the one
 * Quarkus would configure, so the operator runtime watches grants on the hub. The
 * spoke client is qualified with {@link Spoke}.
 */
@ApplicationScoped
public class KubernetesClientProducer {

    private static final Logger LOG = Logger.getLogger(KubernetesClientProducer.class);

    @Inject
    AgentConfig config;

    @Produces
    @Singleton
    KubernetesClient hubClient() {
        return build("hub", config.hub().kubeconfig());
    }

    @Produces
    @Singleton
    @Spoke
    KubernetesClient spokeClient() {
        return build("spoke", config.spoke().kubeconfig());
    }

    void closeHub(@Disposes KubernetesClient client) {
        client.close();
    }

    void closeSpoke(@Disposes @Spoke KubernetesClient client) {
        client.close();
    }

    static KubernetesClient build(String cluster, Optional<String> kubeconfig) {
        if (kubeconfig.isEmpty()) {
            LOG.infof("Connecting to %s cluster with auto-configured client", cluster);
            return new KubernetesClientBuilder().build();
        }

        Path path = Path.of(kubeconfig.get());
        try {
            Config clientConfig = Config.fromKubeconfig(Files.readString(path));
            LOG.infof("Connecting to %s cluster at %s (kubeconfig %s)", cluster, clientConfig.getMasterUrl(), path);
            return new KubernetesClientBuilder().withConfig(clientConfig).build();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + cluster + " kubeconfig " + path, e);
        }
    }
}

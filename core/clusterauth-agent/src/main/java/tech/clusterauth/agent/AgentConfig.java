package tech.clusterauth.agent;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Spoke agent configuration.
 * The agent runs on the spoke cluster, watches grants on the hub and materializes
 * RBAC objects locally. Watch scope, retry and resync settings of the controllers
 * live under {@code quarkus.operator-sdk}.
 */
@ConfigMapping(prefix = "clusterauth.agent")
public interface AgentConfig {

    HubConnection hub();

    SpokeConnection spoke();

    Impersonator impersonator();

    interface HubConnection {

        /**
         * Path to the kubeconfig for the hub cluster.
         * When absent the client is auto-configured (KUBECONFIG, ~/.kube/config or in-cluster).
         */
        Optional<String> kubeconfig();
    }

    interface SpokeConnection {

        /**
         * Path to the kubeconfig for the spoke cluster. Absent means in-cluster.
         */
        Optional<String> kubeconfig();
    }

    /**
     * Service account of the spoke-side impersonation proxy. Bound by every
     * impersonation ClusterRoleBinding.
     */
    interface Impersonator {

        @WithDefault("cluster-gateway")
        String name();

        @WithDefault("open-cluster-management-managed-serviceaccount")
        String namespace();
    }
}

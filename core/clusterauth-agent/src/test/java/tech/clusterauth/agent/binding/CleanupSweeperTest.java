package tech.clusterauth.agent.binding;

import io.fabric8.kubernetes.api.model.ServiceAccountBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBindingBuilder;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBuilder;
import io.fabric8.kubernetes.api.model.rbac.RoleBindingBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.clusterauth.agent.sync.ResourceSynchronizer;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static tech.clusterauth.agent.test.TestResources.*;

@EnableKubernetesMockClient(crud = true)
class CleanupSweeperTest {

    KubernetesClient client;

    private CleanupSweeper sweeper;

    @BeforeEach
    void setUp() {
        sweeper = new CleanupSweeper(client);
    }

    @Test
    @DisplayName("deletes every kind carrying the grant's labels, in every namespace")
    void sweep_deletesAllMatchingObjects() {
        Map<String, String> labels = grantLabels("g1", "hub1");
        client.resource(new ServiceAccountBuilder()
            .withNewMetadata().withName("sa-g1").withNamespace("team-a").withLabels(labels).endMetadata()
            .build()).create();
        client.resource(new ClusterRoleBuilder()
            .withNewMetadata().withName("impersonate-alice-hub1").withLabels(labels).endMetadata()
            .build()).create();
        client.resource(new ClusterRoleBindingBuilder()
            .withNewMetadata().withName("g1").withLabels(labels).endMetadata()
            .withNewRoleRef().withKind("ClusterRole").withName("viewer").endRoleRef()
            .build()).create();
        for (String namespace : List.of("a", "b")) {
            client.resource(new RoleBindingBuilder()
                .withNewMetadata().withName("g1").withNamespace(namespace).withLabels(labels).endMetadata()
                .withNewRoleRef().withKind("Role").withName("editor").endRoleRef()
                .build()).create();
        }

        SweepReport report = sweeper.sweep(labels);

        assertThat(report.total()).isEqualTo(5);
        assertThat(report.deleted("RoleBinding")).isEqualTo(2);
        assertThat(report.unlisted()).isEmpty();
        assertThat(client.serviceAccounts().inAnyNamespace().withLabels(labels).list().getItems()).isEmpty();
        assertThat(client.rbac().clusterRoles().withLabels(labels).list().getItems()).isEmpty();
        assertThat(client.rbac().clusterRoleBindings().withLabels(labels).list().getItems()).isEmpty();
        assertThat(client.rbac().roleBindings().inAnyNamespace().withLabels(labels).list().getItems()).isEmpty();
    }

    @Test
    @DisplayName("leaves objects with a different label set alone")
    void sweep_keepsUnrelatedObjects() {
        client.resource(new ClusterRoleBuilder()
            .withNewMetadata().withName("impersonate-alice-hub1").withLabels(grantLabels("g1", "hub1")).endMetadata()
            .build()).create();
        client.resource(new ClusterRoleBuilder()
            .withNewMetadata().withName("impersonate-bob-hub1").withLabels(grantLabels("g2", "hub1")).endMetadata()
            .build()).create();
        client.resource(new ClusterRoleBuilder()
            .withNewMetadata().withName("cluster-admin").endMetadata()
            .build()).create();

        SweepReport report = sweeper.sweep(grantLabels("g1", "hub1"));

        assertThat(report.deleted("ClusterRole")).isEqualTo(1);
        assertThat(client.rbac().clusterRoles().withName("impersonate-alice-hub1").get()).isNull();
        assertThat(client.rbac().clusterRoles().withName("impersonate-bob-hub1").get()).isNotNull();
        assertThat(client.rbac().clusterRoles().withName("cluster-admin").get()).isNotNull();
    }

    @Test
    @DisplayName("keeps objects whose labels contain the grant's labels plus others")
    void sweep_keepsObjectsWithLargerLabelSet() {
        Map<String, String> owner = Map.of("owner", "hub1");
        Map<String, String> otherGrant = Map.of("owner", "hub1", "app", "g2");
        client.resource(new ClusterRoleBindingBuilder()
            .withNewMetadata().withName("g1").withLabels(owner).endMetadata()
            .withNewRoleRef().withKind("ClusterRole").withName("viewer").endRoleRef()
            .build()).create();
        client.resource(new ClusterRoleBindingBuilder()
            .withNewMetadata().withName("g2").withLabels(otherGrant).endMetadata()
            .withNewRoleRef().withKind("ClusterRole").withName("viewer").endRoleRef()
            .build()).create();
        client.resource(new RoleBindingBuilder()
            .withNewMetadata().withName("g2").withNamespace("a").withLabels(otherGrant).endMetadata()
            .withNewRoleRef().withKind("Role").withName("editor").endRoleRef()
            .build()).create();
        client.resource(new ClusterRoleBuilder()
            .withNewMetadata().withName("reader").withLabels(otherGrant).endMetadata()
            .build()).create();

        SweepReport report = sweeper.sweep(owner);

        assertThat(report.total()).isEqualTo(1);
        assertThat(client.rbac().clusterRoleBindings().withName("g1").get()).isNull();
        assertThat(client.rbac().clusterRoleBindings().withName("g2").get()).isNotNull();
        assertThat(client.rbac().roleBindings().inNamespace("a").withName("g2").get()).isNotNull();
        assertThat(client.rbac().clusterRoles().withName("reader").get()).isNotNull();
    }

    @Test
    @DisplayName("removes everything a materialization created")
    void sweep_afterMaterialize_leavesNothingDiscoverable() {
        PermissionMaterializer materializer =
            new PermissionMaterializer(new ResourceSynchronizer(client), IMPERSONATOR, IMPERSONATOR_NAMESPACE);
        ValidatedGrant grant = GrantValidator.validate(grant("g2", "bob", "hub1", "editor", List.of("a", "b", "c")));
        materializer.materialize(grant);

        SweepReport report = sweeper.sweep(grant.labels());

        assertThat(report.total()).isEqualTo(materializer.desiredObjects(grant).size());
        assertThat(client.rbac().clusterRoles().withLabels(grant.labels()).list().getItems()).isEmpty();
        assertThat(client.rbac().clusterRoleBindings().withLabels(grant.labels()).list().getItems()).isEmpty();
        assertThat(client.rbac().roleBindings().inAnyNamespace().withLabels(grant.labels()).list().getItems()).isEmpty();
    }

    @Test
    @DisplayName("finding nothing is a successful sweep")
    void sweep_nothingToDelete() {
        SweepReport report = sweeper.sweep(grantLabels("gone", "hub1"));

        assertThat(report.total()).isZero();
        assertThat(report.unlisted()).isEmpty();
    }

    @Test
    @DisplayName("refuses an empty label set, which would match every object")
    void sweep_rejectsEmptyLabels() {
        client.resource(new ClusterRoleBuilder()
            .withNewMetadata().withName("cluster-admin").endMetadata()
            .build()).create();

        assertThatThrownBy(() -> sweeper.sweep(Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(client.rbac().clusterRoles().withName("cluster-admin").get()).isNotNull();
    }

    @Test
    @DisplayName("listing failures are treated as nothing found")
    @SuppressWarnings("unchecked")
    void sweep_listingFailureIsSoft() {
        KubernetesClient failing = mock(KubernetesClient.class);
        when(failing.resources(any(Class.class))).thenThrow(new KubernetesClientException("forbidden", 403, null));

        SweepReport report = new CleanupSweeper(failing).sweep(grantLabels("g1", "hub1"));

        assertThat(report.total()).isZero();
        assertThat(report.unlisted()).containsExactlyInAnyOrder("ServiceAccount", "ClusterRole", "ClusterRoleBinding", "RoleBinding");
    }
}

package tech.clusterauth.agent.role;

import io.fabric8.kubernetes.api.model.rbac.ClusterRole;
import io.fabric8.kubernetes.api.model.rbac.ClusterRoleBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusHandler;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.MaxReconciliationInterval;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.processing.retry.GradualRetry;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.clusterauth.agent.InvalidResourceException;
import tech.clusterauth.agent.ResourceKey;
import tech.clusterauth.agent.Spoke;
import tech.clusterauth.agent.api.v1alpha1.ApiGroup;
import tech.clusterauth.agent.api.v1alpha1.ManagedClusterRole;
import tech.clusterauth.agent.sync.Mutator;
import tech.clusterauth.agent.sync.ResourceSynchronizer;
import tech.clusterauth.agent.sync.SyncOutcome;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Propagates a hub {@link ManagedClusterRole} to a spoke ClusterRole with the same
 * name, labels and rules, under the same finalizer protocol as grants.
 */
@ControllerConfiguration(
    name = ManagedClusterRoleReconciler.NAME,
    finalizerName = ApiGroup.FINALIZER,
    maxReconciliationInterval = @MaxReconciliationInterval(interval = 10, timeUnit = TimeUnit.MINUTES))
@GradualRetry(maxAttempts = -1, initialInterval = 1000, intervalMultiplier = 2.0, maxInterval = 300_000)
public class ManagedClusterRoleReconciler implements Reconciler<ManagedClusterRole>, Cleaner<ManagedClusterRole>,
        ErrorStatusHandler<ManagedClusterRole> {

    public static final String NAME = "managedclusterrole";

    private static final Logger LOG = Logger.getLogger(ManagedClusterRoleReconciler.class);

    private static final Mutator<ClusterRole> RULES = (desired, target) -> target.setRules(desired.getRules());

    private final KubernetesClient spokeClient;
    private final ResourceSynchronizer synchronizer;

    @Inject
    public ManagedClusterRoleReconciler(@Spoke KubernetesClient spokeClient, ResourceSynchronizer synchronizer) {
        this.spokeClient = spokeClient;
        this.synchronizer = synchronizer;
    }

    @Override
    public UpdateControl<ManagedClusterRole> reconcile(ManagedClusterRole role, Context<ManagedClusterRole> context) {
        if (role.getSpec() == null) {
            throw new InvalidResourceException(ResourceKey.of(role), "spec is missing");
        }
        SyncOutcome outcome = synchronizer.createOrUpdate(desiredClusterRole(role), RULES);
        LOG.debugf("Spoke ClusterRole %s %s", role.getMetadata().getName(), outcome);
        return UpdateControl.noUpdate();
    }

    @Override
    public DeleteControl cleanup(ManagedClusterRole role, Context<ManagedClusterRole> context) {
        String name = role.getMetadata().getName();
        spokeClient.rbac().clusterRoles().withName(name).delete();
        LOG.infof("Deleted spoke ClusterRole %s", name);
        return DeleteControl.defaultDelete();
    }

    @Override
    public ErrorStatusUpdateControl<ManagedClusterRole> updateErrorStatus(
            ManagedClusterRole role, Context<ManagedClusterRole> context, Exception e) {
        if (e instanceof InvalidResourceException) {
            LOG.errorf("Cannot propagate ManagedClusterRole %s: %s", role.getMetadata().getName(), e.getMessage());
            return ErrorStatusUpdateControl.<ManagedClusterRole>noStatusUpdate().withNoRetry();
        }
        return ErrorStatusUpdateControl.noStatusUpdate();
    }

    static ClusterRole desiredClusterRole(ManagedClusterRole role) {
        Map<String, String> labels = role.getMetadata().getLabels();
        return new ClusterRoleBuilder()
            .withNewMetadata()
                .withName(role.getMetadata().getName())
                .withLabels(labels == null ? null : new HashMap<>(labels))
            .endMetadata()
            .withRules(role.getSpec().getRules())
            .build();
    }
}

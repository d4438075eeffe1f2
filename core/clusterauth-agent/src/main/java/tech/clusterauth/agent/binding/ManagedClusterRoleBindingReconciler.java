package tech.clusterauth.agent.binding;

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
import tech.clusterauth.agent.api.v1alpha1.ApiGroup;
import tech.clusterauth.agent.api.v1alpha1.ManagedClusterRoleBinding;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Reconciles {@link ManagedClusterRoleBinding} grants watched on the hub.
 *
 * <pre>
 *   no finalizer, not deleted  -> runtime adds the finalizer, then reconcile
 *   finalizer, not deleted     -> reconcile: validate, materialize
 *   finalizer, deleted         -> cleanup: sweep spoke objects, then release the finalizer
 *   no finalizer, deleted      -> nothing, the store erases the grant
 * </pre>
 *
 * Every step is idempotent and the first failure propagates, so the runtime retries
 * with backoff and the finalizer stays in place until a later cleanup succeeds.
 */
@ControllerConfiguration(
    name = ManagedClusterRoleBindingReconciler.NAME,
    finalizerName = ApiGroup.FINALIZER,
    maxReconciliationInterval = @MaxReconciliationInterval(interval = 10, timeUnit = TimeUnit.MINUTES))
@GradualRetry(maxAttempts = -1, initialInterval = 1000, intervalMultiplier = 2.0, maxInterval = 300_000)
public class ManagedClusterRoleBindingReconciler implements Reconciler<ManagedClusterRoleBinding>,
        Cleaner<ManagedClusterRoleBinding>, ErrorStatusHandler<ManagedClusterRoleBinding> {

    public static final String NAME = "managedclusterrolebinding";

    private static final Logger LOG = Logger.getLogger(ManagedClusterRoleBindingReconciler.class);

    private final PermissionMaterializer materializer;
    private final CleanupSweeper sweeper;

    @Inject
    public ManagedClusterRoleBindingReconciler(PermissionMaterializer materializer, CleanupSweeper sweeper) {
        this.materializer = materializer;
        this.sweeper = sweeper;
    }

    @Override
    public UpdateControl<ManagedClusterRoleBinding> reconcile(ManagedClusterRoleBinding grant,
                                                              Context<ManagedClusterRoleBinding> context) {
        ValidatedGrant validated = GrantValidator.validate(grant);
        LOG.debugf("Materializing grant %s for %s", ResourceKey.of(grant), validated.subject());
        materializer.materialize(validated);
        return UpdateControl.noUpdate();
    }

    @Override
    public DeleteControl cleanup(ManagedClusterRoleBinding grant, Context<ManagedClusterRoleBinding> context) {
        ResourceKey key = ResourceKey.of(grant);
        Map<String, String> labels = grant.getMetadata().getLabels();
        if (labels == null || labels.isEmpty()) {
            LOG.warnf("Grant %s has no labels, spoke objects cannot be located; releasing without cleanup", key);
            return DeleteControl.defaultDelete();
        }

        SweepReport report = sweeper.sweep(labels);
        if (!report.unlisted().isEmpty()) {
            LOG.warnf("Grant %s cleanup could not list %s", key, report.unlisted());
        }
        LOG.infof("Grant %s cleanup removed %d spoke objects %s", key, report.total(), report.deleted());
        return DeleteControl.defaultDelete();
    }

    /**
     * A malformed grant cannot converge until it is edited, and the edit itself
     * triggers a new reconciliation, so it is not retried.
     */
    @Override
    public ErrorStatusUpdateControl<ManagedClusterRoleBinding> updateErrorStatus(
            ManagedClusterRoleBinding grant, Context<ManagedClusterRoleBinding> context, Exception e) {
        if (e instanceof InvalidResourceException) {
            LOG.errorf("Cannot reconcile grant %s, waiting for it to change: %s", ResourceKey.of(grant), e.getMessage());
            return ErrorStatusUpdateControl.<ManagedClusterRoleBinding>noStatusUpdate().withNoRetry();
        }
        LOG.warnf(e, "Reconciling grant %s failed, retrying", ResourceKey.of(grant));
        return ErrorStatusUpdateControl.noStatusUpdate();
    }
}

package tech.clusterauth.agent.api.v1alpha1;

/**
 * API group constants for the clusterauth custom resources, and the label keys
 * the hub stamps on them.
 */
public final class ApiGroup {

    public static final String NAME = "authorization.k8s.clusterauth.tech";
    public static final String VERSION = "v1alpha1";

    /** Finalizer placed on hub resources while spoke-side objects exist. */
    public static final String FINALIZER = NAME + "/spoke-authorization";

    /** Label carrying the id of the hub user that owns the resource. */
    public static final String USER_ID_LABEL = "authentication.k8s.clusterauth.tech/user-id";

    /** Label carrying the id of the hub owner, used to derive impersonation object names. */
    public static final String HUB_OWNER_ID_LABEL = "authentication.k8s.clusterauth.tech/hub-owner-id";

    private ApiGroup() {
    }
}

package tech.clusterauth.agent.binding;

/**
 * Deterministic names of the impersonation objects.
 * Names depend only on (subject, hub owner), so every reconciliation of the same pair
 * converges on the same objects.
 */
public final class ImpersonationNames {

    private static final String PREFIX = "impersonate-";
    private static final String BINDING_SUFFIX = "-rolebinding";

    private ImpersonationNames() {
    }

    /** {@code impersonate-<subject>-<owner>} */
    public static String roleName(String subject, String hubOwnerId) {
        return PREFIX + subject + "-" + hubOwnerId;
    }

    /** {@code impersonate-<subject>-<owner>-rolebinding} */
    public static String bindingName(String subject, String hubOwnerId) {
        return roleName(subject, hubOwnerId) + BINDING_SUFFIX;
    }
}

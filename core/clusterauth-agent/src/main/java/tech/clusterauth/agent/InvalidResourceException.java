package tech.clusterauth.agent;

/**
 * A hub resource is malformed and cannot be reconciled until it is edited.
 * Retrying without a change cannot succeed.
 */
public class InvalidResourceException extends RuntimeException {

    private final ResourceKey key;

    public InvalidResourceException(ResourceKey key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public ResourceKey key() {
        return key;
    }
}

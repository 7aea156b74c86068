package fr.lapetina.ringbalancer.domain.exception;

import fr.lapetina.ringbalancer.domain.model.ErrorType;

/**
 * Exception thrown by the routing core.
 *
 * Every failure carries an {@link ErrorType} so that callers (the HTTP layer,
 * tests) can branch on the kind of error instead of parsing messages.
 */
public final class LoadBalancerException extends RuntimeException {

    private final ErrorType errorType;

    public LoadBalancerException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public static LoadBalancerException duplicateServer(String serverId) {
        return new LoadBalancerException(ErrorType.DUPLICATE_SERVER, "Server already registered: " + serverId);
    }

    public static LoadBalancerException serverNotFound(String serverId) {
        return new LoadBalancerException(ErrorType.SERVER_NOT_FOUND, "Server not found: " + serverId);
    }

    public static LoadBalancerException invalidWeight(String serverId, int weight) {
        return new LoadBalancerException(ErrorType.INVALID_WEIGHT,
                "Weight must be at least 1: serverId=" + serverId + ", weight=" + weight);
    }

    public static LoadBalancerException weightTooLarge(String serverId, int weight, int maxVirtualNodes) {
        return new LoadBalancerException(ErrorType.INVALID_WEIGHT,
                "Weight exceeds the virtual node limit of " + maxVirtualNodes + " per server: serverId="
                        + serverId + ", weight=" + weight);
    }
}

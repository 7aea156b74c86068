package fr.lapetina.ringbalancer.domain.model;

/**
 * Error taxonomy surfaced by the routing core.
 * Provides clear categorization for error handling and HTTP status mapping.
 */
public enum ErrorType {
    /** A server with the same identity is already registered */
    DUPLICATE_SERVER,

    /** The referenced server is not registered */
    SERVER_NOT_FOUND,

    /** Weight below 1; rejected before any mutation */
    INVALID_WEIGHT,

    /** Lookup on a hash ring that holds no virtual nodes */
    EMPTY_RING,

    /** Selection requested while no servers are registered */
    NO_SERVERS_AVAILABLE,

    /** Servers are registered but none is currently healthy */
    NO_HEALTHY_SERVER
}

package fr.lapetina.ringbalancer.domain.ring;

import fr.lapetina.ringbalancer.domain.hash.HashFunction;

import java.util.Comparator;
import java.util.Objects;

/**
 * One position a physical server occupies on the ring.
 *
 * The hash value is computed once from {@code serverId + ":" + replicaIndex}.
 * Equality is by (serverId, replicaIndex) only. {@code sequence} is the insertion
 * sequence of the owning server and only serves to order colliding hash values.
 */
public final class VirtualNode {

    /**
     * Ring order: hash value, then insertion sequence, then server id, then replica index.
     */
    static final Comparator<VirtualNode> RING_ORDER = Comparator
            .comparingLong(VirtualNode::getHashValue)
            .thenComparingLong(VirtualNode::getSequence)
            .thenComparing(VirtualNode::getServerId)
            .thenComparingInt(VirtualNode::getReplicaIndex);

    private final String serverId;
    private final int replicaIndex;
    private final long hashValue;
    private final long sequence;

    VirtualNode(String serverId, int replicaIndex, long hashValue, long sequence) {
        this.serverId = Objects.requireNonNull(serverId, "Server ID is required");
        this.replicaIndex = replicaIndex;
        this.hashValue = hashValue;
        this.sequence = sequence;
    }

    /**
     * Creates the virtual node for one replica of a server.
     */
    public static VirtualNode create(String serverId, int replicaIndex, HashFunction hashFunction) {
        return create(serverId, replicaIndex, hashFunction, 0);
    }

    static VirtualNode create(String serverId, int replicaIndex, HashFunction hashFunction, long sequence) {
        return new VirtualNode(serverId, replicaIndex, hashFunction.hash(replicaKey(serverId, replicaIndex)), sequence);
    }

    /**
     * The string hashed to place a replica on the ring.
     */
    public static String replicaKey(String serverId, int replicaIndex) {
        return serverId + ":" + replicaIndex;
    }

    public String getServerId() {
        return serverId;
    }

    public int getReplicaIndex() {
        return replicaIndex;
    }

    public long getHashValue() {
        return hashValue;
    }

    long getSequence() {
        return sequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        VirtualNode that = (VirtualNode) o;
        return replicaIndex == that.replicaIndex && serverId.equals(that.serverId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serverId, replicaIndex);
    }

    @Override
    public String toString() {
        return "VirtualNode{" +
                "serverId='" + serverId + '\'' +
                ", replica=" + replicaIndex +
                ", hash=" + hashValue +
                '}';
    }
}

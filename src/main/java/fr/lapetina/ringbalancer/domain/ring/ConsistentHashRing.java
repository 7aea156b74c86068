package fr.lapetina.ringbalancer.domain.ring;

import fr.lapetina.ringbalancer.domain.exception.LoadBalancerException;
import fr.lapetina.ringbalancer.domain.hash.HashFunction;
import fr.lapetina.ringbalancer.domain.model.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Consistent hash ring with weighted virtual nodes.
 *
 * Each server owns {@code weight * baseVirtualNodes} positions on the ring. A key
 * belongs to the owner of the first position whose hash is greater than or equal
 * to the key's hash, wrapping around to the smallest position.
 *
 * Thread-safety: the ring content is an immutable {@link Snapshot} published
 * through a volatile field. Lookups read one snapshot and never lock; mutations
 * are serialized, build a new snapshot off to the side and publish it in a single
 * write, so a lookup sees either the old or the new topology and never a
 * half-applied one.
 */
public final class ConsistentHashRing {

    private static final Logger log = LoggerFactory.getLogger(ConsistentHashRing.class);

    public static final int DEFAULT_VIRTUAL_NODES = 100;

    /** Upper bound on {@code weight * baseVirtualNodes} for a single server. */
    public static final int MAX_VIRTUAL_NODES_PER_SERVER = 1_000_000;

    private final HashFunction placementHash;
    private final HashFunction keyHash;
    private final int baseVirtualNodes;

    private final ReentrantLock writeLock = new ReentrantLock();
    private long nextSequence = 1; // guarded by writeLock
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    public ConsistentHashRing(HashFunction hashFunction, int baseVirtualNodes) {
        this(hashFunction, hashFunction, baseVirtualNodes);
    }

    /**
     * Creates a ring that places virtual nodes and keys with different hash functions.
     *
     * @param placementHash    hashes replica keys into ring positions
     * @param keyHash          hashes lookup keys
     * @param baseVirtualNodes virtual nodes per unit of weight
     * @throws IllegalArgumentException if the two functions have different output domains
     */
    public ConsistentHashRing(HashFunction placementHash, HashFunction keyHash, int baseVirtualNodes) {
        this.placementHash = Objects.requireNonNull(placementHash, "Placement hash function is required");
        this.keyHash = Objects.requireNonNull(keyHash, "Key hash function is required");
        if (placementHash.outputBits() != keyHash.outputBits()) {
            throw new IllegalArgumentException("Hash functions must share the same output domain: placement="
                    + placementHash.outputBits() + " bits, key=" + keyHash.outputBits() + " bits");
        }
        if (placementHash.outputBits() < 1 || placementHash.outputBits() > 63) {
            throw new IllegalArgumentException("Hash output width must be between 1 and 63 bits: "
                    + placementHash.outputBits());
        }
        if (baseVirtualNodes < 1) {
            throw new IllegalArgumentException("Base virtual node count must be at least 1: " + baseVirtualNodes);
        }
        this.baseVirtualNodes = baseVirtualNodes;
    }

    // ==================== MUTATIONS ====================

    /**
     * Adds a server with {@code weight * baseVirtualNodes} virtual nodes.
     *
     * @throws LoadBalancerException DUPLICATE_SERVER or INVALID_WEIGHT
     */
    public void addServer(String serverId, int weight) {
        Map<String, Integer> single = new LinkedHashMap<>();
        single.put(serverId, weight);
        addServers(single);
    }

    /**
     * Adds several servers in one publication. Either all of them are added or,
     * if any entry is invalid, none is. Servers added together share one insertion
     * sequence, so hash collisions between them are ordered by server id.
     *
     * @throws LoadBalancerException DUPLICATE_SERVER or INVALID_WEIGHT
     */
    public void addServers(Map<String, Integer> weights) {
        if (weights.isEmpty()) {
            return;
        }
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            for (Map.Entry<String, Integer> entry : weights.entrySet()) {
                Objects.requireNonNull(entry.getKey(), "Server ID is required");
                checkWeight(entry.getKey(), entry.getValue() == null ? 0 : entry.getValue());
                if (current.servers.containsKey(entry.getKey())) {
                    throw LoadBalancerException.duplicateServer(entry.getKey());
                }
            }

            long sequence = nextSequence++;
            List<VirtualNode> added = new ArrayList<>();
            Map<String, ServerEntry> servers = new LinkedHashMap<>(current.servers);
            for (Map.Entry<String, Integer> entry : weights.entrySet()) {
                added.addAll(createVirtualNodes(entry.getKey(), entry.getValue(), sequence));
                servers.put(entry.getKey(), new ServerEntry(entry.getValue(), sequence));
            }

            snapshot = new Snapshot(merge(current.nodes, added), servers);
            log.debug("Servers added to ring: serverIds={}, virtualNodesAdded={}, totalVirtualNodes={}",
                    weights.keySet(), added.size(), snapshot.nodes.length);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes a server and every one of its virtual nodes.
     *
     * @throws LoadBalancerException SERVER_NOT_FOUND
     */
    public void removeServer(String serverId) {
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            if (!current.servers.containsKey(serverId)) {
                throw LoadBalancerException.serverNotFound(serverId);
            }

            Map<String, ServerEntry> servers = new LinkedHashMap<>(current.servers);
            servers.remove(serverId);
            snapshot = new Snapshot(without(current.nodes, serverId), servers);
            log.debug("Server removed from ring: serverId={}, totalVirtualNodes={}",
                    serverId, snapshot.nodes.length);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Replaces a server's virtual nodes to match a new weight, in one publication.
     * The server keeps its original insertion sequence.
     *
     * @throws LoadBalancerException SERVER_NOT_FOUND or INVALID_WEIGHT
     */
    public void updateWeight(String serverId, int weight) {
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            ServerEntry entry = current.servers.get(serverId);
            if (entry == null) {
                throw LoadBalancerException.serverNotFound(serverId);
            }
            checkWeight(serverId, weight);
            if (entry.weight() == weight) {
                return;
            }

            Map<String, ServerEntry> servers = new LinkedHashMap<>(current.servers);
            servers.put(serverId, new ServerEntry(weight, entry.sequence()));
            List<VirtualNode> replacement = createVirtualNodes(serverId, weight, entry.sequence());
            snapshot = new Snapshot(merge(without(current.nodes, serverId), replacement), servers);
            log.debug("Server weight updated on ring: serverId={}, weight={} -> {}",
                    serverId, entry.weight(), weight);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Checks that a weight is at least 1 and gives the server no more than
     * {@link #MAX_VIRTUAL_NODES_PER_SERVER} virtual nodes on this ring.
     *
     * @throws LoadBalancerException INVALID_WEIGHT
     */
    public void checkWeight(String serverId, int weight) {
        if (weight < 1) {
            throw LoadBalancerException.invalidWeight(serverId, weight);
        }
        if ((long) weight * baseVirtualNodes > MAX_VIRTUAL_NODES_PER_SERVER) {
            throw LoadBalancerException.weightTooLarge(serverId, weight, MAX_VIRTUAL_NODES_PER_SERVER);
        }
    }

    private List<VirtualNode> createVirtualNodes(String serverId, int weight, long sequence) {
        int count = weight * baseVirtualNodes;
        List<VirtualNode> nodes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            nodes.add(VirtualNode.create(serverId, i, placementHash, sequence));
        }
        return nodes;
    }

    private static VirtualNode[] merge(VirtualNode[] existing, List<VirtualNode> added) {
        VirtualNode[] sortedAdded = added.toArray(new VirtualNode[0]);
        Arrays.sort(sortedAdded, VirtualNode.RING_ORDER);

        VirtualNode[] merged = new VirtualNode[existing.length + sortedAdded.length];
        int i = 0;
        int j = 0;
        int k = 0;
        while (i < existing.length && j < sortedAdded.length) {
            if (VirtualNode.RING_ORDER.compare(existing[i], sortedAdded[j]) <= 0) {
                merged[k++] = existing[i++];
            } else {
                merged[k++] = sortedAdded[j++];
            }
        }
        while (i < existing.length) {
            merged[k++] = existing[i++];
        }
        while (j < sortedAdded.length) {
            merged[k++] = sortedAdded[j++];
        }
        return merged;
    }

    private static VirtualNode[] without(VirtualNode[] nodes, String serverId) {
        return Arrays.stream(nodes)
                .filter(node -> !node.getServerId().equals(serverId))
                .toArray(VirtualNode[]::new);
    }

    // ==================== LOOKUPS ====================

    /**
     * Resolves a key to the server owning the first virtual node at or after the
     * key's hash, wrapping around to the start of the ring.
     *
     * @throws LoadBalancerException EMPTY_RING if no server is registered
     */
    public String lookup(String key) {
        Snapshot current = snapshot;
        if (current.nodes.length == 0) {
            throw new LoadBalancerException(ErrorType.EMPTY_RING, "Hash ring is empty");
        }
        return current.nodes[current.startIndex(keyHash.hash(key))].getServerId();
    }

    /**
     * Returns the virtual node a key lands on, or null on an empty ring.
     */
    public VirtualNode lookupVirtualNode(String key) {
        Snapshot current = snapshot;
        if (current.nodes.length == 0) {
            return null;
        }
        return current.nodes[current.startIndex(keyHash.hash(key))];
    }

    /**
     * Walks the ring clockwise from the key's position and collects up to {@code n}
     * distinct servers, in the order they are met. The first element is always
     * {@link #lookup(String)}'s answer.
     *
     * @return distinct server ids; empty if the ring is empty or {@code n <= 0}
     */
    public List<String> lookupCandidates(String key, int n) {
        Snapshot current = snapshot;
        if (current.nodes.length == 0 || n <= 0) {
            return List.of();
        }

        int wanted = Math.min(n, current.servers.size());
        List<String> candidates = new ArrayList<>(wanted);
        Set<String> seen = new HashSet<>();
        int start = current.startIndex(keyHash.hash(key));
        int length = current.nodes.length;

        for (int i = 0; i < length && candidates.size() < wanted; i++) {
            String serverId = current.nodes[(start + i) % length].getServerId();
            if (seen.add(serverId)) {
                candidates.add(serverId);
            }
        }
        return Collections.unmodifiableList(candidates);
    }

    /**
     * Hash of a lookup key, as used by {@link #lookup(String)}.
     */
    public long hash(String key) {
        return keyHash.hash(key);
    }

    // ==================== INSPECTION ====================

    public boolean contains(String serverId) {
        return snapshot.servers.containsKey(serverId);
    }

    /**
     * Number of physical servers on the ring.
     */
    public int size() {
        return snapshot.servers.size();
    }

    public boolean isEmpty() {
        return snapshot.nodes.length == 0;
    }

    public int virtualNodeCount() {
        return snapshot.nodes.length;
    }

    public int getBaseVirtualNodes() {
        return baseVirtualNodes;
    }

    /**
     * Ids of the servers on the ring, in insertion order.
     */
    public List<String> serverIds() {
        return List.copyOf(snapshot.servers.keySet());
    }

    /**
     * Weight a server was added with, or 0 if it is not on the ring.
     */
    public int weightOf(String serverId) {
        ServerEntry entry = snapshot.servers.get(serverId);
        return entry == null ? 0 : entry.weight();
    }

    /**
     * Virtual node count per server, in insertion order.
     */
    public Map<String, Integer> virtualNodeCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        snapshot.servers.forEach((id, entry) -> counts.put(id, entry.weight() * baseVirtualNodes));
        return Collections.unmodifiableMap(counts);
    }

    /**
     * The first {@code limit} virtual nodes in ring order.
     */
    public List<VirtualNode> virtualNodes(int limit) {
        VirtualNode[] nodes = snapshot.nodes;
        return List.of(Arrays.copyOf(nodes, Math.min(Math.max(limit, 0), nodes.length)));
    }

    /**
     * Per-server ring bookkeeping.
     */
    private record ServerEntry(int weight, long sequence) {
    }

    /**
     * Immutable ring content. {@code hashes[i] == nodes[i].getHashValue()}.
     */
    private static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(new VirtualNode[0], Map.of());

        final VirtualNode[] nodes;
        final long[] hashes;
        final Map<String, ServerEntry> servers;

        Snapshot(VirtualNode[] nodes, Map<String, ServerEntry> servers) {
            this.nodes = nodes;
            this.hashes = new long[nodes.length];
            for (int i = 0; i < nodes.length; i++) {
                hashes[i] = nodes[i].getHashValue();
            }
            this.servers = Collections.unmodifiableMap(servers);
        }

        /**
         * Index of the first node with hash >= {@code hash}, 0 when past the end.
         */
        int startIndex(long hash) {
            int low = 0;
            int high = hashes.length;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (hashes[mid] < hash) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            return low == hashes.length ? 0 : low;
        }
    }
}

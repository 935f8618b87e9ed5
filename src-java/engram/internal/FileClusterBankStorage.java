package engram.internal;

import engram.Neuron;
import org.greymatter.engram.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.ref.SoftReference;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ClusterBankStorage} backed by one file per partition under
 * {@code <root>/banks/p<NN>.bank}.
 *
 * <p>A decoded bank is a map of cluster id to its encoded segment. It is cached
 * per partition through a {@link SoftReference}, so hydrating several clusters
 * of the same partition reads the file once, and the cache gives way under
 * memory pressure. Neurons are decoded fresh on every {@link #restore}, so
 * callers never share mutable state with the cache.
 *
 * <p>Writes merge the updated segments into the existing bank and replace the
 * file atomically. Each partition has its own lock; different partitions may be
 * written concurrently.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class FileClusterBankStorage implements ClusterBankStorage {

    private static final Logger logger = LoggerFactory.getLogger(FileClusterBankStorage.class);

    private final Path banksDir;
    private final boolean compress;
    private final Object[] locks;
    private final SoftReference<Map<String, byte[]>>[] cache;

    @SuppressWarnings("unchecked")
    public FileClusterBankStorage(Path root, int partitionCount, boolean compress) {
        if (partitionCount < 1) {
            throw new IllegalArgumentException("partitionCount must be positive, got " + partitionCount);
        }
        this.banksDir = root.resolve("banks");
        this.compress = compress;
        this.locks = new Object[partitionCount];
        for (int i = 0; i < partitionCount; i++) {
            locks[i] = new Object();
        }
        this.cache = new SoftReference[partitionCount];
    }

    public Path bankPath(int partition) {
        return banksDir.resolve(String.format("p%02d.bank", partition));
    }

    @Override
    public Optional<List<Neuron>> restore(int partition, String clusterId) {
        byte[] segment;
        synchronized (locks[partition]) {
            segment = segments(partition).get(clusterId);
        }
        if (segment == null) {
            return Optional.empty();
        }
        return Optional.of(BinaryFormats.decodeCluster(segment, bankPath(partition) + "#" + clusterId));
    }

    @Override
    public void store(int partition, Map<String, List<Neuron>> clusters) {
        if (clusters.isEmpty()) {
            return;
        }
        synchronized (locks[partition]) {
            Map<String, byte[]> merged = new LinkedHashMap<>(segments(partition));
            for (Map.Entry<String, List<Neuron>> e : clusters.entrySet()) {
                merged.put(e.getKey(), BinaryFormats.encodeCluster(e.getValue()));
            }
            Path path = bankPath(partition);
            try {
                AtomicFiles.write(path, BinaryFormats.encodeBank(partition, merged, compress));
            } catch (IOException e) {
                throw new StorageException("Failed to write bank " + path, e);
            }
            cache[partition] = new SoftReference<>(merged);
            logger.debug("Wrote {} clusters ({} updated) to {}", merged.size(), clusters.size(), path);
        }
    }

    @Override
    public long partitionBytes(int partition) {
        Path path = bankPath(partition);
        try {
            return Files.exists(path) ? Files.size(path) : 0L;
        } catch (IOException e) {
            logger.warn("Cannot stat {}: {}", path, e.getMessage());
            return 0L;
        }
    }

    @Override
    public int clusterCount(int partition) {
        synchronized (locks[partition]) {
            return segments(partition).size();
        }
    }

    public int partitionCount() {
        return locks.length;
    }

    /**
     * Forget cached banks; the next access re-reads from disk.
     */
    public void invalidate() {
        for (int i = 0; i < locks.length; i++) {
            synchronized (locks[i]) {
                cache[i] = null;
            }
        }
    }

    // Caller holds locks[partition].
    private Map<String, byte[]> segments(int partition) {
        SoftReference<Map<String, byte[]>> ref = cache[partition];
        Map<String, byte[]> cached = ref == null ? null : ref.get();
        if (cached != null) {
            return cached;
        }
        Path path = bankPath(partition);
        if (!Files.exists(path)) {
            return Collections.emptyMap();
        }
        Map<String, byte[]> loaded;
        try {
            loaded = BinaryFormats.decodeBank(Files.readAllBytes(path), path.toString());
        } catch (IOException e) {
            throw new StorageException("Failed to read bank " + path, e);
        }
        cache[partition] = new SoftReference<>(loaded);
        return loaded;
    }
}

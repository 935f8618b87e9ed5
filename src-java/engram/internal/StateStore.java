package engram.internal;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import engram.CodebookSnapshot;
import engram.Synapse;
import org.greymatter.engram.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * On-disk layout of a memory's state directory.
 *
 * <pre>
 * &lt;root&gt;/
 *   cluster-index.json       cluster metadata, id sequence, concept affinity
 *   region-map.json          region code to cluster ids
 *   activation-stats.json    per-region counters and history
 *   feature-map.json         feature name to neuron input id
 *   concept-capacities.json  per-concept target neuron counts
 *   codebook.bin             quantizer codebook (codebook quantizer only)
 *   synapses.bin             synaptic graph
 *   banks/p&lt;NN&gt;.bank        neurons, one bank per partition
 * </pre>
 *
 * <p>JSON goes through Jackson; binary files through {@link BinaryFormats}. All
 * writes are atomic. A missing file reads as empty; an unreadable one raises
 * {@link StorageException}.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class StateStore {

    private static final Logger logger = LoggerFactory.getLogger(StateStore.class);

    public static final String CLUSTER_INDEX = "cluster-index.json";
    public static final String REGION_MAP = "region-map.json";
    public static final String ACTIVATION_STATS = "activation-stats.json";
    public static final String FEATURE_MAP = "feature-map.json";
    public static final String CAPACITIES = "concept-capacities.json";
    public static final String CODEBOOK = "codebook.bin";
    public static final String SYNAPSES = "synapses.bin";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final Path root;
    private final FileClusterBankStorage banks;

    public StateStore(Path root, int partitionCount, boolean compressBanks) {
        this.root = root;
        this.banks = new FileClusterBankStorage(root, partitionCount, compressBanks);
    }

    /**
     * Create the state directory if needed.
     */
    public void open() {
        try {
            Files.createDirectories(root.resolve("banks"));
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + root, e);
        }
    }

    public Path root() {
        return root;
    }

    public FileClusterBankStorage banks() {
        return banks;
    }

    // =========================================================================
    // JSON documents
    // =========================================================================

    public <T extends Documents.Versioned> Optional<T> readDocument(String name, Class<T> type) {
        Path path = root.resolve(name);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        T doc;
        try {
            doc = MAPPER.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + path, e);
        }
        if (doc == null) {
            throw new StorageException("Empty document " + path);
        }
        if (doc.version != Documents.CURRENT_VERSION) {
            throw new StorageException("Unsupported version " + doc.version + " in " + path);
        }
        return Optional.of(doc);
    }

    public void writeDocument(String name, Documents.Versioned doc) {
        Path path = root.resolve(name);
        try {
            AtomicFiles.write(path, MAPPER.writeValueAsBytes(doc));
        } catch (IOException e) {
            throw new StorageException("Failed to write " + path, e);
        }
    }

    // =========================================================================
    // Binary state
    // =========================================================================

    public Optional<CodebookSnapshot> readCodebook() {
        return readBinary(CODEBOOK).map(bytes -> BinaryFormats.decodeCodebook(bytes, root.resolve(CODEBOOK).toString()));
    }

    public void writeCodebook(CodebookSnapshot snapshot) {
        writeBinary(CODEBOOK, BinaryFormats.encodeCodebook(snapshot));
    }

    public Optional<List<Synapse>> readSynapses() {
        return readBinary(SYNAPSES).map(bytes -> BinaryFormats.decodeSynapses(bytes, root.resolve(SYNAPSES).toString()));
    }

    public void writeSynapses(List<Synapse> synapses) {
        writeBinary(SYNAPSES, BinaryFormats.encodeSynapses(synapses));
    }

    /**
     * Bytes used by every file in the state directory.
     */
    public long totalBytes() {
        if (!Files.isDirectory(root)) {
            return 0L;
        }
        try (var files = Files.walk(root)) {
            return files.filter(Files::isRegularFile).mapToLong(p -> {
                try {
                    return Files.size(p);
                } catch (IOException e) {
                    logger.warn("Cannot stat {}: {}", p, e.getMessage());
                    return 0L;
                }
            }).sum();
        } catch (IOException e) {
            throw new StorageException("Failed to scan " + root, e);
        }
    }

    private Optional<byte[]> readBinary(String name) {
        Path path = root.resolve(name);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new StorageException("Failed to read " + path, e);
        }
    }

    private void writeBinary(String name, byte[] bytes) {
        Path path = root.resolve(name);
        try {
            AtomicFiles.write(path, bytes);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + path, e);
        }
    }
}

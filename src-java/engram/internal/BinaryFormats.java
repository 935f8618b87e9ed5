package engram.internal;

import engram.CodebookSnapshot;
import engram.Neuron;
import engram.NeuronRole;
import engram.Synapse;
import org.greymatter.engram.StorageException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Little-endian binary codecs for the codebook, the synapse graph and the
 * partition banks.
 *
 * <p>Every file starts with a 64-byte header: a 4-byte magic, a format version,
 * then format-specific fields, zero padded. Bank bodies may be gzip compressed,
 * which is flagged in the header.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class BinaryFormats {

    public static final int HEADER_SIZE = 64;
    public static final int VERSION = 1;

    static final int CODEBOOK_MAGIC = 0x42434E45; // "ENCB"
    static final int SYNAPSE_MAGIC = 0x59534E45;  // "ENSY"
    static final int BANK_MAGIC = 0x4B424E45;     // "ENBK"

    static final int FLAG_GZIP = 1;

    private static final NeuronRole[] ROLES = NeuronRole.values();

    private BinaryFormats() {}

    // =========================================================================
    // Codebook
    // =========================================================================

    public static byte[] encodeCodebook(CodebookSnapshot s) {
        int codes = s.getCodebookSize();
        int dims = s.getDimensions();
        LittleEndianOutput out = new LittleEndianOutput(HEADER_SIZE + codes * (dims * 8 + 12));
        out.writeInt(CODEBOOK_MAGIC)
           .writeInt(VERSION)
           .writeInt(codes)
           .writeInt(dims)
           .writeFloat(s.getCommitment())
           .writeFloat(s.getEmaDecay())
           .writeLong(s.getTotalEncodings())
           .padTo(HEADER_SIZE);
        for (float[] code : s.getCodebook()) {
            out.writeFloats(code);
        }
        out.writeFloats(s.getEmaClusterSize());
        for (float[] sum : s.getEmaCodebookSum()) {
            out.writeFloats(sum);
        }
        for (long usage : s.getUsageCounts()) {
            out.writeLong(usage);
        }
        return out.toByteArray();
    }

    public static CodebookSnapshot decodeCodebook(byte[] bytes, String source) {
        LittleEndianInput in = new LittleEndianInput(bytes, source);
        checkHeader(in, CODEBOOK_MAGIC);
        int codes = in.readInt();
        int dims = in.readInt();
        float commitment = in.readFloat();
        float emaDecay = in.readFloat();
        long total = in.readLong();
        if (codes < 0 || dims < 0) {
            throw new StorageException("Corrupt codebook shape " + codes + "x" + dims + " in " + source);
        }
        in.seek(HEADER_SIZE);
        float[][] codebook = new float[codes][];
        for (int i = 0; i < codes; i++) {
            codebook[i] = in.readFloats(dims);
        }
        float[] sizes = in.readFloats(codes);
        float[][] sums = new float[codes][];
        for (int i = 0; i < codes; i++) {
            sums[i] = in.readFloats(dims);
        }
        long[] usage = new long[codes];
        for (int i = 0; i < codes; i++) {
            usage[i] = in.readLong();
        }
        return new CodebookSnapshot(commitment, emaDecay, codebook, sizes, sums, usage, total);
    }

    // =========================================================================
    // Synapses
    // =========================================================================

    public static byte[] encodeSynapses(List<Synapse> synapses) {
        LittleEndianOutput out = new LittleEndianOutput(HEADER_SIZE + synapses.size() * 48);
        out.writeInt(SYNAPSE_MAGIC)
           .writeInt(VERSION)
           .writeInt(synapses.size())
           .padTo(HEADER_SIZE);
        for (Synapse s : synapses) {
            out.writeString(s.getSource())
               .writeString(s.getTarget())
               .writeDouble(s.getWeight())
               .writeInt(s.getAge());
        }
        return out.toByteArray();
    }

    public static List<Synapse> decodeSynapses(byte[] bytes, String source) {
        LittleEndianInput in = new LittleEndianInput(bytes, source);
        checkHeader(in, SYNAPSE_MAGIC);
        int count = in.readInt();
        in.seek(HEADER_SIZE);
        if (count < 0 || count > in.remaining()) {
            throw new StorageException("Corrupt synapse count " + count + " in " + source);
        }
        List<Synapse> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String from = in.readString();
            String to = in.readString();
            double weight = in.readDouble();
            int age = in.readInt();
            result.add(new Synapse(from, to, weight, age));
        }
        return result;
    }

    // =========================================================================
    // Partition banks
    // =========================================================================

    /**
     * Encode the members of one cluster as a self-contained segment.
     */
    public static byte[] encodeCluster(List<Neuron> neurons) {
        LittleEndianOutput out = new LittleEndianOutput(neurons.size() * 160);
        out.writeInt(neurons.size());
        for (Neuron n : neurons) {
            out.writeString(n.getId())
               .writeInt(n.getRole().ordinal())
               .writeDouble(n.getActivationThreshold())
               .writeDouble(n.getDecayRate())
               .writeDouble(n.getRestingPotential())
               .writeDouble(n.getThreshold())
               .writeDouble(n.getLearningRate())
               .writeDouble(n.getBias())
               .writeDouble(n.getCurrentPotential())
               .writeLong(n.getActivationCount())
               .writeDouble(n.getImportance())
               .writeLong(n.getLastUsed().getEpochSecond())
               .writeInt(n.getLastUsed().getNano());
            out.writeInt(n.getConcepts().size());
            for (String c : n.getConcepts()) {
                out.writeString(c);
            }
            out.writeInt(n.getWeights().size());
            for (Map.Entry<Integer, Double> w : n.getWeights().entrySet()) {
                out.writeInt(w.getKey()).writeDouble(w.getValue());
            }
        }
        return out.toByteArray();
    }

    public static List<Neuron> decodeCluster(byte[] segment, String source) {
        LittleEndianInput in = new LittleEndianInput(segment, source);
        int count = in.readLength();
        List<Neuron> neurons = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String id = in.readString();
            int role = in.readInt();
            if (role < 0 || role >= ROLES.length) {
                throw new StorageException("Unknown neuron role " + role + " in " + source);
            }
            double activationThreshold = in.readDouble();
            double decayRate = in.readDouble();
            double resting = in.readDouble();
            double threshold = in.readDouble();
            double learningRate = in.readDouble();
            double bias = in.readDouble();
            double potential = in.readDouble();
            long activations = in.readLong();
            double importance = in.readDouble();
            Instant lastUsed = Instant.ofEpochSecond(in.readLong(), in.readInt());
            int conceptCount = in.readLength();
            Set<String> concepts = new LinkedHashSet<>();
            for (int c = 0; c < conceptCount; c++) {
                concepts.add(in.readString());
            }
            int weightCount = in.readLength();
            Map<Integer, Double> weights = new HashMap<>();
            for (int w = 0; w < weightCount; w++) {
                weights.put(in.readInt(), in.readDouble());
            }
            neurons.add(new Neuron(id, weights, concepts, ROLES[role], activationThreshold, decayRate,
                                   resting, threshold, learningRate, bias, potential, activations,
                                   importance, lastUsed));
        }
        return neurons;
    }

    /**
     * Encode a partition bank from already-encoded cluster segments.
     */
    public static byte[] encodeBank(int partition, Map<String, byte[]> segments, boolean compress) {
        LittleEndianOutput body = new LittleEndianOutput(segments.size() * 256);
        for (Map.Entry<String, byte[]> e : segments.entrySet()) {
            body.writeString(e.getKey())
                .writeInt(e.getValue().length)
                .writeBytes(e.getValue());
        }
        byte[] payload = compress ? gzip(body.toByteArray()) : body.toByteArray();
        LittleEndianOutput out = new LittleEndianOutput(HEADER_SIZE + payload.length);
        out.writeInt(BANK_MAGIC)
           .writeInt(VERSION)
           .writeInt(partition)
           .writeInt(segments.size())
           .writeInt(compress ? FLAG_GZIP : 0)
           .writeInt(payload.length)
           .padTo(HEADER_SIZE)
           .writeBytes(payload);
        return out.toByteArray();
    }

    /**
     * Split a partition bank into its cluster segments, in stored order.
     */
    public static Map<String, byte[]> decodeBank(byte[] bytes, String source) {
        LittleEndianInput header = new LittleEndianInput(bytes, source);
        checkHeader(header, BANK_MAGIC);
        header.readInt(); // partition
        int clusters = header.readInt();
        int flags = header.readInt();
        int payloadLength = header.readInt();
        header.seek(HEADER_SIZE);
        byte[] payload = header.readBytes(payloadLength);
        if ((flags & FLAG_GZIP) != 0) {
            payload = gunzip(payload, source);
        }
        LittleEndianInput in = new LittleEndianInput(payload, source);
        Map<String, byte[]> segments = new LinkedHashMap<>();
        for (int i = 0; i < clusters; i++) {
            String id = in.readString();
            segments.put(id, in.readBytes(in.readLength()));
        }
        return segments;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private static void checkHeader(LittleEndianInput in, int expectedMagic) {
        int magic = in.readInt();
        if (magic != expectedMagic) {
            throw new StorageException(String.format("Bad magic 0x%08X in %s", magic, in.source()));
        }
        int version = in.readInt();
        if (version != VERSION) {
            throw new StorageException("Unsupported format version " + version + " in " + in.source());
        }
    }

    private static byte[] gzip(byte[] raw) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
        try (GZIPOutputStream gz = new GZIPOutputStream(bos)) {
            gz.write(raw);
        } catch (IOException e) {
            throw new StorageException("Failed to compress bank", e);
        }
        return bos.toByteArray();
    }

    private static byte[] gunzip(byte[] compressed, String source) {
        try (InputStream gz = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gz.readAllBytes();
        } catch (IOException e) {
            throw new StorageException("Failed to decompress " + source, e);
        }
    }
}

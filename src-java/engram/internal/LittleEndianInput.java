package engram.internal;

import org.greymatter.engram.StorageException;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Little-endian reader over a byte array. Truncated input raises
 * {@link StorageException} naming the source.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class LittleEndianInput {

    private final ByteBuffer buf;
    private final String source;

    public LittleEndianInput(byte[] bytes, String source) {
        this.buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        this.source = source;
    }

    public int readInt() {
        try {
            return buf.getInt();
        } catch (BufferUnderflowException e) {
            throw truncated();
        }
    }

    public long readLong() {
        try {
            return buf.getLong();
        } catch (BufferUnderflowException e) {
            throw truncated();
        }
    }

    public float readFloat() {
        return Float.intBitsToFloat(readInt());
    }

    public double readDouble() {
        return Double.longBitsToDouble(readLong());
    }

    public float[] readFloats(int n) {
        float[] v = new float[n];
        for (int i = 0; i < n; i++) {
            v[i] = readFloat();
        }
        return v;
    }

    public String readString() {
        return new String(readBytes(readLength()), StandardCharsets.UTF_8);
    }

    public byte[] readBytes(int n) {
        if (n < 0 || n > buf.remaining()) {
            throw truncated();
        }
        byte[] bytes = new byte[n];
        buf.get(bytes);
        return bytes;
    }

    /**
     * A non-negative count that fits in what is left of the input.
     */
    public int readLength() {
        int n = readInt();
        if (n < 0 || n > buf.remaining()) {
            throw new StorageException("Corrupt length " + n + " in " + source);
        }
        return n;
    }

    public void seek(int position) {
        if (position > buf.limit()) {
            throw truncated();
        }
        buf.position(position);
    }

    public int remaining() {
        return buf.remaining();
    }

    public String source() {
        return source;
    }

    private StorageException truncated() {
        return new StorageException("Truncated binary data in " + source);
    }
}

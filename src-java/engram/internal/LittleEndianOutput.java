package engram.internal;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * Growable little-endian byte sink for the binary file formats.
 *
 * <p><b>Internal API</b> - subject to change without notice.
 */
public final class LittleEndianOutput {

    private final ByteArrayOutputStream out;
    private final ByteBuffer scratch = ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN);

    public LittleEndianOutput(int initialCapacity) {
        this.out = new ByteArrayOutputStream(Math.max(64, initialCapacity));
    }

    public LittleEndianOutput writeInt(int v) {
        scratch.clear();
        scratch.putInt(v);
        out.write(scratch.array(), 0, 4);
        return this;
    }

    public LittleEndianOutput writeLong(long v) {
        scratch.clear();
        scratch.putLong(v);
        out.write(scratch.array(), 0, 8);
        return this;
    }

    public LittleEndianOutput writeFloat(float v) {
        return writeInt(Float.floatToRawIntBits(v));
    }

    public LittleEndianOutput writeDouble(double v) {
        return writeLong(Double.doubleToRawLongBits(v));
    }

    public LittleEndianOutput writeFloats(float[] v) {
        for (float f : v) {
            writeFloat(f);
        }
        return this;
    }

    /**
     * Length-prefixed UTF-8.
     */
    public LittleEndianOutput writeString(String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        writeInt(bytes.length);
        out.write(bytes, 0, bytes.length);
        return this;
    }

    public LittleEndianOutput writeBytes(byte[] bytes) {
        out.write(bytes, 0, bytes.length);
        return this;
    }

    /**
     * Pad with zeros up to {@code position}.
     */
    public LittleEndianOutput padTo(int position) {
        while (out.size() < position) {
            out.write(0);
        }
        return this;
    }

    public int size() {
        return out.size();
    }

    public byte[] toByteArray() {
        return out.toByteArray();
    }
}

package eu.doppel_helix.sspi_server.internal.util;

import com.sun.jna.Pointer;

/**
 * Helpers operating on an explicitly passed {@link NativeBuffer}. All offsets
 * are checked against the buffer size.
 */
public final class BufferUtils {

    private BufferUtils() {
    }

    public static byte[] readBytes(NativeBuffer buffer, int offset, int count) {
        checkRange(buffer, offset, count);
        if (count == 0) {
            return new byte[0];
        }
        return buffer.getPointer().getByteArray(offset, count);
    }

    public static void writeBytes(NativeBuffer buffer, int offset, byte[] data) {
        checkRange(buffer, offset, data.length);
        if (data.length > 0) {
            buffer.getPointer().write(offset, data, 0, data.length);
        }
    }

    public static int readInt(NativeBuffer buffer, int offset) {
        checkRange(buffer, offset, 4);
        return buffer.getPointer().getInt(offset);
    }

    public static void writeInt(NativeBuffer buffer, int offset, int value) {
        checkRange(buffer, offset, 4);
        buffer.getPointer().setInt(offset, value);
    }

    /**
     * Create a view on a region of {@code buffer}. The view does not own the
     * memory and must not outlive its parent.
     */
    public static NativeBuffer createBufferView(NativeBuffer buffer, int offset, int length) {
        checkRange(buffer, offset, length);
        return NativeBuffer.view(buffer, offset, length);
    }

    public static void zeroBuffer(NativeBuffer buffer) {
        fillBuffer(buffer, (byte) 0);
    }

    public static void fillBuffer(NativeBuffer buffer, byte fill) {
        buffer.checkReleased();
        Pointer p = buffer.getPointer();
        if (p != null) {
            p.setMemory(0, buffer.size(), fill);
        }
    }

    private static void checkRange(NativeBuffer buffer, int offset, int length) {
        buffer.checkReleased();
        if (offset < 0 || length < 0 || (long) offset + length > buffer.size()) {
            throw new IllegalArgumentException(String.format(
                    "Range [%d, %d) outside of buffer with size %d",
                    offset, (long) offset + length, buffer.size()));
        }
    }
}

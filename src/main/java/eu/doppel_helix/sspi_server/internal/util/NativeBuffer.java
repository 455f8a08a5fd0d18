package eu.doppel_helix.sspi_server.internal.util;

import com.sun.jna.Memory;
import com.sun.jna.Pointer;

/**
 * A block of native memory with an explicit, single release.
 *
 * <p>Views created with {@link BufferUtils#createBufferView} share the memory
 * of their parent and never free it. A view counts as released as soon as
 * its parent is released.</p>
 */
public final class NativeBuffer implements AutoCloseable {

    private final Memory owned;
    private final Pointer pointer;
    private final int size;
    private final NativeBuffer parent;
    private boolean released;

    private NativeBuffer(Memory owned, Pointer pointer, int size, NativeBuffer parent) {
        this.owned = owned;
        this.pointer = pointer;
        this.size = size;
        this.parent = parent;
    }

    /**
     * Allocate {@code size} bytes of uninitialized native memory.
     */
    public static NativeBuffer allocate(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Negative buffer size: " + size);
        }
        if (size == 0) {
            return new NativeBuffer(null, null, 0, null);
        }
        Memory memory = new Memory(size);
        return new NativeBuffer(memory, memory, size, null);
    }

    /**
     * Allocate a buffer holding a copy of {@code data}. {@code null} results
     * in an empty buffer.
     */
    public static NativeBuffer wrap(byte[] data) {
        if (data == null) {
            return allocate(0);
        }
        NativeBuffer buffer = allocate(data.length);
        BufferUtils.writeBytes(buffer, 0, data);
        return buffer;
    }

    static NativeBuffer view(NativeBuffer parent, int offset, int length) {
        Pointer shared = length == 0 ? null : parent.pointer.share(offset, length);
        return new NativeBuffer(null, shared, length, parent);
    }

    /**
     * @return pointer to the start of the memory, {@code null} for an empty
     * buffer
     */
    public Pointer getPointer() {
        checkReleased();
        return pointer;
    }

    public int size() {
        return size;
    }

    /**
     * @return {@code true} if this buffer, or the buffer it is a view of, was
     * released
     */
    public boolean isReleased() {
        return released || (parent != null && parent.isReleased());
    }

    /**
     * @return a copy of the whole buffer
     */
    public byte[] getBytes() {
        return BufferUtils.readBytes(this, 0, size);
    }

    /**
     * Free the memory. Calls after the first are ignored.
     */
    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        if (owned != null) {
            owned.close();
        }
    }

    void checkReleased() {
        if (isReleased()) {
            throw new IllegalStateException("Native buffer already released");
        }
    }

    @Override
    public String toString() {
        return "NativeBuffer{size=" + size + ", view=" + (parent != null) + ", released=" + isReleased() + "}";
    }
}

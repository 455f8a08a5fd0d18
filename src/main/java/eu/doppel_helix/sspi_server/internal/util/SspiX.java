package eu.doppel_helix.sspi_server.internal.util;

import com.sun.jna.Pointer;
import com.sun.jna.Structure;
import com.sun.jna.platform.win32.Sspi;

/**
 * SSPI constants missing from {@link Sspi} and the buffer structures used by
 * the server context.
 */
public interface SspiX {

    int SECBUFFER_DATA = 1;
    int SECBUFFER_STREAM = 10;

    /**
     * A single SecBuffer. {@code cbBuffer} is the capacity on input and the
     * number of valid bytes on output.
     */
    @Structure.FieldOrder({"cbBuffer", "BufferType", "pvBuffer"})
    public static class SecBuffer extends Structure {

        public int cbBuffer;
        public int BufferType = Sspi.SECBUFFER_EMPTY;
        public Pointer pvBuffer;

        public SecBuffer() {
            super();
        }

        public SecBuffer(Pointer p) {
            super(p);
        }

        /**
         * @return a copy of the {@code cbBuffer} valid bytes
         */
        public byte[] getBytes() {
            if (pvBuffer == null || cbBuffer <= 0) {
                return new byte[0];
            }
            return pvBuffer.getByteArray(0, cbBuffer);
        }
    }

    /**
     * SecBufferDesc that owns the native memory of its buffers.
     *
     * <p>The SecBuffer array is not referenced by value from the descriptor,
     * so {@link #write()} and {@link #read()} sync the child structures
     * explicitly. Native memory attached through {@link #setBuffer} is freed
     * in reverse order on {@link #close()}.</p>
     */
    @Structure.FieldOrder({"ulVersion", "cBuffers", "pBuffers"})
    public static class ManagedSecBufferDesc extends Structure implements AutoCloseable {

        public int ulVersion = Sspi.SECBUFFER_VERSION;
        public int cBuffers;
        public Pointer pBuffers;

        private final SecBuffer[] secBuffers;
        private final NativeBuffer[] memory;
        private boolean closed;

        public ManagedSecBufferDesc(int bufferCount) {
            if (bufferCount < 1) {
                throw new IllegalArgumentException("At least one buffer is required");
            }
            secBuffers = (SecBuffer[]) new SecBuffer().toArray(bufferCount);
            memory = new NativeBuffer[bufferCount];
            pBuffers = secBuffers[0].getPointer();
            cBuffers = bufferCount;
        }

        /**
         * Descriptor with one empty buffer of {@code type} that can receive
         * up to {@code capacity} bytes.
         */
        public static ManagedSecBufferDesc allocate(int type, int capacity) {
            ManagedSecBufferDesc desc = new ManagedSecBufferDesc(1);
            desc.setBuffer(0, type, NativeBuffer.allocate(capacity));
            return desc;
        }

        /**
         * Descriptor with one buffer of {@code type} holding a copy of
         * {@code token}.
         */
        public static ManagedSecBufferDesc wrap(int type, byte[] token) {
            ManagedSecBufferDesc desc = new ManagedSecBufferDesc(1);
            desc.setBuffer(0, type, NativeBuffer.wrap(token));
            return desc;
        }

        /**
         * Attach {@code buffer} to slot {@code index}. Ownership passes to
         * this descriptor.
         */
        public void setBuffer(int index, int type, NativeBuffer buffer) {
            checkClosed();
            if (memory[index] != null) {
                memory[index].close();
            }
            memory[index] = buffer;
            SecBuffer secBuffer = secBuffers[index];
            secBuffer.BufferType = type;
            secBuffer.pvBuffer = buffer.getPointer();
            secBuffer.cbBuffer = buffer.size();
        }

        public SecBuffer getBuffer(int index) {
            return secBuffers[index];
        }

        public int getBufferCount() {
            return secBuffers.length;
        }

        /**
         * @return size of the native memory attached to slot {@code index}
         */
        public int getCapacity(int index) {
            return memory[index] == null ? 0 : memory[index].size();
        }

        /**
         * @return valid bytes of every buffer, in slot order
         */
        public byte[][] toArray() {
            byte[][] result = new byte[secBuffers.length][];
            for (int i = 0; i < secBuffers.length; i++) {
                result[i] = secBuffers[i].getBytes();
            }
            return result;
        }

        public boolean isClosed() {
            return closed;
        }

        @Override
        public void write() {
            for (SecBuffer secBuffer : secBuffers) {
                secBuffer.write();
            }
            super.write();
        }

        @Override
        public void read() {
            super.read();
            for (SecBuffer secBuffer : secBuffers) {
                secBuffer.read();
            }
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            for (int i = memory.length - 1; i >= 0; i--) {
                if (memory[i] != null) {
                    memory[i].close();
                }
                secBuffers[i].pvBuffer = null;
                secBuffers[i].cbBuffer = 0;
            }
        }

        private void checkClosed() {
            if (closed) {
                throw new IllegalStateException("Buffer descriptor already closed");
            }
        }
    }
}

package eu.doppel_helix.sspi_server.internal.util;

import org.junit.Assert;
import org.junit.Test;

public class BufferUtilsTest {

    @Test
    public void testReadWrite() {
        try (NativeBuffer buffer = NativeBuffer.allocate(16)) {
            BufferUtils.zeroBuffer(buffer);
            BufferUtils.writeBytes(buffer, 2, new byte[]{7, 8, 9});
            BufferUtils.writeInt(buffer, 8, 0x01020304);

            Assert.assertArrayEquals(new byte[]{0, 0, 7, 8, 9, 0}, BufferUtils.readBytes(buffer, 0, 6));
            Assert.assertEquals(0x01020304, BufferUtils.readInt(buffer, 8));
            Assert.assertEquals(16, buffer.getBytes().length);
        }
    }

    @Test
    public void testFill() {
        try (NativeBuffer buffer = NativeBuffer.allocate(4)) {
            BufferUtils.fillBuffer(buffer, (byte) 0x5A);
            Assert.assertArrayEquals(new byte[]{0x5A, 0x5A, 0x5A, 0x5A}, buffer.getBytes());
        }
    }

    @Test
    public void testView() {
        try (NativeBuffer buffer = NativeBuffer.wrap(new byte[]{1, 2, 3, 4, 5, 6})) {
            NativeBuffer view = BufferUtils.createBufferView(buffer, 2, 3);
            Assert.assertArrayEquals(new byte[]{3, 4, 5}, view.getBytes());

            BufferUtils.writeBytes(view, 0, new byte[]{9});
            Assert.assertEquals(9, buffer.getBytes()[2]);

            view.close();
            Assert.assertFalse("Closing a view must not release the parent", buffer.isReleased());
            Assert.assertArrayEquals(new byte[]{1, 2, 9, 4, 5, 6}, buffer.getBytes());
        }
    }

    @Test
    public void testViewAfterParentClosed() {
        NativeBuffer parent = NativeBuffer.wrap(new byte[]{1, 2, 3, 4, 5, 6, 7, 8});
        NativeBuffer view = BufferUtils.createBufferView(parent, 2, 4);
        parent.close();

        Assert.assertTrue("A view must not outlive its parent", view.isReleased());
        try {
            BufferUtils.readBytes(view, 0, 4);
            Assert.fail("Read through a view of a released buffer");
        } catch (IllegalStateException ex) {
            // expected
        }
        try {
            BufferUtils.fillBuffer(view, (byte) 0x7f);
            Assert.fail("Write through a view of a released buffer");
        } catch (IllegalStateException ex) {
            // expected
        }
        try {
            view.getPointer();
            Assert.fail();
        } catch (IllegalStateException ex) {
            // expected
        }
    }

    @Test
    public void testNestedViewAfterParentClosed() {
        NativeBuffer parent = NativeBuffer.allocate(8);
        NativeBuffer view = BufferUtils.createBufferView(parent, 0, 6);
        NativeBuffer inner = BufferUtils.createBufferView(view, 2, 2);
        BufferUtils.writeBytes(inner, 0, new byte[]{3, 4});
        Assert.assertArrayEquals(new byte[]{3, 4}, BufferUtils.readBytes(parent, 2, 2));

        parent.close();
        Assert.assertTrue(inner.isReleased());
        try {
            BufferUtils.writeInt(inner, 0, 1);
            Assert.fail();
        } catch (IllegalStateException ex) {
            // expected
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testReadOutOfRange() {
        try (NativeBuffer buffer = NativeBuffer.allocate(4)) {
            BufferUtils.readBytes(buffer, 2, 3);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testViewOutOfRange() {
        try (NativeBuffer buffer = NativeBuffer.allocate(4)) {
            BufferUtils.createBufferView(buffer, -1, 2);
        }
    }

    @Test(expected = IllegalStateException.class)
    public void testUseAfterClose() {
        NativeBuffer buffer = NativeBuffer.allocate(4);
        buffer.close();
        buffer.close();
        BufferUtils.readInt(buffer, 0);
    }

    @Test
    public void testEmptyBuffer() {
        try (NativeBuffer buffer = NativeBuffer.wrap(null)) {
            Assert.assertEquals(0, buffer.size());
            Assert.assertNull(buffer.getPointer());
            Assert.assertEquals(0, buffer.getBytes().length);
            BufferUtils.zeroBuffer(buffer);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeSize() {
        NativeBuffer.allocate(-1);
    }
}

package eu.doppel_helix.sspi_server;

import java.util.Arrays;

/**
 * One opaque protocol message exchanged during the handshake. Instances are
 * immutable, the backing array is copied on the way in and on the way out.
 */
public final class AuthenticationToken {

    public static final AuthenticationToken EMPTY = new AuthenticationToken(new byte[0]);

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    private final byte[] data;

    /**
     * @param data token bytes, {@code null} is treated as an empty token
     */
    public AuthenticationToken(byte[] data) {
        this.data = data == null ? new byte[0] : data.clone();
    }

    public static AuthenticationToken parse(byte[] data) {
        if (data == null || data.length == 0) {
            return EMPTY;
        }
        return new AuthenticationToken(data);
    }

    public byte[] toArray() {
        return data.clone();
    }

    public int length() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    /**
     * Multi line hex dump: offset, 16 bytes in hex and their printable
     * characters.
     */
    public String format() {
        StringBuilder sb = new StringBuilder(data.length * 5 + 32);
        sb.append("Length: ").append(data.length).append(" bytes");
        for (int rowOffset = 0; rowOffset < data.length; rowOffset += 16) {
            sb.append('\n');
            sb.append(String.format("%04x | ", rowOffset));
            for (int i = 0; i < 16; i++) {
                if ((rowOffset + i) < data.length) {
                    appendHex(sb, data[rowOffset + i]);
                } else {
                    sb.append("  ");
                }
                sb.append(i == 7 ? ':' : ' ');
            }
            sb.append("| ");
            for (int i = 0; i < 16 && (rowOffset + i) < data.length; i++) {
                int c = data[rowOffset + i] & 0xFF;
                sb.append(c >= 0x20 && c < 0x7f ? (char) c : '.');
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AuthenticationToken)) {
            return false;
        }
        return Arrays.equals(data, ((AuthenticationToken) obj).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("AuthenticationToken{length=");
        sb.append(data.length);
        if (data.length > 0) {
            sb.append(", data=");
            int shown = Math.min(data.length, 16);
            for (int i = 0; i < shown; i++) {
                appendHex(sb, data[i]);
            }
            if (shown < data.length) {
                sb.append("...");
            }
        }
        return sb.append('}').toString();
    }

    private static void appendHex(StringBuilder sb, byte b) {
        sb.append(HEX_DIGITS[(b >> 4) & 0x0F]);
        sb.append(HEX_DIGITS[b & 0x0F]);
    }
}

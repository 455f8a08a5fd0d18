package eu.doppel_helix.sspi_server;

import com.sun.jna.platform.win32.Sspi;

/**
 * Byte order the security package uses on the wire.
 */
public enum DataRepresentation {
    NATIVE(Sspi.SECURITY_NATIVE_DREP),
    NETWORK(Sspi.SECURITY_NETWORK_DREP);

    private final int value;

    private DataRepresentation(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }
}

package eu.doppel_helix.sspi_server;

import eu.doppel_helix.sspi_server.internal.util.WinErrorSecMap;

/**
 * Outputs of one AcceptSecurityContext call: the status and the auxiliary
 * values the call writes to its out parameters.
 */
public final class AcceptResult {

    private final int statusCode;
    private final int contextAttributes;
    private final long expiry;

    /**
     * @param statusCode native SECURITY_STATUS
     * @param contextAttributes returned ASC_RET_* flags
     * @param expiry expiry as 64 bit FILETIME value
     */
    public AcceptResult(int statusCode, int contextAttributes, long expiry) {
        this.statusCode = statusCode;
        this.contextAttributes = contextAttributes;
        this.expiry = expiry;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public SecurityStatus getStatus() {
        return SecurityStatus.fromCode(statusCode);
    }

    public int getContextAttributes() {
        return contextAttributes;
    }

    public long getExpiry() {
        return expiry;
    }

    @Override
    public String toString() {
        return "AcceptResult{status=" + WinErrorSecMap.resolveString(statusCode)
                + ", contextAttributes=" + AcceptContextRetFlags.toString(contextAttributes)
                + ", expiry=" + expiry + '}';
    }
}

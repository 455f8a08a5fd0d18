package eu.doppel_helix.sspi_server;

import org.ietf.jgss.GSSException;

/**
 * Base class of the failures raised by {@link ServerAuthenticationContext}.
 * The minor code carries the native SSPI status where one exists, -1
 * otherwise.
 */
public class NegotiationException extends GSSException {

    private static final long serialVersionUID = -2870946524851218471L;

    public NegotiationException(int majorCode, int status, String message) {
        super(majorCode, status, message);
    }

    public NegotiationException(int majorCode, int status, String message, Throwable cause) {
        super(majorCode, status, message);
        initCause(cause);
    }

    /**
     * @return native SSPI status, -1 if the failure did not originate from a
     * native call
     */
    public int getStatus() {
        return getMinor();
    }
}

package eu.doppel_helix.sspi_server;

import org.ietf.jgss.GSSException;

/**
 * The security package produced a token larger than the fixed output buffer.
 */
public class CapacityException extends NegotiationException {

    private static final long serialVersionUID = -6406211375931577707L;

    public CapacityException(int status, String message) {
        super(GSSException.FAILURE, status, message);
    }
}

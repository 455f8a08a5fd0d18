package eu.doppel_helix.sspi_server;

import org.ietf.jgss.GSSException;

/**
 * An operation was called in a state that does not allow it, e.g.
 * {@code advance} on an established context or {@code impersonate} before
 * the handshake finished.
 */
public class SequenceException extends NegotiationException {

    private static final long serialVersionUID = 2153270867725361608L;

    public SequenceException(String message) {
        this(GSSException.NO_CONTEXT, message);
    }

    public SequenceException(int majorCode, String message) {
        super(majorCode, -1, message);
    }
}

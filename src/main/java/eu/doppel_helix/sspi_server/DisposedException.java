package eu.doppel_helix.sspi_server;

import org.ietf.jgss.GSSException;

/**
 * The context, or a handle it depends on, was already released.
 */
public class DisposedException extends NegotiationException {

    private static final long serialVersionUID = 5190482710923745823L;

    public DisposedException() {
        this("Security context already disposed");
    }

    public DisposedException(String message) {
        super(GSSException.NO_CONTEXT, -1, message);
    }
}

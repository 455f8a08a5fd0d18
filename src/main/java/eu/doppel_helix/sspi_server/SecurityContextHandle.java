package eu.doppel_helix.sspi_server;

import com.sun.jna.platform.win32.Sspi;
import com.sun.jna.platform.win32.WinError;

/**
 * Negotiation state owned by exactly one {@link ServerAuthenticationContext}.
 *
 * <p>The native handle is filled in by the first successful negotiation call
 * and updated in place by every later one. It is released at most once, and
 * only if it was created.</p>
 */
public final class SecurityContextHandle {

    private final Sspi.CtxtHandle handle = new Sspi.CtxtHandle();
    private boolean created;
    private boolean released;

    SecurityContextHandle() {
    }

    public Sspi.CtxtHandle getHandle() throws DisposedException {
        if (released) {
            throw new DisposedException("Security context handle already released");
        }
        return handle;
    }

    /**
     * @return {@code true} once a negotiation call has succeeded on this
     * handle
     */
    public boolean isCreated() {
        return created;
    }

    public boolean isReleased() {
        return released;
    }

    void markCreated() {
        created = true;
    }

    /**
     * Delete the context through {@code provider}. Never created handles are
     * not passed to the provider.
     *
     * @return status of DeleteSecurityContext, SEC_E_OK if nothing was
     * deleted
     */
    int release(NegotiationProvider provider) throws DisposedException {
        if (released) {
            return WinError.SEC_E_OK;
        }
        try {
            if (created) {
                return provider.deleteSecurityContext(this);
            }
            return WinError.SEC_E_OK;
        } finally {
            released = true;
        }
    }

    @Override
    public String toString() {
        return "SecurityContextHandle{created=" + created + ", released=" + released + '}';
    }
}

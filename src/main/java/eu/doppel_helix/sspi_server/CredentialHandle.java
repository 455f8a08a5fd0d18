package eu.doppel_helix.sspi_server;

import com.sun.jna.platform.win32.Sspi;
import com.sun.jna.platform.win32.WinError;

/**
 * Reference to credentials acquired by the caller. Server contexts borrow the
 * handle and never release it, the owner does that once every context using
 * it is disposed. A handle may be shared by any number of contexts.
 */
public final class CredentialHandle {

    private final Sspi.CredHandle handle;
    private boolean released;

    public CredentialHandle(Sspi.CredHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("Credential handle must not be null");
        }
        this.handle = handle;
    }

    public Sspi.CredHandle getHandle() throws DisposedException {
        if (released) {
            throw new DisposedException("Credential handle already released");
        }
        return handle;
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Free the credentials through {@code provider}. Only the owner of the
     * handle may call this. Calls after the first are ignored.
     *
     * @throws ProviderException if FreeCredentialsHandle fails, the handle is
     * considered released anyway
     */
    public void release(NegotiationProvider provider) throws NegotiationException {
        if (released) {
            return;
        }
        int result;
        try {
            result = provider.freeCredentialsHandle(this);
        } finally {
            released = true;
        }
        if (result != WinError.SEC_E_OK) {
            throw ProviderException.forStatus("FreeCredentialsHandle", result);
        }
    }

    @Override
    public String toString() {
        return "CredentialHandle{released=" + released + '}';
    }
}

package eu.doppel_helix.sspi_server;

import com.sun.jna.platform.win32.WinError;

import static eu.doppel_helix.sspi_server.SSPIServer.debug;

/**
 * Scope during which the current thread acts as the client authenticated by a
 * {@link ServerAuthenticationContext}. Obtained from
 * {@link ServerAuthenticationContext#impersonate()}, closing it reverts to the
 * original identity:
 *
 * <pre>
 * try (AuthenticationImpersonationContext imp = context.impersonate()) {
 *     // runs as the client
 * }
 * </pre>
 */
public final class AuthenticationImpersonationContext implements AutoCloseable {

    private final NegotiationProvider provider;
    private final SecurityContextHandle context;
    private boolean active = true;

    AuthenticationImpersonationContext(NegotiationProvider provider, SecurityContextHandle context) {
        this.provider = provider;
        this.context = context;
    }

    public boolean isActive() {
        return active;
    }

    /**
     * Revert the impersonation. Only the first call reaches the security
     * package.
     *
     * @throws ProviderException if RevertSecurityContext fails. The scope is
     * closed nevertheless.
     */
    @Override
    public void close() throws NegotiationException {
        if (!active) {
            return;
        }
        active = false;
        int result = provider.revertSecurityContext(context);
        debug("Reverted impersonation");
        if (result != WinError.SEC_E_OK) {
            throw ProviderException.forStatus("RevertSecurityContext", result);
        }
    }
}

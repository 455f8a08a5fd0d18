package eu.doppel_helix.sspi_server;

import eu.doppel_helix.sspi_server.internal.util.SspiX.ManagedSecBufferDesc;

/**
 * The calls {@link ServerAuthenticationContext} makes into a security
 * package. Status values are native SECURITY_STATUS codes, interpretation is
 * left to the caller.
 */
public interface NegotiationProvider {

    /**
     * Advance the server side of the handshake by one round.
     *
     * @param credentials acceptor credentials
     * @param previous context from the previous round, {@code null} on the
     * first round
     * @param input buffer descriptor holding the token received from the peer
     * @param requestedFlags ASC_REQ_* flags
     * @param dataRepresentation byte order for the package
     * @param newContext handle that receives the (updated) context
     * @param output buffer descriptor receiving the token for the peer
     * @return status, returned flags and expiry
     */
    AcceptResult acceptSecurityContext(CredentialHandle credentials,
            SecurityContextHandle previous, ManagedSecBufferDesc input,
            int requestedFlags, DataRepresentation dataRepresentation,
            SecurityContextHandle newContext, ManagedSecBufferDesc output)
            throws DisposedException;

    /**
     * Finalize the output token after a COMPLETE_NEEDED or
     * COMPLETE_AND_CONTINUE status.
     */
    int completeAuthToken(SecurityContextHandle context, ManagedSecBufferDesc output)
            throws DisposedException;

    /**
     * @return identity bound to an established context
     * @throws ProviderException if the package cannot supply the identity
     */
    AccessToken querySecurityContextToken(SecurityContextHandle context)
            throws NegotiationException;

    int impersonateSecurityContext(SecurityContextHandle context) throws DisposedException;

    int revertSecurityContext(SecurityContextHandle context) throws DisposedException;

    int deleteSecurityContext(SecurityContextHandle context) throws DisposedException;

    int freeCredentialsHandle(CredentialHandle credentials) throws DisposedException;
}

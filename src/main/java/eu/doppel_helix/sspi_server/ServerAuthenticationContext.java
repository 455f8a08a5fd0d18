package eu.doppel_helix.sspi_server;

import com.sun.jna.platform.win32.Sspi;
import com.sun.jna.platform.win32.WinBase;
import com.sun.jna.platform.win32.WinError;
import eu.doppel_helix.sspi_server.internal.util.SspiX.ManagedSecBufferDesc;
import eu.doppel_helix.sspi_server.internal.util.SspiX.SecBuffer;
import eu.doppel_helix.sspi_server.internal.util.WinErrorSecMap;
import java.util.Date;
import org.ietf.jgss.GSSException;

import static eu.doppel_helix.sspi_server.SSPIServer.debug;

/**
 * Server (acceptor) side of an SSPI handshake.
 *
 * <p>Feed every token received from the client into {@link #advance} and send
 * the returned token back until {@link #isDone()} reports completion. After
 * that the client identity is available through {@link #getAccessToken()} and
 * {@link #impersonate()}.</p>
 *
 * <p>Instances are not thread safe, rounds have to be applied in the order the
 * tokens arrive. Concurrent sessions need separate instances, which may share
 * one {@link CredentialHandle}. Dispose the context before releasing the
 * credentials it borrowed.</p>
 */
public class ServerAuthenticationContext implements AutoCloseable {

    /**
     * Capacity of the output buffer handed to the security package.
     */
    public static final int MAX_TOKEN_SIZE = 64 * 1024;

    private static final int STATE_NEW = 1;
    private static final int STATE_IN_PROCESS = 2;
    private static final int STATE_DONE = 3;
    private static final int STATE_FAILED = 4;
    private static final int STATE_DELETED = 5;

    private int state = STATE_NEW;

    private final NegotiationProvider provider;
    private final CredentialHandle credentials;
    private final SecurityContextHandle context = new SecurityContextHandle();
    private final int requestedFlags;
    private final DataRepresentation dataRepresentation;

    private AuthenticationToken token = AuthenticationToken.EMPTY;
    private boolean done;
    private int flags;
    private long expiry;
    private AuthenticationImpersonationContext impersonation;

    /**
     * @param provider security package to negotiate with
     * @param credentials acceptor credentials, borrowed for the lifetime of
     * this context
     * @param requestedFlags ASC_REQ_* flags, ALLOCATE_MEMORY is ignored
     * @param dataRepresentation byte order for the package
     */
    public ServerAuthenticationContext(NegotiationProvider provider,
            CredentialHandle credentials, int requestedFlags,
            DataRepresentation dataRepresentation) {
        if (provider == null) {
            throw new IllegalArgumentException("Cannot have null provider");
        }
        if (credentials == null) {
            throw new IllegalArgumentException("Cannot have null credentials");
        }
        if (dataRepresentation == null) {
            throw new IllegalArgumentException("Cannot have null data representation");
        }
        this.provider = provider;
        this.credentials = credentials;
        this.requestedFlags = requestedFlags & ~AcceptContextReqFlags.ALLOCATE_MEMORY;
        this.dataRepresentation = dataRepresentation;
    }

    public ServerAuthenticationContext(NegotiationProvider provider, CredentialHandle credentials) {
        this(provider, credentials, AcceptContextReqFlags.NONE, DataRepresentation.NATIVE);
    }

    /**
     * Process the next token from the client.
     *
     * @param inbound token received from the client, {@code null} is treated
     * as an empty token
     * @return token to send to the client, possibly empty
     * @throws ProviderException if the package rejects the round, the context
     * can't be advanced afterwards
     * @throws CapacityException if the reply does not fit into
     * {@link #MAX_TOKEN_SIZE} bytes
     * @throws SequenceException if the context is already established or
     * failed before
     * @throws DisposedException if the context was disposed
     */
    public AuthenticationToken advance(AuthenticationToken inbound) throws GSSException {
        debug("Entered ServerAuthenticationContext.advance with state=" + printState(state));

        switch (state) {
            case STATE_DELETED:
                throw new DisposedException();
            case STATE_DONE:
                throw new SequenceException("advance on an established context");
            case STATE_FAILED:
                throw new SequenceException("advance on a context that failed to negotiate");
            default:
                break;
        }
        if (credentials.isReleased()) {
            throw new DisposedException("Credential handle already released");
        }
        if (inbound == null) {
            inbound = AuthenticationToken.EMPTY;
        }

        boolean newContext = (state == STATE_NEW);
        state = STATE_IN_PROCESS;
        try (ManagedSecBufferDesc output = ManagedSecBufferDesc.allocate(Sspi.SECBUFFER_TOKEN, MAX_TOKEN_SIZE);
                ManagedSecBufferDesc input = ManagedSecBufferDesc.wrap(Sspi.SECBUFFER_TOKEN, inbound.toArray())) {

            AcceptResult result = provider.acceptSecurityContext(
                    credentials,
                    newContext ? null : context,
                    input,
                    requestedFlags,
                    dataRepresentation,
                    context,
                    output);

            flags = result.getContextAttributes();
            expiry = result.getExpiry();
            SecurityStatus status = result.getStatus();

            debug("AcceptSecurityContext-Result: %s, flags: %s",
                    WinErrorSecMap.resolveString(result.getStatusCode()),
                    AcceptContextRetFlags.toString(flags));

            if (status.isError()) {
                state = STATE_FAILED;
                if (result.getStatusCode() == WinError.SEC_E_BUFFER_TOO_SMALL) {
                    throw new CapacityException(result.getStatusCode(),
                            "Token exceeds output buffer of " + MAX_TOKEN_SIZE + " bytes");
                }
                throw ProviderException.forStatus("AcceptSecurityContext", result.getStatusCode());
            }
            context.markCreated();

            if (status.requiresCompletion()) {
                int completeResult = provider.completeAuthToken(context, output);
                debug("CompleteAuthToken-Result: %s", WinErrorSecMap.resolveString(completeResult));
                if (SecurityStatus.fromCode(completeResult).isError()) {
                    state = STATE_FAILED;
                    throw ProviderException.forStatus("CompleteAuthToken", completeResult);
                }
            }

            SecBuffer outBuffer = output.getBuffer(0);
            if (outBuffer.cbBuffer < 0 || outBuffer.cbBuffer > output.getCapacity(0)) {
                state = STATE_FAILED;
                throw new CapacityException(WinError.SEC_E_BUFFER_TOO_SMALL, String.format(
                        "Package reported %d token bytes for an output buffer of %d bytes",
                        outBuffer.cbBuffer, output.getCapacity(0)));
            }
            AuthenticationToken outbound = AuthenticationToken.parse(outBuffer.getBytes());

            debug("Created AcceptSecContextToken: %d bytes", outbound.length());

            token = outbound;
            done = status.isDone();
            state = done ? STATE_DONE : STATE_IN_PROCESS;
            return outbound;
        } catch (RuntimeException e) {
            state = STATE_FAILED;
            if (SSPIServer.DEBUG) {
                e.printStackTrace();
            }
            throw new NegotiationException(GSSException.FAILURE, -1, e.getMessage(), e);
        }
    }

    /**
     * Query the identity of the authenticated client.
     *
     * @throws SequenceException if the handshake is not complete
     */
    public AccessToken getAccessToken() throws GSSException {
        checkEstablished("getAccessToken");
        return provider.querySecurityContextToken(context);
    }

    /**
     * Let the current thread act as the authenticated client until the
     * returned scope is closed.
     *
     * @throws SequenceException if the handshake is not complete or an
     * impersonation is still active
     * @throws ProviderException if ImpersonateSecurityContext fails
     */
    public AuthenticationImpersonationContext impersonate() throws GSSException {
        checkEstablished("impersonate");
        if (impersonation != null && impersonation.isActive()) {
            throw new SequenceException("Impersonation of this context is already active");
        }
        int result = provider.impersonateSecurityContext(context);
        if (result != WinError.SEC_E_OK) {
            throw ProviderException.forStatus("ImpersonateSecurityContext", result);
        }
        debug("Impersonating security context");
        impersonation = new AuthenticationImpersonationContext(provider, context);
        return impersonation;
    }

    /**
     * @return latest token produced for the client, empty before the first
     * round
     */
    public AuthenticationToken getToken() {
        return token;
    }

    public boolean isDone() {
        return done;
    }

    /**
     * @return ASC_RET_* flags of the latest round
     */
    public int getFlags() {
        return flags;
    }

    /**
     * @return expiry of the latest round as raw FILETIME value. Advisory only,
     * it is not enforced.
     */
    public long getExpiry() {
        return expiry;
    }

    public Date getExpiryDate() {
        return WinBase.FILETIME.filetimeToDate((int) (expiry >>> 32), (int) expiry);
    }

    public int getRequestedFlags() {
        return requestedFlags;
    }

    public DataRepresentation getDataRepresentation() {
        return dataRepresentation;
    }

    public CredentialHandle getCredentials() {
        return credentials;
    }

    public boolean isDisposed() {
        return state == STATE_DELETED;
    }

    /**
     * Release the security context. An impersonation that is still active is
     * reverted first. Calls after the first have no effect.
     *
     * @throws ProviderException if reverting an active impersonation fails,
     * the context is released nevertheless
     */
    public void dispose() throws GSSException {
        if (state == STATE_DELETED) {
            return;
        }
        debug("Disposing ServerAuthenticationContext in state=" + printState(state));
        state = STATE_DELETED;
        try {
            if (impersonation != null) {
                impersonation.close();
            }
        } finally {
            impersonation = null;
            int result = context.release(provider);
            if (result != WinError.SEC_E_OK) {
                debug("DeleteSecurityContext-Result: %s", WinErrorSecMap.resolveString(result));
            }
        }
    }

    @Override
    public void close() throws GSSException {
        dispose();
    }

    private void checkEstablished(String operation) throws GSSException {
        if (state == STATE_DELETED) {
            throw new DisposedException();
        }
        if (state != STATE_DONE) {
            throw new SequenceException(operation + " requires an established context, state="
                    + printState(state));
        }
    }

    private static String printState(int state) {
        switch (state) {
            case STATE_NEW:
                return ("STATE_NEW");
            case STATE_IN_PROCESS:
                return ("STATE_IN_PROCESS");
            case STATE_DONE:
                return ("STATE_DONE");
            case STATE_FAILED:
                return ("STATE_FAILED");
            case STATE_DELETED:
                return ("STATE_DELETED");
            default:
                return ("Unknown state " + state);
        }
    }

    @Override
    public String toString() {
        return "ServerAuthenticationContext{state=" + printState(state)
                + ", flags=" + AcceptContextRetFlags.toString(flags)
                + ", token=" + token + '}';
    }
}

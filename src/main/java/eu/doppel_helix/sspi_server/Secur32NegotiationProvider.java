package eu.doppel_helix.sspi_server;

import com.sun.jna.platform.win32.Advapi32Util;
import com.sun.jna.platform.win32.Kernel32;
import com.sun.jna.platform.win32.Sspi;
import com.sun.jna.platform.win32.Win32Exception;
import com.sun.jna.platform.win32.WinError;
import com.sun.jna.platform.win32.WinNT;
import com.sun.jna.ptr.IntByReference;
import eu.doppel_helix.sspi_server.internal.util.Secur32X;
import eu.doppel_helix.sspi_server.internal.util.SspiX.ManagedSecBufferDesc;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.ietf.jgss.GSSException;

/**
 * {@link NegotiationProvider} backed by secur32.dll.
 */
public class Secur32NegotiationProvider implements NegotiationProvider {

    private final Secur32X secur32;

    public Secur32NegotiationProvider() {
        this(Secur32X.INSTANCE);
    }

    public Secur32NegotiationProvider(Secur32X secur32) {
        this.secur32 = secur32;
    }

    @Override
    public AcceptResult acceptSecurityContext(CredentialHandle credentials,
            SecurityContextHandle previous, ManagedSecBufferDesc input,
            int requestedFlags, DataRepresentation dataRepresentation,
            SecurityContextHandle newContext, ManagedSecBufferDesc output)
            throws DisposedException {
        Sspi.TimeStamp ptsExpiry = new Sspi.TimeStamp();
        IntByReference contextAttr = new IntByReference();

        int result = secur32.AcceptSecurityContext(
                credentials.getHandle(),
                previous == null ? null : previous.getHandle(),
                input,
                requestedFlags,
                dataRepresentation.getValue(),
                newContext.getHandle(),
                output,
                contextAttr,
                ptsExpiry);

        long expiry = ((long) ptsExpiry.dwUpper << 32) | (ptsExpiry.dwLower & 0xFFFFFFFFL);
        return new AcceptResult(result, contextAttr.getValue(), expiry);
    }

    @Override
    public int completeAuthToken(SecurityContextHandle context, ManagedSecBufferDesc output)
            throws DisposedException {
        return secur32.CompleteAuthToken(context.getHandle(), output);
    }

    @Override
    public AccessToken querySecurityContextToken(SecurityContextHandle context)
            throws NegotiationException {
        WinNT.HANDLEByReference phToken = new WinNT.HANDLEByReference();
        int result = secur32.QuerySecurityContextToken(context.getHandle(), phToken);
        if (result != WinError.SEC_E_OK) {
            throw ProviderException.forStatus("QuerySecurityContextToken", result);
        }
        return new NativeAccessToken(phToken.getValue());
    }

    @Override
    public int impersonateSecurityContext(SecurityContextHandle context) throws DisposedException {
        return secur32.ImpersonateSecurityContext(context.getHandle());
    }

    @Override
    public int revertSecurityContext(SecurityContextHandle context) throws DisposedException {
        return secur32.RevertSecurityContext(context.getHandle());
    }

    @Override
    public int deleteSecurityContext(SecurityContextHandle context) throws DisposedException {
        return secur32.DeleteSecurityContext(context.getHandle());
    }

    @Override
    public int freeCredentialsHandle(CredentialHandle credentials) throws DisposedException {
        return secur32.FreeCredentialsHandle(credentials.getHandle());
    }

    /**
     * Access token handle returned by QuerySecurityContextToken.
     */
    public static class NativeAccessToken implements AccessToken {

        private WinNT.HANDLE handle;

        NativeAccessToken(WinNT.HANDLE handle) {
            this.handle = handle;
        }

        public WinNT.HANDLE getHandle() {
            return handle;
        }

        @Override
        public String getUserName() throws NegotiationException {
            try {
                return Advapi32Util.getTokenAccount(checkOpen()).fqn;
            } catch (Win32Exception ex) {
                throw new NegotiationException(GSSException.FAILURE, ex.getErrorCode(),
                        "Failed to read token account: " + ex.getMessage(), ex);
            }
        }

        @Override
        public List<String> getGroupNames() throws NegotiationException {
            try {
                List<String> result = new ArrayList<>();
                for (Advapi32Util.Account account : Advapi32Util.getTokenGroups(checkOpen())) {
                    result.add(account.fqn != null ? account.fqn : account.sidString);
                }
                return Collections.unmodifiableList(result);
            } catch (Win32Exception ex) {
                throw new NegotiationException(GSSException.FAILURE, ex.getErrorCode(),
                        "Failed to read token groups: " + ex.getMessage(), ex);
            }
        }

        @Override
        public void close() {
            if (handle != null) {
                Kernel32.INSTANCE.CloseHandle(handle);
                handle = null;
            }
        }

        private WinNT.HANDLE checkOpen() throws DisposedException {
            if (handle == null) {
                throw new DisposedException("Access token already closed");
            }
            return handle;
        }
    }
}

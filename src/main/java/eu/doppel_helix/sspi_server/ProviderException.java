package eu.doppel_helix.sspi_server;

import com.sun.jna.platform.win32.WinError;
import eu.doppel_helix.sspi_server.internal.util.WinErrorSecMap;
import org.ietf.jgss.GSSException;

/**
 * A call into the security package returned a failure status.
 */
public class ProviderException extends NegotiationException {

    private static final long serialVersionUID = 4633025839177401275L;

    public ProviderException(int majorCode, int status, String message) {
        super(majorCode, status, message);
    }

    public ProviderException(int majorCode, int status, String message, Throwable cause) {
        super(majorCode, status, message, cause);
    }

    public static ProviderException forStatus(String operation, int status) {
        return new ProviderException(majorCodeFor(status), status,
                operation + " failed: " + WinErrorSecMap.resolveString(status));
    }

    static int majorCodeFor(int status) {
        switch (status) {
            case WinError.SEC_E_INVALID_TOKEN:
                return GSSException.DEFECTIVE_TOKEN;
            case WinError.SEC_E_NO_CREDENTIALS:
            case WinError.SEC_E_UNKNOWN_CREDENTIALS:
                return GSSException.NO_CRED;
            case WinError.SEC_E_CONTEXT_EXPIRED:
                return GSSException.CONTEXT_EXPIRED;
            default:
                return GSSException.FAILURE;
        }
    }
}

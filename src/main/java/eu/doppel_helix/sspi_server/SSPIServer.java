package eu.doppel_helix.sspi_server;

import java.security.AccessController;
import java.security.PrivilegedAction;

/**
 * Entry point for server side SSPI negotiation backed by secur32.dll.
 *
 * <p>Debug output is enabled by setting the system property
 * {@code eu.doppel_helix.sspi_server.debug} to {@code true}.</p>
 */
public final class SSPIServer {

    static final boolean DEBUG;

    static {
        DEBUG = AccessController.doPrivileged(new PrivilegedAction<Boolean>() {
            @Override
            public Boolean run() {
                return Boolean.getBoolean("eu.doppel_helix.sspi_server.debug");
            }
        });
    }

    private SSPIServer() {
    }

    /**
     * Create a server context with no request flags and native data
     * representation.
     */
    public static ServerAuthenticationContext createContext(CredentialHandle credentials) {
        return new ServerAuthenticationContext(NativeProviderHolder.INSTANCE, credentials);
    }

    public static ServerAuthenticationContext createContext(CredentialHandle credentials,
            int requestedFlags, DataRepresentation dataRepresentation) {
        return new ServerAuthenticationContext(NativeProviderHolder.INSTANCE,
                credentials, requestedFlags, dataRepresentation);
    }

    /**
     * The provider bound to secur32.dll. Only available on windows.
     */
    public static NegotiationProvider getNativeProvider() {
        return NativeProviderHolder.INSTANCE;
    }

    static void debug(String message) {
        if (DEBUG) {
            assert (message != null);
            System.out.println(message);
        }
    }

    static void debug(String format, Object... args) {
        if (DEBUG) {
            System.out.printf(format + "%n", args);
        }
    }

    private static class NativeProviderHolder {
        static final Secur32NegotiationProvider INSTANCE = new Secur32NegotiationProvider();
    }
}

package eu.doppel_helix.sspi_server.internal.util;

import com.sun.jna.platform.win32.WinError;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves SSPI status codes (SEC_E_* and SEC_I_*) to their symbolic names.
 */
public class WinErrorSecMap {

    private static final Map<Integer, String> NAMES;

    static {
        Map<Integer, String> names = new HashMap<>();
        names.put(WinError.SEC_E_OK, "SEC_E_OK");
        names.put(WinError.SEC_I_CONTINUE_NEEDED, "SEC_I_CONTINUE_NEEDED");
        names.put(WinError.SEC_I_COMPLETE_NEEDED, "SEC_I_COMPLETE_NEEDED");
        names.put(WinError.SEC_I_COMPLETE_AND_CONTINUE, "SEC_I_COMPLETE_AND_CONTINUE");
        names.put(0x00090315, "SEC_I_LOCAL_LOGON");
        names.put(0x00090317, "SEC_I_CONTEXT_EXPIRED");
        names.put(0x00090320, "SEC_I_INCOMPLETE_CREDENTIALS");
        names.put(0x00090321, "SEC_I_RENEGOTIATE");
        names.put(WinError.SEC_E_INSUFFICIENT_MEMORY, "SEC_E_INSUFFICIENT_MEMORY");
        names.put(WinError.SEC_E_INVALID_HANDLE, "SEC_E_INVALID_HANDLE");
        names.put(0x80090302, "SEC_E_UNSUPPORTED_FUNCTION");
        names.put(0x80090303, "SEC_E_TARGET_UNKNOWN");
        names.put(0x80090304, "SEC_E_INTERNAL_ERROR");
        names.put(0x80090305, "SEC_E_SECPKG_NOT_FOUND");
        names.put(0x80090306, "SEC_E_NOT_OWNER");
        names.put(0x80090307, "SEC_E_CANNOT_INSTALL");
        names.put(WinError.SEC_E_INVALID_TOKEN, "SEC_E_INVALID_TOKEN");
        names.put(0x80090309, "SEC_E_CANNOT_PACK");
        names.put(WinError.SEC_E_QOP_NOT_SUPPORTED, "SEC_E_QOP_NOT_SUPPORTED");
        names.put(WinError.SEC_E_NO_IMPERSONATION, "SEC_E_NO_IMPERSONATION");
        names.put(WinError.SEC_E_LOGON_DENIED, "SEC_E_LOGON_DENIED");
        names.put(WinError.SEC_E_UNKNOWN_CREDENTIALS, "SEC_E_UNKNOWN_CREDENTIALS");
        names.put(WinError.SEC_E_NO_CREDENTIALS, "SEC_E_NO_CREDENTIALS");
        names.put(0x8009030F, "SEC_E_MESSAGE_ALTERED");
        names.put(0x80090310, "SEC_E_OUT_OF_SEQUENCE");
        names.put(0x80090311, "SEC_E_NO_AUTHENTICATING_AUTHORITY");
        names.put(0x80090316, "SEC_E_BAD_PKGID");
        names.put(WinError.SEC_E_CONTEXT_EXPIRED, "SEC_E_CONTEXT_EXPIRED");
        names.put(0x80090318, "SEC_E_INCOMPLETE_MESSAGE");
        names.put(0x80090320, "SEC_E_INCOMPLETE_CREDENTIALS");
        names.put(WinError.SEC_E_BUFFER_TOO_SMALL, "SEC_E_BUFFER_TOO_SMALL");
        names.put(0x80090322, "SEC_E_WRONG_PRINCIPAL");
        names.put(0x80090324, "SEC_E_TIME_SKEW");
        names.put(0x80090325, "SEC_E_UNTRUSTED_ROOT");
        names.put(0x80090326, "SEC_E_ILLEGAL_MESSAGE");
        names.put(0x80090327, "SEC_E_CERT_UNKNOWN");
        names.put(0x80090328, "SEC_E_CERT_EXPIRED");
        names.put(0x80090329, "SEC_E_ENCRYPT_FAILURE");
        names.put(0x80090330, "SEC_E_DECRYPT_FAILURE");
        names.put(0x80090331, "SEC_E_ALGORITHM_MISMATCH");
        names.put(0x80090332, "SEC_E_SECURITY_QOS_FAILED");
        names.put(0x80090333, "SEC_E_UNFINISHED_CONTEXT_DELETED");
        names.put(0x80090334, "SEC_E_NO_TGT_REPLY");
        names.put(0x80090335, "SEC_E_NO_IP_ADDRESSES");
        names.put(0x80090336, "SEC_E_WRONG_CREDENTIAL_HANDLE");
        names.put(WinError.SEC_E_CRYPTO_SYSTEM_INVALID, "SEC_E_CRYPTO_SYSTEM_INVALID");
        names.put(0x80090338, "SEC_E_MAX_REFERRALS_EXCEEDED");
        names.put(0x80090339, "SEC_E_MUST_BE_KDC");
        names.put(0x8009033A, "SEC_E_STRONG_CRYPTO_NOT_SUPPORTED");
        names.put(0x8009033B, "SEC_E_TOO_MANY_PRINCIPALS");
        names.put(0x8009033C, "SEC_E_NO_PA_DATA");
        names.put(0x8009033D, "SEC_E_PKINIT_NAME_MISMATCH");
        names.put(0x8009033E, "SEC_E_SMARTCARD_LOGON_REQUIRED");
        names.put(0x8009033F, "SEC_E_SHUTDOWN_IN_PROGRESS");
        names.put(0x80090340, "SEC_E_KDC_INVALID_REQUEST");
        names.put(0x80090341, "SEC_E_KDC_UNABLE_TO_REFER");
        names.put(0x80090342, "SEC_E_KDC_UNKNOWN_ETYPE");
        names.put(0x80090343, "SEC_E_UNSUPPORTED_PREAUTH");
        names.put(0x80090345, "SEC_E_DELEGATION_REQUIRED");
        names.put(0x80090346, "SEC_E_BAD_BINDINGS");
        names.put(0x80090347, "SEC_E_MULTIPLE_ACCOUNTS");
        names.put(0x80090348, "SEC_E_NO_KERB_KEY");
        names.put(0x80090349, "SEC_E_CERT_WRONG_USAGE");
        names.put(0x80090350, "SEC_E_DOWNGRADE_DETECTED");
        NAMES = Collections.unmodifiableMap(names);
    }

    private WinErrorSecMap() {
    }

    /**
     * @return symbolic name of the status, or {@code null} if unknown
     */
    public static String getName(int status) {
        return NAMES.get(status);
    }

    /**
     * Render a status as {@code NAME (0x8009030c)}. Unknown codes are
     * rendered as {@code UNKNOWN (0x...)}.
     */
    public static String resolveString(int status) {
        String name = NAMES.get(status);
        return String.format("%s (0x%08x)", name == null ? "UNKNOWN" : name, status);
    }
}

package eu.doppel_helix.sspi_server;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ASC_REQ_* request flags for AcceptSecurityContext.
 */
public final class AcceptContextReqFlags {

    public static final int NONE = 0;
    public static final int DELEGATE = 0x00000001;
    public static final int MUTUAL_AUTH = 0x00000002;
    public static final int REPLAY_DETECT = 0x00000004;
    public static final int SEQUENCE_DETECT = 0x00000008;
    public static final int CONFIDENTIALITY = 0x00000010;
    public static final int USE_SESSION_KEY = 0x00000020;
    public static final int SESSION_TICKET = 0x00000040;
    /**
     * Let the package allocate output buffers. Always stripped by
     * {@link ServerAuthenticationContext}, which supplies its own buffer.
     */
    public static final int ALLOCATE_MEMORY = 0x00000100;
    public static final int USE_DCE_STYLE = 0x00000200;
    public static final int DATAGRAM = 0x00000400;
    public static final int CONNECTION = 0x00000800;
    public static final int CALL_LEVEL = 0x00001000;
    public static final int FRAGMENT_SUPPLIED = 0x00002000;
    public static final int EXTENDED_ERROR = 0x00008000;
    public static final int STREAM = 0x00010000;
    public static final int INTEGRITY = 0x00020000;
    public static final int LICENSING = 0x00040000;
    public static final int IDENTIFY = 0x00080000;
    public static final int ALLOW_NULL_SESSION = 0x00100000;
    public static final int ALLOW_NON_USER_LOGONS = 0x00200000;
    public static final int ALLOW_CONTEXT_REPLAY = 0x00400000;
    public static final int FRAGMENT_TO_FIT = 0x00800000;
    public static final int NO_TOKEN = 0x01000000;
    public static final int PROXY_BINDINGS = 0x04000000;
    public static final int ALLOW_MISSING_BINDINGS = 0x10000000;

    private static final Map<Integer, String> NAMES = new LinkedHashMap<>();

    static {
        NAMES.put(DELEGATE, "DELEGATE");
        NAMES.put(MUTUAL_AUTH, "MUTUAL_AUTH");
        NAMES.put(REPLAY_DETECT, "REPLAY_DETECT");
        NAMES.put(SEQUENCE_DETECT, "SEQUENCE_DETECT");
        NAMES.put(CONFIDENTIALITY, "CONFIDENTIALITY");
        NAMES.put(USE_SESSION_KEY, "USE_SESSION_KEY");
        NAMES.put(SESSION_TICKET, "SESSION_TICKET");
        NAMES.put(ALLOCATE_MEMORY, "ALLOCATE_MEMORY");
        NAMES.put(USE_DCE_STYLE, "USE_DCE_STYLE");
        NAMES.put(DATAGRAM, "DATAGRAM");
        NAMES.put(CONNECTION, "CONNECTION");
        NAMES.put(CALL_LEVEL, "CALL_LEVEL");
        NAMES.put(FRAGMENT_SUPPLIED, "FRAGMENT_SUPPLIED");
        NAMES.put(EXTENDED_ERROR, "EXTENDED_ERROR");
        NAMES.put(STREAM, "STREAM");
        NAMES.put(INTEGRITY, "INTEGRITY");
        NAMES.put(LICENSING, "LICENSING");
        NAMES.put(IDENTIFY, "IDENTIFY");
        NAMES.put(ALLOW_NULL_SESSION, "ALLOW_NULL_SESSION");
        NAMES.put(ALLOW_NON_USER_LOGONS, "ALLOW_NON_USER_LOGONS");
        NAMES.put(ALLOW_CONTEXT_REPLAY, "ALLOW_CONTEXT_REPLAY");
        NAMES.put(FRAGMENT_TO_FIT, "FRAGMENT_TO_FIT");
        NAMES.put(NO_TOKEN, "NO_TOKEN");
        NAMES.put(PROXY_BINDINGS, "PROXY_BINDINGS");
        NAMES.put(ALLOW_MISSING_BINDINGS, "ALLOW_MISSING_BINDINGS");
    }

    private AcceptContextReqFlags() {
    }

    /**
     * Render the set bits as {@code A|B}. Bits without a name are appended as
     * a hex value, an empty set is rendered as {@code NONE}.
     */
    public static String toString(int flags) {
        return formatFlags(NAMES, flags);
    }

    static String formatFlags(Map<Integer, String> names, int flags) {
        if (flags == 0) {
            return "NONE";
        }
        StringBuilder sb = new StringBuilder();
        int remaining = flags;
        for (Map.Entry<Integer, String> entry : names.entrySet()) {
            int bit = entry.getKey();
            if ((flags & bit) == bit) {
                if (sb.length() > 0) {
                    sb.append('|');
                }
                sb.append(entry.getValue());
                remaining &= ~bit;
            }
        }
        if (remaining != 0) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            sb.append(String.format("0x%08x", remaining));
        }
        return sb.toString();
    }
}

package eu.doppel_helix.sspi_server;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ASC_RET_* flags reported by AcceptSecurityContext.
 */
public final class AcceptContextRetFlags {

    public static final int NONE = 0;
    public static final int DELEGATE = 0x00000001;
    public static final int MUTUAL_AUTH = 0x00000002;
    public static final int REPLAY_DETECT = 0x00000004;
    public static final int SEQUENCE_DETECT = 0x00000008;
    public static final int CONFIDENTIALITY = 0x00000010;
    public static final int USE_SESSION_KEY = 0x00000020;
    public static final int SESSION_TICKET = 0x00000040;
    public static final int ALLOCATED_MEMORY = 0x00000100;
    public static final int USED_DCE_STYLE = 0x00000200;
    public static final int DATAGRAM = 0x00000400;
    public static final int CONNECTION = 0x00000800;
    public static final int CALL_LEVEL = 0x00002000;
    public static final int THIRD_LEG_FAILED = 0x00004000;
    public static final int EXTENDED_ERROR = 0x00008000;
    public static final int STREAM = 0x00010000;
    public static final int INTEGRITY = 0x00020000;
    public static final int LICENSING = 0x00040000;
    public static final int IDENTIFY = 0x00080000;
    public static final int NULL_SESSION = 0x00100000;
    public static final int ALLOW_NON_USER_LOGONS = 0x00200000;
    public static final int ALLOW_CONTEXT_REPLAY = 0x00400000;
    public static final int FRAGMENT_ONLY = 0x00800000;
    public static final int NO_TOKEN = 0x01000000;
    public static final int NO_ADDITIONAL_TOKEN = 0x02000000;

    private static final Map<Integer, String> NAMES = new LinkedHashMap<>();

    static {
        NAMES.put(DELEGATE, "DELEGATE");
        NAMES.put(MUTUAL_AUTH, "MUTUAL_AUTH");
        NAMES.put(REPLAY_DETECT, "REPLAY_DETECT");
        NAMES.put(SEQUENCE_DETECT, "SEQUENCE_DETECT");
        NAMES.put(CONFIDENTIALITY, "CONFIDENTIALITY");
        NAMES.put(USE_SESSION_KEY, "USE_SESSION_KEY");
        NAMES.put(SESSION_TICKET, "SESSION_TICKET");
        NAMES.put(ALLOCATED_MEMORY, "ALLOCATED_MEMORY");
        NAMES.put(USED_DCE_STYLE, "USED_DCE_STYLE");
        NAMES.put(DATAGRAM, "DATAGRAM");
        NAMES.put(CONNECTION, "CONNECTION");
        NAMES.put(CALL_LEVEL, "CALL_LEVEL");
        NAMES.put(THIRD_LEG_FAILED, "THIRD_LEG_FAILED");
        NAMES.put(EXTENDED_ERROR, "EXTENDED_ERROR");
        NAMES.put(STREAM, "STREAM");
        NAMES.put(INTEGRITY, "INTEGRITY");
        NAMES.put(LICENSING, "LICENSING");
        NAMES.put(IDENTIFY, "IDENTIFY");
        NAMES.put(NULL_SESSION, "NULL_SESSION");
        NAMES.put(ALLOW_NON_USER_LOGONS, "ALLOW_NON_USER_LOGONS");
        NAMES.put(ALLOW_CONTEXT_REPLAY, "ALLOW_CONTEXT_REPLAY");
        NAMES.put(FRAGMENT_ONLY, "FRAGMENT_ONLY");
        NAMES.put(NO_TOKEN, "NO_TOKEN");
        NAMES.put(NO_ADDITIONAL_TOKEN, "NO_ADDITIONAL_TOKEN");
    }

    private AcceptContextRetFlags() {
    }

    public static String toString(int flags) {
        return AcceptContextReqFlags.formatFlags(NAMES, flags);
    }

    public static boolean isSet(int flags, int flag) {
        return (flags & flag) == flag;
    }
}

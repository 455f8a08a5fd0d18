package eu.doppel_helix.sspi_server;

import com.sun.jna.platform.win32.WinError;

/**
 * Outcome of a negotiation call as far as the state machine is concerned.
 * Every native code outside the four success codes maps to {@link #ERROR}.
 */
public enum SecurityStatus {
    OK,
    CONTINUE_NEEDED,
    COMPLETE_NEEDED,
    COMPLETE_AND_CONTINUE,
    ERROR;

    public static SecurityStatus fromCode(int code) {
        switch (code) {
            case WinError.SEC_E_OK:
                return OK;
            case WinError.SEC_I_CONTINUE_NEEDED:
                return CONTINUE_NEEDED;
            case WinError.SEC_I_COMPLETE_NEEDED:
                return COMPLETE_NEEDED;
            case WinError.SEC_I_COMPLETE_AND_CONTINUE:
                return COMPLETE_AND_CONTINUE;
            default:
                return ERROR;
        }
    }

    public boolean isError() {
        return this == ERROR;
    }

    /**
     * @return {@code true} if the output token has to be finalized with
     * CompleteAuthToken before it is sent
     */
    public boolean requiresCompletion() {
        return this == COMPLETE_NEEDED || this == COMPLETE_AND_CONTINUE;
    }

    /**
     * @return {@code true} if the peer has to send another token
     */
    public boolean requiresContinuation() {
        return this == CONTINUE_NEEDED || this == COMPLETE_AND_CONTINUE;
    }

    /**
     * @return {@code true} if the handshake is finished after this status
     */
    public boolean isDone() {
        return !isError() && !requiresContinuation();
    }
}

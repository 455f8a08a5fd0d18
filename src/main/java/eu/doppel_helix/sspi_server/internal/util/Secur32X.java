package eu.doppel_helix.sspi_server.internal.util;

import com.sun.jna.Native;
import com.sun.jna.Pointer;
import com.sun.jna.platform.win32.Sspi;
import com.sun.jna.platform.win32.WinNT;
import com.sun.jna.ptr.IntByReference;
import com.sun.jna.win32.StdCallLibrary;
import com.sun.jna.win32.W32APIOptions;
import eu.doppel_helix.sspi_server.internal.util.SspiX.ManagedSecBufferDesc;

/**
 * Bindings for the parts of secur32.dll used to run the server side of a
 * negotiation. Buffer descriptors are {@link ManagedSecBufferDesc} so that the
 * SecBuffer array is synced around every call.
 */
public interface Secur32X extends StdCallLibrary {

    Secur32X INSTANCE = Native.load("Secur32", Secur32X.class, W32APIOptions.DEFAULT_OPTIONS);

    int AcceptSecurityContext(Sspi.CredHandle phCredential, Sspi.CtxtHandle phContext,
            ManagedSecBufferDesc pInput, int fContextReq, int TargetDataRep,
            Sspi.CtxtHandle phNewContext, ManagedSecBufferDesc pOutput,
            IntByReference pfContextAttr, Sspi.TimeStamp ptsTimeStamp);

    int CompleteAuthToken(Sspi.CtxtHandle phContext, ManagedSecBufferDesc pToken);

    int DeleteSecurityContext(Sspi.CtxtHandle phContext);

    int ImpersonateSecurityContext(Sspi.CtxtHandle phContext);

    int RevertSecurityContext(Sspi.CtxtHandle phContext);

    int QuerySecurityContextToken(Sspi.CtxtHandle phContext, WinNT.HANDLEByReference phToken);

    int AcquireCredentialsHandle(String pszPrincipal, String pszPackage,
            int fCredentialUse, WinNT.LUID pvLogonID, Pointer pAuthData,
            Pointer pGetKeyFn, Pointer pvGetKeyArgument,
            Sspi.CredHandle phCredential, Sspi.TimeStamp ptsExpiry);

    int FreeCredentialsHandle(Sspi.CredHandle phCredential);

    int InitializeSecurityContext(Sspi.CredHandle phCredential, Sspi.CtxtHandle phContext,
            String pszTargetName, int fContextReq, int Reserved1,
            int TargetDataRep, ManagedSecBufferDesc pInput, int Reserved2,
            Sspi.CtxtHandle phNewContext, ManagedSecBufferDesc pOutput,
            IntByReference pfContextAttr, Sspi.TimeStamp ptsExpiry);
}

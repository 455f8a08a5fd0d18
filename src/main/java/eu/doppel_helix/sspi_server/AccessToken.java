package eu.doppel_helix.sspi_server;

import java.util.List;

/**
 * Identity of the client that authenticated through a server context.
 */
public interface AccessToken extends AutoCloseable {

    /**
     * @return account name qualified with its domain
     */
    String getUserName() throws NegotiationException;

    List<String> getGroupNames() throws NegotiationException;

    /**
     * Release the underlying token. Calls after the first are ignored.
     */
    @Override
    void close();
}

package cloud.tokendispenser.sdk.invoke;

import cloud.tokendispenser.sdk.TransportException;

/**
 * Contract for synchronously calling a remote function by identifier.
 */
public interface FunctionInvoker {

    /**
     * Performs a single request/response exchange. Implementations must not retry.
     *
     * @throws TransportException when no answer could be obtained from the backend.
     */
    InvocationResult call(String identifier, byte[] payload) throws TransportException;
}

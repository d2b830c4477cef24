package cloud.tokendispenser.sdk.discovery;

import cloud.tokendispenser.sdk.TransportException;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a hierarchical key/value directory holding backend identifiers.
 */
public interface ParameterDirectory {

    /**
     * @return the value stored at exactly {@code path}, or empty when no such entry exists.
     */
    Optional<String> get(String path) throws TransportException;

    /**
     * Lists entries below {@code prefix}, recursively.
     *
     * @param limit maximum number of entries to return; implementations may stop fetching once reached.
     * @return entry name to value, in the order the directory returned them.
     */
    Map<String, String> listUnder(String prefix, int limit) throws TransportException;
}

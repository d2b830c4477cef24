package cloud.tokendispenser.sdk;

/**
 * Raised when the token dispenser backend cannot be resolved to exactly one identifier.
 */
public final class DiscoveryException extends TokenDispenserException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** No entry at the explicit key, or no entry under the default prefix. */
        NOT_FOUND,
        /** More than one entry under the default prefix. */
        AMBIGUOUS
    }

    private final Kind kind;
    private final String searchedKey;

    public DiscoveryException(Kind kind, String searchedKey, String message) {
        super(message);
        this.kind = kind;
        this.searchedKey = searchedKey;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the explicit key or default prefix that was searched.
     */
    public String getSearchedKey() {
        return searchedKey;
    }
}

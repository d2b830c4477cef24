package cloud.tokendispenser.sdk;

/**
 * Base exception thrown by the Token Dispenser client. Every failure of
 * {@link TokenDispenserClient#getToken(String, Integer, String)} is reported through a subtype.
 */
public class TokenDispenserException extends Exception {

    private static final long serialVersionUID = 1L;

    public TokenDispenserException(String message) {
        super(message);
    }

    public TokenDispenserException(String message, Throwable cause) {
        super(message, cause);
    }
}

package cloud.tokendispenser.sdk;

import java.util.List;

/**
 * Raised when caller input is rejected before any remote call is made.
 */
public final class ValidationException extends TokenDispenserException {

    private static final long serialVersionUID = 1L;

    /**
     * Which input was rejected first.
     */
    public enum Kind {
        INVALID_CLIENT_ID,
        INVALID_TTL
    }

    private final Kind kind;
    private final List<String> problems;

    public ValidationException(Kind kind, List<String> problems) {
        super(String.join("; ", problems));
        this.kind = kind;
        this.problems = List.copyOf(problems);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return every problem found in the input, in the order they were detected.
     */
    public List<String> getProblems() {
        return problems;
    }
}

package infra.director.services;

/**
 * A statement was rejected because it could modify the database.
 */
public class ReadOnlyViolationException extends Exception {

    private final String detected;

    public ReadOnlyViolationException(String detected, String message) {
        super(message);
        this.detected = detected;
    }

    /**
     * Keyword or pattern that triggered the rejection.
     */
    public String getDetected() {
        return detected;
    }
}

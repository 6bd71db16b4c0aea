package me.christianrobert.retarget.translator.context;

/**
 * Exception thrown during translation of a syntax tree into target source.
 * Captures the target and the location inside the tree where the problem surfaced.
 */
public class TranslationException extends RuntimeException {

    private final String target;
    private final String location;

    public TranslationException(String message) {
        super(message);
        this.target = null;
        this.location = null;
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
        this.target = null;
        this.location = null;
    }

    public TranslationException(String message, String target, String location) {
        super(message);
        this.target = target;
        this.location = location;
    }

    public String getTarget() {
        return target;
    }

    public String getLocation() {
        return location;
    }

    /**
     * Gets a detailed error message including target and tree location.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (target != null) {
            sb.append("\nTarget: ").append(target);
        }
        if (location != null) {
            sb.append("\nLocation: ").append(location);
        }
        return sb.toString();
    }
}

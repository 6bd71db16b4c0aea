package me.christianrobert.retarget.translator.context;

/**
 * No syntax tree could be produced for the input. The emitters never raise this;
 * it comes from tree readers, and callers fall back to the original source.
 */
public class ParseUnavailableException extends TranslationException {

    public ParseUnavailableException(String message) {
        super(message);
    }

    public ParseUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package me.christianrobert.retarget.translator.context;

/**
 * The requested target language is not in the catalog. Fatal to the call that raised it.
 */
public class ConfigurationException extends TranslationException {

    public ConfigurationException(String message, String target) {
        super(message, target, null);
    }
}

package me.christianrobert.retarget.translator.profile;

import java.util.HashMap;
import java.util.Map;

/**
 * Fills {@code {name}} placeholders in profile templates.
 *
 * <p>Substitution is a single left-to-right pass: text inserted for one placeholder is
 * never scanned again, so emitted code that itself contains {@code {value}} or braces
 * survives unchanged. A brace that does not start a known placeholder is copied as is,
 * which keeps literal braces in templates such as {@code {{key}, {value}}} intact.</p>
 */
public final class Template {

    private Template() {
    }

    /**
     * @param template template text
     * @param keyValues alternating placeholder names and replacement values
     */
    public static String fill(String template, String... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Placeholder names and values must come in pairs");
        }
        Map<String, String> values = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put(keyValues[i], keyValues[i + 1]);
        }
        return fill(template, values);
    }

    public static String fill(String template, Map<String, String> values) {
        StringBuilder result = new StringBuilder(template.length() + 16);
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '{') {
                int end = template.indexOf('}', i + 1);
                if (end > i + 1) {
                    String name = template.substring(i + 1, end);
                    if (isPlaceholderName(name) && values.containsKey(name)) {
                        result.append(values.get(name));
                        i = end + 1;
                        continue;
                    }
                }
            }
            result.append(c);
            i++;
        }
        return result.toString();
    }

    /**
     * True when the template mentions {@code {name}}.
     */
    public static boolean mentions(String template, String name) {
        return template.contains("{" + name + "}");
    }

    private static boolean isPlaceholderName(String name) {
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }
}

package me.christianrobert.retarget.translator.profile;

import me.christianrobert.retarget.translator.context.ConfigurationException;
import me.christianrobert.retarget.translator.profile.catalog.ManagedLanguageProfiles;
import me.christianrobert.retarget.translator.profile.catalog.NativeLanguageProfiles;
import me.christianrobert.retarget.translator.profile.catalog.ScriptingLanguageProfiles;
import me.christianrobert.retarget.translator.profile.catalog.WebLanguageProfiles;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of all target profiles, keyed by catalog entry.
 *
 * <p>Built once when the class loads; every {@link TargetLanguage} must have exactly one
 * profile, otherwise class initialization fails.</p>
 */
public final class LanguageProfiles {

    private static final Map<TargetLanguage, LanguageProfile> PROFILES = register();

    private LanguageProfiles() {
    }

    private static Map<TargetLanguage, LanguageProfile> register() {
        List<LanguageProfile> all = new ArrayList<>();
        all.addAll(WebLanguageProfiles.profiles());
        all.addAll(ManagedLanguageProfiles.profiles());
        all.addAll(NativeLanguageProfiles.profiles());
        all.addAll(ScriptingLanguageProfiles.profiles());

        Map<TargetLanguage, LanguageProfile> byLanguage = new EnumMap<>(TargetLanguage.class);
        for (LanguageProfile profile : all) {
            if (byLanguage.put(profile.getLanguage(), profile) != null) {
                throw new IllegalStateException("Duplicate profile for " + profile.getId());
            }
        }
        for (TargetLanguage language : TargetLanguage.values()) {
            if (!byLanguage.containsKey(language)) {
                throw new IllegalStateException("No profile registered for " + language.getId());
            }
        }
        return Collections.unmodifiableMap(byLanguage);
    }

    public static LanguageProfile get(TargetLanguage language) {
        return PROFILES.get(language);
    }

    /**
     * Resolves a target identifier or alias.
     *
     * @throws ConfigurationException when the identifier is not in the catalog
     */
    public static LanguageProfile resolve(String target) {
        TargetLanguage language = TargetLanguage.fromName(target);
        if (language == null) {
            throw new ConfigurationException("Unknown target language: '" + target + "'", target);
        }
        return PROFILES.get(language);
    }

    public static Collection<LanguageProfile> all() {
        return PROFILES.values();
    }
}

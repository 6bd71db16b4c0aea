package me.christianrobert.retarget.translator.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.RuntimeFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Adds the import lines a translated program needs for the runtime facilities it used.
 *
 * <p>Source imports are never carried over (their modules mean nothing in the target);
 * instead the profile maps each {@link RuntimeFeature} to the line that makes it
 * available, e.g. {@code import "fmt"} for Go's print or {@code #include <iostream>}
 * for C++.</p>
 *
 * <p>Lines are placed right after the profile's import anchor (Go's {@code package main},
 * PHP's {@code <?php}) or, without an anchor, at the very top.</p>
 */
@ApplicationScoped
public class ImportSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(ImportSynthesizer.class);

    /**
     * Import lines for the given features, in feature declaration order, without duplicates.
     * Several features may share one line (all of Go's formatting goes through {@code fmt}).
     */
    public List<String> requiredImports(LanguageProfile profile, Set<RuntimeFeature> features) {
        Set<String> lines = new LinkedHashSet<>();
        for (RuntimeFeature feature : RuntimeFeature.values()) {
            if (!features.contains(feature)) {
                continue;
            }
            String line = profile.importFor(feature);
            if (line != null) {
                lines.add(line);
            }
        }
        return new ArrayList<>(lines);
    }

    /**
     * Inserts the import lines into the code. Lines already present in the code are skipped.
     */
    public String insertImports(String code, LanguageProfile profile, List<String> imports) {
        Set<String> existing = new HashSet<>();
        for (String line : code.split("\n", -1)) {
            existing.add(line.trim());
        }
        List<String> missing = new ArrayList<>();
        for (String line : imports) {
            if (!existing.contains(line.trim())) {
                missing.add(line);
            }
        }
        if (missing.isEmpty()) {
            return code;
        }
        String block = String.join("\n", missing);
        log.debug("Adding {} import line(s) for {}", missing.size(), profile.getId());

        String anchor = profile.getImportAnchor();
        if (anchor != null && !anchor.isEmpty()) {
            List<String> lines = Arrays.asList(code.split("\n", -1));
            for (int i = 0; i < lines.size(); i++) {
                if (lines.get(i).trim().equals(anchor)) {
                    String head = String.join("\n", lines.subList(0, i + 1));
                    String tail = String.join("\n", lines.subList(i + 1, lines.size()));
                    if (tail.trim().isEmpty()) {
                        return head + "\n\n" + block;
                    }
                    return head + "\n\n" + block + "\n" + (tail.startsWith("\n") ? tail : "\n" + tail);
                }
            }
            log.debug("Import anchor '{}' not found, prepending imports", anchor);
        }
        return block + "\n\n" + code;
    }
}

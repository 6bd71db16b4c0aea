package me.christianrobert.retarget.translator.context;

import me.christianrobert.retarget.translator.profile.RuntimeFeature;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Output of one emission call: the target text plus what the caller needs for
 * post-processing (import synthesis, placeholder warnings).
 */
public class EmissionResult {

    private final String code;
    private final List<EmissionDiagnostic> diagnostics;
    private final Set<RuntimeFeature> usedFeatures;
    private final List<String> droppedImports;

    public EmissionResult(String code, List<EmissionDiagnostic> diagnostics,
                          Set<RuntimeFeature> usedFeatures, List<String> droppedImports) {
        this.code = code;
        this.diagnostics = List.copyOf(diagnostics);
        this.usedFeatures = Collections.unmodifiableSet(usedFeatures.isEmpty()
                ? EnumSet.noneOf(RuntimeFeature.class)
                : EnumSet.copyOf(usedFeatures));
        this.droppedImports = List.copyOf(droppedImports);
    }

    public String getCode() {
        return code;
    }

    public List<EmissionDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public Set<RuntimeFeature> getUsedFeatures() {
        return usedFeatures;
    }

    /**
     * Module names of top-level import statements, which are not emitted.
     */
    public List<String> getDroppedImports() {
        return droppedImports;
    }
}

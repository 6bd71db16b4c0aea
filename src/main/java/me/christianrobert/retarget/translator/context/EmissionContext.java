package me.christianrobert.retarget.translator.context;

import me.christianrobert.retarget.translator.profile.LanguageProfile;
import me.christianrobert.retarget.translator.profile.RuntimeFeature;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Mutable state of a single emission call.
 *
 * <h3>Lifecycle</h3>
 * <p>Created by {@code ProgramEmitter} for one call and discarded when it returns.
 * It is never cached or shared, so emissions on different threads need no locking.
 * Only the profile it holds is shared, and profiles are immutable.</p>
 *
 * <h3>State</h3>
 * <ul>
 *   <li>Depth: indentation level of the statement being emitted</li>
 *   <li>{@link DeclarationScopes}: which variable names are already declared</li>
 *   <li>Definition stack: whether the innermost definition is a class body or a function
 *       body, plus the names of enclosing classes</li>
 *   <li>Location breadcrumb, diagnostics and used runtime features, reported back to
 *       the caller in the {@link EmissionResult}</li>
 * </ul>
 */
public class EmissionContext {

    private final LanguageProfile profile;
    private final DeclarationScopes scopes = new DeclarationScopes();
    private final Deque<String> enclosingClasses = new ArrayDeque<>();
    // true = class body, false = function body
    private final Deque<Boolean> definitionKinds = new ArrayDeque<>();
    private final Deque<String> location = new ArrayDeque<>();
    private final List<EmissionDiagnostic> diagnostics = new ArrayList<>();
    private final Set<RuntimeFeature> usedFeatures = EnumSet.noneOf(RuntimeFeature.class);
    private int depth;

    public EmissionContext(LanguageProfile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("profile cannot be null");
        }
        this.profile = profile;
    }

    public LanguageProfile getProfile() {
        return profile;
    }

    // ========== DEPTH AND SCOPES ==========

    public int getDepth() {
        return depth;
    }

    public void setDepth(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth cannot be negative");
        }
        this.depth = depth;
    }

    /**
     * Indentation prefix for the current depth.
     */
    public String indent() {
        return profile.indent(depth);
    }

    /**
     * Enters a nested block: one level deeper, with a fresh declaration scope.
     * Always pair with {@link #exitBlock()} in a finally block.
     *
     * @param boundary true for function and class bodies
     */
    public void enterBlock(boolean boundary) {
        depth++;
        scopes.push(boundary);
    }

    public void exitBlock() {
        scopes.pop();
        depth--;
    }

    public boolean isDeclared(String name) {
        return scopes.isDeclared(name);
    }

    /**
     * @return true when this is the first sight of the name in the visible scopes
     */
    public boolean declare(String name) {
        return scopes.declare(name);
    }

    // ========== DEFINITIONS ==========

    public void enterClass(String className) {
        enclosingClasses.push(className);
        definitionKinds.push(Boolean.TRUE);
    }

    public void exitClass() {
        enclosingClasses.pop();
        definitionKinds.pop();
    }

    public void enterFunction() {
        definitionKinds.push(Boolean.FALSE);
    }

    public void exitFunction() {
        definitionKinds.pop();
    }

    /**
     * True while emitting statements that sit directly in a class body.
     */
    public boolean isInClassBody() {
        return !definitionKinds.isEmpty() && definitionKinds.peek();
    }

    /**
     * Name of the innermost enclosing class, or null outside any class.
     */
    public String getCurrentClassName() {
        return enclosingClasses.peek();
    }

    // ========== DIAGNOSTICS ==========

    public void pushLocation(String step) {
        location.push(step);
    }

    public void popLocation() {
        location.pop();
    }

    public String getLocation() {
        StringBuilder sb = new StringBuilder();
        Iterator<String> it = location.descendingIterator();
        while (it.hasNext()) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(it.next());
        }
        return sb.toString();
    }

    public void report(String nodeKind, String reason) {
        diagnostics.add(new EmissionDiagnostic(getLocation(), nodeKind, reason));
    }

    public List<EmissionDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public void useFeature(RuntimeFeature feature) {
        usedFeatures.add(feature);
    }

    public Set<RuntimeFeature> getUsedFeatures() {
        return Collections.unmodifiableSet(usedFeatures);
    }
}

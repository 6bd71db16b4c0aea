package me.christianrobert.retarget.translator.context;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;

/**
 * Stack of variable declaration scopes for one emission.
 *
 * <p>Function and class bodies open <em>boundary</em> scopes; nested blocks (if, loops)
 * open plain scopes. A lookup walks outward from the innermost scope and stops after the
 * nearest boundary, so a name assigned in an enclosing function is declared again in a
 * nested function, while a name assigned before an if statement is not declared again
 * inside it.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * scopes.push(false);
 * try {
 *     // emit block
 * } finally {
 *     scopes.pop();
 * }
 * </pre>
 */
public class DeclarationScopes {

    private static class Scope {
        private final Set<String> names = new HashSet<>();
        private final boolean boundary;

        Scope(boolean boundary) {
            this.boundary = boundary;
        }
    }

    private final Deque<Scope> scopes = new ArrayDeque<>();

    /**
     * Creates the stack with the module scope already open.
     */
    public DeclarationScopes() {
        scopes.push(new Scope(true));
    }

    public void push(boolean boundary) {
        scopes.push(new Scope(boundary));
    }

    public void pop() {
        if (scopes.size() <= 1) {
            throw new IllegalStateException("Cannot pop the module scope");
        }
        scopes.pop();
    }

    /**
     * True when the name was declared in the current scope or an enclosing scope up to
     * and including the nearest boundary.
     */
    public boolean isDeclared(String name) {
        Iterator<Scope> it = scopes.iterator();
        while (it.hasNext()) {
            Scope scope = it.next();
            if (scope.names.contains(name)) {
                return true;
            }
            if (scope.boundary) {
                return false;
            }
        }
        return false;
    }

    /**
     * Declares a name in the innermost scope.
     *
     * @return true when the name was not yet visible, i.e. this is its declaring assignment
     */
    public boolean declare(String name) {
        if (isDeclared(name)) {
            return false;
        }
        scopes.peek().names.add(name);
        return true;
    }

    public int size() {
        return scopes.size();
    }
}

package me.christianrobert.retarget.translator.context;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeclarationScopesTest {

    private DeclarationScopes scopes;

    @BeforeEach
    void setUp() {
        scopes = new DeclarationScopes();
    }

    @Test
    void firstSightDeclares() {
        assertTrue(scopes.declare("x"));
        assertFalse(scopes.declare("x"));
        assertTrue(scopes.isDeclared("x"));
    }

    @Test
    void nestedBlockSeesOuterNames() {
        scopes.declare("x");
        scopes.push(false);

        assertTrue(scopes.isDeclared("x"));
        assertFalse(scopes.declare("x"));
    }

    @Test
    void blockDeclarationsEndWithTheBlock() {
        scopes.push(false);
        scopes.declare("y");
        scopes.pop();

        assertFalse(scopes.isDeclared("y"));
    }

    @Test
    void boundaryHidesEnclosingScopes() {
        scopes.declare("x");
        scopes.push(true);

        assertFalse(scopes.isDeclared("x"));
        assertTrue(scopes.declare("x"));

        scopes.push(false);
        assertTrue(scopes.isDeclared("x"));
    }

    @Test
    void moduleScopeCannotBePopped() {
        assertEquals(1, scopes.size());
        assertThrows(IllegalStateException.class, () -> scopes.pop());
    }
}

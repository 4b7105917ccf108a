package com.aether.binding;

import com.aether.model.Action;
import com.aether.variables.VariableStore;
import com.aether.variables.VariableType;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraalJsFragmentValidator against the real parser.
 */
public class GraalJsFragmentValidatorTest {

    private static GraalJsFragmentValidator validator;

    @BeforeAll
    static void setUp() {
        validator = new GraalJsFragmentValidator();
    }

    @AfterAll
    static void tearDown() {
        validator.close();
    }

    @Test
    void testStatements_Valid() {
        assertTrue(validator.checkStatements("this.counter += 1;").valid());
        assertTrue(validator.checkStatements("const next = this.counter * 2;\nthis.counter = next;").valid());
        assertTrue(validator.checkStatements("").valid());
    }

    @Test
    void testStatements_Invalid() {
        SyntaxCheck check = validator.checkStatements("if (");

        assertFalse(check.valid());
        assertNotNull(check.message());
    }

    @Test
    void testStatements_WrapperEscapeRejected() {
        assertFalse(validator.checkStatements("}); globalThis.x = 1; (function () {").valid());
        assertFalse(validator.checkStatements("}\nfunction other() {").valid());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "with (Math) { this.counter = floor(1.5); }",
        "this.counter = 010;",
        "let scratch = 1; delete scratch;",
        "var eval = 1;"
    })
    void testStatements_StrictModeOnly(String source) {
        assertFalse(validator.checkStatements(source).valid());
    }

    @Test
    void testExpression_StrictModeOnly() {
        assertFalse(validator.checkExpression("010 + 1").valid());
        assertTrue(validator.checkExpression("0o10 + 1").valid());
    }

    @Test
    void testResolveAction_RejectsSloppyFragment() {
        VariableStore variables = new VariableStore();
        variables.define("counter", VariableType.INTEGER, 0L);
        BindingResolver resolver = new BindingResolver(validator);

        Resolution<ResolvedEffect> result = resolver.resolveAction(
            new Action.InlineCode("with (Math) { this.counter = floor(1.5); }"), variables);

        assertFalse(result.isSuccess());
        assertEquals(DiagnosticCode.INVALID_FRAGMENT, result.diagnostic().code());
    }

    @Test
    void testStatements_NeverExecuted() {
        // would loop forever if evaluated
        assertTrue(validator.checkStatements("while (true) {}").valid());
    }

    @Test
    void testExpressions() {
        assertTrue(validator.checkExpression("this.counter * 2").valid());
        assertTrue(validator.checkExpression("'a' + this.title").valid());
        assertFalse(validator.checkExpression("1 +").valid());
        assertFalse(validator.checkExpression("   ").valid());
        assertFalse(validator.checkExpression("1); globalThis.x = (1").valid());
    }

    @Test
    void testModules() {
        assertTrue(validator.checkModule(
            "import { AppState } from './state.js';\nexport class Other {}\n", "main.js").valid());
        assertFalse(validator.checkModule("export const = ;", "broken.js").valid());
    }
}

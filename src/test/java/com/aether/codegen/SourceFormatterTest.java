package com.aether.codegen;

import com.aether.binding.FragmentValidator;
import com.aether.binding.SyntaxCheck;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SourceFormatter.
 */
public class SourceFormatterTest {

    @Test
    void testLayout_IndentsByBracketDepth() {
        String source = "function f(a) {\nif (a) {\nreturn [\n1,\n2\n];\n}\n}\n";

        assertEquals("function f(a) {\n  if (a) {\n    return [\n      1,\n      2\n    ];\n  }\n}\n",
            SourceFormatter.layout(source));
    }

    @Test
    void testLayout_CollapsesBlankLinesAndTrims() {
        assertEquals("a();\n\nb();\n", SourceFormatter.layout("\n\na();   \n\n\n\n   b();\n\n\n"));
    }

    @Test
    void testLayout_IgnoresBracketsInStringsCommentsAndRegex() {
        String source = "const s = '{(';\n// {\n/* [ */\nconst r = /[}]/;\nx();\n";

        assertEquals(source, SourceFormatter.layout(source));
    }

    @Test
    void testLayout_LeavesTemplateLinesAlone() {
        String source = "const t = `a\n  {b\n`;\nx();\n";

        assertEquals(source, SourceFormatter.layout(source));
    }

    @Test
    void testFormat_UnparsableSourceReturnedAsIs() {
        FragmentValidator validator = mock(FragmentValidator.class);
        when(validator.checkModule(anyString(), anyString())).thenReturn(SyntaxCheck.failed("Unexpected end", 2));
        SourceFormatter formatter = new SourceFormatter(validator);

        SourceFormatter.Formatted result = formatter.format("if (\n", "main.js");

        assertFalse(result.formatted());
        assertEquals("if (\n", result.text());
        assertEquals("Unexpected end at line 2", result.problem());
    }

    @Test
    void testFormat_Valid() {
        SourceFormatter formatter = new SourceFormatter(FragmentValidator.permissive());

        SourceFormatter.Formatted result = formatter.format("class A {\nm() {\n}\n}", "a.js");

        assertTrue(result.formatted());
        assertEquals("class A {\n  m() {\n  }\n}\n", result.text());
        assertNull(result.problem());
    }
}

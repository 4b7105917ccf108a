package com.aether.codegen.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JsRenderer.
 */
public class JsRendererTest {

    @Test
    void testQuote_EscapesEverythingThatEndsALiteral() {
        assertEquals("'it\\'s'", JsRenderer.quote("it's"));
        assertEquals("'a\\\\b'", JsRenderer.quote("a\\b"));
        assertEquals("'line\\nnext\\r'", JsRenderer.quote("line\nnext\r"));
        assertEquals("'\\u2028\\u2029'", JsRenderer.quote("\u2028\u2029"));
        assertEquals("'\\u0001'", JsRenderer.quote("\u0001"));
        assertEquals("'</script>'", JsRenderer.quote("</script>"));
    }

    @Test
    void testComment_OneLinePerLineBreak() {
        String rendered = JsRenderer.render(List.of(new JsAst.Comment("first\n\nsecond */ third")));

        assertEquals("// first\n//\n// second */ third\n", rendered);
    }

    @Test
    void testOperands_Parenthesized() {
        JsAst.Expression sum = new JsAst.Binary(JsAst.num(1L), "+", JsAst.num(2L));

        assertEquals("(1 + 2) * 3", JsRenderer.expression(new JsAst.Binary(sum, "*", JsAst.num(3L))));
        assertEquals("this.x = (a + b);\n", JsRenderer.render(List.of(
            JsAst.assign(JsAst.member("this", "x"), new JsAst.Raw("a + b")))));
        assertEquals("this.x = this.y;\n", JsRenderer.render(List.of(
            JsAst.assign(JsAst.member("this", "x"), new JsAst.Raw("this.y")))));
    }

    @Test
    void testRawExpressionWithLineComment_ClosesOnNextLine() {
        String rendered = JsRenderer.render(List.of(
            JsAst.assign(JsAst.member("this", "x"), new JsAst.Raw("1 // one"))));

        assertEquals("this.x = (1 // one\n);\n", rendered);
    }

    @Test
    void testArrowAndCall() {
        JsAst.Statement listener = JsAst.exec(JsAst.invoke(JsAst.id("el"), "addEventListener",
            JsAst.str("click"), JsAst.arrow(List.of(JsAst.exec(JsAst.call(JsAst.id("go")))))));

        assertEquals("el.addEventListener('click', () => {\ngo();\n});\n", JsRenderer.render(List.of(listener)));
    }

    @Test
    void testClassDeclaration() {
        JsAst.Module module = new JsAst.Module(List.of(new JsAst.ClassDeclaration("S", true, List.of(
            new JsAst.Method("constructor", List.of()),
            new JsAst.Method("run", List.of(new JsAst.RawStatements("a();\nb();")))))));

        assertEquals("export class S {\nconstructor() {\n}\n\nrun() {\na();\nb();\n}\n}\n", JsRenderer.render(module));
    }

    @Test
    void testNumbers() {
        assertEquals("0.5", JsRenderer.expression(JsAst.num(0.5)));
        assertEquals("100", JsRenderer.expression(JsAst.num(100.0)));
        assertEquals("NaN", JsRenderer.expression(JsAst.num(Double.NaN)));
        assertEquals("-Infinity", JsRenderer.expression(JsAst.num(Double.NEGATIVE_INFINITY)));
    }
}

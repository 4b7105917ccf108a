package com.aether.binding;

import com.aether.codegen.ast.JsAst;
import com.aether.model.Action;
import com.aether.model.Binding;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import com.aether.model.NodeRegistry;
import com.aether.model.PropertyType;
import com.aether.model.PropertyValue;
import com.aether.variables.VariableStore;
import com.aether.variables.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for BindingResolver.
 */
public class BindingResolverTest {

    private final NodeRegistry registry = NodeRegistry.standard();
    private BindingResolver resolver;
    private VariableStore variables;

    @BeforeEach
    void setUp() {
        resolver = new BindingResolver(FragmentValidator.permissive());
        variables = new VariableStore();
        variables.define("counter", VariableType.INTEGER, 7L);
        variables.define("ratio", VariableType.FLOAT, 0.5);
        variables.define("title", VariableType.STRING, "Hello");
        variables.define("enabled", VariableType.BOOLEAN, true);
    }

    @Test
    void testUnboundProperty_ResolvesToOwnValue() {
        Node label = registry.create("label");
        label.setProperty("text", PropertyValue.ofString("Static"));

        Resolution<ResolvedValue> result = resolver.resolveProperty(label, "text", variables);

        assertTrue(result.isSuccess());
        assertEquals(PropertyValue.ofString("Static"), result.value().value());
        assertFalse(result.value().isBound());
    }

    @Test
    void testAnyVariableFeedsStringProperty() {
        Node label = registry.create("label");

        label.setBinding("text", Binding.variable("counter"));
        ResolvedValue fromInteger = resolver.resolveProperty(label, "text", variables).value();
        label.setBinding("text", Binding.variable("ratio"));
        ResolvedValue fromFloat = resolver.resolveProperty(label, "text", variables).value();
        label.setBinding("text", Binding.variable("enabled"));
        ResolvedValue fromBoolean = resolver.resolveProperty(label, "text", variables).value();

        assertEquals("7", fromInteger.value().asString());
        assertEquals("counter", fromInteger.variable().name());
        assertEquals("0.5", fromFloat.value().asString());
        assertEquals("true", fromBoolean.value().asString());
    }

    @Test
    void testIntegerWidensToFloatProperty() {
        Node bar = registry.create("progress_bar");
        bar.setBinding("value", Binding.variable("counter"));

        Resolution<ResolvedValue> result = resolver.resolveProperty(bar, "value", variables);

        assertEquals(PropertyType.FLOAT, result.value().value().type());
        assertEquals(7.0, result.value().value().asDouble());
    }

    @Test
    void testDanglingBinding() {
        Node label = registry.create("label");
        label.setBinding("text", Binding.variable("missing"));

        Resolution<ResolvedValue> result = resolver.resolveProperty(label, "text", variables);

        assertFalse(result.isSuccess());
        Diagnostic diagnostic = result.diagnostic();
        assertEquals(DiagnosticCode.DANGLING_BINDING, diagnostic.code());
        assertEquals(Severity.ERROR, diagnostic.severity());
        assertEquals(label.getId(), diagnostic.nodeId());
        assertEquals("text", diagnostic.subject());
    }

    @Test
    void testTypeMismatch() {
        Node bar = registry.create("progress_bar");
        bar.setBinding("value", Binding.variable("title"));
        Node button = registry.create("button");
        button.setBinding("enabled", Binding.variable("counter"));

        assertEquals(DiagnosticCode.TYPE_MISMATCH,
            resolver.resolveProperty(bar, "value", variables).diagnostic().code());
        assertEquals(DiagnosticCode.TYPE_MISMATCH,
            resolver.resolveProperty(button, "enabled", variables).diagnostic().code());
    }

    @Test
    void testLiteralBinding() {
        Node button = registry.create("button");
        button.setBinding("enabled", Binding.literal(PropertyValue.ofBoolean(false)));
        Node label = registry.create("label");
        label.setBinding("text", Binding.literal(PropertyValue.ofInteger(3)));

        assertFalse(resolver.resolveProperty(button, "enabled", variables).value().value().asBoolean());
        assertEquals(DiagnosticCode.TYPE_MISMATCH,
            resolver.resolveProperty(label, "text", variables).diagnostic().code());
    }

    @Test
    void testCompatibilityTable() {
        for (VariableType type : VariableType.values()) {
            assertTrue(BindingResolver.isCompatible(type, PropertyType.STRING));
            assertFalse(BindingResolver.isCompatible(type, PropertyType.ASSET));
            assertFalse(BindingResolver.isCompatible(type, PropertyType.STRING_LIST));
        }
        assertTrue(BindingResolver.isCompatible(VariableType.INTEGER, PropertyType.INTEGER));
        assertFalse(BindingResolver.isCompatible(VariableType.FLOAT, PropertyType.INTEGER));
        assertTrue(BindingResolver.isCompatible(VariableType.INTEGER, PropertyType.FLOAT));
        assertFalse(BindingResolver.isCompatible(VariableType.STRING, PropertyType.BOOLEAN));
    }

    @Test
    void testIncrement() {
        Resolution<ResolvedEffect> ok = resolver.resolveAction(new Action.IncrementVariable("ratio"), variables);
        Resolution<ResolvedEffect> text = resolver.resolveAction(new Action.IncrementVariable("title"), variables);
        Resolution<ResolvedEffect> missing = resolver.resolveAction(new Action.IncrementVariable("nope"), variables);

        assertEquals("ratio", ((ResolvedEffect.Increment) ok.value()).variable().name());
        assertEquals(DiagnosticCode.TYPE_MISMATCH, text.diagnostic().code());
        assertEquals(DiagnosticCode.DANGLING_BINDING, missing.diagnostic().code());
        assertNull(missing.diagnostic().nodeId());
    }

    @Test
    void testSetVariable_Literals() {
        ResolvedEffect.Assign integer = assign(new Action.SetVariable("counter", " 5 "));
        ResolvedEffect.Assign flag = assign(new Action.SetVariable("enabled", "false"));
        ResolvedEffect.Assign number = assign(new Action.SetVariable("ratio", "2"));

        assertEquals(JsAst.num(5L), integer.value());
        assertEquals(JsAst.bool(false), flag.value());
        assertEquals(JsAst.num(2.0), number.value());
    }

    @Test
    void testSetVariable_LiteralOfWrongType() {
        assertEquals(DiagnosticCode.TYPE_MISMATCH, resolver.resolveAction(
            new Action.SetVariable("counter", "'five'"), variables).diagnostic().code());
        assertEquals(DiagnosticCode.TYPE_MISMATCH, resolver.resolveAction(
            new Action.SetVariable("counter", "2.5"), variables).diagnostic().code());
        assertEquals(DiagnosticCode.TYPE_MISMATCH, resolver.resolveAction(
            new Action.SetVariable("enabled", "1"), variables).diagnostic().code());
    }

    @Test
    void testSetVariable_Expression() {
        ResolvedEffect.Assign effect = assign(new Action.SetVariable("counter", "this.counter * 2"));

        assertEquals(new JsAst.Raw("this.counter * 2"), effect.value());
    }

    @Test
    void testSetVariable_StringTargets() {
        assertEquals(JsAst.str("42"), assign(new Action.SetVariable("title", "42")).value());
        assertEquals(JsAst.str("hello"), assign(new Action.SetVariable("title", "hello")).value());
        assertEquals(new JsAst.Raw("this.title + '!'"),
            assign(new Action.SetVariable("title", "this.title + '!'")).value());
    }

    @Test
    void testSetVariable_StringFallsBackToTextWhenExpressionInvalid() {
        FragmentValidator validator = mock(FragmentValidator.class);
        when(validator.checkExpression(anyString())).thenReturn(SyntaxCheck.failed("Unexpected token", 1));
        BindingResolver strict = new BindingResolver(validator);

        Resolution<ResolvedEffect> result = strict.resolveAction(new Action.SetVariable("title", "Hi there!"), variables);

        assertEquals(JsAst.str("Hi there!"), ((ResolvedEffect.Assign) result.value()).value());
    }

    @Test
    void testSetVariable_InvalidExpression() {
        FragmentValidator validator = mock(FragmentValidator.class);
        when(validator.checkExpression(anyString())).thenReturn(SyntaxCheck.failed("Unexpected token", 1));
        BindingResolver strict = new BindingResolver(validator);

        Resolution<ResolvedEffect> result = strict.resolveAction(new Action.SetVariable("counter", "this.(("), variables);

        assertEquals(DiagnosticCode.INVALID_FRAGMENT, result.diagnostic().code());
    }

    @Test
    void testInlineCode() {
        FragmentValidator validator = mock(FragmentValidator.class);
        when(validator.checkStatements("this.counter = 0;")).thenReturn(SyntaxCheck.ok());
        when(validator.checkStatements("if (")).thenReturn(SyntaxCheck.failed("Expected )", 2));
        BindingResolver strict = new BindingResolver(validator);

        Resolution<ResolvedEffect> ok = strict.resolveAction(new Action.InlineCode("this.counter = 0;"), variables);
        Resolution<ResolvedEffect> bad = strict.resolveAction(new Action.InlineCode("if ("), variables);

        assertEquals(new ResolvedEffect.Inline("this.counter = 0;"), ok.value());
        assertEquals(DiagnosticCode.INVALID_FRAGMENT, bad.diagnostic().code());
        assertEquals("Expected ) (line 2)", bad.diagnostic().message());
        verify(validator, never()).checkExpression(anyString());
    }

    @Test
    void testDiagnose_BindingsThenActionsWithLocations() {
        Node button = registry.create("button");
        button.setBinding("text", Binding.variable("gone"));
        button.setAction(NodeEvent.CLICKED, new Action.IncrementVariable("title"));

        List<Diagnostic> diagnostics = resolver.diagnose(button, variables);

        assertEquals(2, diagnostics.size());
        assertEquals(DiagnosticCode.DANGLING_BINDING, diagnostics.get(0).code());
        assertEquals("text", diagnostics.get(0).subject());
        assertEquals(DiagnosticCode.TYPE_MISMATCH, diagnostics.get(1).code());
        assertEquals(button.getId(), diagnostics.get(1).nodeId());
        assertEquals("clicked", diagnostics.get(1).subject());
    }

    private ResolvedEffect.Assign assign(Action action) {
        Resolution<ResolvedEffect> result = resolver.resolveAction(action, variables);
        assertTrue(result.isSuccess(), () -> String.valueOf(result.diagnostic()));
        return (ResolvedEffect.Assign) result.value();
    }
}

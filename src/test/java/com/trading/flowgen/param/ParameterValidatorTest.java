package com.trading.flowgen.param;

import com.trading.flowgen.api.NodeKind;
import com.trading.flowgen.graph.GraphNode;
import com.trading.flowgen.graph.LogicFlow;
import com.trading.flowgen.template.NodeTemplate;
import com.trading.flowgen.template.NodeTemplateRegistry;
import com.trading.flowgen.template.ParameterField;
import com.trading.flowgen.template.ParameterSchema;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ParameterValidatorTest {
    private final ParameterValidator validator = new ParameterValidator();

    private static ParameterSchema periodSchema() {
        return ParameterSchema.of(ParameterField.integer("period", 1.0, null, null));
    }

    @Test
    public void testBelowMinimum() {
        ParameterValidationResult r = validator.validate(Map.of("period", -5), periodSchema());

        assertFalse(r.isValid());
        assertEquals(1, r.errors().size());
        ParameterError e = r.errors().get(0);
        assertEquals("period", e.field());
        assertEquals(ParameterError.Code.BELOW_MINIMUM, e.code());
        assertEquals("Parameter 'period' value -5 is below minimum 1", e.message());
    }

    @Test
    public void testWithinBounds() {
        assertTrue(validator.validate(Map.of("period", 14), periodSchema()).isValid());
        assertTrue(validator.validate(Map.of("period", 1), periodSchema()).isValid());
    }

    @Test
    public void testAboveMaximum() {
        ParameterSchema schema = ParameterSchema.of(ParameterField.number("fraction", 0.0, 1.0, null));
        ParameterValidationResult r = validator.validate(Map.of("fraction", 1.5), schema);
        assertEquals(ParameterError.Code.ABOVE_MAXIMUM, r.errors().get(0).code());
        assertEquals("Parameter 'fraction' value 1.5 exceeds maximum 1", r.errors().get(0).message());
    }

    @Test
    public void testTypeMismatch() {
        ParameterValidationResult r = validator.validate(Map.of("period", "20"), periodSchema());
        assertEquals(ParameterError.Code.TYPE_MISMATCH, r.errors().get(0).code());
        assertEquals("Parameter 'period' type error: must be an integer, got string", r.errors().get(0).message());

        // Fractional values and booleans are not integers
        assertFalse(validator.validate(Map.of("period", 2.5), periodSchema()).isValid());
        assertFalse(validator.validate(Map.of("period", true), periodSchema()).isValid());
    }

    @Test
    public void testEnum() {
        ParameterSchema schema = ParameterSchema.of(ParameterField.string("side", List.of("BUY", "SELL"), null));
        assertTrue(validator.validate(Map.of("side", "BUY"), schema).isValid());

        ParameterValidationResult r = validator.validate(Map.of("side", "HOLD"), schema);
        assertEquals(ParameterError.Code.NOT_IN_ENUM, r.errors().get(0).code());
    }

    @Test
    public void testMissingRequired() {
        ParameterSchema schema = ParameterSchema.of(
                ParameterField.integer("period", 1.0, null, null).asRequired());
        ParameterValidationResult r = validator.validate(Map.of(), schema);
        assertEquals(1, r.errors().size());
        assertEquals(ParameterError.Code.MISSING_REQUIRED, r.errors().get(0).code());
        assertEquals("Required parameter 'period' is missing", r.errors().get(0).message());

        // null map behaves like an empty one
        assertFalse(validator.validate(null, schema).isValid());
    }

    @Test
    public void testErrorsAccumulate() {
        ParameterSchema schema = ParameterSchema.of(
                ParameterField.integer("period", 1.0, 100.0, null).asRequired(),
                ParameterField.number("threshold", 0.0, null, null),
                ParameterField.bool("enabled", null));
        Map<String, Object> params = new HashMap<>();
        params.put("threshold", -1);
        params.put("enabled", "yes");

        ParameterValidationResult r = validator.validate(params, schema);
        assertEquals(3, r.errors().size());
        assertEquals(1, r.errorsFor("period").size());
        assertEquals(1, r.errorsFor("threshold").size());
        assertEquals(1, r.errorsFor("enabled").size());
    }

    @Test
    public void testUnknownFieldsIgnored() {
        assertTrue(validator.validate(Map.of("period", 5, "colour", "red"), periodSchema()).isValid());
        assertTrue(validator.validate(Map.of("anything", 1), ParameterSchema.empty()).isValid());
    }

    @Test
    public void testValidateFlowUsesTemplateDefaults() {
        NodeTemplate sma = NodeTemplate.builder()
                .id("sma").kind(NodeKind.INDICATOR)
                .parameterSchema(ParameterSchema.of(ParameterField.integer("period", 1.0, null, 20).asRequired()))
                .build();
        NodeTemplateRegistry registry = NodeTemplateRegistry.of(sma);
        LogicFlow flow = LogicFlow.of(List.of(GraphNode.of("a", "sma"), GraphNode.of("b", "sma")), List.of());

        // "a" relies on the default; "b" overrides it with a bad value
        Map<String, ParameterValidationResult> failures = validator.validateFlow(flow,
                Map.of("b", Map.of("period", 0)), registry);

        assertEquals(1, failures.size());
        assertTrue(failures.containsKey("b"));
        assertEquals(ParameterError.Code.BELOW_MINIMUM, failures.get("b").errors().get(0).code());
    }
}

package com.codearena.harness;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GoLiteralRendererTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final GoLiteralRenderer renderer = new GoLiteralRenderer(mapper);

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void numbersAreVerbatimForNumericTypes() throws Exception {
        assertEquals("5", renderer.render(json("5"), "int"));
        assertEquals("2.5", renderer.render(json("2.5"), "float64"));
        assertEquals("-3", renderer.render(json("-3"), "int64"));
    }

    @Test
    void nonNumbersAreConvertedForNumericTypes() throws Exception {
        assertEquals("int(\"5\")", renderer.render(json("\"5\""), "int"));
        assertEquals("float32(true)", renderer.render(json("true"), "float32"));
    }

    @Test
    void stringsAreQuotedAndEscaped() throws Exception {
        assertEquals("\"hi\"", renderer.render(json("\"hi\""), "string"));
        assertEquals("\"a\\\"b\\n\"", renderer.render(json("\"a\\\"b\\n\""), "string"));
        assertEquals("\"42\"", renderer.render(json("42"), "string"));
    }

    @Test
    void booleans() throws Exception {
        assertEquals("true", renderer.render(json("true"), "bool"));
        assertEquals("bool(1)", renderer.render(json("1"), "bool"));
    }

    @Test
    void slicesIncludingNested() throws Exception {
        assertEquals("[]int{1, 2, 3}", renderer.render(json("[1,2,3]"), "[]int"));
        assertEquals("[][]string{[]string{\"a\"}, []string{}}",
                renderer.render(json("[[\"a\"],[]]"), "[][]string"));
        assertEquals("nil", renderer.render(json("null"), "[]int"));
    }

    @Test
    void stringKeyedMaps() throws Exception {
        assertEquals("map[string]int{\"a\": 1, \"b\": 2}", renderer.render(json("{\"a\":1,\"b\":2}"), "map[string]int"));
    }

    @Test
    void dynamicTypesRenderUntypedValues() throws Exception {
        assertEquals("[]interface{}{1, \"x\", nil}", renderer.render(json("[1,\"x\",null]"), "interface{}"));
        assertEquals("\"x\"", renderer.render(json("\"x\""), "any"));
    }

    @Test
    void unknownTypeEmbedsRawJson() throws Exception {
        assertEquals("42", renderer.render(json("42"), null));
        assertEquals("[1,2]", renderer.render(json("[1,2]"), "Matrix"));
    }
}

package com.codearena.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One input/expected-output pair used to judge a submission.
 *
 * <p>Fields the challenge store keeps alongside a test case (ids, hidden flags)
 * are dropped on deserialization and never reach a sandbox.
 *
 * @param input       positional arguments for the function under test
 * @param expected    the value the function must return
 * @param description optional human-readable label
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestCase(
    List<JsonNode> input,
    JsonNode expected,
    String description
) {

    public TestCase {
        // List.copyOf rejects null elements, and a JSON null input is legal
        input = input == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(input));
        expected = expected == null ? NullNode.getInstance() : expected;
    }

    public TestCase(List<JsonNode> input, JsonNode expected) {
        this(input, expected, null);
    }
}

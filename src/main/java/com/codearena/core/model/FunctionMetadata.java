package com.codearena.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Describes the single entry point a harness must call.
 *
 * @param functionName   identifier of the user function
 * @param parameterTypes type tags of the positional parameters, in order
 * @param returnType     type tag of the return value
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FunctionMetadata(
    String functionName,
    List<String> parameterTypes,
    String returnType
) {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    public FunctionMetadata {
        if (functionName == null || !IDENTIFIER.matcher(functionName).matches()) {
            throw new IllegalArgumentException("Invalid function name: " + functionName);
        }
        parameterTypes = parameterTypes == null ? List.of() : List.copyOf(parameterTypes);
        returnType = returnType == null ? "" : returnType;
    }

    /**
     * Type tag of the parameter at {@code index}, or {@code null} when the
     * metadata does not declare one.
     */
    public String parameterType(int index) {
        return index < parameterTypes.size() ? parameterTypes.get(index) : null;
    }
}

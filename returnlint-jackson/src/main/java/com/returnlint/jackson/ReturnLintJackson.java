package com.returnlint.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for trees and diagnostics.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = ReturnLintJackson.createObjectMapper();
 * Node tree = mapper.readValue(json, Node.class);
 * String out = mapper.writeValueAsString(diagnostics);
 * </pre>
 */
public final class ReturnLintJackson {

    private ReturnLintJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for tree serialization/deserialization.
     *
     * The returned mapper:
     * - Handles polymorphic Node types via the "type" property
     * - Always writes the nullable parts of a node (else branch, callee, function name)
     * - Writes diagnostics as flat line/column records
     * - Ignores properties a parser may add that the tree model doesn't know about
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Specific null fields (like elseBranch) are included via mixins in AstModule
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Parsers attach extra attributes (tokens, text); skip them
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}

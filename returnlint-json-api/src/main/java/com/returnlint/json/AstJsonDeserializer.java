package com.returnlint.json;

import com.returnlint.PolicyConfig;
import com.returnlint.ast.Node;

/**
 * Interface for reading trees and configuration from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON document to a tree. The root may be any node kind.
     *
     * @param json the JSON string to deserialize
     * @return the root node
     * @throws AstJsonException if deserialization fails
     */
    Node deserializeTree(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;

    /**
     * Reads linter configuration ({@code return_style}, {@code allow_implicit_else},
     * {@code return_functions}, {@code except}).
     *
     * @param json the configuration document
     * @return the raw configuration values
     * @throws AstJsonException if the document is not valid JSON
     * @throws com.returnlint.InvalidPolicyException if a value has the wrong type
     */
    PolicyConfig deserializeConfig(String json) throws AstJsonException;
}

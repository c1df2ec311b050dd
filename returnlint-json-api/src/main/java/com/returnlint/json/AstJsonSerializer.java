package com.returnlint.json;

import com.returnlint.Diagnostic;
import com.returnlint.ast.Node;

import java.util.List;

/**
 * Interface for serializing trees and lint results to JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node and its subtree to a JSON string.
     *
     * @param node the node to serialize
     * @return the JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes a node to a pretty-printed JSON string.
     *
     * @param node the node to serialize
     * @return the pretty-printed JSON representation of the node
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes diagnostics as a JSON array, in the order given.
     *
     * @param diagnostics the diagnostics to serialize
     * @return a JSON array
     * @throws AstJsonException if serialization fails
     */
    String serializeDiagnostics(List<Diagnostic> diagnostics) throws AstJsonException;
}

package com.returnlint.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.returnlint.InvalidPolicyException;
import com.returnlint.PolicyConfig;
import com.returnlint.json.AstJsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Reads linter configuration from a JSON document:
 * <pre>
 * {
 *   "return_style": "explicit",
 *   "allow_implicit_else": false,
 *   "return_functions": ["abort"],
 *   "except": ["main"]
 * }
 * </pre>
 * Name lists may also be given as a single string. Unknown keys are logged and ignored.
 */
public class PolicyConfigReader {

    private static final Logger LOG = LoggerFactory.getLogger(PolicyConfigReader.class);

    static final String RETURN_STYLE = "return_style";
    static final String ALLOW_IMPLICIT_ELSE = "allow_implicit_else";
    static final String RETURN_FUNCTIONS = "return_functions";
    static final String EXCEPT = "except";

    private static final Set<String> KNOWN_KEYS = Set.of(RETURN_STYLE, ALLOW_IMPLICIT_ELSE, RETURN_FUNCTIONS, EXCEPT);

    private final ObjectMapper mapper;

    public PolicyConfigReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public PolicyConfig read(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Failed to parse configuration", e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return PolicyConfig.EMPTY;
        }
        if (!root.isObject()) {
            throw new InvalidPolicyException("Configuration must be a JSON object");
        }

        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_KEYS.contains(name)) {
                LOG.warn("Ignoring unknown configuration key '{}'", name);
            }
        }

        return new PolicyConfig(
            readString(root, RETURN_STYLE),
            readBoolean(root, ALLOW_IMPLICIT_ELSE),
            readNames(root, RETURN_FUNCTIONS),
            readNames(root, EXCEPT)
        );
    }

    private static String readString(JsonNode root, String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new InvalidPolicyException(key + " must be a string, got: " + value);
        }
        return value.asText();
    }

    private static Boolean readBoolean(JsonNode root, String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isBoolean()) {
            throw new InvalidPolicyException(key + " must be true or false, got: " + value);
        }
        return value.booleanValue();
    }

    private static List<String> readNames(JsonNode root, String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return List.of(value.asText());
        }
        if (!value.isArray()) {
            throw new InvalidPolicyException(key + " must be a string or an array of strings, got: " + value);
        }
        List<String> names = new ArrayList<>();
        for (JsonNode element : value) {
            if (!element.isTextual()) {
                throw new InvalidPolicyException(key + " must only contain strings, got: " + element);
            }
            names.add(element.asText());
        }
        return names;
    }
}

package com.returnlint.jackson;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.returnlint.Diagnostic;
import com.returnlint.PolicyConfig;
import com.returnlint.ast.Node;
import com.returnlint.json.AstJsonDeserializer;
import com.returnlint.json.AstJsonException;
import com.returnlint.json.AstJsonProvider;
import com.returnlint.json.AstJsonSerializer;

import java.util.List;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(ReturnLintJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writerFor(Node.class).writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize node", e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerFor(Node.class).withDefaultPrettyPrinter().writeValueAsString(node);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize node", e);
            }
        }

        @Override
        public String serializeDiagnostics(List<Diagnostic> diagnostics) throws AstJsonException {
            try {
                return mapper.writeValueAsString(diagnostics);
            } catch (Exception e) {
                throw new AstJsonException("Failed to serialize diagnostics", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;
        private final PolicyConfigReader configReader;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
            this.configReader = new PolicyConfigReader(mapper);
        }

        @Override
        public Node deserializeTree(String json) throws AstJsonException {
            return deserialize(json, Node.class);
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (Exception e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
        }

        @Override
        public PolicyConfig deserializeConfig(String json) throws AstJsonException {
            return configReader.read(json);
        }
    }
}

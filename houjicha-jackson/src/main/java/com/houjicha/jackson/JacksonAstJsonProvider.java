package com.houjicha.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.houjicha.ParseResult;
import com.houjicha.ast.Document;
import com.houjicha.ast.Node;
import com.houjicha.json.AstJsonDeserializer;
import com.houjicha.json.AstJsonException;
import com.houjicha.json.AstJsonProvider;
import com.houjicha.json.AstJsonSerializer;
import com.houjicha.json.ResultFormat;

/**
 * The {@code jackson} JSON binding, backed by {@link HoujichaJackson#createObjectMapper()}.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    public static final String NAME = "jackson";

    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(HoujichaJackson.createObjectMapper());
    }

    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public AstJsonSerializer serializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer deserializer() {
        return deserializer;
    }

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        private ObjectWriter writer(boolean pretty) {
            return pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
        }

        @Override
        public String serialize(Node node, boolean pretty) {
            try {
                return writer(pretty).writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + node.type(), e);
            }
        }

        @Override
        public String serializeResult(ParseResult result, ResultFormat format) {
            ObjectNode root = mapper.createObjectNode();
            if (format.file() != null) {
                root.put("file", format.file());
            }
            try {
                if (format.includeDocument()) {
                    root.set("document", mapper.valueToTree(result.document()));
                }
                root.set("errors", mapper.valueToTree(result.errors()));
                return writer(format.pretty()).writeValueAsString(root);
            } catch (IllegalArgumentException | JsonProcessingException e) {
                String what = format.file() != null ? format.file() : "parse result";
                throw new AstJsonException("Failed to serialize " + what, e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Document readDocument(String json) {
            return read(json, Document.class);
        }

        @Override
        public <T extends Node> T read(String json, Class<T> type) {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to read " + type.getSimpleName(), e);
            }
        }
    }
}

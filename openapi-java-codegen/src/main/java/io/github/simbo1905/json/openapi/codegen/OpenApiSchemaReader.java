package io.github.simbo1905.json.openapi.codegen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.github.simbo1905.json.openapi.codegen.OpenApiReadException.Reason;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static io.github.simbo1905.json.openapi.codegen.CodegenLogging.LOG;
import static io.github.simbo1905.json.openapi.codegen.SchemaAst.*;

/// Reads the `components/schemas` section of an OpenAPI 3.x document (or the
/// `definitions` section of a Swagger 2.0 one) into an ordered schema map.
///
/// JSON and YAML are both accepted. Local references become [SchemaRef]s carrying the
/// referenced schema name; nothing else in the document is interpreted.
public final class OpenApiSchemaReader {
    private OpenApiSchemaReader() {}

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private static final Set<String> TYPES = Set.of(
            "string", "integer", "number", "boolean", "array", "object", "null");

    /// Siblings of `$ref` that are kept by wrapping the reference in an `allOf`.
    private static final Set<String> REF_SIBLINGS = Set.of("default", "description", "nullable");

    public static Map<String, Schema> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        return read(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static Map<String, Schema> read(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final JsonNode root;
        try {
            root = mapperFor(text).readTree(text);
        } catch (JsonProcessingException e) {
            throw new OpenApiReadException("/", Reason.MALFORMED_DOCUMENT,
                    "Document is not valid JSON or YAML: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    public static Map<String, Schema> read(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new OpenApiReadException("/", Reason.MALFORMED_DOCUMENT, "Document root must be an object");
        }
        JsonNode schemas = root.path("components").path("schemas");
        String location = "/components/schemas";
        if (schemas.isMissingNode() && root.has("definitions")) {
            schemas = root.get("definitions");
            location = "/definitions";
        }
        if (!schemas.isObject() || schemas.isEmpty()) {
            throw new OpenApiReadException(location, Reason.NO_SCHEMAS,
                    "Document has no schemas under components/schemas");
        }

        final Map<String, Schema> out = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> fields = schemas.fields();
        while (fields.hasNext()) {
            final var e = fields.next();
            out.put(e.getKey(), parseSchema(location + "/" + e.getKey(), e.getValue()));
        }
        StructuredLog.fine(LOG, "read.done", "schemas", out.size(), "section", location);
        return out;
    }

    static ObjectMapper mapperFor(String text) {
        final String trimmed = text.stripLeading();
        return trimmed.startsWith("{") || trimmed.startsWith("[") ? JSON : YAML;
    }

    private static Schema parseSchema(String path, JsonNode value) {
        if (value.isBoolean()) {
            // `true` accepts anything
            return builder().build();
        }
        if (!(value instanceof ObjectNode schema)) {
            throw new OpenApiReadException(path, Reason.INVALID_SCHEMA, "Schema at '" + path + "' must be an object");
        }

        if (schema.has("$ref")) {
            final var ref = new SchemaRef(referenceName(path, text(path, schema, "$ref")));
            final boolean siblings = REF_SIBLINGS.stream().anyMatch(schema::has);
            if (!siblings) {
                return ref;
            }
            final var b = builder().allOf(ref);
            applyNullable(schema, b);
            if (schema.has("default")) b.defaultValue(value(schema.get("default")));
            if (schema.has("description")) b.description(text(path, schema, "description"));
            return b.build();
        }

        final var b = builder();
        if (schema.has("type")) {
            final JsonNode type = schema.get("type");
            if (type.isArray()) {
                for (var t : type) b.type(jsonType(path, t));
            } else {
                b.type(jsonType(path, type));
            }
        }
        applyNullable(schema, b);
        if (schema.has("format")) b.format(text(path, schema, "format"));
        if (schema.has("description")) b.description(text(path, schema, "description"));
        if (schema.has("default")) b.defaultValue(value(schema.get("default")));

        if (schema.has("enum")) {
            final JsonNode values = schema.get("enum");
            if (!values.isArray()) {
                throw new OpenApiReadException(path + "/enum", Reason.INVALID_SCHEMA,
                        "Expected '" + path + "/enum' to be an array");
            }
            final var literals = new ArrayList<SchemaValue>();
            for (var v : values) literals.add(value(v));
            b.enumValues(literals);
        }

        if (schema.has("required")) {
            final JsonNode required = schema.get("required");
            if (!required.isArray()) {
                throw new OpenApiReadException(path + "/required", Reason.INVALID_SCHEMA,
                        "Expected '" + path + "/required' to be an array");
            }
            for (var r : required) b.required(r.asText());
        }

        if (schema.has("properties")) {
            final JsonNode props = schema.get("properties");
            if (!props.isObject()) {
                throw new OpenApiReadException(path + "/properties", Reason.INVALID_SCHEMA,
                        "Expected '" + path + "/properties' to be an object");
            }
            final var it = props.fields();
            while (it.hasNext()) {
                final var e = it.next();
                b.property(e.getKey(), parseSchema(path + "/properties/" + e.getKey(), e.getValue()));
            }
        }

        if (schema.has("items")) b.items(parseSchema(path + "/items", schema.get("items")));

        if (schema.has("additionalProperties")) {
            final JsonNode ap = schema.get("additionalProperties");
            if (!(ap.isBoolean() && !ap.booleanValue())) {
                b.additionalProperties(parseSchema(path + "/additionalProperties", ap));
            }
        }

        b.allOf(composition(path, schema, "allOf"));
        b.oneOf(composition(path, schema, "oneOf"));
        b.anyOf(composition(path, schema, "anyOf"));

        if (schema.has("discriminator")) {
            final JsonNode d = schema.get("discriminator");
            if (d.isTextual()) {
                // Swagger 2.0 form: just the property name
                b.discriminator(d.asText(), Map.of());
            } else if (d instanceof ObjectNode disc) {
                final String propertyName = text(path + "/discriminator", disc, "propertyName");
                final Map<String, SchemaRef> mapping = new LinkedHashMap<>();
                if (disc.has("mapping")) {
                    final var it = disc.get("mapping").fields();
                    while (it.hasNext()) {
                        final var e = it.next();
                        mapping.put(e.getKey(), new SchemaRef(referenceName(path, e.getValue().asText())));
                    }
                }
                b.discriminator(propertyName, mapping);
            } else {
                throw new OpenApiReadException(path + "/discriminator", Reason.INVALID_SCHEMA,
                        "Expected '" + path + "/discriminator' to be an object");
            }
        }
        return b.build();
    }

    private static Schema[] composition(String path, ObjectNode schema, String key) {
        if (!schema.has(key)) {
            return new Schema[0];
        }
        final JsonNode parts = schema.get(key);
        if (!parts.isArray()) {
            throw new OpenApiReadException(path + "/" + key, Reason.INVALID_SCHEMA,
                    "Expected '" + path + "/" + key + "' to be an array");
        }
        final List<Schema> out = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            out.add(parseSchema(path + "/" + key + "/" + i, parts.get(i)));
        }
        return out.toArray(new Schema[0]);
    }

    private static void applyNullable(ObjectNode schema, Builder b) {
        if (schema.path("nullable").asBoolean(false) || schema.path("x-nullable").asBoolean(false)) {
            b.type(JsonType.NULL);
        }
    }

    private static JsonType jsonType(String path, JsonNode type) {
        final String name = type.asText().toLowerCase(Locale.ROOT).trim();
        if (!TYPES.contains(name)) {
            throw new OpenApiReadException(path + "/type", Reason.INVALID_SCHEMA,
                    "Unknown type: '" + type.asText() + "', expected one of: " + String.join(", ", TYPES.stream().sorted().toList()));
        }
        return JsonType.valueOf(name.toUpperCase(Locale.ROOT));
    }

    /// `#/components/schemas/Pet`, `#/definitions/Pet`, `other.yaml#/Pet` and `Pet` all name `Pet`.
    static String referenceName(String path, String ref) {
        if (ref == null || ref.isBlank()) {
            throw new OpenApiReadException(path, Reason.INVALID_SCHEMA, "Empty reference at '" + path + "'");
        }
        final int slash = ref.lastIndexOf('/');
        final String name = slash >= 0 ? ref.substring(slash + 1) : ref;
        // JSON pointer escapes
        return name.replace("~1", "/").replace("~0", "~");
    }

    private static String text(String path, ObjectNode schema, String key) {
        final JsonNode v = schema.get(key);
        if (v == null || !v.isTextual()) {
            throw new OpenApiReadException(path + "/" + key, Reason.INVALID_SCHEMA,
                    "Expected '" + path + "/" + key + "' to be a string");
        }
        return v.asText();
    }

    static SchemaValue value(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return new NullValue();
        if (v.isBoolean()) return new BooleanValue(v.booleanValue());
        if (v.isIntegralNumber()) return new IntegerValue(v.bigIntegerValue());
        if (v.isNumber()) return new NumberValue(v.decimalValue());
        if (v.isTextual()) return new StringValue(v.textValue());
        if (v.isArray()) {
            final var elements = new ArrayList<SchemaValue>(v.size());
            for (var e : v) elements.add(value(e));
            return new ArrayValue(elements);
        }
        if (v.isObject()) {
            final Map<String, SchemaValue> members = new LinkedHashMap<>();
            final var it = v.fields();
            while (it.hasNext()) {
                final var e = it.next();
                members.put(e.getKey(), value(e.getValue()));
            }
            return new ObjectValue(members);
        }
        return new StringValue(v.asText());
    }
}

package alpha.handlerkit.core;

import alpha.handlerkit.spi.FieldError;
import alpha.handlerkit.spi.FormDecodeException;
import alpha.handlerkit.spi.FormDecoder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.introspect.BeanPropertyDefinition;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static alpha.handlerkit.spi.FieldError.Kind.BINDING;
import static alpha.handlerkit.spi.FieldError.Kind.CONVERSION;
import static alpha.handlerkit.spi.FieldError.Kind.MISSING_REQUIRED;
import static alpha.handlerkit.spi.FieldError.Kind.UNKNOWN_FIELD;
import static java.util.Objects.requireNonNull;

/**
 * Decodes form values into a Java bean or record, using Jackson's bean
 * introspection as the schema.<p>
 *
 * Each form value is matched against a deserializable property of the target
 * type. A property typed as an array or a collection receives all values of
 * the form field, any other property receives the first value. A property
 * annotated {@code @JsonProperty(required = true)} must be present.<p>
 *
 * All problems are collected before the exception is thrown, so the caller
 * sees every field in error at once:
 *
 * <table>
 *   <caption>Problems reported</caption>
 *   <tr><th>Kind</th><th>Cause</th></tr>
 *   <tr><td>UNKNOWN_FIELD</td><td>No property has the field's name</td></tr>
 *   <tr><td>CONVERSION</td><td>The value does not convert to the property type</td></tr>
 *   <tr><td>MISSING_REQUIRED</td><td>A required property has no value</td></tr>
 *   <tr><td>BINDING</td><td>The target can not be instantiated</td></tr>
 * </table>
 *
 * The value in the exception is decoded from the fields without problems. It
 * is {@code null} only if the target could not be instantiated.
 */
public final class SchemaFormDecoder implements FormDecoder
{
    private final ObjectMapper mapper;

    /**
     * Constructs a {@code SchemaFormDecoder} using the library's JSON
     * configuration.
     */
    public SchemaFormDecoder() {
        this(Json.mapper());
    }

    SchemaFormDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public <T> T decode(Map<String, String[]> values, Class<T> type)
            throws FormDecodeException
    {
        requireNonNull(values);
        requireNonNull(type);

        final Map<String, BeanPropertyDefinition> props = properties(type);
        final List<FieldError> errors = new ArrayList<>();
        final ObjectNode tree = mapper.createObjectNode();

        values.forEach((name, vals) -> {
            var p = props.get(name);
            if (p == null) {
                errors.add(new FieldError(name, UNKNOWN_FIELD, "No such field."));
                return;
            }
            if (vals == null || vals.length == 0) {
                return;
            }
            JavaType t = p.getPrimaryType();
            JsonNode node = t.isArrayType() || t.isCollectionLikeType() ?
                    arrayOf(vals) : TextNode.valueOf(vals[0]);
            try {
                mapper.convertValue(node, t);
            } catch (IllegalArgumentException e) {
                errors.add(new FieldError(name, CONVERSION,
                        "Can not convert " + node + " to " +
                        t.getRawClass().getSimpleName() + "."));
                return;
            }
            tree.set(p.getName(), node);
        });

        props.forEach((name, p) -> {
            if (p.isRequired() && !values.containsKey(name)) {
                errors.add(new FieldError(name, MISSING_REQUIRED,
                        "Field is required."));
            }
        });

        T value;
        try {
            value = mapper.treeToValue(tree, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            value = null;
            // A missing required creator property also fails binding
            if (errors.stream().allMatch(x -> x.kind() == UNKNOWN_FIELD)) {
                errors.add(new FieldError(type.getSimpleName(), BINDING,
                        String.valueOf(e.getMessage())));
            }
        }

        if (!errors.isEmpty()) {
            throw new FormDecodeException(errors, value);
        }
        return value;
    }

    private Map<String, BeanPropertyDefinition> properties(Class<?> type) {
        var desc = mapper.getDeserializationConfig()
                         .introspect(mapper.constructType(type));
        var map = new LinkedHashMap<String, BeanPropertyDefinition>();
        for (var p : desc.findProperties()) {
            if (p.couldDeserialize()) {
                map.put(p.getName(), p);
            }
        }
        return map;
    }

    private ArrayNode arrayOf(String[] vals) {
        var arr = mapper.createArrayNode();
        for (String v : vals) {
            arr.add(v);
        }
        return arr;
    }
}

package io.terraform.tfe.jsonapi;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts between annotated model classes and JSON:API resource objects.
 *
 * <p>
 * Model metadata is derived once per class from its {@link JsonApiResource}, {@link JsonApiId},
 * {@link JsonApiAttribute} and {@link JsonApiRelation} annotations and cached. Encoding writes the primary resource and
 * relationship identifiers only, embedding related resources that have no ID yet; decoding resolves relationships
 * from the document's {@code included} section when the server side-loaded them.
 * </p>
 */
public final class JsonApiCodec {

    private static final Map<Class<?>, ResourceModel> MODELS = new ConcurrentHashMap<>();

    private final ObjectMapper mapper;

    public JsonApiCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static boolean isResource(Class<?> type) {
        return type != null && type.isAnnotationPresent(JsonApiResource.class);
    }

    /**
     * Wraps a single resource into a {@code {"data": {...}}} document.
     */
    public ObjectNode encodeDocument(Object resource) {
        ObjectNode document = mapper.createObjectNode();
        document.set("data", encodeResource(resource));
        return document;
    }

    /**
     * Wraps a list of resources into a {@code {"data": [...]}} document.
     */
    public ObjectNode encodeDocument(List<?> resources) {
        ObjectNode document = mapper.createObjectNode();
        ArrayNode data = document.putArray("data");
        for (Object resource : resources) {
            data.add(encodeResource(resource));
        }
        return document;
    }

    public ObjectNode encodeResource(Object resource) {
        Objects.requireNonNull(resource, "resource");
        ResourceModel model = model(resource.getClass());

        ObjectNode node = mapper.createObjectNode();
        node.put("type", model.type());

        String id = model.id(resource);
        if (id != null && !id.isEmpty()) {
            node.put("id", id);
        }

        ObjectNode attributes = mapper.createObjectNode();
        for (Field field : model.attributes()) {
            Object value = read(field, resource);
            if (value == null) {
                continue;
            }
            attributes.set(field.getAnnotation(JsonApiAttribute.class).value(), mapper.valueToTree(value));
        }
        if (!attributes.isEmpty()) {
            node.set("attributes", attributes);
        }

        ObjectNode relationships = mapper.createObjectNode();
        for (Field field : model.relations()) {
            Object value = read(field, resource);
            if (value == null) {
                continue;
            }
            ObjectNode relation = mapper.createObjectNode();
            if (value instanceof List<?> list) {
                ArrayNode data = relation.putArray("data");
                for (Object item : list) {
                    if (item != null) {
                        data.add(identifier(item));
                    }
                }
            } else {
                relation.set("data", identifier(value));
            }
            relationships.set(field.getAnnotation(JsonApiRelation.class).value(), relation);
        }
        if (!relationships.isEmpty()) {
            node.set("relationships", relationships);
        }
        return node;
    }

    /**
     * Decodes one resource object into a new instance of {@code type}.
     *
     * @param node     the resource object ({@code type}, {@code id}, {@code attributes}, {@code relationships}).
     * @param type     target model class.
     * @param included index built by {@link #indexIncluded(JsonNode)}; may be empty.
     * @throws IOException if the object names a {@code type} other than the one {@code type} is bound to.
     */
    public <T> T decodeResource(JsonNode node, Class<T> type, Map<String, JsonNode> included) throws IOException {
        String actual = node == null ? null : node.path("type").asText(null);
        String expected = model(type).type();
        if (actual != null && !actual.isEmpty() && !actual.equals(expected)) {
            throw new IOException("resource type " + actual + " does not match " + expected + " for "
                + type.getSimpleName());
        }
        return decode(node, type, included, new ArrayDeque<>());
    }

    /**
     * Indexes the document's {@code included} section by {@code type/id}.
     */
    public static Map<String, JsonNode> indexIncluded(JsonNode document) {
        JsonNode included = document.path("included");
        if (!included.isArray() || included.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, JsonNode> index = new HashMap<>();
        for (JsonNode node : included) {
            index.put(key(node.path("type").asText(), node.path("id").asText()), node);
        }
        return index;
    }

    private <T> T decode(JsonNode node, Class<T> type, Map<String, JsonNode> included, Deque<String> visiting)
        throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("expected a resource object for " + type.getSimpleName());
        }
        ResourceModel model = model(type);
        T instance = model.instantiate(type);

        String id = node.path("id").isNull() ? null : node.path("id").asText(null);
        if (model.idField() != null && id != null) {
            write(model.idField(), instance, id);
        }

        JsonNode attributes = node.path("attributes");
        if (attributes.isObject()) {
            for (Field field : model.attributes()) {
                JsonNode value = attributes.get(field.getAnnotation(JsonApiAttribute.class).value());
                if (value == null || value.isNull()) {
                    continue;
                }
                JavaType javaType = mapper.getTypeFactory().constructType(field.getGenericType());
                try {
                    write(field, instance, mapper.convertValue(value, javaType));
                } catch (IllegalArgumentException ex) {
                    throw new IOException("decode attribute " + field.getName() + ": " + ex.getMessage(), ex);
                }
            }
        }

        JsonNode relationships = node.path("relationships");
        if (relationships.isObject() && !model.relations().isEmpty()) {
            String self = key(node.path("type").asText(), id);
            visiting.push(self);
            try {
                for (Field field : model.relations()) {
                    JsonNode data = relationships.path(field.getAnnotation(JsonApiRelation.class).value()).get("data");
                    if (data == null || data.isNull()) {
                        continue;
                    }
                    write(field, instance, decodeRelation(field, data, included, visiting));
                }
            } finally {
                visiting.pop();
            }
        }
        return instance;
    }

    private Object decodeRelation(Field field, JsonNode data, Map<String, JsonNode> included, Deque<String> visiting)
        throws IOException {
        if (List.class.isAssignableFrom(field.getType())) {
            Class<?> element = listElement(field);
            List<Object> items = new ArrayList<>();
            if (data.isArray()) {
                for (JsonNode ref : data) {
                    items.add(resolve(ref, element, included, visiting));
                }
            }
            return items;
        }
        return data.isObject() ? resolve(data, field.getType(), included, visiting) : null;
    }

    private <T> T resolve(JsonNode ref, Class<T> type, Map<String, JsonNode> included, Deque<String> visiting)
        throws IOException {
        String key = key(ref.path("type").asText(), ref.path("id").asText());
        JsonNode full = included.get(key);
        if (full != null && !visiting.contains(key)) {
            return decode(full, type, included, visiting);
        }
        return decode(ref, type, included, visiting);
    }

    /**
     * Related resources with an ID are written as identifiers. Those without one can only be created together with
     * the primary resource, so they are embedded with their attributes.
     */
    private ObjectNode identifier(Object related) {
        ResourceModel model = model(related.getClass());
        String id = model.id(related);
        if (id == null || id.isEmpty()) {
            return encodeResource(related);
        }
        ObjectNode ref = mapper.createObjectNode();
        ref.put("type", model.type());
        ref.put("id", id);
        return ref;
    }

    private static String key(String type, String id) {
        return type + "/" + id;
    }

    private static Class<?> listElement(Field field) {
        Type generic = field.getGenericType();
        if (generic instanceof ParameterizedType parameterized
            && parameterized.getActualTypeArguments()[0] instanceof Class<?> element) {
            return element;
        }
        throw new IllegalStateException("relation " + field.getName() + " must declare its element type");
    }

    private static Object read(Field field, Object target) {
        try {
            return field.get(target);
        } catch (IllegalAccessException ex) {
            throw new IllegalStateException("read field " + field.getName(), ex);
        }
    }

    private static void write(Field field, Object target, Object value) {
        try {
            field.set(target, value);
        } catch (IllegalAccessException ex) {
            throw new IllegalStateException("write field " + field.getName(), ex);
        }
    }

    static ResourceModel model(Class<?> type) {
        return MODELS.computeIfAbsent(type, ResourceModel::scan);
    }

    record ResourceModel(
        String type,
        Constructor<?> constructor,
        Field idField,
        List<Field> attributes,
        List<Field> relations
    ) {

        static ResourceModel scan(Class<?> type) {
            JsonApiResource resource = type.getAnnotation(JsonApiResource.class);
            if (resource == null) {
                throw new IllegalStateException(type.getName() + " is not annotated with @JsonApiResource");
            }
            Field idField = null;
            List<Field> attributes = new ArrayList<>();
            List<Field> relations = new ArrayList<>();
            for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
                for (Field field : current.getDeclaredFields()) {
                    if (Modifier.isStatic(field.getModifiers())) {
                        continue;
                    }
                    if (field.isAnnotationPresent(JsonApiId.class)) {
                        field.setAccessible(true);
                        idField = field;
                    } else if (field.isAnnotationPresent(JsonApiAttribute.class)) {
                        field.setAccessible(true);
                        attributes.add(field);
                    } else if (field.isAnnotationPresent(JsonApiRelation.class)) {
                        field.setAccessible(true);
                        relations.add(field);
                    }
                }
            }
            Constructor<?> constructor;
            try {
                constructor = type.getDeclaredConstructor();
                constructor.setAccessible(true);
            } catch (NoSuchMethodException ex) {
                throw new IllegalStateException(type.getName() + " needs a no-argument constructor", ex);
            }
            return new ResourceModel(resource.value(), constructor, idField, List.copyOf(attributes), List.copyOf(relations));
        }

        String id(Object instance) {
            return idField == null ? null : (String) read(idField, instance);
        }

        <T> T instantiate(Class<T> type) {
            try {
                return type.cast(constructor.newInstance());
            } catch (ReflectiveOperationException ex) {
                throw new IllegalStateException("instantiate " + type.getName(), ex);
            }
        }
    }
}

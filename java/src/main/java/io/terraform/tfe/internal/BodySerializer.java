package io.terraform.tfe.internal;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;
import io.terraform.tfe.jsonapi.JsonApiAttribute;
import io.terraform.tfe.jsonapi.JsonApiCodec;
import io.terraform.tfe.jsonapi.JsonApiId;
import io.terraform.tfe.jsonapi.JsonApiRelation;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serializes request bodies, choosing JSON:API or plain JSON from the payload class.
 *
 * <p>
 * A class annotated with {@link io.terraform.tfe.jsonapi.JsonApiResource} is written as a JSON:API document without
 * an {@code included} section; any other class is written as plain JSON. A class that combines JSON:API field mappings
 * with Jackson {@link JsonProperty} fields can be written neither way and is rejected.
 * </p>
 */
public final class BodySerializer {

    public static final String CONTENT_TYPE_JSONAPI = "application/vnd.api+json";
    public static final String CONTENT_TYPE_JSON = "application/json";

    private static final Map<Class<?>, Format> FORMATS = new ConcurrentHashMap<>();

    private BodySerializer() {
    }

    /**
     * @param bytes       encoded payload.
     * @param contentType {@link #CONTENT_TYPE_JSONAPI} or {@link #CONTENT_TYPE_JSON}.
     */
    public record SerializedBody(byte[] bytes, String contentType) {
    }

    enum Format {
        JSONAPI,
        JSON,
        INVALID
    }

    public static SerializedBody serialize(Object body) throws TfeException {
        if (body == null) {
            throw new TfeException(TfeError.INVALID_REQUEST_BODY);
        }

        Format format;
        if (body instanceof List<?> list) {
            format = null;
            for (Object element : list) {
                Format elementFormat = formatOf(element);
                if (format != null && format != elementFormat) {
                    throw new TfeException(TfeError.INVALID_STRUCT_FORMAT);
                }
                format = elementFormat;
            }
            if (format == null) {
                // An empty list carries no element type to inspect.
                format = Format.JSONAPI;
            }
        } else {
            format = formatOf(body);
        }

        try {
            if (format == Format.JSON) {
                return new SerializedBody(Json.mapper().writeValueAsBytes(body), CONTENT_TYPE_JSON);
            }
            JsonApiCodec codec = Json.codec();
            Object document = body instanceof List<?> list ? codec.encodeDocument(list) : codec.encodeDocument(body);
            return new SerializedBody(Json.mapper().writeValueAsBytes(document), CONTENT_TYPE_JSONAPI);
        } catch (JsonProcessingException ex) {
            throw new TfeException("encode request body: " + ex.getOriginalMessage(), ex);
        }
    }

    private static Format formatOf(Object element) throws TfeException {
        if (element == null || !isObjectValue(element)) {
            throw new TfeException(TfeError.INVALID_REQUEST_BODY);
        }
        Format format = FORMATS.computeIfAbsent(element.getClass(), BodySerializer::inspect);
        if (format == Format.INVALID) {
            throw new TfeException(TfeError.INVALID_STRUCT_FORMAT);
        }
        return format;
    }

    private static boolean isObjectValue(Object value) {
        Class<?> type = value.getClass();
        return !(value instanceof CharSequence
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof Character
            || value instanceof Enum<?>
            || value instanceof Map<?, ?>
            || value instanceof Collection<?>
            || type.isArray());
    }

    static Format inspect(Class<?> type) {
        int jsonApiFields = 0;
        int jsonFields = 0;
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers())) {
                    continue;
                }
                if (field.isAnnotationPresent(JsonApiId.class)
                    || field.isAnnotationPresent(JsonApiAttribute.class)
                    || field.isAnnotationPresent(JsonApiRelation.class)) {
                    jsonApiFields++;
                }
                if (field.isAnnotationPresent(JsonProperty.class)) {
                    jsonFields++;
                }
            }
        }
        boolean resource = JsonApiCodec.isResource(type);
        if (jsonApiFields > 0 && jsonFields > 0) {
            return Format.INVALID;
        }
        if (resource && jsonFields > 0) {
            return Format.INVALID;
        }
        if (!resource && jsonApiFields > 0) {
            return Format.INVALID;
        }
        return resource ? Format.JSONAPI : Format.JSON;
    }
}

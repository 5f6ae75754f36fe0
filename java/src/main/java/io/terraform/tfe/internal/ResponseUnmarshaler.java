package io.terraform.tfe.internal;

import com.fasterxml.jackson.databind.JsonNode;
import io.terraform.tfe.NextPrevList;
import io.terraform.tfe.Pagination;
import io.terraform.tfe.PaginationNextPrev;
import io.terraform.tfe.ResourceList;
import io.terraform.tfe.TfeError;
import io.terraform.tfe.TfeException;
import io.terraform.tfe.jsonapi.JsonApiCodec;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Decodes JSON:API response documents into models. Callers pick the variant: a single resource, or a list with its
 * pagination block from {@code meta.pagination}.
 */
public final class ResponseUnmarshaler {

    private ResponseUnmarshaler() {
    }

    public static <T> T decodeOne(InputStream body, Class<T> type) throws TfeException {
        JsonNode document = readDocument(body, type);
        JsonNode data = document.path("data");
        if (!data.isObject()) {
            throw new TfeException("decode " + type.getSimpleName() + " response: data is not a resource object");
        }
        try {
            return Json.codec().decodeResource(data, type, JsonApiCodec.indexIncluded(document));
        } catch (IOException ex) {
            throw new TfeException("decode " + type.getSimpleName() + " response: " + ex.getMessage(), ex);
        }
    }

    public static <T> ResourceList<T> decodeList(InputStream body, Class<T> type) throws TfeException {
        JsonNode document = readDocument(body, type);
        List<T> items = decodeItems(document, type);
        Pagination pagination = parsePagination(document, Pagination.class, Pagination.EMPTY);
        return new ResourceList<>(items, pagination);
    }

    public static <T> NextPrevList<T> decodeNextPrevList(InputStream body, Class<T> type) throws TfeException {
        JsonNode document = readDocument(body, type);
        List<T> items = decodeItems(document, type);
        PaginationNextPrev pagination = parsePagination(document, PaginationNextPrev.class, PaginationNextPrev.EMPTY);
        return new NextPrevList<>(items, pagination);
    }

    private static <T> List<T> decodeItems(JsonNode document, Class<T> type) throws TfeException {
        JsonNode data = document.path("data");
        if (!data.isArray()) {
            throw new TfeException(TfeError.ITEMS_MUST_BE_LIST);
        }
        Map<String, JsonNode> included = JsonApiCodec.indexIncluded(document);
        List<T> items = new ArrayList<>(data.size());
        try {
            for (JsonNode node : data) {
                items.add(Json.codec().decodeResource(node, type, included));
            }
        } catch (IOException ex) {
            throw new TfeException("decode " + type.getSimpleName() + " list response: " + ex.getMessage(), ex);
        }
        return items;
    }

    private static <P> P parsePagination(JsonNode document, Class<P> type, P empty) throws TfeException {
        JsonNode pagination = document.path("meta").path("pagination");
        if (!pagination.isObject()) {
            return empty;
        }
        try {
            return Json.mapper().treeToValue(pagination, type);
        } catch (IOException ex) {
            throw new TfeException("decode pagination: " + ex.getMessage(), ex);
        }
    }

    private static JsonNode readDocument(InputStream body, Class<?> type) throws TfeException {
        try {
            JsonNode document = Json.mapper().readTree(body);
            if (document == null || document.isMissingNode()) {
                throw new TfeException("decode " + type.getSimpleName() + " response: empty body");
            }
            return document;
        } catch (IOException ex) {
            throw new TfeException("decode " + type.getSimpleName() + " response: " + ex.getMessage(), ex);
        }
    }
}

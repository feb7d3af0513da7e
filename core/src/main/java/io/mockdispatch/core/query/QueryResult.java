package io.mockdispatch.core.query;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * One page of a collection query.
 *
 * @param data       records on the page, with embedded and expanded relations attached
 * @param pagination page metadata
 */
public record QueryResult(List<ObjectNode> data, PageMeta pagination) {

    public QueryResult {
        data = List.copyOf(data);
    }

    /** The {@code {data, pagination}} response envelope. */
    public ObjectNode toJson() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        ArrayNode array = root.putArray("data");
        data.forEach(array::add);
        ObjectNode meta = root.putObject("pagination");
        meta.put("page", pagination.page());
        meta.put("limit", pagination.limit());
        meta.put("total", pagination.total());
        meta.put("totalPages", pagination.totalPages());
        return root;
    }
}

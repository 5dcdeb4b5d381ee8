package org.carball.qan.fingerprint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.carball.qan.model.profile.SystemProfile;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reduces a profiled query document to a stable grouping key of the form
 * {@code OPERATION collection field1,field2}. Values are ignored, only the operation, the
 * target collection and the sorted set of field names matter. Empty parts are left out.
 *
 * <p>Instances hold nothing but the compiled key filters and can be shared between threads.
 */
public class Fingerprinter {

    public static final int MAX_DEPTH_LEVEL = 10;
    public static final List<String> DEFAULT_KEY_FILTERS = List.of("^shardVersion$");

    private final List<Pattern> keyFilters;

    public Fingerprinter() {
        this(DEFAULT_KEY_FILTERS);
    }

    public Fingerprinter(List<String> keyFilters) {
        this.keyFilters = keyFilters.stream()
                .map(Pattern::compile)
                .collect(Collectors.toUnmodifiableList());
    }

    public String fingerprint(SystemProfile doc) throws FingerprintException {
        JsonNode realQuery = queryField(doc);
        List<String> keys = keys(realQuery);

        JsonNode query = hasFields(doc.getCommand()) ? doc.getCommand() : doc.getQuery();
        if (query == null || !query.isObject()) {
            query = JsonNodeFactory.instance.objectNode();
        }

        JsonNode sort = query.get("sort");
        if (sort != null && sort.isObject()) {
            keys.addAll(topLevelKeys(sort));
        }

        String op = "";
        String collection = "";
        String docOp = doc.getOp() == null ? "" : doc.getOp();
        switch (docOp) {
            case "remove":
            case "update":
                op = docOp;
                collection = collectionOf(doc.getNs());
                break;
            case "insert":
                op = docOp;
                collection = collectionOf(doc.getNs());
                // inserted documents are never filtered on
                keys.clear();
                break;
            case "query":
                op = "find";
                collection = collectionOf(doc.getNs());
                break;
            default:
                if (query.size() == 0) {
                    break;
                }
                Map.Entry<String, JsonNode> first = query.fields().next();
                op = first.getKey();
                collection = first.getValue().isTextual() ? first.getValue().asText() : "";
                switch (op) {
                    case "group":
                        keys.clear();
                        JsonNode group = query.get("group");
                        if (group != null && group.isObject()) {
                            keys.addAll(keys(group.get("key")));
                            keys.addAll(keys(group.get("cond")));
                            JsonNode ns = group.get("ns");
                            if (ns != null && ns.isTextual()) {
                                collection = ns.asText();
                            }
                        }
                        break;
                    case "distinct":
                        keys.clear();
                        JsonNode key = query.get("key");
                        if (key != null && key.isTextual() && !isFiltered(key.asText())) {
                            keys.add(key.asText());
                        }
                        break;
                    case "aggregate":
                        keys.clear();
                        keys.addAll(keys(query.get("pipeline")));
                        break;
                    case "geoNear":
                        keys.clear();
                        break;
                    default:
                        break;
                }
        }

        List<String> parts = new ArrayList<>(3);
        if (!op.isEmpty()) {
            parts.add(op.toUpperCase());
        }
        if (!collection.isEmpty()) {
            parts.add(collection);
        }
        String joinedKeys = String.join(",", new TreeSet<>(keys));
        if (!joinedKeys.isEmpty()) {
            parts.add(joinedKeys);
        }
        return String.join(" ", parts);
    }

    /**
     * Finds the filter document of a profile entry. Commands carry it in a {@code q},
     * {@code query} or {@code filter} argument depending on the operation and server version,
     * legacy queries either directly or under a nested {@code query} key.
     */
    JsonNode queryField(SystemProfile doc) throws FingerprintException {
        JsonNode query = doc.getQuery();
        if (hasFields(doc.getCommand())) {
            query = doc.getCommand();
            if ("update".equals(doc.getOp()) || "remove".equals(doc.getOp())) {
                JsonNode q = query.get("q");
                if (q != null && q.isObject()) {
                    return q;
                }
            }
        }

        if (query == null || query.isNull() || query.isMissingNode()) {
            // inserts and some commands are profiled without a filter
            return JsonNodeFactory.instance.objectNode();
        }
        if (!query.isObject()) {
            throw new FingerprintException(String.format(
                    "query of profile entry is not a document (op=%s, ns=%s): %s",
                    doc.getOp(), doc.getNs(), query));
        }

        JsonNode nested = query.get("query");
        if (nested != null && nested.isObject()) {
            return nested;
        }

        JsonNode filter = query.get("filter");
        if (filter != null && filter.isObject()) {
            return filter;
        }

        if (query.size() == 1 && query.has("find")) {
            return JsonNodeFactory.instance.objectNode();
        }

        return query;
    }

    private List<String> keys(JsonNode node) {
        List<String> collected = new ArrayList<>();
        collectKeys(node, 0, collected);
        return collected;
    }

    private void collectKeys(JsonNode node, int level, List<String> collected) {
        if (node == null || level > MAX_DEPTH_LEVEL) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isObject()) {
                    collectKeys(element, level, collected);
                }
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (isFiltered(key)) {
                continue;
            }
            if (!key.startsWith("$")) {
                collected.add(key);
            }
            collectKeys(field.getValue(), level + 1, collected);
        }
    }

    private List<String> topLevelKeys(JsonNode node) {
        List<String> collected = new ArrayList<>();
        node.fieldNames().forEachRemaining(key -> {
            if (!isFiltered(key) && !key.startsWith("$")) {
                collected.add(key);
            }
        });
        return collected;
    }

    private boolean isFiltered(String key) {
        for (Pattern filter : keyFilters) {
            if (filter.matcher(key).find()) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasFields(JsonNode node) {
        return node != null && node.isObject() && node.size() > 0;
    }

    /**
     * Second segment of a dotted namespace: {@code db.fs.files} is {@code fs}, a bare database
     * name has none.
     */
    private static String collectionOf(String ns) {
        if (ns == null) {
            return "";
        }
        String[] segments = ns.split("\\.");
        return segments.length < 2 ? "" : segments[1];
    }
}

package com.dbdoctor.adapter.out.catalog;

import com.dbdoctor.domain.schema.SchemaCatalog;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the schema catalog from a JSON document of the form
 * <pre>
 * {
 *   "pages": { "ctrl": { "label": "title", "delete": "deleted", "versioningWS": true } },
 *   "tt_content": { "ctrl": { ... } }
 * }
 * </pre>
 * Table order in the document is the catalog declaration order.
 */
@Component
public class JsonSchemaCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonSchemaCatalogLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public JsonSchemaCatalogLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public SchemaCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Schema catalog not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            SchemaCatalog catalog = parse(objectMapper.readTree(in), location);
            log.info("Loaded schema catalog with {} tables from {}", catalog.tableNames().size(), location);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read schema catalog " + location, e);
        }
    }

    SchemaCatalog parse(JsonNode root, String location) {
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Schema catalog " + location + " must be a JSON object of tables");
        }
        Map<String, Map<String, Object>> tables = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            Map<String, Object> ctrl = new LinkedHashMap<>();
            JsonNode ctrlNode = entry.getValue().path("ctrl");
            Iterator<Map.Entry<String, JsonNode>> ctrlEntries = ctrlNode.fields();
            while (ctrlEntries.hasNext()) {
                Map.Entry<String, JsonNode> ctrlEntry = ctrlEntries.next();
                ctrl.put(ctrlEntry.getKey(), toValue(ctrlEntry.getValue()));
            }
            tables.put(entry.getKey(), ctrl);
        }
        return new SchemaCatalog(tables);
    }

    private Object toValue(JsonNode node) {
        if (node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return objectMapper.convertValue(node, Object.class);
    }
}

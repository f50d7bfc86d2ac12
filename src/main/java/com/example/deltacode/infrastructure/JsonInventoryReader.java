package com.example.deltacode.infrastructure;

import com.example.deltacode.application.InventoryReader;
import com.example.deltacode.domain.FileRecord;
import com.example.deltacode.domain.MalformedRecordException;
import com.example.deltacode.domain.Snapshot;
import com.example.deltacode.domain.SnapshotInput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a scan inventory of the form {@code {"files": [{"path", "size", "sha1", "attributes"}]}}.
 * The fingerprint is taken from {@code fingerprint}, {@code sha1} or {@code md5},
 * whichever comes first. Directory entries are skipped.
 */
@Component
public class JsonInventoryReader implements InventoryReader {
    private static final Logger log = LogManager.getLogger(JsonInventoryReader.class);

    private static final List<String> FINGERPRINT_FIELDS = List.of("fingerprint", "sha1", "md5");

    private final ObjectMapper objectMapper;

    public JsonInventoryReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Snapshot read(SnapshotInput input) throws IOException {
        JsonNode root;
        try (InputStream inputStream = input.openStream()) {
            root = objectMapper.readTree(inputStream);
        } catch (JsonProcessingException ex) {
            throw new MalformedRecordException("Inventory " + input.describe() + " is not valid JSON", ex);
        }
        return parse(input.label(), root);
    }

    public Snapshot parse(String label, JsonNode root) {
        if (root == null || !root.path("files").isArray()) {
            throw new MalformedRecordException(
                    "Inventory for the " + label + " snapshot has no 'files' array");
        }
        List<FileRecord> records = new ArrayList<>();
        int skipped = 0;
        int index = 0;
        for (JsonNode node : root.get("files")) {
            if (!node.isObject()) {
                throw new MalformedRecordException(
                        String.format("Record #%d of the %s snapshot is not an object", index, label));
            }
            if ("directory".equals(node.path("type").asText())) {
                skipped++;
            } else {
                try {
                    records.add(toRecord(node));
                } catch (MalformedRecordException ex) {
                    throw new MalformedRecordException(
                            String.format(
                                    "Record #%d of the %s snapshot: %s", index, label, ex.getMessage()),
                            ex);
                }
            }
            index++;
        }
        log.info("Loaded {} records for the {} snapshot, skipped {} directories", records.size(), label, skipped);
        return new Snapshot(label, records);
    }

    private FileRecord toRecord(JsonNode node) {
        String path = node.hasNonNull("path") ? node.get("path").asText() : null;
        long size = parseSize(node.get("size"));
        String fingerprint = null;
        for (String field : FINGERPRINT_FIELDS) {
            if (node.hasNonNull(field) && !node.get(field).asText().isBlank()) {
                fingerprint = node.get(field).asText();
                break;
            }
        }
        Map<String, String> attributes = new LinkedHashMap<>();
        JsonNode attributeNodes = node.path("attributes");
        if (attributeNodes.isObject()) {
            attributeNodes
                    .fields()
                    .forEachRemaining(
                            entry -> {
                                JsonNode value = entry.getValue();
                                if (!value.isNull()) {
                                    attributes.put(
                                            entry.getKey(),
                                            value.isValueNode() ? value.asText() : value.toString());
                                }
                            });
        }
        return new FileRecord(FileRecord.splitPath(path), size, fingerprint, attributes);
    }

    /** Absent or null means 0; anything other than an integral number is malformed. */
    private long parseSize(JsonNode sizeNode) {
        if (sizeNode == null || sizeNode.isNull()) {
            return 0L;
        }
        if (!sizeNode.isIntegralNumber() || !sizeNode.canConvertToLong()) {
            throw new MalformedRecordException("size must be a whole number of bytes, got " + sizeNode);
        }
        return sizeNode.asLong();
    }
}

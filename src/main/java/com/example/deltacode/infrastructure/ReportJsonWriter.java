package com.example.deltacode.infrastructure;

import com.example.deltacode.domain.Delta;
import com.example.deltacode.domain.FileRecord;
import com.example.deltacode.domain.Report;
import com.example.deltacode.domain.ReportHeaders;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * Writes a report as {@code {"headers": {...}, "deltas": [...]}} keeping the
 * ranked order of the deltas and the order of their factors.
 */
@Component
public class ReportJsonWriter {
    private final ObjectMapper objectMapper;

    public ReportJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Report report) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(report));
    }

    public ObjectNode toJson(Report report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("headers", headers(report.getHeaders()));
        ArrayNode deltas = root.putArray("deltas");
        for (Delta delta : report.getDeltas()) {
            deltas.add(delta(delta));
        }
        return root;
    }

    private ObjectNode headers(ReportHeaders headers) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("deltacode_version", headers.getVersion());
        node.set("deltacode_options", objectMapper.valueToTree(headers.getOptions()));
        ArrayNode errors = node.putArray("deltacode_errors");
        headers.getErrors().forEach(errors::add);
        node.put("deltas_count", headers.getDeltasCount());
        ObjectNode stats = node.putObject("stats");
        headers.getStats().forEach((kind, count) -> stats.put(kind.label(), count));
        return node;
    }

    private ObjectNode delta(Delta delta) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("kind", delta.getKind().label());
        node.set("old", record(delta.getOldRecord()));
        node.set("new", record(delta.getNewRecord()));
        ObjectNode factors = node.putObject("factors");
        delta.getFactors().forEach(factors::put);
        node.put("score", delta.getScore());
        if (delta.getDiff() != null) {
            node.put("diff", delta.getDiff());
        }
        return node;
    }

    private JsonNode record(FileRecord record) {
        if (record == null) {
            return objectMapper.nullNode();
        }
        ObjectNode node = objectMapper.createObjectNode();
        node.put("path", record.pathString());
        node.put("size", record.size());
        node.put("fingerprint", record.fingerprint());
        ObjectNode attributes = node.putObject("attributes");
        record.attributes().forEach(attributes::put);
        return node;
    }
}

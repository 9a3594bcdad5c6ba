package com.beadhub.trigger.application.common;

import com.beadhub.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * JSONL 工作项载荷解析：跳过空行，每行必须是 JSON 对象，限制嵌套深度与记录数。
 */
@Component
public class JsonlPayloadParser {

    static final int MAX_DEPTH = 10;
    static final int MAX_RECORDS = 10_000;

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper objectMapper;

    public JsonlPayloadParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Map<String, Object>> parse(String jsonl) {
        List<Map<String, Object>> records = new ArrayList<>();
        if (StringUtils.isBlank(jsonl)) {
            return records;
        }
        String[] lines = jsonl.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            if (records.size() >= MAX_RECORDS) {
                throw AppException.illegalParameter("Too many issues in payload, max " + MAX_RECORDS);
            }
            JsonNode node;
            try {
                node = objectMapper.readTree(line);
            } catch (JsonProcessingException ex) {
                throw AppException.illegalParameter("Invalid JSON on line " + (i + 1));
            }
            if (node == null || !node.isObject()) {
                throw AppException.illegalParameter("Line " + (i + 1) + " is not a JSON object");
            }
            if (depth(node) > MAX_DEPTH) {
                throw AppException.illegalParameter("Line " + (i + 1) + " exceeds max nesting depth " + MAX_DEPTH);
            }
            records.add(objectMapper.convertValue(node, MAP_REF));
        }
        return records;
    }

    int depth(JsonNode node) {
        if (node == null || !node.isContainerNode()) {
            return 0;
        }
        int deepest = 0;
        Iterator<JsonNode> children = node.elements();
        while (children.hasNext()) {
            deepest = Math.max(deepest, depth(children.next()));
        }
        return deepest + 1;
    }
}

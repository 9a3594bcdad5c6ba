package com.beadhub.trigger.application.common;

import com.beadhub.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.io.BaseEncoding;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 列表游标编解码：base64url 编码的 {created_at, id}。
 */
@Component
public class PageCursorCodec {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 200;
    static final int MAX_CURSOR_LENGTH = 8192;

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};
    private static final BaseEncoding BASE64_URL = BaseEncoding.base64Url().omitPadding();

    private final ObjectMapper objectMapper;

    public PageCursorCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public int normalizeLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw AppException.illegalParameter("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }

    public String encode(LocalDateTime createdAt, String id) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("created_at", createdAt == null ? null : createdAt.toString());
        body.put("id", id);
        try {
            return BASE64_URL.encode(objectMapper.writeValueAsBytes(body));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to encode page cursor", ex);
        }
    }

    /**
     * @return 解码后的游标；cursor 为空时返回 null
     */
    public PageCursor decode(String cursor) {
        if (StringUtils.isBlank(cursor)) {
            return null;
        }
        if (cursor.length() > MAX_CURSOR_LENGTH) {
            throw AppException.illegalParameter("cursor is too long");
        }
        try {
            byte[] raw = BASE64_URL.decode(StringUtils.stripEnd(cursor.trim(), "="));
            Map<String, Object> body = objectMapper.readValue(new String(raw, StandardCharsets.UTF_8), MAP_REF);
            Object createdAt = body.get("created_at");
            Object id = body.get("id");
            if (!(createdAt instanceof String) || !(id instanceof String)) {
                throw AppException.illegalParameter("Invalid cursor");
            }
            return new PageCursor(LocalDateTime.parse((String) createdAt), (String) id);
        } catch (IllegalArgumentException | DateTimeParseException | JsonProcessingException ex) {
            throw AppException.illegalParameter("Invalid cursor");
        }
    }

    public record PageCursor(LocalDateTime createdAt, String id) {
    }
}

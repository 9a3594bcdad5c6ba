package com.beadhub.infrastructure.redis;

import com.beadhub.domain.presence.adapter.gateway.IProjectEventGateway;
import com.beadhub.domain.presence.model.valobj.ProjectEvent;
import com.beadhub.types.enums.EventTypeEnum;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 基于 Redis pub/sub 的项目事件通道（events:{projectId}）。
 * <p>
 * 发布为尽力而为：Redis 不可用时只记录告警，不影响已提交的业务写入。
 * </p>
 */
@Slf4j
@Component
public class RedisProjectEventGateway implements IProjectEventGateway {

    private static final TypeReference<Map<String, Object>> MAP_REF = new TypeReference<Map<String, Object>>() {};

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;

    public RedisProjectEventGateway(StringRedisTemplate redisTemplate,
                                    RedisMessageListenerContainer listenerContainer,
                                    ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(ProjectEvent event) {
        if (event == null || event.getProjectId() == null) {
            return;
        }
        try {
            redisTemplate.convertAndSend(RedisKeys.eventChannel(event.getProjectId()), encode(event));
        } catch (RuntimeException | JsonProcessingException ex) {
            log.warn("Event publish failed. projectId={}, type={}, error={}",
                    event.getProjectId(), event.typeName(), ex.getMessage());
        }
    }

    @Override
    public AutoCloseable subscribe(String projectId, Consumer<ProjectEvent> listener) {
        ChannelTopic topic = new ChannelTopic(RedisKeys.eventChannel(projectId));
        MessageListener messageListener = (message, pattern) -> {
            ProjectEvent event = decode(new String(message.getBody(), StandardCharsets.UTF_8));
            if (event != null) {
                listener.accept(event);
            }
        };
        listenerContainer.addMessageListener(messageListener, topic);
        log.debug("Event subscription opened. projectId={}", projectId);
        return () -> {
            listenerContainer.removeMessageListener(messageListener, topic);
            log.debug("Event subscription closed. projectId={}", projectId);
        };
    }

    String encode(ProjectEvent event) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", event.typeName());
        body.put("project_id", event.getProjectId());
        body.put("workspace_id", event.getWorkspaceId());
        body.put("occurred_at", event.getOccurredAt() == null
                ? OffsetDateTime.now(ZoneOffset.UTC).toString() : event.getOccurredAt());
        body.put("payload", event.getPayload());
        return objectMapper.writeValueAsString(body);
    }

    @SuppressWarnings("unchecked")
    ProjectEvent decode(String raw) {
        try {
            Map<String, Object> body = objectMapper.readValue(raw, MAP_REF);
            String type = asString(body.get("type"));
            Object payload = body.get("payload");
            return ProjectEvent.builder()
                    .type(EventTypeEnum.fromCode(type))
                    .rawType(type)
                    .projectId(asString(body.get("project_id")))
                    .workspaceId(asString(body.get("workspace_id")))
                    .occurredAt(asString(body.get("occurred_at")))
                    .payload(payload instanceof Map ? (Map<String, Object>) payload : new LinkedHashMap<>())
                    .build();
        } catch (JsonProcessingException ex) {
            log.warn("Dropping undecodable event. error={}", ex.getMessage());
            return null;
        }
    }

    private String asString(Object value) {
        return value == null ? null : value.toString();
    }
}

package com.beadhub.test;

import com.beadhub.domain.presence.model.valobj.PresenceRecord;
import com.beadhub.infrastructure.redis.RedisKeys;
import com.beadhub.infrastructure.redis.RedisPresenceRepository;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class RedisPresenceRepositoryTest {

    private StringRedisTemplate redisTemplate;
    private RedisOperations<String, String> operations;
    private HashOperations<String, Object, Object> hashOperations;
    private SetOperations<String, String> setOperations;
    private RedisPresenceRepository repository;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        operations = mock(RedisOperations.class);
        hashOperations = mock(HashOperations.class);
        setOperations = mock(SetOperations.class);
        when(operations.opsForHash()).thenReturn(hashOperations);
        when(operations.opsForSet()).thenReturn(setOperations);
        when(redisTemplate.execute(any(SessionCallback.class))).thenAnswer(invocation -> {
            SessionCallback<Object> callback = invocation.getArgument(0);
            return callback.execute(operations);
        });
        repository = new RedisPresenceRepository(redisTemplate, 2);
    }

    @Test
    public void shouldWriteRecordTtlAndIndexesInsideOneTransaction() {
        when(operations.exec()).thenReturn(List.of(1L, true, true));

        repository.heartbeat(record(), 30);

        InOrder order = inOrder(operations, hashOperations, setOperations);
        order.verify(operations).multi();
        order.verify(operations).delete(RedisKeys.presence("ws-a"));
        order.verify(hashOperations).putAll(eq(RedisKeys.presence("ws-a")), anyMap());
        order.verify(operations).expire(RedisKeys.presence("ws-a"), Duration.ofSeconds(30));
        order.verify(setOperations).add(RedisKeys.projectIndex("p-1"), "ws-a");
        order.verify(operations).expire(RedisKeys.projectIndex("p-1"), Duration.ofSeconds(60));
        order.verify(operations).exec();
    }

    @Test
    public void shouldFailWhenTransactionIsDiscarded() {
        when(operations.exec()).thenReturn(Collections.emptyList());

        Assertions.assertThrows(IllegalStateException.class, () -> repository.heartbeat(record(), 30));
    }

    private PresenceRecord record() {
        return PresenceRecord.builder()
                .workspaceId("ws-a")
                .projectId("p-1")
                .repoId("r-1")
                .branch("main")
                .alias("alice-dev")
                .lastSeen("2026-01-12T09:00:00Z")
                .build();
    }
}

package com.beadhub.trigger.http;

import com.beadhub.domain.auth.model.valobj.AuthIdentity;
import com.beadhub.domain.presence.adapter.gateway.IProjectEventGateway;
import com.beadhub.domain.presence.model.valobj.ProjectEvent;
import com.beadhub.types.exception.AppException;
import com.google.common.collect.ImmutableSet;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 项目事件 SSE 流。
 * <p>
 * 每个连接持有一个事件总线订阅句柄，连接完成、超时或出错时释放。
 * event_types 按事件类别过滤，为空时推送全部事件。
 * </p>
 */
@Slf4j
@RestController
public class StatusStreamController {

    static final Set<String> SUPPORTED_CATEGORIES = ImmutableSet.of("bead", "claim", "escalation", "policy", "presence");

    private final IProjectEventGateway projectEventGateway;
    private final ConcurrentMap<String, SubscriberState> subscribers;
    private final ExecutorService pushExecutor;
    private final long timeoutMillis;
    private final Counter sseConnectCounter;
    private final Counter ssePushAttemptCounter;
    private final Counter ssePushFailCounter;

    public StatusStreamController(IProjectEventGateway projectEventGateway,
                                  ObjectProvider<MeterRegistry> meterRegistryProvider,
                                  @Value("${beadhub.sse.timeout-ms:1800000}") long timeoutMillis) {
        this.projectEventGateway = projectEventGateway;
        this.subscribers = new ConcurrentHashMap<>();
        this.timeoutMillis = timeoutMillis <= 0 ? 30L * 60L * 1000L : timeoutMillis;
        this.pushExecutor = Executors.newFixedThreadPool(4, runnable -> {
            Thread thread = new Thread(runnable, "status-stream-push");
            thread.setDaemon(true);
            return thread;
        });
        MeterRegistry meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.sseConnectCounter = Counter.builder("beadhub.sse.connect.total").register(meterRegistry);
        this.ssePushAttemptCounter = Counter.builder("beadhub.sse.push.attempt.total").register(meterRegistry);
        this.ssePushFailCounter = Counter.builder("beadhub.sse.push.fail.total").register(meterRegistry);
    }

    @GetMapping(value = "/v1/status/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestAttribute(AuthIdentity.REQUEST_ATTRIBUTE) AuthIdentity identity,
                             @RequestParam(value = "event_types", required = false) String eventTypes) {
        Set<String> categories = parseCategories(eventTypes);
        String projectId = identity.getProjectId();
        SseEmitter emitter = new SseEmitter(timeoutMillis);
        String subscriberId = UUID.randomUUID().toString();
        SubscriberState state = new SubscriberState(projectId, emitter, categories);
        subscribers.put(subscriberId, state);
        sseConnectCounter.increment();

        emitter.onCompletion(() -> removeSubscriber(subscriberId));
        emitter.onTimeout(() -> removeSubscriber(subscriberId));
        emitter.onError(ex -> removeSubscriber(subscriberId));

        Map<String, Object> hello = new LinkedHashMap<>();
        hello.put("project_id", projectId);
        hello.put("event_types", categories.isEmpty() ? SUPPORTED_CATEGORIES : categories);
        hello.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC).toString());
        if (!sendEvent(emitter, "hello", hello)) {
            removeSubscriber(subscriberId);
            return emitter;
        }
        try {
            state.handle = projectEventGateway.subscribe(projectId,
                    event -> pushExecutor.execute(() -> deliverEvent(subscriberId, event)));
        } catch (RuntimeException ex) {
            log.warn("Status stream subscribe failed. projectId={}, error={}", projectId, ex.getMessage());
            removeSubscriber(subscriberId);
            emitter.completeWithError(ex);
            return emitter;
        }
        // 订阅期间连接可能已经关闭
        if (!subscribers.containsKey(subscriberId)) {
            closeQuietly(state);
        }
        log.debug("Status stream opened. projectId={}, subscriberId={}, categories={}",
                projectId, subscriberId, categories);
        return emitter;
    }

    private void deliverEvent(String subscriberId, ProjectEvent event) {
        SubscriberState subscriber = subscribers.get(subscriberId);
        if (subscriber == null || event == null) {
            return;
        }
        if (!subscriber.accepts(event)) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", event.typeName());
        data.put("project_id", event.getProjectId());
        data.put("workspace_id", event.getWorkspaceId());
        data.put("payload", event.getPayload());
        data.put("occurred_at", event.getOccurredAt());
        synchronized (subscriber) {
            if (!sendEvent(subscriber.emitter, event.typeName(), data)) {
                removeSubscriber(subscriberId);
            }
        }
    }

    @Scheduled(fixedDelayString = "${beadhub.sse.keepalive-interval-ms:15000}", scheduler = "daemonScheduler")
    public void emitKeepalive() {
        if (subscribers.isEmpty()) {
            return;
        }
        for (Map.Entry<String, SubscriberState> entry : subscribers.entrySet()) {
            SubscriberState subscriber = entry.getValue();
            boolean sent;
            synchronized (subscriber) {
                sent = sendComment(subscriber.emitter, "keepalive");
            }
            if (!sent) {
                removeSubscriber(entry.getKey());
            }
        }
    }

    int subscriberCount() {
        return subscribers.size();
    }

    private Set<String> parseCategories(String eventTypes) {
        if (StringUtils.isBlank(eventTypes)) {
            return Collections.emptySet();
        }
        Set<String> categories = new LinkedHashSet<>();
        for (String raw : eventTypes.split(",")) {
            String category = StringUtils.lowerCase(StringUtils.trimToNull(raw));
            if (category == null) {
                continue;
            }
            if (!SUPPORTED_CATEGORIES.contains(category)) {
                throw AppException.illegalParameter("Unsupported event type: " + category);
            }
            categories.add(category);
        }
        return categories;
    }

    private void removeSubscriber(String subscriberId) {
        SubscriberState removed = subscribers.remove(subscriberId);
        if (removed != null) {
            closeQuietly(removed);
        }
    }

    private void closeQuietly(SubscriberState state) {
        AutoCloseable handle = state.handle;
        if (handle == null) {
            return;
        }
        try {
            handle.close();
        } catch (Exception ex) {
            log.debug("Status stream unsubscribe failed. projectId={}, error={}", state.projectId, ex.getMessage());
        }
    }

    private boolean sendEvent(SseEmitter emitter, String name, Object data) {
        ssePushAttemptCounter.increment();
        try {
            emitter.send(SseEmitter.event().name(name).data(data, MediaType.APPLICATION_JSON));
            return true;
        } catch (IOException | RuntimeException ex) {
            ssePushFailCounter.increment();
            log.debug("SSE send failed: {}", ex.getMessage());
            return false;
        }
    }

    private boolean sendComment(SseEmitter emitter, String comment) {
        try {
            emitter.send(SseEmitter.event().comment(comment));
            return true;
        } catch (IOException | RuntimeException ex) {
            ssePushFailCounter.increment();
            log.debug("SSE keepalive failed: {}", ex.getMessage());
            return false;
        }
    }

    private static final class SubscriberState {
        private final String projectId;
        private final SseEmitter emitter;
        private final Set<String> categories;
        private volatile AutoCloseable handle;

        private SubscriberState(String projectId, SseEmitter emitter, Set<String> categories) {
            this.projectId = projectId;
            this.emitter = emitter;
            this.categories = categories;
        }

        private boolean accepts(ProjectEvent event) {
            return categories.isEmpty() || categories.contains(event.category());
        }
    }

    @PreDestroy
    public void shutdown() {
        for (String subscriberId : subscribers.keySet()) {
            removeSubscriber(subscriberId);
        }
        pushExecutor.shutdownNow();
    }
}

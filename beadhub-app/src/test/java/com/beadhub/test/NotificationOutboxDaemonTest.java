package com.beadhub.test;

import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.trigger.application.command.OutboxDeliveryCommandService;
import com.beadhub.trigger.job.NotificationOutboxDaemon;
import com.beadhub.types.enums.OutboxStatusEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class NotificationOutboxDaemonTest {

    private OutboxDeliveryCommandService deliveryService;
    private NotificationOutboxDaemon daemon;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    public void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Metrics.addRegistry(meterRegistry);
        deliveryService = mock(OutboxDeliveryCommandService.class);
        daemon = new NotificationOutboxDaemon(deliveryService, 10, 7);
    }

    @AfterEach
    public void tearDown() {
        Metrics.removeRegistry(meterRegistry);
    }

    @Test
    public void shouldDeliverEachDueEntry() {
        when(deliveryService.findDueIds(10)).thenReturn(List.of("o-1", "o-2"));
        when(deliveryService.deliverEntry(anyString())).thenReturn(true);

        daemon.drain();

        verify(deliveryService).deliverEntry("o-1");
        verify(deliveryService).deliverEntry("o-2");
        verify(deliveryService, never()).recordFailure(anyString(), anyString());
    }

    @Test
    public void shouldRecordFailureAndContinueWithNextEntry() {
        when(deliveryService.findDueIds(10)).thenReturn(List.of("o-1", "o-2"));
        when(deliveryService.deliverEntry("o-1")).thenThrow(new IllegalStateException("mail store down"));
        when(deliveryService.deliverEntry("o-2")).thenReturn(true);
        OutboxEntryEntity retried = new OutboxEntryEntity();
        retried.setStatus(OutboxStatusEnum.PENDING);
        retried.setAttempts(1);
        when(deliveryService.recordFailure("o-1", "mail store down")).thenReturn(retried);

        daemon.drain();

        verify(deliveryService).recordFailure("o-1", "mail store down");
        verify(deliveryService).deliverEntry("o-2");
    }

    @Test
    public void shouldSurviveFailureBookkeepingErrors() {
        when(deliveryService.findDueIds(10)).thenReturn(List.of("o-1"));
        when(deliveryService.deliverEntry("o-1")).thenThrow(new IllegalStateException("boom"));
        when(deliveryService.recordFailure(eq("o-1"), anyString())).thenThrow(new IllegalStateException("db down"));

        daemon.drain();

        verify(deliveryService).recordFailure("o-1", "boom");
    }

    @Test
    public void shouldCountLockedEntriesAsSkippedNotDelivered() {
        when(deliveryService.findDueIds(10)).thenReturn(List.of("o-1", "o-2"));
        when(deliveryService.deliverEntry("o-1")).thenReturn(false);
        when(deliveryService.deliverEntry("o-2")).thenReturn(true);

        daemon.drain();

        Assertions.assertEquals(1.0, counter("beadhub.outbox.delivered.total"), 0.0001);
        Assertions.assertEquals(1.0, counter("beadhub.outbox.skipped.total"), 0.0001);
        verify(deliveryService, never()).recordFailure(anyString(), anyString());
    }

    @Test
    public void shouldSkipWhenNothingIsDue() {
        when(deliveryService.findDueIds(10)).thenReturn(Collections.emptyList());

        daemon.drain();

        verify(deliveryService, never()).deliverEntry(anyString());
    }

    @Test
    public void shouldCleanupDeliveredEntriesOlderThanRetention() {
        when(deliveryService.cleanupDelivered(any(LocalDateTime.class))).thenReturn(3);

        daemon.cleanup();

        verify(deliveryService).cleanupDelivered(any(LocalDateTime.class));
    }

    private double counter(String name) {
        Counter counter = meterRegistry.find(name).counter();
        return counter == null ? 0.0 : counter.count();
    }
}

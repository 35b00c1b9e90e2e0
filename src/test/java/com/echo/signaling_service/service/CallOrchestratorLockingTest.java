package com.echo.signaling_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.echo.signaling_service.config.SignalingProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.CallInviteRequest;
import com.echo.signaling_service.dto.CallLogEntry;
import com.echo.signaling_service.dto.Identity;
import com.echo.signaling_service.dto.SignalRequest;
import com.echo.signaling_service.enums.CallState;
import com.echo.signaling_service.repo.InMemoryPresenceStore;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Trickle relays of one call keep flowing while another call is being set up.
 */
class CallOrchestratorLockingTest {

    private final AtomicBoolean holdRecords = new AtomicBoolean();
    private final CountDownLatch recordEntered = new CountDownLatch(1);
    private final CountDownLatch releaseRecord = new CountDownLatch(1);

    private RecordingDispatcher dispatcher;
    private CallOrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        SignalingProperties properties = new SignalingProperties();
        dispatcher = new RecordingDispatcher();
        ConnectionRegistryService registry = new ConnectionRegistryService(new InMemoryPresenceStore(), event -> {
        });
        RoomMembershipService rooms = new RoomMembershipService(registry, new InMemoryPresenceStore(), dispatcher);

        // stalls the first record() made while holdRecords is set, inside the orchestrator lock
        CallLogService callLog = new CallLogService(properties) {
            @Override
            public void record(CallLogEntry entry) {
                if (holdRecords.compareAndSet(true, false)) {
                    recordEntered.countDown();
                    try {
                        releaseRecord.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                super.record(entry);
            }
        };

        ScheduledExecutorService callTimer = mock(ScheduledExecutorService.class);
        ScheduledFuture<?> timeoutFuture = mock(ScheduledFuture.class);
        when(callTimer.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class)))
                .thenAnswer(invocation -> timeoutFuture);

        orchestrator = new CallOrchestratorService(registry, rooms, dispatcher, callLog,
                mock(CallNotificationService.class), callTimer, properties, Clock.systemUTC());

        registry.register("a", new Identity("Alice", null));
        registry.register("b", new Identity("Bob", null));
        registry.register("c", new Identity("Carol", null));
        registry.register("d", new Identity("Dave", null));
    }

    @AfterEach
    void tearDown() {
        releaseRecord.countDown();
    }

    @Test
    void iceOfActiveCallIsRelayedWhileAnotherCallIsBeingSetUp() throws Exception {
        orchestrator.invite("a", CallInviteRequest.builder().callId("c1").to("b").build());
        orchestrator.answer("b", SignalRequest.builder().to("a").callId("c1").build());

        holdRecords.set(true);
        CompletableFuture<Void> slowInvite = CompletableFuture.runAsync(
                () -> orchestrator.invite("c", CallInviteRequest.builder().callId("c2").to("d").build()));
        assertThat(recordEntered.await(2, TimeUnit.SECONDS)).isTrue();

        CompletableFuture.runAsync(() -> orchestrator.ice("a",
                SignalRequest.builder().to("b").callId("c1").candidate(TextNode.valueOf("candidate:1")).build()))
                .get(2, TimeUnit.SECONDS);

        assertThat(dispatcher.to("b", ApplicationConstants.EVENT_WEBRTC_ICE)).hasSize(1);
        assertThat(dispatcher.lastPayload("b", ApplicationConstants.EVENT_WEBRTC_ICE))
                .containsEntry("from", "a")
                .containsEntry("callId", "c1");

        releaseRecord.countDown();
        slowInvite.get(2, TimeUnit.SECONDS);
        assertThat(orchestrator.stateOf("c2")).contains(CallState.RINGING);
        assertThat(dispatcher.to("d", ApplicationConstants.EVENT_CALL_INVITE)).hasSize(1);
    }

    @Test
    void iceForRingingCallIsRelayedBeforeItsLogEntryLands() throws Exception {
        holdRecords.set(true);
        CompletableFuture<Void> slowInvite = CompletableFuture.runAsync(
                () -> orchestrator.invite("c", CallInviteRequest.builder().callId("c2").to("d").build()));
        assertThat(recordEntered.await(2, TimeUnit.SECONDS)).isTrue();

        // session is published before record(); the relay sees a fully set up ringing call
        CompletableFuture.runAsync(() -> orchestrator.ice("c",
                SignalRequest.builder().to("d").callId("c2").candidate(TextNode.valueOf("candidate:1")).build()))
                .get(2, TimeUnit.SECONDS);
        assertThat(dispatcher.lastPayload("d", ApplicationConstants.EVENT_WEBRTC_ICE)).containsEntry("callId", "c2");

        releaseRecord.countDown();
        slowInvite.get(2, TimeUnit.SECONDS);
    }
}

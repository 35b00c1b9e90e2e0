package com.echo.signaling_service.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.echo.signaling_service.config.SignalingProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.CallInviteRequest;
import com.echo.signaling_service.dto.CallLogEntry;
import com.echo.signaling_service.dto.ConnectionClosedEvent;
import com.echo.signaling_service.dto.Identity;
import com.echo.signaling_service.dto.SignalRequest;
import com.echo.signaling_service.enums.CallKind;
import com.echo.signaling_service.enums.CallOutcome;
import com.echo.signaling_service.enums.CallScopeType;
import com.echo.signaling_service.enums.CallState;
import com.echo.signaling_service.repo.InMemoryPresenceStore;

class CallOrchestratorServiceTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
    private final List<Runnable> scheduled = new ArrayList<>();

    private RecordingDispatcher dispatcher;
    private ConnectionRegistryService registry;
    private RoomMembershipService rooms;
    private CallLogService callLog;
    private CallNotificationService notifications;
    private ScheduledExecutorService callTimer;
    private ScheduledFuture<?> timeoutFuture;
    private CallOrchestratorService orchestrator;

    @BeforeEach
    void setUp() {
        SignalingProperties properties = new SignalingProperties();
        dispatcher = new RecordingDispatcher();
        registry = new ConnectionRegistryService(new InMemoryPresenceStore(), event -> {
            if (event instanceof ConnectionClosedEvent) {
                orchestrator.onConnectionClosed((ConnectionClosedEvent) event);
                rooms.onConnectionClosed((ConnectionClosedEvent) event);
            }
        });
        rooms = new RoomMembershipService(registry, new InMemoryPresenceStore(), dispatcher);
        callLog = new CallLogService(properties);
        notifications = mock(CallNotificationService.class);

        callTimer = mock(ScheduledExecutorService.class);
        timeoutFuture = mock(ScheduledFuture.class);
        when(callTimer.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(invocation -> {
            scheduled.add(invocation.getArgument(0));
            return timeoutFuture;
        });

        orchestrator = new CallOrchestratorService(registry, rooms, dispatcher, callLog, notifications, callTimer,
                properties, clock);

        registry.register("a", new Identity("Alice", "user-a"));
        registry.register("b", new Identity("Bob", "user-b"));
        registry.register("c", new Identity("Carol", null));
        registry.register("d", new Identity("Dave", null));
    }

    // ------------------------------------------------------------------ one-to-one

    @Test
    void inviteRingsCalleeAndArmsRingTimer() {
        invite("a", "b", "c1");

        assertThat(orchestrator.stateOf("c1")).contains(CallState.RINGING);
        Map<String, Object> invite = dispatcher.lastPayload("b", ApplicationConstants.EVENT_CALL_INVITE);
        assertThat(invite).containsEntry("callId", "c1").containsEntry("from", "a").containsEntry("fromName", "Alice");
        verify(callTimer).schedule(any(Runnable.class), eq(30_000L), eq(TimeUnit.MILLISECONDS));
        assertThat(callLog.find("c1")).hasValueSatisfying(entry -> {
            assertThat(entry.getScope()).isEqualTo(CallScopeType.DIRECT);
            assertThat(entry.getTarget()).isEqualTo("b");
            assertThat(entry.isFinal()).isFalse();
        });
    }

    @Test
    void answerFromCalleeActivatesCallAndDisarmsTimeout() {
        invite("a", "b", "c1");

        orchestrator.answer("b", SignalRequest.builder().to("a").callId("c1").build());

        assertThat(orchestrator.stateOf("c1")).contains(CallState.ACTIVE);
        assertThat(orchestrator.participantsOf("c1")).containsExactly("a", "b");
        assertThat(dispatcher.lastPayload("a", ApplicationConstants.EVENT_WEBRTC_ANSWER)).containsEntry("from", "b");
        verify(timeoutFuture).cancel(false);

        // a timer that already fired and queued its task must not act on the accepted call
        scheduled.get(0).run();
        assertThat(orchestrator.stateOf("c1")).contains(CallState.ACTIVE);
        assertThat(dispatcher.to("a", ApplicationConstants.EVENT_CALL_MISSED)).isEmpty();
        verify(notifications, never()).publishMissedCall(any(), any(), any(), any(), anyLong());
    }

    @Test
    void unansweredCallIsMissedWhenTimerFires() {
        invite("a", "b", "c1");

        scheduled.get(0).run();

        assertThat(dispatcher.lastPayload("a", ApplicationConstants.EVENT_CALL_MISSED))
                .containsEntry("callId", "c1")
                .containsEntry("to", "b");
        assertThat(dispatcher.lastPayload("b", ApplicationConstants.EVENT_WEBRTC_END)).containsEntry("from", "a");
        assertThat(orchestrator.stateOf("c1")).isEmpty();
        assertThat(callLog.find("c1").map(CallLogEntry::getOutcome)).contains(CallOutcome.MISSED);
        verify(notifications).publishMissedCall("user-b", "Alice", "c1", CallKind.AUDIO, clock.millis());
    }

    @Test
    void offerToEngagedConnectionIsAnsweredWithBusy() {
        invite("a", "b", "c1");
        orchestrator.answer("b", SignalRequest.builder().to("a").callId("c1").build());
        dispatcher.clear();

        orchestrator.offer("d", SignalRequest.builder().to("a").callId("c2").build());

        assertThat(dispatcher.lastPayload("d", ApplicationConstants.EVENT_CALL_BUSY))
                .containsEntry("from", "a")
                .containsEntry("callId", "c2");
        assertThat(dispatcher.eventsFor("a")).isEmpty();
        assertThat(orchestrator.stateOf("c1")).contains(CallState.ACTIVE);
        assertThat(orchestrator.stateOf("c2")).isEmpty();
        assertThat(callLog.find("c2").map(CallLogEntry::getOutcome)).contains(CallOutcome.BUSY);
        verify(callTimer, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    void firstOfferWithUnknownCallIdStartsCallAndLaterOffersAreRelayed() {
        orchestrator.offer("a", SignalRequest.builder().to("b").callId("c1").kind(CallKind.VIDEO).build());
        orchestrator.answer("b", SignalRequest.builder().to("a").callId("c1").build());

        orchestrator.offer("b", SignalRequest.builder().to("a").callId("c1").build());

        assertThat(dispatcher.lastPayload("b", ApplicationConstants.EVENT_WEBRTC_OFFER))
                .containsEntry("media", CallKind.VIDEO);
        assertThat(dispatcher.lastPayload("a", ApplicationConstants.EVENT_WEBRTC_OFFER)).containsEntry("from", "b");
        assertThat(orchestrator.stateOf("c1")).contains(CallState.ACTIVE);
        verify(callTimer, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    void offerWithoutCallIdBetweenCallPeersRenegotiatesTheirCall() {
        invite("a", "b", "c1");
        orchestrator.answer("b", SignalRequest.builder().to("a").callId("c1").build());
        dispatcher.clear();

        orchestrator.offer("a", SignalRequest.builder().to("b").kind(CallKind.VIDEO).build());

        assertThat(dispatcher.eventsFor("a")).isEmpty();
        assertThat(dispatcher.to("b", ApplicationConstants.EVENT_WEBRTC_OFFER)).hasSize(1);
        assertThat(dispatcher.lastPayload("b", ApplicationConstants.EVENT_WEBRTC_OFFER))
                .containsEntry("callId", "c1")
                .containsEntry("media", CallKind.VIDEO);
        assertThat(orchestrator.stateOf("c1")).contains(CallState.ACTIVE);
        assertThat(orchestrator.participantsOf("c1")).containsExactly("a", "b");
        assertThat(callLog.size()).isEqualTo(1);
        assertThat(callLog.find("c1").map(CallLogEntry::getKind)).contains(CallKind.VIDEO);
        verify(callTimer, times(1)).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
    }

    @Test
    void offerReusingEndedCallIdStartsNewCall() {
        orchestrator.offer("a", SignalRequest.builder().to("b").callId("c1").build());
        orchestrator.end("a", SignalRequest.builder().to("b").callId("c1").build());

        orchestrator.offer("a", SignalRequest.builder().to("b").callId("c1").build());

        assertThat(orchestrator.stateOf("c1")).contains(CallState.RINGING);
        assertThat(dispatcher.to("b", ApplicationConstants.EVENT_WEBRTC_OFFER)).hasSize(2);
        assertThat(callLog.size()).isEqualTo(2);
    }

    @Test
    void offerWithoutCallIdGetsServerGeneratedId() {
        orchestrator.offer("a", SignalRequest.builder().to("b").build());

        String callId = (String) dispatcher.lastPayload("b", ApplicationConstants.EVENT_WEBRTC_OFFER).get("callId");
        assertThat(callId).startsWith("call-");
        assertThat(orchestrator.stateOf(callId)).contains(CallState.RINGING);
    }

    @Test
    void calleeEndingRingingCallDeclinesIt() {
        invite("a", "b", "c1");

        orchestrator.end("b", SignalRequest.builder().to("a").callId("c1").build());

        assertThat(dispatcher.lastPayload("a", ApplicationConstants.EVENT_WEBRTC_END)).containsEntry("from", "b");
        assertThat(callLog.find("c1").map(CallLogEntry::getOutcome)).contains(CallOutcome.DECLINED);
        assertThat(orchestrator.engagedCallOf("a")).isEmpty();
        assertThat(orchestrator.engagedCallOf("b")).isEmpty();
    }

    @Test
    void callerEndingRingingCallCancelsIt() {
        invite("a", "b", "c1");

        orchestrator.end("a", SignalRequest.builder().to("b").callId("c1").build());

        assertThat(callLog.find("c1").map(CallLogEntry::getOutcome)).contains(CallOutcome.CANCELED);
        verify(timeoutFuture).cancel(false);
    }

    @Test
    void endingActiveCallCompletesIt() {
        invite("a", "b", "c1");
        orchestrator.answer("b", SignalRequest.builder().to("a").callId("c1").build());

        orchestrator.end("a", SignalRequest.builder().to("b").callId("c1").build());

        assertThat(callLog.find("c1")).hasValueSatisfying(entry -> {
            assertThat(entry.getOutcome()).isEqualTo(CallOutcome.COMPLETED);
            assertThat(entry.getEndedAt()).isEqualTo(clock.millis());
            assertThat(entry.getParticipants()).containsExactly("a", "b");
        });
    }

    @Test
    void busyFromRingingCalleeEndsCallAsBusy() {
        invite("a", "b", "c1");

        orchestrator.busy("b", SignalRequest.builder().to("a").callId("c1").build());

        assertThat(dispatcher.lastPayload("a", ApplicationConstants.EVENT_CALL_BUSY)).containsEntry("from", "b");
        assertThat(callLog.find("c1").map(CallLogEntry::getOutcome)).contains(CallOutcome.BUSY);
    }

    @Test
    void acceptedUpgradeSwitchesCallKind() {
        invite("a", "b", "c1");
        orchestrator.answer("b", SignalRequest.builder().to("a").callId("c1").build());

        orchestrator.upgrade("a", SignalRequest.builder().to("b").callId("c1").kind(CallKind.VIDEO).build());
        orchestrator.upgradeResponse("b",
                SignalRequest.builder().to("a").callId("c1").kind(CallKind.VIDEO).accepted(true).build());

        assertThat(dispatcher.lastPayload("b", ApplicationConstants.EVENT_CALL_UPGRADE))
                .containsEntry("kind", CallKind.VIDEO);
        assertThat(dispatcher.lastPayload("a", ApplicationConstants.EVENT_CALL_UPGRADE_RESPONSE))
                .containsEntry("accepted", true);
        assertThat(callLog.find("c1").map(CallLogEntry::getKind)).contains(CallKind.VIDEO);
    }

    @Test
    void signalsBetweenUnrelatedConnectionsAreDropped() {
        invite("a", "b", "c1");
        dispatcher.clear();

        orchestrator.ice("c", SignalRequest.builder().to("a").callId("c1").build());
        orchestrator.answer("d", SignalRequest.builder().to("a").callId("c1").build());

        assertThat(dispatcher.sent).isEmpty();
        assertThat(orchestrator.stateOf("c1")).contains(CallState.RINGING);
    }

    @Test
    void inviteToUnknownTargetIsDropped() {
        invite("a", "ghost", "c1");

        assertThat(orchestrator.stateOf("c1")).isEmpty();
        assertThat(dispatcher.sent).isEmpty();
    }

    // ------------------------------------------------------------------ mesh

    @Test
    void meshParticipantsGetExactlyOneOffererPerPair() {
        orchestrator.invite("a", CallInviteRequest.builder().callId("m1").build());
        orchestrator.join("m1", "a");
        orchestrator.join("m1", "b");
        orchestrator.join("m1", "c");

        assertThat(orchestrator.stateOf("m1")).contains(CallState.ACTIVE);
        assertThat(initiateTo("a")).containsExactly("b", "c");
        assertThat(initiateTo("b")).containsExactly("c");
        assertThat(initiateTo("c")).isEmpty();
        // non-participant in scope hears the roster but initiates nothing
        assertThat(initiateTo("d")).isEmpty();
        assertThat(dispatcher.lastPayload("d", ApplicationConstants.EVENT_CALL_PARTICIPANTS).get("participants"))
                .isEqualTo(List.of("a", "b", "c"));

        List<String> ids = List.of("a", "b", "c");
        for (String x : ids) {
            for (String y : ids) {
                if (!x.equals(y)) {
                    boolean xOffers = initiateTo(x).contains(y);
                    boolean yOffers = initiateTo(y).contains(x);
                    assertThat(xOffers ^ yOffers).as("one offerer for %s-%s", x, y).isTrue();
                }
            }
        }
    }

    @Test
    void groupInviteReachesScopeExceptInitiator() {
        orchestrator.invite("a", CallInviteRequest.builder().callId("m1").kind(CallKind.VIDEO).build());

        assertThat(dispatcher.to("a", ApplicationConstants.EVENT_CALL_INVITE)).isEmpty();
        for (String member : List.of("b", "c", "d")) {
            assertThat(dispatcher.lastPayload(member, ApplicationConstants.EVENT_CALL_INVITE))
                    .containsEntry("callId", "m1")
                    .containsEntry("kind", CallKind.VIDEO);
        }
        assertThat(orchestrator.stateOf("m1")).contains(CallState.INVITING);
    }

    @Test
    void roomScopedInviteOnlyReachesRoomMembers() {
        rooms.join("a", "team");
        rooms.join("b", "team");
        dispatcher.clear();

        orchestrator.invite("a", CallInviteRequest.builder().callId("m1").room("team").build());

        assertThat(dispatcher.to("b", ApplicationConstants.EVENT_CALL_INVITE)).hasSize(1);
        assertThat(dispatcher.to("c", ApplicationConstants.EVENT_CALL_INVITE)).isEmpty();
        assertThat(callLog.find("m1").map(CallLogEntry::getScope)).contains(CallScopeType.ROOM);
    }

    @Test
    void participantInvitesAnotherUserIntoRunningGroupCall() {
        orchestrator.invite("a", CallInviteRequest.builder().callId("g1").room("r1").kind(CallKind.VIDEO).build());
        orchestrator.join("g1", "a");
        dispatcher.clear();

        orchestrator.invite("a", CallInviteRequest.builder().callId("g1").room("r1").to("d").build());

        assertThat(dispatcher.to("d", ApplicationConstants.EVENT_CALL_INVITE)).hasSize(1);
        assertThat(dispatcher.lastPayload("d", ApplicationConstants.EVENT_CALL_INVITE))
                .containsEntry("callId", "g1")
                .containsEntry("kind", CallKind.VIDEO)
                .containsEntry("from", "a")
                .containsEntry("fromName", "Alice")
                .containsEntry("room", "r1");
        assertThat(dispatcher.eventsFor("a")).isEmpty();
        assertThat(orchestrator.stateOf("g1")).contains(CallState.ACTIVE);
        assertThat(orchestrator.participantsOf("g1")).containsExactly("a");
        assertThat(orchestrator.engagedCallOf("d")).isEmpty();
        assertThat(callLog.size()).isEqualTo(1);
        verify(callTimer, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));

        orchestrator.join("g1", "d");
        assertThat(orchestrator.participantsOf("g1")).containsExactly("a", "d");
    }

    @Test
    void disconnectingParticipantIsRemovedAndOthersAreUpdated() {
        orchestrator.invite("a", CallInviteRequest.builder().callId("m1").build());
        orchestrator.join("m1", "a");
        orchestrator.join("m1", "b");
        orchestrator.join("m1", "c");
        dispatcher.clear();

        registry.unregister("b");

        assertThat(orchestrator.participantsOf("m1")).containsExactly("a", "c");
        assertThat(orchestrator.stateOf("m1")).contains(CallState.ACTIVE);
        assertThat(dispatcher.lastPayload("a", ApplicationConstants.EVENT_CALL_PARTICIPANTS).get("participants"))
                .isEqualTo(List.of("a", "c"));
        assertThat(dispatcher.lastPayload("c", ApplicationConstants.EVENT_CALL_PARTICIPANTS).get("participants"))
                .isEqualTo(List.of("a", "c"));
        assertThat(callLog.find("m1").map(CallLogEntry::getParticipants)).contains(List.of("a", "b", "c"));
    }

    @Test
    void lastParticipantLeavingEndsMeshCall() {
        orchestrator.invite("a", CallInviteRequest.builder().callId("m1").build());
        orchestrator.join("m1", "a");
        orchestrator.join("m1", "b");

        orchestrator.leave("m1", "a");
        orchestrator.leave("m1", "b");

        assertThat(orchestrator.stateOf("m1")).isEmpty();
        assertThat(callLog.find("m1").map(CallLogEntry::getOutcome)).contains(CallOutcome.COMPLETED);
    }

    @Test
    void endAllTearsDownEveryParticipant() {
        orchestrator.invite("a", CallInviteRequest.builder().callId("m1").build());
        orchestrator.join("m1", "a");
        orchestrator.join("m1", "b");
        dispatcher.clear();

        orchestrator.endAll("m1", "b");

        assertThat(dispatcher.lastPayload("a", ApplicationConstants.EVENT_WEBRTC_END)).containsEntry("from", "b");
        assertThat(dispatcher.lastPayload("b", ApplicationConstants.EVENT_WEBRTC_END)).containsEntry("from", "b");
        for (String member : List.of("a", "b", "c", "d")) {
            assertThat(dispatcher.to(member, ApplicationConstants.EVENT_CALL_END_ALL)).hasSize(1);
        }
        assertThat(orchestrator.stateOf("m1")).isEmpty();
        assertThat(orchestrator.engagedCallOf("a")).isEmpty();
        assertThat(callLog.find("m1").map(CallLogEntry::getOutcome)).contains(CallOutcome.TERMINATED);
    }

    @Test
    void connectionIsEngagedInAtMostOneCall() {
        orchestrator.invite("a", CallInviteRequest.builder().callId("m1").build());
        orchestrator.invite("b", CallInviteRequest.builder().callId("m2").build());
        orchestrator.join("m1", "c");

        orchestrator.join("m2", "c");

        assertThat(orchestrator.participantsOf("m2")).doesNotContain("c");
        assertThat(orchestrator.engagedCallOf("c")).contains("m1");
        assertThat(dispatcher.lastPayload("c", ApplicationConstants.EVENT_CALL_BUSY))
                .containsEntry("activeCallId", "m1");
    }

    @Test
    void reusedCallIdAfterTerminationStartsFreshLogEntry() {
        invite("a", "b", "c1");
        orchestrator.end("a", SignalRequest.builder().to("b").callId("c1").build());

        invite("a", "c", "c1");

        assertThat(orchestrator.stateOf("c1")).contains(CallState.RINGING);
        assertThat(callLog.recent(10)).extracting(CallLogEntry::getOutcome)
                .containsExactly(CallOutcome.CANCELED, null);
    }

    // ------------------------------------------------------------------ disconnect cascade

    @Test
    void calleeDisconnectWhileRingingDeclinesCall() {
        invite("a", "b", "c1");

        registry.unregister("b");

        assertThat(dispatcher.lastPayload("a", ApplicationConstants.EVENT_WEBRTC_END)).containsEntry("from", "b");
        assertThat(callLog.find("c1").map(CallLogEntry::getOutcome)).contains(CallOutcome.DECLINED);
        verify(timeoutFuture).cancel(false);
    }

    @Test
    void callerDisconnectWhileRingingCancelsCall() {
        invite("a", "b", "c1");

        registry.unregister("a");

        assertThat(dispatcher.lastPayload("b", ApplicationConstants.EVENT_WEBRTC_END)).containsEntry("from", "a");
        assertThat(callLog.find("c1").map(CallLogEntry::getOutcome)).contains(CallOutcome.CANCELED);
        assertThat(orchestrator.engagedCallOf("b")).isEmpty();
    }

    @Test
    void initiatorDisconnectCancelsMeshCallNobodyJoined() {
        orchestrator.invite("a", CallInviteRequest.builder().callId("m1").build());

        registry.unregister("a");

        assertThat(orchestrator.stateOf("m1")).isEmpty();
        assertThat(dispatcher.to("b", ApplicationConstants.EVENT_CALL_END_ALL)).hasSize(1);
        assertThat(callLog.find("m1").map(CallLogEntry::getOutcome)).contains(CallOutcome.CANCELED);
    }

    private void invite(String from, String to, String callId) {
        orchestrator.invite(from, CallInviteRequest.builder().callId(callId).to(to).build());
    }

    @SuppressWarnings("unchecked")
    private List<String> initiateTo(String connectionId) {
        return (List<String>) dispatcher.lastPayload(connectionId, ApplicationConstants.EVENT_CALL_PARTICIPANTS)
                .get("initiateTo");
    }
}

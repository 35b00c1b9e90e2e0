package com.echo.signaling_service.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import com.echo.signaling_service.config.SignalingProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.CallInviteRequest;
import com.echo.signaling_service.dto.CallLogEntry;
import com.echo.signaling_service.dto.CallScope;
import com.echo.signaling_service.dto.CallSession;
import com.echo.signaling_service.dto.ConnectionClosedEvent;
import com.echo.signaling_service.dto.Identity;
import com.echo.signaling_service.dto.OutboundSignal;
import com.echo.signaling_service.dto.RingingEdge;
import com.echo.signaling_service.dto.SignalRequest;
import com.echo.signaling_service.enums.CallKind;
import com.echo.signaling_service.enums.CallOutcome;
import com.echo.signaling_service.enums.CallState;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns every call session: one-to-one ringing with timeout, busy detection, mesh
 * membership, forced termination and the disconnect cascade. Every change to sessions or
 * engagement happens under one lock, with outbound events collected while it is held and
 * sent after it is released. Relays that only read one call (ICE candidates, upgrade
 * requests) skip the lock, so trickle traffic of unrelated calls never waits on it.
 *
 * A connection is engaged in at most one call at a time (ringing party or active
 * participant).
 */
@Slf4j
@Service
public class CallOrchestratorService {

    private final Object lock = new Object();
    // callId -> non-ended session
    private final Map<String, CallSession> sessions = new ConcurrentHashMap<>();
    // connectionId -> callId it is engaged in
    private final Map<String, String> engagedIn = new ConcurrentHashMap<>();

    private final ConnectionRegistryService connectionRegistry;
    private final RoomMembershipService roomMembership;
    private final SignalDispatcher dispatcher;
    private final CallLogService callLog;
    private final CallNotificationService notifications;
    private final ScheduledExecutorService callTimer;
    private final SignalingProperties properties;
    private final Clock clock;

    public CallOrchestratorService(ConnectionRegistryService connectionRegistry,
            RoomMembershipService roomMembership, SignalDispatcher dispatcher, CallLogService callLog,
            CallNotificationService notifications, @Qualifier("callTimer") ScheduledExecutorService callTimer,
            SignalingProperties properties, Clock clock) {
        this.connectionRegistry = connectionRegistry;
        this.roomMembership = roomMembership;
        this.dispatcher = dispatcher;
        this.callLog = callLog;
        this.notifications = notifications;
        this.callTimer = callTimer;
        this.properties = properties;
        this.clock = clock;
    }

    // ------------------------------------------------------------------ invites

    /**
     * {@code call:invite}: rings a single target when {@code to} is set, otherwise
     * announces a mesh call to a room or to everyone. A targeted invite naming a live mesh
     * call brings one more user into that call instead of ringing.
     */
    public void invite(String initiator, CallInviteRequest request) {
        CallKind kind = request.getKind() != null ? request.getKind() : CallKind.AUDIO;
        String callId = hasText(request.getCallId()) ? request.getCallId() : newCallId();
        String to = request.getTo();
        if (!hasText(to)) {
            inviteGroup(initiator, callId, kind, RoomMembershipService.normalizeRoom(request.getRoom()));
            return;
        }
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            CallSession existing = sessions.get(callId);
            if (existing != null && !existing.isDirect()) {
                inviteIntoGroupLocked(existing, initiator, to, outbox);
            } else {
                startDirectLocked(initiator, to, callId, kind, ApplicationConstants.EVENT_CALL_INVITE,
                        payload("callId", callId, "kind", kind, "from", initiator, "fromName", nameOf(initiator)),
                        outbox);
            }
        }
        dispatcher.sendAll(outbox);
    }

    /**
     * {@code webrtc:offer}: an offer inside a call the two peers already share is relayed
     * (initial offer or renegotiation). The shared call is found by {@code callId}, or by the
     * peer pair when the id is missing. Any other offer starts a one-to-one call.
     */
    public void offer(String from, SignalRequest request) {
        String to = request.getTo();
        if (!hasText(to)) {
            log.debug("webrtc:offer from {} dropped: no target", from);
            return;
        }
        String callId = hasText(request.getCallId()) ? request.getCallId() : null;
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            CallSession live = callId != null ? sessions.get(callId) : sharedSession(from, to, null);
            if (live != null) {
                renegotiateLocked(live, from, request, outbox);
            } else {
                String id = callId != null ? callId : newCallId();
                CallKind kind = request.getKind() != null ? request.getKind() : CallKind.AUDIO;
                startDirectLocked(from, to, id, kind, ApplicationConstants.EVENT_WEBRTC_OFFER,
                        payload("from", from, "sdp", request.getSdp(), "media", kind, "callId", id), outbox);
            }
        }
        dispatcher.sendAll(outbox);
    }

    // relays the offer; an active one-to-one call also switches kind in place. Membership is untouched
    private void renegotiateLocked(CallSession live, String from, SignalRequest request,
            List<OutboundSignal> outbox) {
        CallSession session = sharedSession(from, request.getTo(), live.getCallId());
        if (session == null) {
            log.debug("webrtc:offer from {} to {} dropped: not peers in {}", from, request.getTo(), live.getCallId());
            return;
        }
        CallKind kind = request.getKind();
        if (session.isDirect() && session.getState() == CallState.ACTIVE && kind != null && kind != session.getKind()) {
            session.setKind(kind);
            callLog.update(CallLogEntry.of(session));
            log.info("CALL {} renegotiated to {}", session.getCallId(), kind.getWireName());
        }
        outbox.add(new OutboundSignal(request.getTo(), ApplicationConstants.EVENT_WEBRTC_OFFER,
                payload("from", from, "sdp", request.getSdp(), "media", kind, "callId", session.getCallId())));
    }

    private void startDirectLocked(String caller, String callee, String callId, CallKind kind, String event,
            Map<String, Object> firstSignal, List<OutboundSignal> outbox) {
        if (caller.equals(callee) || !connectionRegistry.isRegistered(callee)) {
            log.debug("Call {} from {} dropped: target {} unknown", callId, caller, callee);
            return;
        }
        CallSession existing = sessions.get(callId);
        if (existing != null) {
            if (existing.isParty(caller) && existing.isParty(callee)) {
                outbox.add(new OutboundSignal(callee, event, firstSignal));
            } else {
                log.warn("Call id {} already in use, {} from {} dropped", callId, event, caller);
            }
        } else if (engagedIn.containsKey(callee) || engagedIn.containsKey(caller)) {
            rejectBusy(caller, callee, callId, kind, outbox);
        } else {
            long now = clock.millis();
            CallSession session = new CallSession(callId, kind, CallScope.direct(callee), caller, now);
            session.setState(CallState.RINGING);
            RingingEdge edge = new RingingEdge(caller, callee, kind, now);
            session.setRingingEdge(edge);
            edge.setTimeout(callTimer.schedule(() -> onRingTimeout(callId, edge),
                    properties.getRingTimeoutMs(), TimeUnit.MILLISECONDS));

            sessions.put(callId, session);
            engagedIn.put(caller, callId);
            engagedIn.put(callee, callId);
            callLog.record(CallLogEntry.of(session));

            outbox.add(new OutboundSignal(callee, event, firstSignal));
            log.info("CALL {} RINGING {} -> {} ({})", callId, caller, callee, kind.getWireName());
        }
    }

    // no ringing edge: the invitee joins through call:join like everyone else in scope
    private void inviteIntoGroupLocked(CallSession session, String inviter, String invitee,
            List<OutboundSignal> outbox) {
        if (inviter.equals(invitee) || !connectionRegistry.isRegistered(invitee)) {
            log.debug("Invite into {} from {} dropped: target {} unknown", session.getCallId(), inviter, invitee);
            return;
        }
        if (session.hasParticipant(invitee)) {
            log.debug("Invite into {} from {} dropped: {} already participates", session.getCallId(), inviter,
                    invitee);
            return;
        }
        outbox.add(new OutboundSignal(invitee, ApplicationConstants.EVENT_CALL_INVITE,
                payload("callId", session.getCallId(), "kind", session.getKind(), "from", inviter,
                        "fromName", nameOf(inviter), "room", session.getScope().getRoom())));
        log.info("CALL {} {} invited {} into the running call", session.getCallId(), inviter, invitee);
    }

    // either side already engaged: the call never rings, the offerer hears busy
    private void rejectBusy(String caller, String callee, String callId, CallKind kind,
            List<OutboundSignal> outbox) {
        long now = clock.millis();
        CallSession attempt = new CallSession(callId, kind, CallScope.direct(callee), caller, now);
        attempt.markEnded(now);
        callLog.record(CallLogEntry.of(attempt).toBuilder().outcome(CallOutcome.BUSY).build());
        String reason = engagedIn.containsKey(callee) ? "callee-busy" : "caller-busy";
        outbox.add(new OutboundSignal(caller, ApplicationConstants.EVENT_CALL_BUSY,
                payload("from", callee, "callId", callId, "reason", reason)));
        log.info("CALL {} BUSY {} -> {} ({})", callId, caller, callee, reason);
    }

    private void inviteGroup(String initiator, String callId, CallKind kind, String room) {
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            CallSession session = sessions.get(callId);
            if (session == null) {
                session = new CallSession(callId, kind, CallScope.group(room), initiator, clock.millis());
                sessions.put(callId, session);
                callLog.record(CallLogEntry.of(session));
                log.info("CALL {} INVITING {} scope={} room={}", callId, initiator,
                        session.getScope().getType(), room);
            } else if (session.isDirect()) {
                log.warn("Call id {} belongs to a one-to-one call, group invite from {} dropped", callId, initiator);
                return;
            }
            Map<String, Object> invite = payload("callId", callId, "kind", session.getKind(), "from", initiator,
                    "fromName", nameOf(initiator), "room", session.getScope().getRoom());
            for (String member : audienceOf(session)) {
                if (!member.equals(initiator)) {
                    outbox.add(new OutboundSignal(member, ApplicationConstants.EVENT_CALL_INVITE, invite));
                }
            }
        }
        dispatcher.sendAll(outbox);
    }

    // ------------------------------------------------------------------ peer signals

    /**
     * {@code webrtc:answer}: from the callee of a ringing call it accepts the call.
     */
    public void answer(String from, SignalRequest request) {
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            CallSession session = sharedSession(from, request.getTo(), request.getCallId());
            if (session == null) {
                log.debug("webrtc:answer from {} to {} dropped: no shared call", from, request.getTo());
                return;
            }
            RingingEdge edge = session.getRingingEdge();
            if (session.getState() == CallState.RINGING && edge != null && edge.getCallee().equals(from)) {
                edge.cancelTimeout();
                session.setRingingEdge(null);
                session.setState(CallState.ACTIVE);
                session.addParticipant(edge.getCaller());
                session.addParticipant(edge.getCallee());
                callLog.update(CallLogEntry.of(session));
                log.info("CALL {} ACTIVE {} <-> {}", session.getCallId(), edge.getCaller(), edge.getCallee());
            }
            outbox.add(new OutboundSignal(request.getTo(), ApplicationConstants.EVENT_WEBRTC_ANSWER,
                    payload("from", from, "sdp", request.getSdp(), "callId", session.getCallId())));
        }
        dispatcher.sendAll(outbox);
    }

    public void ice(String from, SignalRequest request) {
        relayBetweenPeers(from, request, ApplicationConstants.EVENT_WEBRTC_ICE,
                payload("from", from, "candidate", request.getCandidate(), "callId", request.getCallId()));
    }

    /**
     * {@code webrtc:end}: ends a one-to-one call (declined, canceled or completed depending
     * on state and sender); on a mesh call it only tears down the pair link.
     */
    public void end(String from, SignalRequest request) {
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            CallSession session = sharedSession(from, request.getTo(), request.getCallId());
            if (session == null) {
                log.debug("webrtc:end from {} to {} dropped: no shared call", from, request.getTo());
                return;
            }
            outbox.add(new OutboundSignal(request.getTo(), ApplicationConstants.EVENT_WEBRTC_END,
                    payload("from", from, "callId", session.getCallId())));
            if (session.isDirect()) {
                CallOutcome outcome;
                if (session.getState() == CallState.RINGING) {
                    outcome = from.equals(session.getInitiator()) ? CallOutcome.CANCELED : CallOutcome.DECLINED;
                } else {
                    outcome = CallOutcome.COMPLETED;
                }
                terminateLocked(session, outcome);
            }
        }
        dispatcher.sendAll(outbox);
    }

    /**
     * {@code call:busy} sent by a ringing callee that refuses because it is occupied.
     */
    public void busy(String from, SignalRequest request) {
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            CallSession session = sharedSession(from, request.getTo(), request.getCallId());
            if (session == null) {
                log.debug("call:busy from {} to {} dropped: no shared call", from, request.getTo());
                return;
            }
            outbox.add(new OutboundSignal(request.getTo(), ApplicationConstants.EVENT_CALL_BUSY,
                    payload("from", from, "callId", session.getCallId())));
            if (session.isDirect() && session.getState() == CallState.RINGING
                    && from.equals(session.getScope().getTarget())) {
                terminateLocked(session, CallOutcome.BUSY);
            }
        }
        dispatcher.sendAll(outbox);
    }

    public void upgrade(String from, SignalRequest request) {
        relayBetweenPeers(from, request, ApplicationConstants.EVENT_CALL_UPGRADE,
                payload("from", from, "kind", request.getKind(), "callId", request.getCallId()));
    }

    /**
     * {@code call:upgrade:response}: an accepted upgrade switches the call kind in place.
     */
    public void upgradeResponse(String from, SignalRequest request) {
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            CallSession session = sharedSession(from, request.getTo(), request.getCallId());
            if (session == null) {
                log.debug("call:upgrade:response from {} dropped: no shared call", from);
                return;
            }
            boolean accepted = Boolean.TRUE.equals(request.getAccepted());
            if (accepted && request.getKind() != null && request.getKind() != session.getKind()) {
                session.setKind(request.getKind());
                callLog.update(CallLogEntry.of(session));
                log.info("CALL {} kind changed to {}", session.getCallId(), request.getKind().getWireName());
            }
            outbox.add(new OutboundSignal(request.getTo(), ApplicationConstants.EVENT_CALL_UPGRADE_RESPONSE,
                    payload("from", from, "accepted", accepted, "kind", request.getKind(),
                            "callId", session.getCallId())));
        }
        dispatcher.sendAll(outbox);
    }

    // reads a single call only; no orchestrator lock
    private void relayBetweenPeers(String from, SignalRequest request, String event, Map<String, Object> body) {
        CallSession session = sharedSession(from, request.getTo(), request.getCallId());
        if (session == null || session.isEnded()) {
            log.debug("{} from {} to {} dropped: no shared call", event, from, request.getTo());
            return;
        }
        body.put("callId", session.getCallId());
        dispatcher.send(request.getTo(), event, body);
    }

    /**
     * The live session both connections belong to: the two parties of a one-to-one call or
     * two current participants of a mesh call.
     */
    private CallSession sharedSession(String from, String to, String callId) {
        if (!hasText(to) || from.equals(to)) {
            return null;
        }
        String id = hasText(callId) ? callId : engagedIn.get(from);
        CallSession session = id == null ? null : sessions.get(id);
        if (session == null) {
            return null;
        }
        if (session.isDirect()) {
            return session.isParty(from) && session.isParty(to) ? session : null;
        }
        return session.hasParticipant(from) && session.hasParticipant(to) ? session : null;
    }

    // ------------------------------------------------------------------ mesh

    /**
     * {@code call:join}: adds the connection to a mesh call and publishes the participant
     * list. Each participant is told to initiate towards peers with a greater id, so every
     * pair gets exactly one offerer.
     */
    public void join(String callId, String connectionId) {
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            CallSession session = callId == null ? null : sessions.get(callId);
            if (session == null || session.isDirect()) {
                log.debug("call:join {} from {} dropped: no such mesh call", callId, connectionId);
                return;
            }
            if (!session.hasParticipant(connectionId)) {
                String engaged = engagedIn.get(connectionId);
                if (engaged != null) {
                    outbox.add(new OutboundSignal(connectionId, ApplicationConstants.EVENT_CALL_BUSY,
                            payload("callId", callId, "activeCallId", engaged, "reason", "already-in-call")));
                    log.info("CALL {} join refused for {}: engaged in {}", callId, connectionId, engaged);
                } else {
                    if (session.addParticipant(connectionId)) {
                        session.setState(CallState.ACTIVE);
                        log.info("CALL {} ACTIVE (first participant {})", callId, connectionId);
                    }
                    engagedIn.put(connectionId, callId);
                    callLog.update(CallLogEntry.of(session));
                    log.info("CALL {} participant {} joined ({} now)", callId, connectionId,
                            session.participantCount());
                }
            }
            if (session.hasParticipant(connectionId)) {
                announceParticipants(session, outbox);
            }
        }
        dispatcher.sendAll(outbox);
    }

    /**
     * {@code call:leave}: removes the connection; the last one out ends the call.
     */
    public void leave(String callId, String connectionId) {
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            CallSession session = callId == null ? null : sessions.get(callId);
            if (session == null || !session.hasParticipant(connectionId)) {
                log.debug("call:leave {} from {} dropped: not a participant", callId, connectionId);
                return;
            }
            leaveLocked(session, connectionId, outbox);
        }
        dispatcher.sendAll(outbox);
    }

    private void leaveLocked(CallSession session, String connectionId, List<OutboundSignal> outbox) {
        session.removeParticipant(connectionId);
        engagedIn.remove(connectionId, session.getCallId());
        if (session.isDirect()) {
            String peer = session.peerOf(connectionId);
            outbox.add(new OutboundSignal(peer, ApplicationConstants.EVENT_WEBRTC_END,
                    payload("from", connectionId, "callId", session.getCallId())));
            terminateLocked(session, CallOutcome.COMPLETED);
            return;
        }
        log.info("CALL {} participant {} left ({} remain)", session.getCallId(), connectionId,
                session.participantCount());
        announceParticipants(session, outbox);
        if (session.participantCount() == 0) {
            terminateLocked(session, CallOutcome.COMPLETED);
        }
    }

    /**
     * {@code call:endAll}: tears the whole call down for every participant.
     */
    public void endAll(String callId, String requester) {
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            CallSession session = callId == null ? null : sessions.get(callId);
            if (session == null) {
                log.debug("call:endAll {} from {} dropped: no such call", callId, requester);
                return;
            }
            session.setState(CallState.DRAINING);
            log.info("CALL {} DRAINING (endAll by {})", callId, requester);

            Map<String, Object> end = payload("from", requester, "callId", callId);
            Set<String> notified = new LinkedHashSet<>(session.participantList());
            if (session.isDirect()) {
                notified.add(session.getInitiator());
                notified.add(session.getScope().getTarget());
            }
            for (String participant : notified) {
                outbox.add(new OutboundSignal(participant, ApplicationConstants.EVENT_WEBRTC_END, end));
            }
            Map<String, Object> endAll = payload("callId", callId);
            for (String member : audienceOf(session)) {
                outbox.add(new OutboundSignal(member, ApplicationConstants.EVENT_CALL_END_ALL, endAll));
            }
            terminateLocked(session, CallOutcome.TERMINATED);
        }
        dispatcher.sendAll(outbox);
    }

    private void announceParticipants(CallSession session, List<OutboundSignal> outbox) {
        List<String> participants = session.participantList();
        Set<String> recipients = new LinkedHashSet<>(participants);
        recipients.addAll(audienceOf(session));
        for (String recipient : recipients) {
            List<String> initiateTo = new ArrayList<>();
            if (session.hasParticipant(recipient)) {
                for (String peer : participants) {
                    if (recipient.compareTo(peer) < 0) {
                        initiateTo.add(peer);
                    }
                }
            }
            outbox.add(new OutboundSignal(recipient, ApplicationConstants.EVENT_CALL_PARTICIPANTS,
                    payload("callId", session.getCallId(), "participants", participants, "initiateTo", initiateTo)));
        }
    }

    // ------------------------------------------------------------------ lifecycle

    private void onRingTimeout(String callId, RingingEdge edge) {
        List<OutboundSignal> outbox = new ArrayList<>();
        CallSession session;
        try {
            synchronized (lock) {
                session = sessions.get(callId);
                if (session == null || session.getRingingEdge() != edge || session.getState() != CallState.RINGING) {
                    log.debug("Ring timeout for {} ignored: call no longer ringing", callId);
                    return;
                }
                outbox.add(new OutboundSignal(edge.getCaller(), ApplicationConstants.EVENT_CALL_MISSED,
                        payload("callId", callId, "to", edge.getCallee())));
                outbox.add(new OutboundSignal(edge.getCallee(), ApplicationConstants.EVENT_WEBRTC_END,
                        payload("from", edge.getCaller(), "callId", callId)));
                terminateLocked(session, CallOutcome.MISSED);
            }
            dispatcher.sendAll(outbox);

            String calleeUserId = connectionRegistry.lookup(edge.getCallee()).map(Identity::getUserId).orElse(null);
            notifications.publishMissedCall(calleeUserId, nameOf(edge.getCaller()), callId, edge.getKind(),
                    clock.millis());
        } catch (RuntimeException e) {
            log.error("Ring timeout handling failed for call {}: {}", callId, e.getMessage(), e);
        }
    }

    /**
     * Cascade for a closing connection. Runs before room membership is released so mesh
     * audiences are still intact.
     */
    @EventListener
    @Order(1)
    public void onConnectionClosed(ConnectionClosedEvent event) {
        String connectionId = event.getConnectionId();
        List<OutboundSignal> outbox = new ArrayList<>();
        synchronized (lock) {
            for (CallSession session : new ArrayList<>(sessions.values())) {
                if (session.isDirect()) {
                    if (session.isParty(connectionId)) {
                        endDirectOnDisconnect(session, connectionId, outbox);
                    }
                } else if (session.hasParticipant(connectionId)) {
                    leaveLocked(session, connectionId, outbox);
                } else if (session.getInitiator().equals(connectionId) && session.joinedOnceList().isEmpty()) {
                    for (String member : audienceOf(session)) {
                        if (!member.equals(connectionId)) {
                            outbox.add(new OutboundSignal(member, ApplicationConstants.EVENT_CALL_END_ALL,
                                    payload("callId", session.getCallId())));
                        }
                    }
                    terminateLocked(session, CallOutcome.CANCELED);
                }
            }
            engagedIn.remove(connectionId);
        }
        dispatcher.sendAll(outbox);
    }

    private void endDirectOnDisconnect(CallSession session, String connectionId, List<OutboundSignal> outbox) {
        String peer = session.peerOf(connectionId);
        outbox.add(new OutboundSignal(peer, ApplicationConstants.EVENT_WEBRTC_END,
                payload("from", connectionId, "callId", session.getCallId())));
        CallOutcome outcome;
        if (session.getState() == CallState.RINGING) {
            outcome = connectionId.equals(session.getInitiator()) ? CallOutcome.CANCELED : CallOutcome.DECLINED;
        } else {
            outcome = CallOutcome.COMPLETED;
        }
        terminateLocked(session, outcome);
    }

    private void terminateLocked(CallSession session, CallOutcome outcome) {
        long now = clock.millis();
        session.markEnded(now);
        sessions.remove(session.getCallId());
        engagedIn.values().removeIf(session.getCallId()::equals);
        callLog.finalizeEntry(session.getCallId(), now, outcome);
        log.info("CALL {} ENDED ({})", session.getCallId(), outcome);
    }

    private List<String> audienceOf(CallSession session) {
        if (session.isDirect()) {
            List<String> parties = new ArrayList<>();
            parties.add(session.getInitiator());
            parties.add(session.getScope().getTarget());
            return parties;
        }
        return roomMembership.audienceOf(session.getScope().getRoom());
    }

    // ------------------------------------------------------------------ views

    public Optional<CallState> stateOf(String callId) {
        synchronized (lock) {
            CallSession session = sessions.get(callId);
            return session == null ? Optional.empty() : Optional.of(session.getState());
        }
    }

    public List<String> participantsOf(String callId) {
        synchronized (lock) {
            CallSession session = sessions.get(callId);
            return session == null ? new ArrayList<>() : session.participantList();
        }
    }

    public Optional<String> engagedCallOf(String connectionId) {
        synchronized (lock) {
            return Optional.ofNullable(engagedIn.get(connectionId));
        }
    }

    public int liveCallCount() {
        synchronized (lock) {
            return sessions.size();
        }
    }

    private String nameOf(String connectionId) {
        return connectionRegistry.lookup(connectionId)
                .map(Identity::getName)
                .orElse(ApplicationConstants.DEFAULT_DISPLAY_NAME);
    }

    private static String newCallId() {
        return "call-" + UUID.randomUUID();
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }

    // insertion-ordered, null values omitted
    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return map;
    }
}

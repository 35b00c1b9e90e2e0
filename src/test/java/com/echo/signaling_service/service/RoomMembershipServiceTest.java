package com.echo.signaling_service.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.ConnectedUser;
import com.echo.signaling_service.dto.ConnectionClosedEvent;
import com.echo.signaling_service.dto.Identity;
import com.echo.signaling_service.dto.OutboundSignal;
import com.echo.signaling_service.repo.InMemoryPresenceStore;

class RoomMembershipServiceTest {

    private RecordingDispatcher dispatcher;
    private InMemoryPresenceStore presenceStore;
    private ConnectionRegistryService registry;
    private RoomMembershipService rooms;

    @BeforeEach
    void setUp() {
        dispatcher = new RecordingDispatcher();
        presenceStore = new InMemoryPresenceStore();
        registry = new ConnectionRegistryService(presenceStore, event -> {
            if (event instanceof ConnectionClosedEvent) {
                rooms.onConnectionClosed((ConnectionClosedEvent) event);
            }
        });
        rooms = new RoomMembershipService(registry, presenceStore, dispatcher);
        registry.register("a", new Identity("Alice", null));
        registry.register("b", new Identity("Bob", null));
        registry.register("c", new Identity("Carol", null));
    }

    @Test
    void joinReturnsRosterAndNotifiesRoom() {
        rooms.join("a", "team");

        List<ConnectedUser> roster = rooms.join("b", "team");

        assertThat(roster).extracting(ConnectedUser::getId).containsExactly("a", "b");
        assertThat(payloadOf("a", ApplicationConstants.EVENT_ROOM_JOIN))
                .containsEntry("id", "b").containsEntry("name", "Bob").containsEntry("room", "team");
        assertThat(dispatcher.to("c", ApplicationConstants.EVENT_ROOM_JOIN)).isEmpty();
        assertThat(presenceStore.members(ApplicationConstants.PRESENCE_ROOM_KEY_PREFIX + "team"))
                .containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void connectionIsInAtMostOneRoom() {
        rooms.join("a", "one");
        rooms.join("b", "one");

        rooms.join("a", "two");

        assertThat(rooms.roomOf("a")).contains("two");
        assertThat(rooms.audienceOf("one")).containsExactly("b");
        assertThat(rooms.audienceOf("two")).containsExactly("a");
        assertThat(payloadOf("b", ApplicationConstants.EVENT_ROOM_LEAVE)).containsEntry("id", "a");
        assertThat(presenceStore.members(ApplicationConstants.PRESENCE_ROOM_KEY_PREFIX + "one")).containsExactly("b");
    }

    @Test
    void globalAliasAndBlankMeanNoRoom() {
        rooms.join("a", "team");

        List<ConnectedUser> roster = rooms.join("a", "global");

        assertThat(rooms.roomOf("a")).isEmpty();
        assertThat(roster).extracting(ConnectedUser::getId).containsExactly("a", "b", "c");
        assertThat(RoomMembershipService.normalizeRoom("  ")).isNull();
        assertThat(RoomMembershipService.normalizeRoom(null)).isNull();
    }

    @Test
    void leaveReturnsPreviousRoomOnlyOnce() {
        rooms.join("a", "team");

        assertThat(rooms.leave("a")).contains("team");
        assertThat(rooms.leave("a")).isEmpty();
        assertThat(rooms.rosterOf("team")).isEmpty();
    }

    @Test
    void disconnectRemovesConnectionFromItsRoom() {
        rooms.join("a", "team");
        rooms.join("b", "team");
        dispatcher.clear();

        registry.unregister("a");

        assertThat(rooms.roomOf("a")).isEmpty();
        assertThat(payloadOf("b", ApplicationConstants.EVENT_ROOM_LEAVE)).containsEntry("name", "Alice");
        List<OutboundSignal> roster = dispatcher.to("b", ApplicationConstants.EVENT_USERS_IN_ROOM);
        assertThat(roster).hasSize(1);
        assertThat(roster.get(0).getPayload()).asList().extracting("id").containsExactly("b");
    }

    private Map<String, Object> payloadOf(String connectionId, String event) {
        return dispatcher.lastPayload(connectionId, event);
    }
}

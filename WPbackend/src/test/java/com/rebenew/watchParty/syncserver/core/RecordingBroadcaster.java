package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.model.SyncMsg;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory {@link RoomBroadcaster} that keeps one inbox per connection.
 * Connections passed to {@link #markClosed} can no longer subscribe.
 */
public class RecordingBroadcaster implements RoomBroadcaster {

    private final Map<String, Set<String>> groups = new LinkedHashMap<>();
    private final Map<String, List<SyncMsg>> inboxes = new LinkedHashMap<>();
    private final Set<String> closed = new LinkedHashSet<>();

    @Override
    public synchronized boolean subscribe(String roomCode, String connectionId) {
        if (closed.contains(connectionId))
            return false;
        groups.computeIfAbsent(roomCode, k -> new LinkedHashSet<>()).add(connectionId);
        return true;
    }

    public synchronized void markClosed(String connectionId) {
        closed.add(connectionId);
    }

    @Override
    public synchronized void unsubscribe(String roomCode, String connectionId) {
        Set<String> members = groups.get(roomCode);
        if (members != null) {
            members.remove(connectionId);
            if (members.isEmpty())
                groups.remove(roomCode);
        }
    }

    @Override
    public synchronized Set<String> roomsOf(String connectionId) {
        return groups.entrySet().stream()
                .filter(e -> e.getValue().contains(connectionId))
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
    }

    @Override
    public synchronized void publish(String roomCode, SyncMsg message, String excludeConnectionId) {
        for (String connectionId : groups.getOrDefault(roomCode, Set.of())) {
            if (!connectionId.equals(excludeConnectionId))
                inbox(connectionId).add(message);
        }
    }

    @Override
    public synchronized void sendTo(String connectionId, SyncMsg message) {
        inbox(connectionId).add(message);
    }

    public synchronized List<SyncMsg> received(String connectionId) {
        return List.copyOf(inbox(connectionId));
    }

    public synchronized List<String> events(String connectionId) {
        return inbox(connectionId).stream().map(SyncMsg::getEvent).toList();
    }

    public synchronized SyncMsg last(String connectionId) {
        List<SyncMsg> inbox = inbox(connectionId);
        return inbox.isEmpty() ? null : inbox.get(inbox.size() - 1);
    }

    public synchronized Set<String> subscribers(String roomCode) {
        return Set.copyOf(groups.getOrDefault(roomCode, Set.of()));
    }

    public synchronized void clear() {
        inboxes.clear();
    }

    private List<SyncMsg> inbox(String connectionId) {
        return inboxes.computeIfAbsent(connectionId, k -> new ArrayList<>());
    }
}

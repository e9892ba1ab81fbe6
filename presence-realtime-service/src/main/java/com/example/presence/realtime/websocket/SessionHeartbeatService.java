package com.example.presence.realtime.websocket;

import com.example.presence.shared.service.broadcast.LocalSessionSinks;
import com.example.presence.shared.service.registry.ConnectionRegistry;
import com.example.presence.shared.util.Batches;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps the registry rows of this pod's open sockets from passively expiring while the
 * client is silent. Runs on every pod, so it is not cluster-locked.
 * <p>
 * A socket whose row is missing on two consecutive runs was removed elsewhere (expired or
 * disconnected through another pod) and is closed here. One run of grace covers a socket
 * that is still between opening its sink and registering.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionHeartbeatService {

    static final int BATCH_SIZE = 500;

    private final ConnectionRegistry connectionRegistry;
    private final LocalSessionSinks localSessionSinks;

    private final Set<String> unregisteredLastRun = new HashSet<>();

    @Scheduled(fixedDelayString = "${presence.connection.heartbeat-interval-ms:300000}",
               initialDelayString = "${presence.connection.heartbeat-interval-ms:300000}")
    public void scheduledRun() {
        int refreshed = run();
        log.debug("Heartbeat refreshed {} local connections", refreshed);
    }

    /**
     * @return number of connections whose expiry was pushed out
     */
    public synchronized int run() {
        List<String> localIds = new ArrayList<>(localSessionSinks.connectionIds());
        if (localIds.isEmpty()) {
            unregisteredLastRun.clear();
            return 0;
        }

        Set<String> registered = new HashSet<>();
        int refreshed = 0;
        for (List<String> batch : Batches.partition(localIds, BATCH_SIZE)) {
            try {
                Set<String> alive = connectionRegistry.heartbeat(batch);
                refreshed += alive.size();
                registered.addAll(alive);
            } catch (Exception e) {
                // unknown state; none of these count as missing this run
                log.error("Heartbeat of {} local connections failed: {}", batch.size(), e.getMessage(), e);
                registered.addAll(batch);
            }
        }

        Set<String> unregistered = new HashSet<>();
        for (String connectionId : localIds) {
            if (registered.contains(connectionId)) {
                continue;
            }
            if (unregisteredLastRun.contains(connectionId)) {
                log.warn("Connection {} is no longer registered; closing its local socket", connectionId);
                localSessionSinks.close(connectionId);
            } else {
                unregistered.add(connectionId);
            }
        }
        unregisteredLastRun.clear();
        unregisteredLastRun.addAll(unregistered);
        return refreshed;
    }
}

package com.axiomprofiler.service.session;

import com.axiomprofiler.config.SessionDefaults;
import com.axiomprofiler.exception.SessionNotFoundException;
import com.axiomprofiler.model.facts.FactStore;
import com.axiomprofiler.model.graph.RawInstGraph;
import com.axiomprofiler.service.disable.DisablerEngine;
import com.axiomprofiler.service.graph.InstGraphBuilder;
import com.axiomprofiler.service.visible.VisibleGraphMaterializer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of graph sessions. Sessions live until deleted or the process exits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InstGraphSessionService {

    private final InstGraphBuilder graphBuilder;
    private final DisablerEngine disablerEngine;
    private final VisibleGraphMaterializer materializer;
    private final SessionDefaults sessionDefaults;

    private final Map<String, InstGraphSession> sessions = new ConcurrentHashMap<>();

    /**
     * Builds the raw graph for {@code facts} and opens a session with the default disablers and filter chain.
     */
    public InstGraphSession create(FactStore facts) {
        RawInstGraph graph = graphBuilder.build(facts);
        String id = UUID.randomUUID().toString();
        InstGraphSession session = new InstGraphSession(id, facts, graph,
                sessionDefaults.getDisplayConfiguration(), disablerEngine, materializer);
        session.setDisablers(sessionDefaults.getDisablers());
        session.applyChain(sessionDefaults.getFilterChain());
        sessions.put(id, session);
        log.info("Created session {} over {} nodes", id, graph.nodeCount());
        return session;
    }

    public Optional<InstGraphSession> find(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    public InstGraphSession get(String id) {
        return find(id).orElseThrow(() -> new SessionNotFoundException("Session not found with id: " + id));
    }

    public boolean delete(String id) {
        boolean removed = sessions.remove(id) != null;
        if (removed) {
            log.info("Deleted session {}", id);
        }
        return removed;
    }

    public int count() {
        return sessions.size();
    }
}

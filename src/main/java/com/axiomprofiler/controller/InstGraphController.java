package com.axiomprofiler.controller;

import com.axiomprofiler.dto.graph.GraphVisualizationResponse;
import com.axiomprofiler.dto.graph.NodeInfoResponse;
import com.axiomprofiler.dto.session.CreateSessionRequest;
import com.axiomprofiler.dto.session.DisablersRequest;
import com.axiomprofiler.dto.session.FilterChainRequest;
import com.axiomprofiler.dto.session.SessionResponse;
import com.axiomprofiler.exception.SessionNotFoundException;
import com.axiomprofiler.service.graph.NodeInfoService;
import com.axiomprofiler.service.session.InstGraphSession;
import com.axiomprofiler.service.session.InstGraphSessionService;
import com.axiomprofiler.service.visualization.GraphVisualizationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for instantiation graph sessions.
 * Each session owns one graph; filters, disablers and resets all answer with the new snapshot.
 */
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Slf4j
public class InstGraphController {

    private final InstGraphSessionService sessionService;
    private final GraphVisualizationService graphVisualizationService;
    private final NodeInfoService nodeInfoService;

    /**
     * Build the graph for a fact store and open a session over it.
     * The default filter chain and disablers are already applied to the returned snapshot.
     */
    @PostMapping
    public ResponseEntity<SessionResponse> createSession(@Valid @RequestBody CreateSessionRequest request) {
        log.info("Creating session over {} dependencies", request.getFacts().getDependencies().size());
        InstGraphSession session = sessionService.create(request.getFacts());
        return ResponseEntity.status(HttpStatus.CREATED).body(graphVisualizationService.buildSessionResponse(session));
    }

    /**
     * Get the current snapshot of a session.
     */
    @GetMapping("/{sessionId}/graph")
    public ResponseEntity<GraphVisualizationResponse> getGraph(@PathVariable String sessionId) {
        InstGraphSession session = sessionService.get(sessionId);
        return ResponseEntity.ok(graphVisualizationService.buildVisualization(session));
    }

    /**
     * Replace the session's filter chain. Filters apply in order to an all-visible graph;
     * a rejected filter leaves the session unchanged.
     */
    @PostMapping("/{sessionId}/filters")
    public ResponseEntity<SessionResponse> applyFilters(@PathVariable String sessionId,
                                                        @Valid @RequestBody FilterChainRequest request) {
        log.info("Applying {} filters to session {}", request.getFilters().size(), sessionId);
        InstGraphSession session = sessionService.get(sessionId);
        return ResponseEntity.ok(session.update(s -> s.applyChain(request.getFilters()),
                graphVisualizationService::buildSessionResponse));
    }

    @PostMapping("/{sessionId}/reset")
    public ResponseEntity<SessionResponse> reset(@PathVariable String sessionId) {
        log.info("Resetting session {}", sessionId);
        InstGraphSession session = sessionService.get(sessionId);
        return ResponseEntity.ok(session.update(InstGraphSession::reset,
                graphVisualizationService::buildSessionResponse));
    }

    @PutMapping("/{sessionId}/disablers")
    public ResponseEntity<SessionResponse> setDisablers(@PathVariable String sessionId,
                                                        @Valid @RequestBody DisablersRequest request) {
        log.info("Setting disablers {} on session {}", request.getDisablers(), sessionId);
        InstGraphSession session = sessionService.get(sessionId);
        return ResponseEntity.ok(session.update(s -> s.setDisablers(request.getDisablers()),
                graphVisualizationService::buildSessionResponse));
    }

    /**
     * Get details of one raw node, whether or not it is currently visible.
     */
    @GetMapping("/{sessionId}/nodes/{nodeIndex}")
    public ResponseEntity<NodeInfoResponse> getNodeInfo(@PathVariable String sessionId, @PathVariable int nodeIndex) {
        InstGraphSession session = sessionService.get(sessionId);
        return ResponseEntity.ok(nodeInfoService.getNodeInfo(session, nodeIndex));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable String sessionId) {
        if (!sessionService.delete(sessionId)) {
            throw new SessionNotFoundException("Session not found with id: " + sessionId);
        }
        return ResponseEntity.noContent().build();
    }
}

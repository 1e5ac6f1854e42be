package com.axiomprofiler.service.session;

import com.axiomprofiler.exception.InvalidFilterException;
import com.axiomprofiler.model.facts.DisplayConfiguration;
import com.axiomprofiler.model.facts.FactStore;
import com.axiomprofiler.model.graph.RawInstGraph;
import com.axiomprofiler.model.visible.VisibleInstGraph;
import com.axiomprofiler.service.disable.Disabler;
import com.axiomprofiler.service.disable.DisablerEngine;
import com.axiomprofiler.service.filter.FilterOutput;
import com.axiomprofiler.service.filter.GraphFilter;
import com.axiomprofiler.service.visible.VisibleGraphMaterializer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * One user's view of one trace. Owns the raw graph exclusively: every visibility or
 * disabling change goes through this class, one at a time, and ends with a freshly
 * materialized visible graph carrying a new generation number.
 */
@Slf4j
public class InstGraphSession {

    private final String id;
    private final FactStore facts;
    private final RawInstGraph graph;
    private final DisplayConfiguration displayConfiguration;
    private final DisablerEngine disablerEngine;
    private final VisibleGraphMaterializer materializer;

    private List<GraphFilter> appliedChain = List.of();
    private Set<Disabler> disablers = EnumSet.noneOf(Disabler.class);
    private List<FilterOutput> lastOutputs = List.of();
    private long generation;
    private VisibleInstGraph visible;

    public InstGraphSession(String id, FactStore facts, RawInstGraph graph,
                            DisplayConfiguration displayConfiguration,
                            DisablerEngine disablerEngine, VisibleGraphMaterializer materializer) {
        this.id = id;
        this.facts = facts;
        this.graph = graph;
        this.displayConfiguration = displayConfiguration;
        this.disablerEngine = disablerEngine;
        this.materializer = materializer;
        this.visible = materializer.toVisible(graph, generation);
    }

    /**
     * Makes every node visible, then applies {@code filters} in order. If any filter fails,
     * the visibility from before the call is restored and the previous snapshot stays current.
     */
    public synchronized VisibleInstGraph applyChain(List<GraphFilter> filters) {
        if (filters == null || filters.contains(null)) {
            throw new InvalidFilterException("Filter chain must not contain null entries");
        }
        BitSet before = graph.visibilitySnapshot();
        graph.resetVisibilityTo(false);
        List<FilterOutput> outputs = new ArrayList<>(filters.size());
        try {
            for (GraphFilter filter : filters) {
                log.debug("Session {}: {}", id, filter.description());
                outputs.add(filter.apply(graph, facts, displayConfiguration));
            }
        } catch (RuntimeException e) {
            graph.restoreVisibility(before);
            log.warn("Session {}: filter chain rolled back: {}", id, e.getMessage());
            throw e;
        }
        appliedChain = List.copyOf(filters);
        lastOutputs = Collections.unmodifiableList(outputs);
        rematerialize();
        log.info("Session {}: applied {} filters, {} of {} nodes visible (generation {})",
                id, filters.size(), visible.nodeCount(), graph.nodeCount(), generation);
        return visible;
    }

    public synchronized VisibleInstGraph reset() {
        graph.resetVisibilityTo(false);
        appliedChain = List.of();
        lastOutputs = List.of();
        rematerialize();
        log.info("Session {}: reset to all {} nodes (generation {})", id, graph.nodeCount(), generation);
        return visible;
    }

    public synchronized VisibleInstGraph setDisablers(Set<Disabler> enabled) {
        Set<Disabler> next = enabled == null || enabled.isEmpty()
                ? EnumSet.noneOf(Disabler.class)
                : EnumSet.copyOf(enabled);
        disablerEngine.classify(next, graph);
        disablers = next;
        rematerialize();
        log.info("Session {}: disablers {} (generation {})", id, disablers, generation);
        return visible;
    }

    private void rematerialize() {
        generation++;
        visible = materializer.toVisible(graph, generation);
    }

    /**
     * Runs {@code reader} against the raw graph while no mutation is in progress.
     */
    public synchronized <T> T readGraph(Function<RawInstGraph, T> reader) {
        return reader.apply(graph);
    }

    /**
     * Applies {@code mutation} and then runs {@code reader} under the same lock, so the
     * reader sees exactly the state the mutation produced.
     */
    public synchronized <T> T update(Consumer<InstGraphSession> mutation, Function<InstGraphSession, T> reader) {
        mutation.accept(this);
        return reader.apply(this);
    }

    public String getId() {
        return id;
    }

    public FactStore getFacts() {
        return facts;
    }

    public DisplayConfiguration getDisplayConfiguration() {
        return displayConfiguration;
    }

    public synchronized VisibleInstGraph getVisible() {
        return visible;
    }

    public synchronized long getGeneration() {
        return generation;
    }

    public synchronized List<GraphFilter> getAppliedChain() {
        return appliedChain;
    }

    public synchronized Set<Disabler> getDisablers() {
        return Collections.unmodifiableSet(disablers);
    }

    public synchronized List<FilterOutput> getLastOutputs() {
        return lastOutputs;
    }
}

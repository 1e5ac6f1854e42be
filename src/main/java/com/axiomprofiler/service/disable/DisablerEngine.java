package com.axiomprofiler.service.disable;

import com.axiomprofiler.model.graph.RawInstGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Recomputes the disabled mark of every raw node from the active disablers.
 * Visibility flags are left alone.
 */
@Service
@Slf4j
public class DisablerEngine {

    public void classify(Set<Disabler> disablers, RawInstGraph graph) {
        graph.resetDisabledTo(idx -> {
            for (Disabler disabler : disablers) {
                if (disabler.disables(graph.node(idx))) {
                    return true;
                }
            }
            return false;
        });
        log.debug("Disablers {} marked {} of {} nodes", disablers, graph.disabledCount(), graph.nodeCount());
    }
}

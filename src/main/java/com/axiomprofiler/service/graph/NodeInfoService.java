package com.axiomprofiler.service.graph;

import com.axiomprofiler.dto.graph.NodeInfoResponse;
import com.axiomprofiler.exception.NodeNotFoundException;
import com.axiomprofiler.model.facts.DisplayConfiguration;
import com.axiomprofiler.model.facts.FactStore;
import com.axiomprofiler.model.facts.GivenEquality;
import com.axiomprofiler.model.facts.Instantiation;
import com.axiomprofiler.model.facts.Match;
import com.axiomprofiler.model.facts.TransEquality;
import com.axiomprofiler.model.graph.NodeKind;
import com.axiomprofiler.model.graph.RawInstGraph;
import com.axiomprofiler.model.graph.RawNode;
import com.axiomprofiler.service.session.InstGraphSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Looks up the details shown when a single node is selected.
 */
@Service
@Slf4j
public class NodeInfoService {

    public NodeInfoResponse getNodeInfo(InstGraphSession session, int index) {
        return session.readGraph(raw -> getNodeInfo(raw, index, session.getFacts(), session.getDisplayConfiguration()));
    }

    public NodeInfoResponse getNodeInfo(RawInstGraph raw, int index, FactStore facts, DisplayConfiguration config) {
        if (!raw.contains(index)) {
            throw new NodeNotFoundException("Node " + index + " does not exist (graph has " + raw.nodeCount() + " nodes)");
        }
        RawNode node = raw.node(index);
        NodeKind kind = node.getKind();
        log.debug("[NodeInfo] Describing {} (raw node {})", kind.shortLabel(), index);

        NodeInfoResponse.NodeInfoResponseBuilder info = NodeInfoResponse.builder()
                .index(index)
                .type(kind.getType().name())
                .entityIndex(kind.getIndex())
                .discoveryKey(node.getDiscoveryKey())
                .label(kind.shortLabel())
                .visible(node.isVisible())
                .disabled(raw.isDisabled(index))
                .cost(node.getCost())
                .costRank(node.getCostRank())
                .generation(node.getGeneration())
                .minDepth(node.getFwdDepth().getMin())
                .maxDepth(node.getFwdDepth().getMax())
                .minDepthToLeaf(node.getBwdDepth().getMin())
                .maxDepthToLeaf(node.getBwdDepth().getMax())
                .parentCount(node.getParentCount())
                .childCount(node.getChildCount());

        switch (kind.getType()) {
            case INSTANTIATION -> {
                Instantiation inst = facts.instantiation(kind.getIndex());
                Match match = facts.match(inst.getMatch());
                info.quantifier(node.getQuantifier() != null
                                ? facts.quantifier(node.getQuantifier()).displayName(config)
                                : null)
                        .matchKind(match.getKind() != null ? match.getKind().name() : null)
                        .theoryDiscovered(node.isTheoryDiscovered())
                        .fingerprint(inst.getFingerprint())
                        .lineNo(inst.getLineNo())
                        .pattern(match.getPattern() != null ? termName(facts, match.getPattern()) : null)
                        .blamedTerms(termNames(facts, match.getBlamedTerms()))
                        .yieldedTerms(termNames(facts, inst.getYieldsTerms()));
            }
            case ENODE -> info.yieldedTerms(List.of(termName(facts, facts.enode(kind.getIndex()).getTerm())));
            case GIVEN_EQUALITY -> {
                GivenEquality eq = facts.givenEquality(kind.getIndex());
                info.equality(enodeName(facts, eq.getFrom()) + " = " + enodeName(facts, eq.getTo()))
                        .explanation(eq.getExplanation());
            }
            case TRANS_EQUALITY -> {
                TransEquality eq = facts.transEquality(kind.getIndex());
                info.equality(enodeName(facts, eq.getFrom()) + " = " + enodeName(facts, eq.getTo()))
                        .explanation("transitive over " + sizeOf(eq.getGivenEqualities()) + " given equalities");
            }
        }
        return info.build();
    }

    private int sizeOf(List<Integer> items) {
        return items == null ? 0 : items.size();
    }

    private List<String> termNames(FactStore facts, List<Integer> terms) {
        if (terms == null) {
            return List.of();
        }
        return terms.stream().map(t -> termName(facts, t)).collect(Collectors.toList());
    }

    private String termName(FactStore facts, int term) {
        if (term < 0 || term >= facts.getTerms().size()) {
            return "#" + term;
        }
        return facts.term(term).getName();
    }

    private String enodeName(FactStore facts, int enode) {
        if (enode < 0 || enode >= facts.getEnodes().size()) {
            return "e" + enode;
        }
        return termName(facts, facts.enode(enode).getTerm());
    }
}

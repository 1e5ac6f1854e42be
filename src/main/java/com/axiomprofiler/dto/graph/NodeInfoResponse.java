package com.axiomprofiler.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Details of one raw node, visible or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeInfoResponse {

    private int index;
    private String type;
    private int entityIndex;        // Index into the fact store collection of the node's type
    private int discoveryKey;
    private String label;
    private boolean visible;
    private boolean disabled;

    private double cost;
    private int costRank;
    private Integer generation;
    private int minDepth;
    private int maxDepth;
    private int minDepthToLeaf;
    private int maxDepthToLeaf;
    private int parentCount;
    private int childCount;

    // Instantiations only
    private String quantifier;
    private String matchKind;
    private Boolean theoryDiscovered;
    private Long fingerprint;
    private Integer lineNo;
    private String pattern;
    private List<String> blamedTerms;
    private List<String> yieldedTerms;

    // Equalities only
    private String equality;
    private String explanation;
}

package com.axiomprofiler.model.facts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Instantiation {

    private int match;
    private long fingerprint;
    private double cost;
    private Integer z3Generation;
    private Integer lineNo;

    @Builder.Default
    private List<Integer> yieldsTerms = new ArrayList<>();
}

package com.axiomprofiler.model.facts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A directly asserted equality between two e-nodes, together with its explanation kind.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GivenEquality {

    private int from;
    private int to;
    private String explanation; // literal, congruence, theory, axiom, unknown
}

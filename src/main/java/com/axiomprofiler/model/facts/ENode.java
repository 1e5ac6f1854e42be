package com.axiomprofiler.model.facts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An e-graph node; {@code createdBy} is empty for terms that existed before any instantiation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ENode {

    private int term;
    private Integer createdBy;
}

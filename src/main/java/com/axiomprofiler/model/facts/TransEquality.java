package com.axiomprofiler.model.facts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * An equality derived by chaining given equalities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransEquality {

    private int from;
    private int to;

    @Builder.Default
    private List<Integer> givenEqualities = new ArrayList<>();
}

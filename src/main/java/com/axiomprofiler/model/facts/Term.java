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
public class Term {

    private String name;

    @Builder.Default
    private List<Integer> children = new ArrayList<>();

    private Integer quantifier; // Set when the term is the body of a quantifier
}

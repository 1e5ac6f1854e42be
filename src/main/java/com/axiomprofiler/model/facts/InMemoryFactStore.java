package com.axiomprofiler.model.facts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * List-backed fact store. Also the JSON shape accepted when a session is created over HTTP.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InMemoryFactStore implements FactStore {

    @Builder.Default
    private List<Quantifier> quantifiers = new ArrayList<>();

    @Builder.Default
    private List<Term> terms = new ArrayList<>();

    @Builder.Default
    private List<Match> matches = new ArrayList<>();

    @Builder.Default
    private List<Instantiation> instantiations = new ArrayList<>();

    @Builder.Default
    private List<ENode> enodes = new ArrayList<>();

    @Builder.Default
    private List<GivenEquality> givenEqualities = new ArrayList<>();

    @Builder.Default
    private List<TransEquality> transEqualities = new ArrayList<>();

    @Builder.Default
    private List<Dependency> dependencies = new ArrayList<>();

    public static InMemoryFactStore empty() {
        return InMemoryFactStore.builder().build();
    }
}

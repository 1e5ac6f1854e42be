package com.axiomprofiler.model.facts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A quantifier as reported by the solver trace.
 * Theory-solving pseudo-quantifiers (e.g. "basic#", "arith#") use kind OTHER.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Quantifier {

    public enum Kind {
        OTHER,      // From [inst-discovered] with theory-solving or MBQI
        LAMBDA,
        NAMED,
        UNNAMED     // name!id
    }

    private Kind kind;
    private String name;
    private Integer id;         // Only set for UNNAMED quantifiers
    private int numVars;
    private Integer term;       // Body term index, absent for pseudo-quantifiers

    /**
     * Name shown to the user, e.g. {@code prf!12} or {@code <null>} for lambdas.
     */
    public String displayName(DisplayConfiguration config) {
        if (kind == null) {
            return name;
        }
        return switch (kind) {
            case LAMBDA -> "<null>";
            case UNNAMED -> config.isShowQuantifierIds() && id != null ? name + "!" + id : name;
            default -> name;
        };
    }
}

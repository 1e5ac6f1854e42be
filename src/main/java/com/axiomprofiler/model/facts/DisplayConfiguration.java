package com.axiomprofiler.model.facts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Controls how fact store items are rendered into text, e.g. for quantifier name matching.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisplayConfiguration {

    @Builder.Default
    private boolean showQuantifierIds = true;

    public static DisplayConfiguration defaults() {
        return DisplayConfiguration.builder().build();
    }
}

package com.axiomprofiler.dto.session;

import com.axiomprofiler.service.filter.GraphFilter;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Filter chain to apply, in order, starting from an all-visible graph.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilterChainRequest {

    @NotNull(message = "Filter list is required")
    private List<GraphFilter> filters;
}

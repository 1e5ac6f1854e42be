package com.axiomprofiler.config;

import com.axiomprofiler.model.facts.DisplayConfiguration;
import com.axiomprofiler.service.disable.Disabler;
import com.axiomprofiler.service.filter.GraphFilter;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * What a new session starts with before the user touches anything.
 */
@Value
@Builder
public class SessionDefaults {

    List<GraphFilter> filterChain;
    Set<Disabler> disablers;
    DisplayConfiguration displayConfiguration;
}

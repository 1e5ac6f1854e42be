package com.axiomprofiler.config;

import com.axiomprofiler.model.facts.DisplayConfiguration;
import com.axiomprofiler.service.disable.Disabler;
import com.axiomprofiler.service.filter.GraphFilter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Session defaults for the instantiation graph.
 * Reads the default filter chain and disabler set from application.yml properties.
 */
@Configuration
@Slf4j
public class InstGraphConfig {

    @Value("${profiler.graph.default-max-insts:250}")
    private int defaultMaxInsts;

    @Value("${profiler.graph.ignore-theory-solving:true}")
    private boolean ignoreTheorySolving;

    @Value("${profiler.graph.default-disablers:SMART}")
    private String defaultDisablers;

    @Value("${profiler.graph.show-quantifier-ids:true}")
    private boolean showQuantifierIds;

    @Bean
    public SessionDefaults sessionDefaults() {
        List<GraphFilter> chain = new ArrayList<>();
        if (ignoreTheorySolving) {
            chain.add(new GraphFilter.IgnoreTheorySolving());
        }
        chain.add(new GraphFilter.MaxInsts(defaultMaxInsts));

        Set<Disabler> disablers = parseDisablers(defaultDisablers);
        log.info("[Graph Config] Default chain: {}, default disablers: {}",
                chain.stream().map(GraphFilter::description).collect(Collectors.toList()), disablers);

        return SessionDefaults.builder()
                .filterChain(List.copyOf(chain))
                .disablers(disablers)
                .displayConfiguration(DisplayConfiguration.builder()
                        .showQuantifierIds(showQuantifierIds)
                        .build())
                .build();
    }

    static Set<Disabler> parseDisablers(String value) {
        Set<Disabler> disablers = EnumSet.noneOf(Disabler.class);
        if (value == null || value.isBlank()) {
            return disablers;
        }
        for (String name : value.split(",")) {
            String trimmed = name.trim();
            if (!trimmed.isEmpty()) {
                disablers.add(Disabler.valueOf(trimmed.toUpperCase(Locale.ROOT)));
            }
        }
        return disablers;
    }
}

package com.axiomprofiler;

import com.axiomprofiler.config.SessionDefaults;
import com.axiomprofiler.service.disable.Disabler;
import com.axiomprofiler.service.filter.GraphFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "profiler.graph.default-max-insts=40")
class AxiomProfilerApplicationTests {

    @Autowired
    private SessionDefaults sessionDefaults;

    @Test
    void contextLoadsWithConfiguredDefaults() {
        assertThat(sessionDefaults.getFilterChain())
                .containsExactly(new GraphFilter.IgnoreTheorySolving(), new GraphFilter.MaxInsts(40));
        assertThat(sessionDefaults.getDisablers()).containsExactly(Disabler.SMART);
        assertThat(sessionDefaults.getDisplayConfiguration().isShowQuantifierIds()).isTrue();
    }
}

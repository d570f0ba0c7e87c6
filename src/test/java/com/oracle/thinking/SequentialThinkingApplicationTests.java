package com.oracle.thinking;

import com.oracle.thinking.core.SessionTracker;
import com.oracle.thinking.core.ThoughtTreeService;
import com.oracle.thinking.model.ThoughtRecord;
import com.oracle.thinking.model.ThoughtResponse;
import com.oracle.thinking.service.SequentialThinkingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SequentialThinkingApplicationTests {

    @Autowired
    private SequentialThinkingService thinkingService;

    @Autowired
    private ThoughtTreeService treeService;

    @Autowired
    private SessionTracker sessionTracker;

    @Test
    void contextLoads() {
        assertThat(thinkingService).isNotNull();
    }

    @Test
    void shouldDropTreeWhenTrackerEvictsSession() {
        ThoughtResponse response = thinkingService.submitThought(ThoughtRecord.builder()
                .thought("Wired end to end")
                .thoughtNumber(1)
                .totalThoughts(1)
                .nextThoughtNeeded(false)
                .sessionId("context-session")
                .build());

        assertThat(response.getNodeId()).isNotNull();
        assertThat(treeService.hasTree("context-session")).isTrue();

        sessionTracker.evict(List.of("context-session"));

        assertThat(treeService.hasTree("context-session")).isFalse();
    }
}

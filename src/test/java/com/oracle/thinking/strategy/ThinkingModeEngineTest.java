package com.oracle.thinking.strategy;

import com.oracle.thinking.MutableClock;
import com.oracle.thinking.model.ModeGuidance;
import com.oracle.thinking.model.ModeGuidance.Action;
import com.oracle.thinking.model.ModeGuidance.Phase;
import com.oracle.thinking.model.ThoughtRecord;
import com.oracle.thinking.tree.MctsEngine;
import com.oracle.thinking.tree.ThoughtNode;
import com.oracle.thinking.tree.ThoughtTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ThinkingModeEngineTest {

    private ThinkingModeEngine modeEngine;
    private MctsEngine engine;
    private ThoughtTree tree;

    @BeforeEach
    void setUp() {
        modeEngine = new ThinkingModeEngine();
        engine = new MctsEngine();
        tree = new ThoughtTree("s1", 100, new MutableClock(0L));
    }

    private ThoughtNode add(int number) {
        return tree.addThought(ThoughtRecord.builder()
                .thought("Thought number " + number + ".")
                .thoughtNumber(number)
                .totalThoughts(10)
                .nextThoughtNeeded(true)
                .sessionId("s1")
                .build());
    }

    private ModeGuidance guidance(ThinkingMode mode) {
        return modeEngine.generateGuidance(modeEngine.getPreset(mode), tree, engine, engine.getTreeStats(tree));
    }

    @Test
    void shouldContinueLinearlyInFastMode() {
        add(1);

        ModeGuidance guidance = guidance(ThinkingMode.FAST);

        assertThat(guidance.getMode()).isEqualTo(ThinkingMode.FAST);
        assertThat(guidance.getRecommendedAction()).isEqualTo(Action.CONTINUE);
        assertThat(guidance.getCurrentPhase()).isEqualTo(Phase.EXPLORING);
        assertThat(guidance.getTargetTotalThoughts()).isEqualTo(5);
        assertThat(guidance.getThoughtPrompt()).startsWith("Step 1 of about 5.");
        assertThat(guidance.getConvergenceStatus()).isNull();
        assertThat(guidance.getCritique()).isNull();
        assertThat(guidance.getPerspectiveSuggestions()).isEmpty();
    }

    @Test
    void shouldConcludeFastModeAtTargetDepth() {
        for (int i = 1; i <= 6; i++) {
            add(i);
        }

        ModeGuidance guidance = guidance(ThinkingMode.FAST);

        assertThat(guidance.getCurrentPhase()).isEqualTo(Phase.CONCLUDED);
        assertThat(guidance.getRecommendedAction()).isEqualTo(Action.CONCLUDE);
        assertThat(guidance.getProgressOverview()).startsWith("PROGRESS [6 thoughts");
    }

    @Test
    void shouldAskForEvaluationInExpertMode() {
        add(1);

        ModeGuidance guidance = guidance(ThinkingMode.EXPERT);

        assertThat(guidance.getRecommendedAction()).isEqualTo(Action.EVALUATE);
        assertThat(guidance.getConvergenceStatus().isConverged()).isFalse();
        assertThat(guidance.getPerspectiveSuggestions()).isNotEmpty();
        assertThat(guidance.getThoughtPrompt()).contains("1 nodes are unscored");
    }

    @Test
    void shouldBacktrackFromWeakPath() {
        add(1);
        ThoughtNode middle = add(2);
        ThoughtNode last = add(3);
        engine.backpropagate(tree, last.getNodeId(), 0.1);

        ModeGuidance guidance = guidance(ThinkingMode.EXPERT);

        assertThat(guidance.getRecommendedAction()).isEqualTo(Action.BACKTRACK);
        assertThat(guidance.getBacktrackSuggestion().getToNodeId()).isEqualTo(middle.getNodeId());
        assertThat(guidance.getBacktrackSuggestion().getDepth()).isEqualTo(1);
        assertThat(guidance.getThoughtPrompt()).contains("0.10").contains(middle.getNodeId());
    }

    @Test
    void shouldConcludeOnceConverged() {
        add(1);
        add(2);
        ThoughtNode last = add(3);
        engine.backpropagate(tree, last.getNodeId(), 0.9);

        ModeGuidance guidance = guidance(ThinkingMode.EXPERT);

        assertThat(guidance.getCurrentPhase()).isEqualTo(Phase.CONCLUDED);
        assertThat(guidance.getRecommendedAction()).isEqualTo(Action.CONCLUDE);
        assertThat(guidance.getConvergenceStatus().isConverged()).isTrue();
        assertThat(guidance.getThoughtPrompt()).contains("Converged at 0.90");
        assertThat(guidance.getCritique()).startsWith("CRITIQUE:");
    }

    @Test
    void shouldSuggestBranchingInDeepMode() {
        ThoughtNode root = add(1);

        ModeGuidance guidance = guidance(ThinkingMode.DEEP);

        assertThat(guidance.getRecommendedAction()).isEqualTo(Action.BRANCH);
        assertThat(guidance.getBranchingSuggestion().getFromNodeId()).isEqualTo(root.getNodeId());
        assertThat(guidance.getThoughtPrompt()).contains("0/5 alternatives");
    }

    @Test
    void shouldNotConvergeBeforeMinimumEvaluations() {
        ThinkingModeConfig deep = modeEngine.getPreset(ThinkingMode.DEEP);
        add(1);
        ThoughtNode last = add(2);
        engine.backpropagate(tree, last.getNodeId(), 1.0);

        ModeGuidance.ConvergenceStatus status =
                modeEngine.convergenceStatus(deep, engine.extractBestPath(tree), 2);

        assertThat(status.getScore()).isEqualTo(1.0);
        assertThat(status.isConverged()).isFalse();
        assertThat(modeEngine.determinePhase(deep, 1, 2, status)).isEqualTo(Phase.EXPLORING);
    }

    @Test
    void shouldLeaveConvergenceOffWithoutThreshold() {
        add(1);

        assertThat(modeEngine.convergenceStatus(modeEngine.getPreset(ThinkingMode.FAST),
                engine.extractBestPath(tree), 1)).isNull();
    }

    @Test
    void shouldRenderPlaceholders() {
        String rendered = ThinkingModeEngine.render("{{a}} and {{b}} but {{missing}}.", Map.of("a", 1, "b", "$x"));

        assertThat(rendered).isEqualTo("1 and $x but .");
    }

    @Test
    void shouldCompressLongText() {
        String text = "First sentence here. Middle one. Last bit.";

        assertThat(ThinkingModeEngine.compress(text, 100)).isEqualTo(text);
        assertThat(ThinkingModeEngine.compress(text, 40)).isEqualTo("First sentence here. [...] Last bit.");
        assertThat(ThinkingModeEngine.compress(text, 30)).isEqualTo("First sentence here. [...]");
        assertThat(ThinkingModeEngine.compress("one two three four five six", 12)).isEqualTo("one two...");
    }

    @Test
    void shouldExposeAllPresets() {
        for (ThinkingMode mode : ThinkingMode.values()) {
            assertThat(modeEngine.getPreset(mode).getMode()).isEqualTo(mode);
        }
        assertThat(List.of(ThinkingMode.values())).hasSize(3);
    }
}

package com.dispense.follow;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkingStateClassifierTest {

    private final WorkingStateClassifier classifier = new WorkingStateClassifier();

    private static AgentMessage.Assistant assistant(AgentMessage.ContentBlock... blocks) {
        return new AgentMessage.Assistant("m", List.of(blocks));
    }

    @Test
    void startsIdle() {
        assertFalse(classifier.isWorking());
        assertEquals(WorkingState.IDLE, classifier.state());
    }

    @Test
    void followsATypicalTurn() {
        classifier.update(new AgentMessage.SystemInit("init", "/w", "m", List.of()));
        assertTrue(classifier.isWorking());
        assertEquals(WorkingState.PROCESSING, classifier.state());

        classifier.update(assistant(new AgentMessage.ContentBlock("tool_use", null, "Bash", "{}")));
        assertEquals(WorkingState.TOOLING, classifier.state());

        classifier.update(new AgentMessage.ToolResult("t1", "ok", false));
        assertEquals(WorkingState.PROCESSING, classifier.state());

        classifier.update(assistant(new AgentMessage.ContentBlock("text", "Done.", null, null)));
        assertEquals(WorkingState.THINKING, classifier.state());
        assertTrue(classifier.isWorking());

        classifier.update(new AgentMessage.Result("success", false, 10L, null, null, null, "ok"));
        assertFalse(classifier.isWorking());
        assertEquals(WorkingState.IDLE, classifier.state());
    }

    @Test
    void streamEventsDriveState() {
        classifier.update(new AgentMessage.StreamEvent("message_start"));
        assertEquals(WorkingState.PROCESSING, classifier.state());
        classifier.update(new AgentMessage.StreamEvent("content_block_start"));
        assertEquals(WorkingState.THINKING, classifier.state());
        classifier.update(new AgentMessage.StreamEvent("content_block_delta"));
        assertEquals(WorkingState.THINKING, classifier.state());
        classifier.update(new AgentMessage.StreamEvent("message_stop"));
        assertFalse(classifier.isWorking());
    }

    @Test
    void rawLinesLeaveStateAlone() {
        classifier.update(new AgentMessage.User("go"));
        classifier.update(new AgentMessage.Raw("npm WARN deprecated"));

        assertTrue(classifier.isWorking());
        assertEquals(WorkingState.THINKING, classifier.state());
    }

    @Test
    void spinnerFramesCycle() {
        assertEquals(WorkingState.PROCESSING.frame(0), WorkingState.PROCESSING.frame(4));
        assertEquals("Using tools...", WorkingState.TOOLING.label());
        assertNotNull(WorkingState.THINKING.frame(-1));
    }
}

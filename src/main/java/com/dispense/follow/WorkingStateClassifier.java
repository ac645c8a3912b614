package com.dispense.follow;

/**
 * Tracks whether the agent is working and in which {@link WorkingState}, updated from each
 * decoded message. Updated by the follower thread and read by the progress indicator.
 */
public class WorkingStateClassifier {

    private record Snapshot(boolean working, WorkingState state) {}

    private volatile Snapshot current = new Snapshot(false, WorkingState.IDLE);

    public void update(AgentMessage message) {
        Snapshot now = current;
        current = next(now, message);
    }

    public boolean isWorking() {
        return current.working();
    }

    public WorkingState state() {
        return current.state();
    }

    private static Snapshot next(Snapshot now, AgentMessage message) {
        if (message instanceof AgentMessage.User) {
            return new Snapshot(true, WorkingState.THINKING);
        }
        if (message instanceof AgentMessage.ToolResult) {
            return new Snapshot(true, WorkingState.PROCESSING);
        }
        if (message instanceof AgentMessage.SystemInit) {
            return new Snapshot(true, WorkingState.PROCESSING);
        }
        if (message instanceof AgentMessage.Result) {
            return new Snapshot(false, WorkingState.IDLE);
        }
        if (message instanceof AgentMessage.Assistant assistant) {
            Snapshot result = now;
            for (AgentMessage.ContentBlock block : assistant.content()) {
                if (block.isToolUse()) {
                    result = new Snapshot(true, WorkingState.TOOLING);
                } else if (block.isText() && block.text() != null && !block.text().isBlank()) {
                    result = new Snapshot(result.working(), WorkingState.THINKING);
                }
            }
            return result;
        }
        if (message instanceof AgentMessage.StreamEvent event) {
            return switch (event.eventType()) {
                case "message_start" -> new Snapshot(true, WorkingState.PROCESSING);
                case "message_stop" -> new Snapshot(false, WorkingState.IDLE);
                case "content_block_start" -> new Snapshot(true, WorkingState.THINKING);
                default -> now;
            };
        }
        return now;
    }
}

package com.rapcode.script.flowchart;

/**
 * One node of a structural flowchart: a terminator, assignment box, I/O parallelogram,
 * decision diamond or loop, linked to the rest of the chart by successor and child links.
 * Links that do not apply to a kind are null.
 */
public final class FlowNode {

    public enum Kind { START, END, ASSIGNMENT, INPUT, OUTPUT, DECISION, LOOP, UNKNOWN }

    public final Kind kind;
    /** Assignment, output expression, input variable, decision or loop-exit condition text. */
    public final String text;
    /** Input prompt text; null for every other kind or when the chart has none. */
    public final String prompt;
    /** Element type as named by the source format; used in warnings about unknown nodes. */
    public final String sourceType;

    public final FlowNode successor;
    /** Decision: taken when the condition holds. */
    public final FlowNode left;
    /** Decision: taken when the condition fails. */
    public final FlowNode right;
    /** Loop: runs before the exit test. */
    public final FlowNode before;
    /** Loop: runs after the exit test when the loop continues. */
    public final FlowNode after;

    private FlowNode(Kind kind, String text, String prompt, String sourceType,
                     FlowNode successor, FlowNode left, FlowNode right, FlowNode before, FlowNode after) {
        this.kind = kind;
        this.text = (text == null) ? "" : text.trim();
        this.prompt = prompt;
        this.sourceType = (sourceType == null) ? kind.name() : sourceType;
        this.successor = successor;
        this.left = left;
        this.right = right;
        this.before = before;
        this.after = after;
    }

    public static FlowNode start(FlowNode successor) {
        return new FlowNode(Kind.START, "Start", null, "Start", successor, null, null, null, null);
    }

    public static FlowNode end() {
        return new FlowNode(Kind.END, "End", null, "End", null, null, null, null, null);
    }

    public static FlowNode assignment(String text, FlowNode successor) {
        return new FlowNode(Kind.ASSIGNMENT, text, null, "Rectangle", successor, null, null, null, null);
    }

    public static FlowNode input(String variable, String prompt, FlowNode successor) {
        return new FlowNode(Kind.INPUT, variable, prompt, "Parallelogram", successor, null, null, null, null);
    }

    public static FlowNode output(String text, FlowNode successor) {
        return new FlowNode(Kind.OUTPUT, text, null, "Parallelogram", successor, null, null, null, null);
    }

    public static FlowNode decision(String condition, FlowNode left, FlowNode right, FlowNode successor) {
        return new FlowNode(Kind.DECISION, condition, null, "IF_Control", successor, left, right, null, null);
    }

    public static FlowNode loop(FlowNode before, String exitCondition, FlowNode after, FlowNode successor) {
        return new FlowNode(Kind.LOOP, exitCondition, null, "Loop", successor, null, null, before, after);
    }

    public static FlowNode unknown(String sourceType, String text, FlowNode successor) {
        return new FlowNode(Kind.UNKNOWN, text, null, sourceType, successor, null, null, null, null);
    }

    @Override
    public String toString() {
        return kind + (text.isEmpty() ? "" : "(" + text + ")");
    }
}

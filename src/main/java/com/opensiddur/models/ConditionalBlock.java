package com.opensiddur.models;

/**
 * Guards the content up to the {@link EndConditional} with the same id.
 * The optional instruction note tells the reader when the guarded text applies; it is
 * emitted only when the condition cannot be decided.
 */
public class ConditionalBlock extends Node {
    private String id;
    private Condition condition;
    private ElementNode instruction;

    public ConditionalBlock() {}

    public ConditionalBlock(String id, Condition condition, ElementNode instruction) {
        this.id = id;
        this.condition = condition;
        this.instruction = instruction;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Condition getCondition() { return condition; }
    public void setCondition(Condition condition) { this.condition = condition; }

    public ElementNode getInstruction() { return instruction; }
    public void setInstruction(ElementNode instruction) { this.instruction = instruction; }

    @Override
    public boolean isScaffolding() {
        return true;
    }

    @Override
    public String pathName() {
        return "conditional";
    }

    @Override
    public ConditionalBlock copy() {
        return new ConditionalBlock(id, condition, instruction != null ? instruction.copy() : null);
    }
}

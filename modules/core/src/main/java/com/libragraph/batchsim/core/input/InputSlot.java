package com.libragraph.batchsim.core.input;

/**
 * One {@code (type, index)} position in the cache.
 */
public final class InputSlot {

    private final String typeName;
    private final int index;
    private SlotState state = SlotState.UNBUILT;
    private Object object;
    private int builtForFile = -1;

    InputSlot(String typeName, int index) {
        this.typeName = typeName;
        this.index = index;
    }

    InputSlot copy() {
        InputSlot c = new InputSlot(typeName, index);
        c.state = state;
        c.object = object;
        c.builtForFile = builtForFile;
        return c;
    }

    public String typeName() {
        return typeName;
    }

    public int index() {
        return index;
    }

    public String tag() {
        return typeName + index;
    }

    public SlotState state() {
        return state;
    }

    public Object object() {
        return object;
    }

    public boolean isBuilt() {
        return state == SlotState.BUILT_SAFE || state == SlotState.BUILT_UNSAFE;
    }

    /** A safe object serves every file; an unsafe one only the file it was built for. */
    boolean isReusableFor(int fileNum) {
        return state == SlotState.BUILT_SAFE
                || (state == SlotState.BUILT_UNSAFE && builtForFile == fileNum);
    }

    void built(Object object, boolean safe, int fileNum) {
        this.object = object;
        this.state = safe ? SlotState.BUILT_SAFE : SlotState.BUILT_UNSAFE;
        this.builtForFile = fileNum;
    }

    void invalidate() {
        if (state != SlotState.UNBUILT) {
            state = SlotState.INVALIDATED;
        }
    }

    @Override
    public String toString() {
        return tag() + "[" + state + "]";
    }
}

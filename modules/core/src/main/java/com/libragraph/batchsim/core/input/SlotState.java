package com.libragraph.batchsim.core.input;

public enum SlotState {
    UNBUILT,
    BUILT_UNSAFE,
    BUILT_SAFE,
    INVALIDATED
}

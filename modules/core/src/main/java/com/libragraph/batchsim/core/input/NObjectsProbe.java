package com.libragraph.batchsim.core.input;

/**
 * Object count reported by the count-capable input that was consulted.
 */
public record NObjectsProbe(String typeName, int count) {
}

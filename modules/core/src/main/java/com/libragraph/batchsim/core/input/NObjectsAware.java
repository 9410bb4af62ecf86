package com.libragraph.batchsim.core.input;

/**
 * Input objects that can tell how many objects they describe. Loaders of such objects
 * are count-capable and may drive object counts when an image leaves them unset.
 */
public interface NObjectsAware {

    int getNObjects();
}

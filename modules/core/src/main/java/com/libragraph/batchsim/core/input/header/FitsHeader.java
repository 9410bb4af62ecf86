package com.libragraph.batchsim.core.input.header;

import java.util.Set;

/**
 * Keywords of one FITS header unit.
 */
public interface FitsHeader {

    Object get(String keyword);

    Set<String> keywords();
}

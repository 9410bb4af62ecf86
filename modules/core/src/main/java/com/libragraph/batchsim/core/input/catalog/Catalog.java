package com.libragraph.batchsim.core.input.catalog;

import com.libragraph.batchsim.core.input.NObjectsAware;

/**
 * Row/column table of per-object values. Rows and columns are 0-based.
 */
public interface Catalog extends NObjectsAware {

    int getNCols();

    String get(int index, int col);

    double getFloat(int index, int col);

    int getInt(int index, int col);
}

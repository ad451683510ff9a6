package com.firmo.core.tree;

import com.firmo.core.engine.CaseContext;

/**
 * The code of one test case. Stored at declaration time, invoked only by the executor.
 */
@FunctionalInterface
public interface CaseBody {
    void run(CaseContext ctx) throws Exception;
}

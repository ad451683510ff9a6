package com.firmo.core.tree;

/**
 * Setup or teardown code registered on a suite and run around every case beneath it.
 */
@FunctionalInterface
public interface Hook {
    void run() throws Exception;
}

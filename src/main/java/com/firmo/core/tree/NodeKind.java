package com.firmo.core.tree;

public enum NodeKind {
    SUITE,
    CASE
}

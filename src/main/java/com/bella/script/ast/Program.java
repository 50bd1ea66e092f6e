package com.bella.script.ast;

import com.bella.script.ast.Statement.Block;

/** Root of a Bella tree: a single top-level block. */
public final class Program {
    public final Block body;

    public Program(Block body) {
        this.body = body;
    }
}

package com.backport.transpiler.fixer.unpacking;

import java.util.List;

import com.backport.transpiler.model.Node;

import lombok.Value;

/**
 * Result of expanding one expression: statements to hoist before the
 * containing statement, the node that replaces the expression, and the
 * statements that release temporaries after it.
 */
@Value
class ExpansionUpdate {

    List<Node> prefix;
    Node replacement;
    List<Node> cleanup;
}

package com.backport.transpiler.fixer.unpacking;

import java.util.List;

import com.backport.transpiler.model.Node;

import lombok.Value;

/**
 * Statements to splice around a statement whose fields were rewritten.
 */
@Value
class HoistedStatements {

    List<Node> prefix;
    List<Node> cleanup;
}

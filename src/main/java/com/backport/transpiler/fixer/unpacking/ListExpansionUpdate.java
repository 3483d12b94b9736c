package com.backport.transpiler.fixer.unpacking;

import java.util.List;

import com.backport.transpiler.model.Node;

import lombok.Value;

/**
 * Same as {@link ExpansionUpdate} for a list field; {@code replacements}
 * has one entry per original element.
 */
@Value
class ListExpansionUpdate {

    List<Node> prefix;
    List<Node> replacements;
    List<Node> cleanup;
}

package com.backport.transpiler.rewrite;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.backport.transpiler.model.Node;
import com.backport.transpiler.model.NodeKind;

import static com.backport.transpiler.model.Nodes.*;
import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TreeWalker.
 */
class TreeWalkerTest {

    @Test
    void testWalkIsPreOrderInDocumentOrder() {
        Node module = module(
                assign("x", call(name("f"), name("a"))),
                expr(name("b")));

        List<String> names = TreeWalker.walk(module, NodeKind.NAME).stream()
                .map(node -> node.getString("id"))
                .toList();

        assertThat(names).containsExactly("x", "f", "a", "b");
    }

    @Test
    void testWalkIncludesRootAndSupportNodes() {
        Node function = functionDef("f", arguments("a", "b"), pass());

        List<NodeKind> kinds = TreeWalker.walk(function).stream().map(Node::getKind).toList();

        assertThat(kinds).containsExactly(NodeKind.FUNCTION_DEF, NodeKind.ARGUMENTS, NodeKind.ARG, NodeKind.ARG,
                NodeKind.PASS);
    }

    @Test
    void testWalkSkipsNullDictKeys() {
        Node dict = dict(java.util.Arrays.asList(null, str("k")), List.of(name("m"), num(1)));

        assertThat(TreeWalker.walk(dict)).hasSize(4);
    }

    @Test
    void testWalkResultIsSnapshot() {
        Node module = module(pass(), pass());

        for (Node node : TreeWalker.walk(module)) {
            if (node.is(NodeKind.PASS)) {
                module.getNodes("body").add(expr(name("added")));
            }
        }

        assertThat(module.getNodes("body")).hasSize(4);
    }

    @Test
    void testChildren() {
        Node call = call(name("f"), List.of(name("a")), List.of(keyword("k", num(1))));

        assertThat(TreeWalker.children(call)).extracting(Node::getKind)
                .containsExactly(NodeKind.NAME, NodeKind.NAME, NodeKind.KEYWORD);
        assertThat(TreeWalker.children(name("x"))).isEmpty();
    }
}

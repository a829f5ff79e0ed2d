package org.dxworks.markflow.hir;

/**
 * One content item of a node: literal text or the arena index of a child node.
 */
public sealed interface HirContent permits HirContent.Text, HirContent.Child {

    record Text(String text) implements HirContent {
    }

    record Child(int index) implements HirContent {
    }
}

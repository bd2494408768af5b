/*
 * GoFix - Automated Go Source Migration
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.gofix.walk;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import net.boyechko.gofix.ast.Node;

/**
 * Visits every node reachable from a root in pre-order.
 *
 * <p>The walker only looks at the shape of the values returned by {@link Node#children()}: a
 * node, a collection of nodes, an {@link Optional} or {@code null}. It never switches on node
 * kinds, so new node classes need no changes here. Children are visited in the order the parent
 * lists them and collection elements in list order.
 *
 * <p>Visitors may mutate the tree. Each collection is copied before its elements are visited, so
 * replacing or removing elements of the list being walked does not disturb the traversal; a
 * newly assigned child is walked if the parent's {@code children()} returns it after the visitor
 * for the parent has run.
 */
public final class AstWalker {
    /**
     * Nesting limit. Real syntax trees are far shallower; exceeding it means the tree contains a
     * cycle, which is a bug in whatever built it.
     */
    public static final int MAX_DEPTH = 1000;

    private AstWalker() {}

    /** Calls {@code visit} on {@code root} and on every node below it. */
    public static void walk(Object root, Consumer<? super Node> visit) {
        walkBeforeAfter(root, visit, n -> {});
    }

    /**
     * Calls {@code before} when entering a node and {@code after} once all of its children have
     * been walked.
     */
    public static void walkBeforeAfter(
            Object root, Consumer<? super Node> before, Consumer<? super Node> after) {
        visitValue(root, before, after, 0);
    }

    /** All nodes of the given class below and including {@code root}, in visitation order. */
    public static <T extends Node> List<T> collect(Object root, Class<T> type) {
        List<T> found = new ArrayList<>();
        walk(
                root,
                n -> {
                    if (type.isInstance(n)) {
                        found.add(type.cast(n));
                    }
                });
        return found;
    }

    private static void visitValue(
            Object value, Consumer<? super Node> before, Consumer<? super Node> after, int depth) {
        if (value == null) {
            return;
        }
        if (depth > MAX_DEPTH) {
            throw new IllegalStateException(
                    "syntax tree nested deeper than " + MAX_DEPTH + " levels; is it cyclic?");
        }
        if (value instanceof Node node) {
            before.accept(node);
            for (Object child : node.children()) {
                visitValue(child, before, after, depth + 1);
            }
            after.accept(node);
        } else if (value instanceof Collection<?> collection) {
            for (Object element : new ArrayList<>(collection)) {
                visitValue(element, before, after, depth + 1);
            }
        } else if (value instanceof Optional<?> optional) {
            optional.ifPresent(v -> visitValue(v, before, after, depth + 1));
        } else {
            throw new IllegalArgumentException(
                    "not a syntax tree value: " + value.getClass().getName());
        }
    }
}

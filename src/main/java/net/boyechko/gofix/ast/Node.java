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
package net.boyechko.gofix.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Base class of every syntax tree node.
 *
 * <p>Each node kind must implement {@link #children()}, listing its structural fields in source
 * order. The values may be a child node, a list of nodes, an {@link java.util.Optional} or
 * {@code null} for an absent child; {@link net.boyechko.gofix.walk.AstWalker} only inspects that
 * shape, so adding a node kind never requires touching the walker.
 *
 * <p>Nodes are mutable. Fixes rewrite the live tree in place.
 */
public abstract class Node {
    private Position pos = Position.NONE;
    private int endLine;
    private final List<Comment> leadingComments = new ArrayList<>();
    private Comment trailingComment;

    /** Structural fields of this node in the order they appear in source. */
    public abstract List<Object> children();

    public Position getPos() {
        return pos;
    }

    public void setPos(Position pos) {
        this.pos = pos;
    }

    /** Last source line covered by this node, or 0 when the node was not parsed from source. */
    public int getEndLine() {
        return endLine;
    }

    public void setEndLine(int endLine) {
        this.endLine = endLine;
    }

    /** Comments on the lines directly above this statement, declaration, spec or field. */
    public List<Comment> getLeadingComments() {
        return leadingComments;
    }

    /** A comment that follows this node on its last line. */
    public Comment getTrailingComment() {
        return trailingComment;
    }

    public void setTrailingComment(Comment trailingComment) {
        this.trailingComment = trailingComment;
    }

    /** Packs structural field values for {@link #children()}; {@code null} marks an absent child. */
    protected static List<Object> fields(Object... values) {
        return Arrays.asList(values);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "@" + pos;
    }
}

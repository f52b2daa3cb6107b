/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.graph;

import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.egraphs.core.graph.Encoding.Property.NAME;
import static com.egraphs.core.graph.Encoding.Property.SOURCE_FUNCTION;

/**
 * A line of identity: a variable or a constant. Nodes are immutable values; their placement in a
 * context is recorded by the owning {@link Hypergraph}.
 */
public final class Node {

    private final Identifier id;
    private final Encoding.NodeType type;
    private final ImmutableMap<String, String> properties;
    private final int hash;

    public Node(Identifier id, Encoding.NodeType type, Map<String, String> properties) {
        this.id = id;
        this.type = type;
        this.properties = ImmutableMap.copyOf(properties);
        this.hash = Objects.hash(id, type, this.properties);
    }

    public static Node variable(@Nullable String name) {
        if (name == null) return new Node(Identifier.random(), Encoding.NodeType.VARIABLE, ImmutableMap.of());
        return new Node(Identifier.random(), Encoding.NodeType.VARIABLE, ImmutableMap.of(NAME.key(), name));
    }

    public static Node constant(String name) {
        return new Node(Identifier.random(), Encoding.NodeType.CONSTANT, ImmutableMap.of(NAME.key(), name));
    }

    public static Node functionOutput(String function) {
        return new Node(Identifier.random(), Encoding.NodeType.VARIABLE, ImmutableMap.of(SOURCE_FUNCTION.key(), function));
    }

    public Identifier id() {
        return id;
    }

    public Encoding.NodeType type() {
        return type;
    }

    public ImmutableMap<String, String> properties() {
        return properties;
    }

    public Optional<String> property(Encoding.Property property) {
        return Optional.ofNullable(properties.get(property.key()));
    }

    public Optional<String> name() {
        return property(NAME);
    }

    public Optional<String> sourceFunction() {
        return property(SOURCE_FUNCTION);
    }

    public boolean isVariable() {
        return type == Encoding.NodeType.VARIABLE;
    }

    public boolean isConstant() {
        return type == Encoding.NodeType.CONSTANT;
    }

    public boolean isFunctionOutput() {
        return isVariable() && properties.containsKey(SOURCE_FUNCTION.key());
    }

    public Node withId(Identifier newId) {
        return new Node(newId, type, properties);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Node that = (Node) o;
        return id.equals(that.id) && type == that.type && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "Node(" + type + ", " + id + (properties.isEmpty() ? "" : ", " + properties) + ")";
    }
}

/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.graph;

import com.egraphs.core.common.exception.EGException;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.egraphs.core.common.exception.ErrorMessage.Internal.ILLEGAL_STATE;
import static com.egraphs.core.graph.Encoding.Property.CONSTRUCT;
import static com.egraphs.core.graph.Encoding.Property.IDENTITY;
import static com.egraphs.core.graph.Encoding.Property.NAME;

/**
 * A relation over an ordered list of nodes, or a cut. A predicate or function edge keeps its
 * relation name in the {@code name} property; a function edge lists its output node first and
 * its arguments after it. A cut refers to no nodes and is itself a container of items.
 */
public final class Hyperedge {

    private final Identifier id;
    private final Encoding.EdgeType type;
    private final ImmutableList<Identifier> nodes;
    private final ImmutableMap<String, String> properties;
    private final int hash;

    public Hyperedge(Identifier id, Encoding.EdgeType type, List<Identifier> nodes, Map<String, String> properties) {
        this.id = id;
        this.type = type;
        this.nodes = ImmutableList.copyOf(nodes);
        this.properties = ImmutableMap.copyOf(properties);
        this.hash = Objects.hash(id, type, this.nodes, this.properties);
    }

    public static Hyperedge predicate(String name, List<Identifier> nodes) {
        return new Hyperedge(Identifier.random(), Encoding.EdgeType.PREDICATE, nodes, ImmutableMap.of(NAME.key(), name));
    }

    /**
     * The identity of two terms. It is named like a predicate but marked apart, so that a
     * user relation of the same name stays distinct from it.
     */
    public static Hyperedge identity(Identifier left, Identifier right) {
        return new Hyperedge(Identifier.random(), Encoding.EdgeType.PREDICATE, ImmutableList.of(left, right),
                             ImmutableMap.of(NAME.key(), Encoding.EQUALS_RELATION, IDENTITY.key(), "true"));
    }

    public static Hyperedge function(String name, Identifier output, List<Identifier> arguments) {
        ImmutableList<Identifier> nodes = ImmutableList.<Identifier>builder().add(output).addAll(arguments).build();
        return new Hyperedge(Identifier.random(), Encoding.EdgeType.FUNCTION, nodes, ImmutableMap.of(NAME.key(), name));
    }

    public static Hyperedge cut() {
        return cut(null);
    }

    public static Hyperedge cut(@Nullable Encoding.Construct construct) {
        if (construct == null) return new Hyperedge(Identifier.random(), Encoding.EdgeType.CUT, ImmutableList.of(), ImmutableMap.of());
        return new Hyperedge(Identifier.random(), Encoding.EdgeType.CUT, ImmutableList.of(), ImmutableMap.of(CONSTRUCT.key(), construct.label()));
    }

    public Identifier id() {
        return id;
    }

    public Encoding.EdgeType type() {
        return type;
    }

    public ImmutableList<Identifier> nodes() {
        return nodes;
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

    /**
     * The construct this cut was tagged with. A tag that names no known construct is treated as
     * absent, so that the cut still reads as a plain negation.
     */
    public Optional<Encoding.Construct> construct() {
        return property(CONSTRUCT).flatMap(Encoding.Construct::of);
    }

    public boolean isCut() {
        return type == Encoding.EdgeType.CUT;
    }

    public boolean isPredicate() {
        return type == Encoding.EdgeType.PREDICATE;
    }

    public boolean isIdentity() {
        return isPredicate() && property(IDENTITY).isPresent();
    }

    public boolean isFunction() {
        return type == Encoding.EdgeType.FUNCTION;
    }

    public Identifier output() {
        if (!isFunction() || nodes.isEmpty()) throw EGException.of(ILLEGAL_STATE);
        return nodes.get(0);
    }

    public ImmutableList<Identifier> arguments() {
        if (!isFunction() || nodes.isEmpty()) throw EGException.of(ILLEGAL_STATE);
        return nodes.subList(1, nodes.size());
    }

    public Hyperedge withId(Identifier newId) {
        return new Hyperedge(newId, type, nodes, properties);
    }

    public Hyperedge withNodes(List<Identifier> newNodes) {
        return new Hyperedge(id, type, newNodes, properties);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Hyperedge that = (Hyperedge) o;
        return id.equals(that.id) && type == that.type && nodes.equals(that.nodes) && properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "Hyperedge(" + type + ", " + id + (properties.isEmpty() ? "" : ", " + properties) + ", " + nodes + ")";
    }
}

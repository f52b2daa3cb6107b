/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.egraphs.core.graph;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque handle of a node or hyperedge in a {@link Hypergraph}. The reserved {@link #SHEET}
 * identifier names the sheet of assertion, the outermost positive context.
 */
public final class Identifier {

    public static final Identifier SHEET = new Identifier(new UUID(0L, 0L));

    private final UUID uuid;
    private final int hash;

    private Identifier(UUID uuid) {
        this.uuid = uuid;
        this.hash = Objects.hash(uuid);
    }

    public static Identifier random() {
        return new Identifier(UUID.randomUUID());
    }

    public static Identifier of(UUID uuid) {
        return uuid.equals(SHEET.uuid) ? SHEET : new Identifier(uuid);
    }

    public boolean isSheet() {
        return this.equals(SHEET);
    }

    public UUID uuid() {
        return uuid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Identifier that = (Identifier) o;
        return uuid.equals(that.uuid);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return isSheet() ? "SA" : uuid.toString();
    }
}

package com.openapi.simpleSDK.generator.schema;

import java.util.List;

public record Composition(CompositionKind kind, List<CompositionMember> members, Discriminator discriminator) {

    public Composition {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("a composition needs at least one member");
        }
        members = List.copyOf(members);
    }

    public boolean hasDiscriminator() {
        return discriminator != null;
    }
}

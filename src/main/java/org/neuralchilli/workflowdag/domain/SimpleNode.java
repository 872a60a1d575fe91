package org.neuralchilli.workflowdag.domain;

import javax.annotation.Nonnull;
import java.util.Random;
import java.util.UUID;

/**
 * Node carrying nothing but its identity.
 */
public record SimpleNode(UUID id) implements Node {

    public SimpleNode {
        if (id == null) {
            throw new IllegalArgumentException("Node id cannot be null");
        }
    }

    /**
     * Create a node with a fresh random identity
     */
    public static SimpleNode create() {
        return new SimpleNode(UUID.randomUUID());
    }

    /**
     * Create a node whose version 4 identity is drawn from the given source,
     * so seeded generators reproduce the same identities.
     */
    public static SimpleNode random(Random random) {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        bytes[6] = (byte) ((bytes[6] & 0x0f) | 0x40);  // version 4
        bytes[8] = (byte) ((bytes[8] & 0x3f) | 0x80);  // IETF variant

        long msb = 0;
        long lsb = 0;
        for (int i = 0; i < 8; i++) {
            msb = (msb << 8) | (bytes[i] & 0xff);
        }
        for (int i = 8; i < 16; i++) {
            lsb = (lsb << 8) | (bytes[i] & 0xff);
        }
        return new SimpleNode(new UUID(msb, lsb));
    }

    @Nonnull
    @Override
    public String toString() {
        return label();
    }
}

package com.questrail.push.protocol.binary.model;

import com.questrail.push.api.Payload;

import java.util.Objects;

/**
 * A payload paired with the connection-scoped notification id it was sent under.
 *
 * <p>Ids are unsigned 32-bit values held in an {@code int}; zero is reserved
 * for "no specific notification" and is rejected here.</p>
 */
public record IdentifiedPayload(Payload payload, int id)
{
    public IdentifiedPayload {
        Objects.requireNonNull(payload, "payload");
        if (id == 0) {
            throw new IllegalArgumentException("notification id 0 is reserved");
        }
    }

    @Override
    public String toString() {
        return "IdentifiedPayload[id=" + Integer.toUnsignedString(id) + ", payload=" + payload + "]";
    }
}

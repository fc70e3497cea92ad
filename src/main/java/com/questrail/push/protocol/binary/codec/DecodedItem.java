package com.questrail.push.protocol.binary.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * One item read back from a frame by a {@link PushFrameDecoder}.
 *
 * @param localId        position marker within the frame (0 for the first item)
 * @param token          lower-case hex rendering of the 32 token bytes
 * @param payload        notification body bytes
 * @param notificationId connection-scoped notification id
 * @param expiration     expiration, unsigned epoch seconds
 * @param priority       priority byte as written
 */
public record DecodedItem(
        int localId,
        String token,
        byte[] payload,
        int notificationId,
        long expiration,
        int priority
) {
    public DecodedItem {
        Objects.requireNonNull(token, "token");
        payload = Objects.requireNonNull(payload, "payload").clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecodedItem)) {
            return false;
        }
        DecodedItem other = (DecodedItem) o;
        return localId == other.localId
                && notificationId == other.notificationId
                && expiration == other.expiration
                && priority == other.priority
                && token.equals(other.token)
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(localId, token, notificationId, expiration, priority);
        return 31 * result + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "DecodedItem[localId=" + localId + ", token=" + token + ", payload=" + payload.length
                + " bytes, id=" + Integer.toUnsignedString(notificationId) + ", expiration=" + expiration
                + ", priority=" + priority + "]";
    }
}

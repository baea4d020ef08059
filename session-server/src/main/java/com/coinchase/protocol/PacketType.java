package com.coinchase.protocol;

/**
 * Inbound frame types, keyed by the tag byte that opens every frame.
 *
 * Client → Server:
 * - STATUS (0): the user's current position
 * - ATTACK (1): the user attacks a neighbouring cell
 */
public enum PacketType {
    STATUS((byte) 0, StatusEvent.class),
    ATTACK((byte) 1, AttackEvent.class);

    private final byte tag;
    private final Class<? extends InboundEvent> payloadType;

    PacketType(byte tag, Class<? extends InboundEvent> payloadType) {
        this.tag = tag;
        this.payloadType = payloadType;
    }

    public byte tag() {
        return tag;
    }

    public Class<? extends InboundEvent> payloadType() {
        return payloadType;
    }

    /**
     * @return the type for {@code tag}, or null if the tag is unknown
     */
    public static PacketType fromTag(byte tag) {
        for (PacketType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        return null;
    }
}

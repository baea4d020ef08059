package com.coinchase.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;

/**
 * Encodes and decodes the payloads carried inside wire frames.
 *
 * Frame layout: [type: 1 byte][JSON payload][delimiter '$']
 * Outbound snapshots have no type byte: [JSON payload]['$'].
 *
 * The writer escapes '$' as a unicode escape, so the delimiter byte can never occur
 * inside a payload and frames split cleanly on it. UTF-8 continuation bytes
 * are all >= 0x80 and never collide with it either.
 *
 * The codec is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class PacketCodec {

    private static final Logger logger = LoggerFactory.getLogger(PacketCodec.class);

    public static final byte DELIMITER = '$';

    private final ObjectMapper objectMapper;

    public PacketCodec() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.getFactory().setCharacterEscapes(new DelimiterEscapes());
    }

    /**
     * Decodes one frame with the delimiter already stripped.
     *
     * @throws ProtocolViolationException if the frame is empty, the tag is unknown
     *                                    or the payload does not match the tag
     */
    public InboundEvent decode(ByteBuf frame) {
        if (!frame.isReadable()) {
            throw new ProtocolViolationException("Empty frame");
        }

        byte tag = frame.readByte();
        PacketType type = PacketType.fromTag(tag);
        if (type == null) {
            throw new ProtocolViolationException("Unknown packet type: " + tag);
        }

        byte[] payload = ByteBufUtil.getBytes(frame);
        frame.skipBytes(payload.length);
        try {
            return objectMapper.readValue(payload, type.payloadType());
        } catch (IOException e) {
            logger.debug("Failed to decode {} payload ({} bytes)", type, payload.length, e);
            throw new ProtocolViolationException("Malformed " + type + " payload", e);
        }
    }

    /**
     * Encodes an inbound event the way a client does: tag, payload, delimiter.
     */
    public byte[] encodeFrame(InboundEvent event) {
        byte[] payload = writeBytes(event);
        byte[] frame = new byte[payload.length + 2];
        frame[0] = event.type().tag();
        System.arraycopy(payload, 0, frame, 1, payload.length);
        frame[frame.length - 1] = DELIMITER;
        return frame;
    }

    /**
     * Serializes a snapshot and appends the delimiter. Compression happens later.
     */
    public byte[] encodeSnapshot(RelatedPositionsMessage message) {
        byte[] payload = writeBytes(message);
        byte[] framed = Arrays.copyOf(payload, payload.length + 1);
        framed[payload.length] = DELIMITER;
        return framed;
    }

    /**
     * Reads a snapshot back from its framed form (delimiter included or not).
     */
    public RelatedPositionsMessage decodeSnapshot(byte[] framed) throws IOException {
        int length = framed.length;
        if (length > 0 && framed[length - 1] == DELIMITER) {
            length--;
        }
        return objectMapper.readValue(framed, 0, length, RelatedPositionsMessage.class);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private byte[] writeBytes(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize {}", value, e);
            throw new IllegalStateException("Serialization failed", e);
        }
    }

    /**
     * Standard JSON escapes plus '$'.
     */
    private static final class DelimiterEscapes extends CharacterEscapes {

        private final int[] asciiEscapes;

        DelimiterEscapes() {
            asciiEscapes = CharacterEscapes.standardAsciiEscapesForJSON();
            asciiEscapes[DELIMITER] = CharacterEscapes.ESCAPE_STANDARD;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return null;
        }
    }
}

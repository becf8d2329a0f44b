package com.ackmediator.common.api;

import com.ackmediator.common.exception.CodecException;
import com.ackmediator.common.exception.DecodeException;
import com.ackmediator.common.model.SerializedMessage;

/**
 * Turns domain objects into bytes plus manifest and back.
 * Implementations: JsonMessageCodec
 */
public interface MessageCodec {

    /**
     * Encode an outbound message
     * @param message Domain object
     * @return Bytes with the manifest needed to decode them
     * @throws CodecException if the message cannot be encoded
     */
    SerializedMessage encode(Object message) throws CodecException;

    /**
     * Decode an inbound record value
     * @param message Bytes and manifest read from the log
     * @return Domain object
     * @throws DecodeException if the bytes do not form a known message
     */
    Object decode(SerializedMessage message) throws DecodeException;
}

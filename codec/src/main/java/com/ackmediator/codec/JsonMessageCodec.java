package com.ackmediator.codec;

import com.ackmediator.common.api.MessageCodec;
import com.ackmediator.common.exception.CodecException;
import com.ackmediator.common.exception.DecodeException;
import com.ackmediator.common.model.SerializedMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Encodes messages as JSON, the manifest names the type to decode into.
 * Only registered types are decoded; a type encoded without registration uses its class name as manifest.
 */
public class JsonMessageCodec implements MessageCodec {
    private static final Logger log = LoggerFactory.getLogger(JsonMessageCodec.class);

    private final ObjectMapper mapper;
    private final Map<String, Class<?>> typesByManifest = new ConcurrentHashMap<>();
    private final Map<Class<?>, String> manifestsByType = new ConcurrentHashMap<>();

    public JsonMessageCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public JsonMessageCodec() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    /**
     * Register a type under an explicit manifest
     */
    public JsonMessageCodec register(String manifest, Class<?> type) {
        Class<?> previous = typesByManifest.putIfAbsent(manifest, type);
        if (previous != null && previous != type) {
            throw new IllegalArgumentException(
                    String.format("Manifest %s already registered for %s", manifest, previous.getName()));
        }
        manifestsByType.put(type, manifest);
        log.debug("Registered manifest={} for type={}", manifest, type.getName());
        return this;
    }

    /**
     * Register a type under its class name
     */
    public JsonMessageCodec register(Class<?> type) {
        return register(type.getName(), type);
    }

    @Override
    public SerializedMessage encode(Object message) throws CodecException {
        Class<?> type = message.getClass();
        String manifest = manifestsByType.getOrDefault(type, type.getName());
        try {
            return new SerializedMessage(manifest, mapper.writeValueAsBytes(message));
        } catch (JsonProcessingException e) {
            throw CodecException.encodeFailed(type, e);
        }
    }

    @Override
    public Object decode(SerializedMessage message) throws DecodeException {
        if (!message.hasManifest()) {
            throw DecodeException.unknownManifest(message.getManifest());
        }

        Class<?> type = typesByManifest.get(message.getManifest());
        if (type == null) {
            throw DecodeException.unknownManifest(message.getManifest());
        }

        byte[] payload = message.getPayload();
        if (payload == null || payload.length == 0) {
            throw DecodeException.malformed(message.getManifest(), null);
        }

        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw DecodeException.malformed(message.getManifest(), e);
        }
    }
}

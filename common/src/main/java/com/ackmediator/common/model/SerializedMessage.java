package com.ackmediator.common.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Encoded payload plus the manifest that tells the codec which type to decode it into
 */
public class SerializedMessage {
    private final String manifest;
    private final byte[] payload;

    public SerializedMessage(String manifest, byte[] payload) {
        this.manifest = manifest;
        this.payload = payload;
    }

    public String getManifest() {
        return manifest;
    }

    public byte[] getPayload() {
        return payload;
    }

    public boolean hasManifest() {
        return manifest != null && !manifest.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SerializedMessage that = (SerializedMessage) o;
        return Objects.equals(manifest, that.manifest) && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(manifest) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "SerializedMessage{manifest=" + manifest + ", payloadLength=" + (payload != null ? payload.length : 0) + "}";
    }
}

package com.meltwater.rxjetstream;

import com.google.common.base.Preconditions;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The body of a {@link Message}. The bytes are copied on the way in and on the way out.
 */
public class Payload {

    public static final Payload EMPTY = new Payload(new byte[0]);

    private final byte[] data;

    public Payload(byte[] data) {
        Preconditions.checkNotNull(data, "data");
        this.data = data.clone();
    }

    public static Payload of(String text) {
        return new Payload(text.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] getData() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    public String asString() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return Arrays.equals(data, payload.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Payload{" +
                "size=" + data.length + " bytes"+
                '}';
    }
}

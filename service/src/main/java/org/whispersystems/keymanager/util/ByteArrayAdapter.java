/*
 * Copyright 2013-2020 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */
package org.whispersystems.keymanager.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import java.io.IOException;
import java.util.Base64;

/**
 * Standard (padded) base64 codec for raw byte fields such as signatures and serialized key pairs.
 */
public class ByteArrayAdapter {

  public static class Serializing extends JsonSerializer<byte[]> {
    @Override
    public void serialize(final byte[] bytes, final JsonGenerator jsonGenerator,
        final SerializerProvider serializerProvider) throws IOException {

      jsonGenerator.writeString(Base64.getEncoder().encodeToString(bytes));
    }
  }

  public static class Deserializing extends JsonDeserializer<byte[]> {
    @Override
    public byte[] deserialize(final JsonParser jsonParser, final DeserializationContext deserializationContext)
        throws IOException {

      try {
        return Base64.getDecoder().decode(jsonParser.getValueAsString());
      } catch (final IllegalArgumentException e) {
        throw new JsonParseException(jsonParser, "Could not parse value as base64", e);
      }
    }
  }
}

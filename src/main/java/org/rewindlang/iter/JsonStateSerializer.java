/*
 * Copyright 2025 The Rewind Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.rewindlang.iter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.rewindlang.impl.Values;
import org.rewindlang.tree.None;

/**
 * Encodes {@link WrapperState}s as JSON objects:
 *
 * <pre>
 * {"format": "rewind-wrapper-state", "version": 1, "factoryName": "fib",
 *  "constructorArgs": [8], "constructorKwargs": {}, "stepCount": 3,
 *  "yieldedHistory": [0, 1, 1], "exhausted": false}
 * </pre>
 *
 * <p>Ints are written as JSON integers and floats always with a fraction or exponent, so each reads
 * back as the type it was written as. {@code none} is {@code null}, lists are arrays and maps with
 * string keys are objects. Any other value (a function, generator, range, non-finite float, map
 * with a non-string key, or arbitrary Java object) can't be encoded.
 *
 * <p>When decoding, fields other than those listed above are ignored, and {@code format}, {@code
 * version} and {@code factoryName} are optional.
 */
public class JsonStateSerializer implements StateSerializer {
  public static final String FORMAT = "rewind-wrapper-state";
  public static final int VERSION = 1;

  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS);

  private static final JsonNodeFactory NODES = MAPPER.getNodeFactory();

  @Override
  public String encode(WrapperState state) throws SerializationException {
    ObjectNode root = NODES.objectNode();
    root.put("format", FORMAT);
    root.put("version", VERSION);
    if (state.factoryName() != null) {
      root.put("factoryName", state.factoryName());
    }
    root.set("constructorArgs", encodeValue(state.constructorArgs(), "constructorArgs"));
    root.set("constructorKwargs", encodeValue(state.constructorKwargs(), "constructorKwargs"));
    root.put("stepCount", state.stepCount());
    root.set("yieldedHistory", encodeValue(state.yieldedHistory(), "yieldedHistory"));
    root.put("exhausted", state.exhausted());
    try {
      return MAPPER.writeValueAsString(root);
    } catch (JsonProcessingException e) {
      throw new SerializationException("", "failed to write JSON", e);
    }
  }

  private static JsonNode encodeValue(Object value, String path) throws SerializationException {
    value = Values.fromJava(value);
    if (value instanceof None) {
      return NODES.nullNode();
    } else if (value instanceof Boolean b) {
      return NODES.booleanNode(b);
    } else if (value instanceof String s) {
      return NODES.textNode(s);
    } else if (value instanceof BigInteger i) {
      return NODES.numberNode(i);
    } else if (value instanceof Double d) {
      if (!Double.isFinite(d)) {
        throw new SerializationException(path, "non-finite float " + d + " is not supported");
      }
      return NODES.numberNode(d);
    } else if (value instanceof List<?> list) {
      ArrayNode array = NODES.arrayNode();
      for (int i = 0; i < list.size(); i++) {
        array.add(encodeValue(list.get(i), path + "[" + i + "]"));
      }
      return array;
    } else if (value instanceof Map<?, ?> map) {
      ObjectNode object = NODES.objectNode();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new SerializationException(
              path,
              String.format(
                  "map key %s is a %s; only string keys are supported",
                  Values.repr(entry.getKey()), Values.typeName(entry.getKey())));
        }
        object.set(key, encodeValue(entry.getValue(), path + "." + key));
      }
      return object;
    }
    throw new SerializationException(
        path, "values of type '" + Values.typeName(value) + "' are not supported");
  }

  @Override
  public WrapperState decode(String encoded) throws SerializationException {
    JsonNode root;
    try {
      root = MAPPER.readTree(encoded);
    } catch (JsonProcessingException e) {
      throw new SerializationException("", "malformed JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new SerializationException("", "expected a JSON object");
    }
    JsonNode format = root.get("format");
    if (format != null && !format.asText().equals(FORMAT)) {
      throw new SerializationException("format", "unknown format " + format);
    }
    JsonNode factoryName = root.get("factoryName");
    if (factoryName != null && !factoryName.isNull() && !factoryName.isTextual()) {
      throw new SerializationException("factoryName", "expected a string");
    }
    JsonNode stepCount = required(root, "stepCount");
    if (!stepCount.isIntegralNumber() || !stepCount.canConvertToLong() || stepCount.asLong() < 0) {
      throw new SerializationException("stepCount", "expected a non-negative integer");
    }
    JsonNode exhausted = required(root, "exhausted");
    if (!exhausted.isBoolean()) {
      throw new SerializationException("exhausted", "expected true or false");
    }
    return new WrapperState(
        decodeList(required(root, "constructorArgs"), "constructorArgs"),
        decodeKwargs(required(root, "constructorKwargs")),
        stepCount.asLong(),
        decodeList(required(root, "yieldedHistory"), "yieldedHistory"),
        exhausted.booleanValue(),
        (factoryName == null || factoryName.isNull()) ? null : factoryName.textValue());
  }

  private static JsonNode required(JsonNode root, String field) throws SerializationException {
    JsonNode result = root.get(field);
    if (result == null) {
      throw new SerializationException(field, "missing");
    }
    return result;
  }

  private static ImmutableList<Object> decodeList(JsonNode node, String path)
      throws SerializationException {
    if (!node.isArray()) {
      throw new SerializationException(path, "expected an array");
    }
    ImmutableList.Builder<Object> builder = ImmutableList.builder();
    for (int i = 0; i < node.size(); i++) {
      builder.add(decodeValue(node.get(i), path + "[" + i + "]"));
    }
    return builder.build();
  }

  private static ImmutableMap<String, Object> decodeKwargs(JsonNode node)
      throws SerializationException {
    if (!node.isObject()) {
      throw new SerializationException("constructorKwargs", "expected an object");
    }
    return decodeMap(node, "constructorKwargs");
  }

  private static ImmutableMap<String, Object> decodeMap(JsonNode node, String path)
      throws SerializationException {
    ImmutableMap.Builder<String, Object> builder = ImmutableMap.builder();
    for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
      Map.Entry<String, JsonNode> field = it.next();
      builder.put(field.getKey(), decodeValue(field.getValue(), path + "." + field.getKey()));
    }
    return builder.buildOrThrow();
  }

  private static Object decodeValue(JsonNode node, String path) throws SerializationException {
    if (node.isNull()) {
      return None.NONE;
    } else if (node.isBoolean()) {
      return node.booleanValue();
    } else if (node.isTextual()) {
      return node.textValue();
    } else if (node.isIntegralNumber()) {
      return node.bigIntegerValue();
    } else if (node.isFloatingPointNumber()) {
      double d = node.doubleValue();
      if (!Double.isFinite(d)) {
        throw new SerializationException(path, "float out of range");
      }
      return d;
    } else if (node.isArray()) {
      return decodeList(node, path);
    } else if (node.isObject()) {
      return decodeMap(node, path);
    }
    throw new SerializationException(path, "unsupported JSON value " + node.getNodeType());
  }
}

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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.rewindlang.impl.RangeValue;
import org.rewindlang.tree.None;

@RunWith(JUnit4.class)
public class JsonStateSerializerTest {

  private final JsonStateSerializer serializer = new JsonStateSerializer();

  private static final WrapperState STATE =
      WrapperState.of(
          List.of(new BigInteger("123456789012345678901234567890"), "s"),
          ImmutableMap.of("scale", 2.0, "opts", ImmutableMap.of("deep", List.of(true))),
          3,
          Arrays.asList(
              0, -1.5, null, "é\n", List.of(), ImmutableMap.of("k", Arrays.asList(1, null))),
          false,
          "numbers");

  private String errorPath(WrapperState state) {
    return assertThrows(SerializationException.class, () -> serializer.encode(state)).path;
  }

  private SerializationException decodeError(String json) {
    return assertThrows(SerializationException.class, () -> serializer.decode(json));
  }

  @Test
  public void roundTrip() throws Exception {
    assertThat(serializer.decode(serializer.encode(STATE))).isEqualTo(STATE);
    assertThat(serializer.decodeBytes(serializer.encodeBytes(STATE))).isEqualTo(STATE);
    WrapperState anonymous =
        WrapperState.of(List.of(), ImmutableMap.of(), 0, List.of(), true, null);
    assertThat(serializer.decode(serializer.encode(anonymous))).isEqualTo(anonymous);
  }

  @Test
  public void decodedValueTypes() throws Exception {
    WrapperState decoded = serializer.decode(serializer.encode(STATE));
    assertThat(decoded.yieldedHistory().get(0)).isEqualTo(BigInteger.ZERO);
    assertThat(decoded.yieldedHistory().get(1)).isEqualTo(-1.5);
    assertThat(decoded.yieldedHistory().get(2)).isEqualTo(None.NONE);
    assertThat(decoded.constructorKwargs().get("scale")).isEqualTo(2.0);
  }

  @Test
  public void selfDescribing() throws Exception {
    JsonNode root = new ObjectMapper().readTree(serializer.encode(STATE));
    assertThat(root.get("format").asText()).isEqualTo(JsonStateSerializer.FORMAT);
    assertThat(root.get("version").asInt()).isEqualTo(JsonStateSerializer.VERSION);
    assertThat(root.get("factoryName").asText()).isEqualTo("numbers");
    assertThat(root.get("stepCount").asLong()).isEqualTo(3);
    assertThat(root.get("exhausted").asBoolean()).isFalse();
  }

  @Test
  public void unknownFieldsAreIgnored() throws Exception {
    ObjectMapper mapper = new ObjectMapper();
    ObjectNode root = (ObjectNode) mapper.readTree(serializer.encode(STATE));
    root.put("version", 7);
    root.put("checksum", "abc");
    root.putObject("extra").put("nested", 1);
    root.remove("format");
    assertThat(serializer.decode(mapper.writeValueAsString(root))).isEqualTo(STATE);
  }

  @Test
  public void minimalInput() throws Exception {
    WrapperState state =
        serializer.decode(
            """
            {"constructorArgs": [5], "constructorKwargs": {}, "stepCount": 2,
             "yieldedHistory": [1, 2.5], "exhausted": false}
            """);
    assertThat(state)
        .isEqualTo(
            WrapperState.of(List.of(5), ImmutableMap.of(), 2, List.of(1, 2.5), false, null));
  }

  @Test
  public void unsupportedValues() {
    List<Object> history = List.of(1, new RangeValue(0, 3, 1));
    assertThat(errorPath(WrapperState.of(List.of(), ImmutableMap.of(), 2, history, false, "r")))
        .isEqualTo("yieldedHistory[1]");
    assertThat(
            errorPath(
                WrapperState.of(
                    List.of(),
                    ImmutableMap.of("opts", ImmutableMap.of("a", List.of(1, new Object()))),
                    0,
                    List.of(),
                    false,
                    "r")))
        .isEqualTo("constructorKwargs.opts.a[1]");
    SerializationException e =
        assertThrows(
            SerializationException.class,
            () ->
                serializer.encode(
                    WrapperState.of(
                        List.of(Double.NaN), ImmutableMap.of(), 0, List.of(), false, "r")));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("constructorArgs[0]: non-finite float NaN is not supported");
    List<Object> intKeys = List.of(ImmutableMap.of(1, "a"));
    e =
        assertThrows(
            SerializationException.class,
            () ->
                serializer.encode(
                    WrapperState.of(List.of(), ImmutableMap.of(), 1, intKeys, false, "r")));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("yieldedHistory[0]: map key 1 is a int; only string keys are supported");
  }

  @Test
  public void malformedInput() {
    assertThat(decodeError("{").getMessage()).startsWith("malformed JSON");
    assertThat(decodeError("[]").getMessage()).isEqualTo("expected a JSON object");
    assertThat(decodeError("{\"format\": \"pickle\"}").path).isEqualTo("format");
    assertThat(decodeError("{\"constructorArgs\": []}").getMessage())
        .isEqualTo("stepCount: missing");
    String rest = "\"constructorArgs\": [], \"constructorKwargs\": {}, \"yieldedHistory\": []";
    assertThat(decodeError("{\"stepCount\": -1, \"exhausted\": false, " + rest + "}").path)
        .isEqualTo("stepCount");
    assertThat(decodeError("{\"stepCount\": 1.5, \"exhausted\": false, " + rest + "}").path)
        .isEqualTo("stepCount");
    assertThat(
            decodeError("{\"stepCount\": 1, \"exhausted\": \"yes\", " + rest + "}").getMessage())
        .isEqualTo("exhausted: expected true or false");
    assertThat(
            decodeError(
                    "{\"stepCount\": 1, \"exhausted\": false, \"constructorArgs\": {},"
                        + " \"constructorKwargs\": {}, \"yieldedHistory\": []}")
                .getMessage())
        .isEqualTo("constructorArgs: expected an array");
    assertThat(
            decodeError(
                    "{\"stepCount\": 1, \"exhausted\": false, \"constructorArgs\": [],"
                        + " \"constructorKwargs\": [], \"yieldedHistory\": []}")
                .getMessage())
        .isEqualTo("constructorKwargs: expected an object");
  }
}

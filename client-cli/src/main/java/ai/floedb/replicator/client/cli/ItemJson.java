/*
 * Copyright 2026 Yellowbrick Data, Inc.
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
package ai.floedb.replicator.client.cli;

import ai.floedb.replicator.spi.Item;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Map;
import java.util.TreeMap;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Renders items in the typed wire form ({@code {"name": {"S": "..."}}}), attributes sorted by
 * name.
 */
final class ItemJson {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ItemJson() {}

  static String toPrettyJson(Item item) {
    return write(typed(item.attributes()), true);
  }

  static String toJson(Object value) {
    return write(MAPPER.valueToTree(value), false);
  }

  static ObjectNode typed(Map<String, AttributeValue> attributes) {
    ObjectNode out = MAPPER.createObjectNode();
    new TreeMap<>(attributes).forEach((name, value) -> out.set(name, typed(value)));
    return out;
  }

  static ObjectNode typed(AttributeValue v) {
    ObjectNode node = MAPPER.createObjectNode();
    switch (v.type()) {
      case S -> node.put("S", v.s());
      case N -> node.put("N", v.n());
      case B -> node.put("B", v.b().asByteArray());
      case BOOL -> node.put("BOOL", v.bool());
      case NUL -> node.put("NULL", true);
      case SS -> {
        ArrayNode arr = node.putArray("SS");
        v.ss().forEach(arr::add);
      }
      case NS -> {
        ArrayNode arr = node.putArray("NS");
        v.ns().forEach(arr::add);
      }
      case BS -> {
        ArrayNode arr = node.putArray("BS");
        for (SdkBytes bytes : v.bs()) {
          arr.add(bytes.asByteArray());
        }
      }
      case L -> {
        ArrayNode arr = node.putArray("L");
        v.l().forEach(e -> arr.add(typed(e)));
      }
      case M -> node.set("M", typed(v.m()));
      default -> throw new IllegalArgumentException("Unsupported attribute value: " + v);
    }
    return node;
  }

  private static String write(JsonNode node, boolean pretty) {
    try {
      return pretty
          ? MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(node)
          : MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot render JSON", e);
    }
  }
}

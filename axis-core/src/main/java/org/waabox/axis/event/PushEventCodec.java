package org.waabox.axis.event;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.axis.model.ItemStatus;
import org.waabox.axis.model.RegistryItem;

/**
 * Static utility class that builds the JSON payloads of push events.
 *
 * <p>Uses Jackson's tree model so the wire shape is spelled out here rather
 * than inferred from the domain types.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PushEventCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private PushEventCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Returns the shared mapper.
   *
   * @return the mapper, never null
   */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Serializes a payload to a compact JSON string.
   *
   * @param payload the payload, a tree node or any Jackson-serializable
   *                value, may be null
   *
   * @return the JSON text, never null
   *
   * @throws JsonProcessingException if the payload cannot be serialized
   */
  public static String encode(final Object payload)
      throws JsonProcessingException {
    return MAPPER.writeValueAsString(payload);
  }

  /**
   * Builds the JSON array of a snapshot.
   *
   * @param items the decorated items, never null
   *
   * @return the array node, never null
   */
  public static ArrayNode items(final List<RegistryItem> items) {
    Objects.requireNonNull(items, "items cannot be null");
    final ArrayNode array = MAPPER.createArrayNode();
    for (final RegistryItem item : items) {
      array.add(item(item));
    }
    return array;
  }

  /**
   * Builds the JSON object of one item. The {@code status} field is omitted
   * when the item carries none.
   *
   * @param item the item, never null
   *
   * @return the object node, never null
   */
  public static ObjectNode item(final RegistryItem item) {
    Objects.requireNonNull(item, "item cannot be null");
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("id", item.id());
    node.put("kind", item.kind().value());
    node.put("title", item.title());
    node.put("snippet", item.snippet());
    if (item.status() != null) {
      node.put("status", item.status().value());
    }
    return node;
  }

  /**
   * Builds the payload of a countdown tick.
   *
   * @param secondsRemaining the seconds left before the next refresh
   *
   * @return the object node, never null
   */
  public static ObjectNode tick(final int secondsRemaining) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("seconds_remaining", secondsRemaining);
    return node;
  }

  /**
   * Builds the payload of a status change.
   *
   * @param id     the item id, never null
   * @param status the new status, never null
   * @param title  the item title, never null
   *
   * @return the object node, never null
   */
  public static ObjectNode statusChanged(final String id,
      final ItemStatus status, final String title) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("id", id);
    node.put("status", status.value());
    node.put("title", title);
    return node;
  }

  /**
   * Builds the payload of an automation event.
   *
   * @param state the state name, {@code started} or {@code error}
   * @param task  the task text, never null
   * @param error the failure message, null when there is none
   *
   * @return the object node, never null
   */
  public static ObjectNode automation(final String state, final String task,
      final String error) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("state", state);
    node.put("task", task);
    if (error != null && !error.isEmpty()) {
      node.put("error", error);
    }
    return node;
  }
}

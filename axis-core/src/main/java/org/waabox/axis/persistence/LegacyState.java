package org.waabox.axis.persistence;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * The deprecated single-file state format, read once for migration.
 *
 * <p>The file holds one JSON object:
 * <pre>{@code
 * {"mode": "MANUAL", "statuses": {"notes/1": "Keep", "notes/2": "Review"}}
 * }</pre>
 * Both fields are optional. Status tokens are kept verbatim here; mapping
 * them onto the lifecycle is the migrator's job.
 *
 * @param mode     the raw mode value, null if absent
 * @param statuses the raw statuses by item id, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record LegacyState(String mode, Map<String, String> statuses) {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Copies the statuses. */
  public LegacyState {
    Objects.requireNonNull(statuses, "statuses cannot be null");
    statuses = Map.copyOf(statuses);
  }

  /**
   * Parses the legacy JSON document.
   *
   * @param json the file content, never null
   *
   * @return the parsed state, never null
   *
   * @throws IllegalArgumentException if the content is not a JSON object or
   *                                  the statuses field is not an object
   */
  public static LegacyState parse(final String json) {
    Objects.requireNonNull(json, "json cannot be null");

    final JsonNode root;
    try {
      root = MAPPER.readTree(json);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException(
          "Malformed legacy state document", e);
    }
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException(
          "Legacy state document must be a JSON object");
    }

    final JsonNode modeNode = root.get("mode");
    final String mode = modeNode == null || modeNode.isNull()
        ? null : modeNode.asText();

    final Map<String, String> statuses = new LinkedHashMap<>();
    final JsonNode statusesNode = root.get("statuses");
    if (statusesNode != null && !statusesNode.isNull()) {
      if (!statusesNode.isObject()) {
        throw new IllegalArgumentException(
            "Legacy statuses must be a JSON object");
      }
      final Iterator<Map.Entry<String, JsonNode>> fields =
          statusesNode.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        statuses.put(field.getKey(), field.getValue().asText());
      }
    }
    return new LegacyState(mode, statuses);
  }
}

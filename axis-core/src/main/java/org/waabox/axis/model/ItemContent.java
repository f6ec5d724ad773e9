package org.waabox.axis.model;

/**
 * What the dashboard returns when an operator opens one item.
 *
 * @param id      the item identifier, never null
 * @param content the trimmed body, or {@code "No body content."}
 * @param status  the lifecycle status, null for non-note items
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ItemContent(String id, String content, ItemStatus status) {
}

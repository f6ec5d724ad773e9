package org.waabox.axis.provider;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import org.waabox.axis.model.ItemDetail;
import org.waabox.axis.model.RegistryItem;

/**
 * An in-memory {@link ItemProvider} for tests, with a switch to simulate an
 * upstream outage.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FakeItemProvider implements ItemProvider {

  /** The current upstream list. */
  private final List<RegistryItem> items = new CopyOnWriteArrayList<>();

  /** The details by id. */
  private final Map<String, ItemDetail> details = new ConcurrentHashMap<>();

  /** The ids deleted so far. */
  private final List<String> deleted = new CopyOnWriteArrayList<>();

  /** The number of listAll calls. */
  private final AtomicInteger listCalls = new AtomicInteger();

  /** Whether every call fails. */
  private volatile boolean failing;

  /**
   * Replaces the upstream list.
   *
   * @param theItems the new items
   */
  public void items(final RegistryItem... theItems) {
    items.clear();
    items.addAll(Arrays.asList(theItems));
  }

  /**
   * Registers the detail returned for an id.
   *
   * @param detail the detail
   */
  public void detail(final ItemDetail detail) {
    details.put(detail.id(), detail);
  }

  /**
   * Makes every following call fail, or succeed again.
   *
   * @param isFailing true to simulate an outage
   */
  public void failing(final boolean isFailing) {
    failing = isFailing;
  }

  /**
   * Returns how many times the list was fetched.
   *
   * @return the call count
   */
  public int listCalls() {
    return listCalls.get();
  }

  /**
   * Returns the ids deleted so far.
   *
   * @return the ids in call order
   */
  public List<String> deleted() {
    return new ArrayList<>(deleted);
  }

  @Override
  public List<RegistryItem> listAll() {
    listCalls.incrementAndGet();
    checkAvailable();
    return List.copyOf(items);
  }

  @Override
  public ItemDetail getDetail(final String id) {
    checkAvailable();
    final ItemDetail detail = details.get(id);
    if (detail == null) {
      throw new ProviderException("item not found: " + id);
    }
    return detail;
  }

  @Override
  public void delete(final String id) {
    checkAvailable();
    deleted.add(id);
    items.removeIf(item -> item.id().equals(id));
  }

  private void checkAvailable() {
    if (failing) {
      throw new ProviderException("upstream unavailable");
    }
  }
}

package org.waabox.axis.server.http;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.waabox.axis.model.ItemDetail;
import org.waabox.axis.model.RegistryItem;
import org.waabox.axis.provider.ItemProvider;
import org.waabox.axis.provider.ProviderException;

/** A fixed in-memory provider backing the endpoint tests. */
final class StubItemProvider implements ItemProvider {

  private final List<RegistryItem> items = new CopyOnWriteArrayList<>();

  private final Map<String, ItemDetail> details = new ConcurrentHashMap<>();

  StubItemProvider(final List<RegistryItem> theItems) {
    items.addAll(theItems);
  }

  void detail(final ItemDetail detail) {
    details.put(detail.id(), detail);
  }

  @Override
  public List<RegistryItem> listAll() {
    return List.copyOf(items);
  }

  @Override
  public ItemDetail getDetail(final String id) {
    final ItemDetail detail = details.get(id);
    if (detail == null) {
      throw new ProviderException("item not found: " + id);
    }
    return detail;
  }

  @Override
  public void delete(final String id) {
    if (!items.removeIf(item -> item.id().equals(id))) {
      throw new ProviderException("item not found: " + id);
    }
  }
}

package org.waabox.axis.provider;

import java.util.List;

import org.waabox.axis.model.ItemDetail;
import org.waabox.axis.model.RegistryItem;

/**
 * The upstream system that owns the authoritative item list.
 *
 * <p>Implementations typically call a remote API and may block on the
 * network. Axis never calls them while holding any of its locks.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface ItemProvider {

  /**
   * Lists every current item.
   *
   * <p>Must return the full list; partial results are not supported. The
   * returned items carry no status.
   *
   * @return the items in display order, never null
   *
   * @throws ProviderException if the upstream call fails
   */
  List<RegistryItem> listAll();

  /**
   * Fetches the full payload of one item.
   *
   * @param id the item identifier, never null
   *
   * @return the detail, never null
   *
   * @throws ProviderException if the upstream call fails or the item does
   *                           not exist
   */
  ItemDetail getDetail(String id);

  /**
   * Deletes one item upstream.
   *
   * @param id the item identifier, never null
   *
   * @throws ProviderException if the upstream call fails
   */
  void delete(String id);
}

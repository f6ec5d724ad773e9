package org.waabox.axis.store.jdbc;

import java.util.Objects;
import java.util.regex.Pattern;

import javax.sql.DataSource;

/**
 * Configuration for the JDBC state store.
 *
 * <p>Holds the {@link DataSource} and the prefix of the two tables the
 * store owns, {@code <prefix>_mode} and {@code <prefix>_status}.
 *
 * <p>Instances are created via the static factory methods
 * {@link #create(DataSource)} and {@link #create(DataSource, String)}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class JdbcStateStoreConfig {

  /** Default table prefix. */
  private static final String DEFAULT_TABLE_PREFIX = "axis";

  /** Accepted table prefixes; they are concatenated into SQL. */
  private static final Pattern IDENTIFIER =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  /** The JDBC data source, never null. */
  private final DataSource dataSource;

  /** The table prefix, never null. */
  private final String tablePrefix;

  /** Private constructor; use static factories.
   *
   * @param theDataSource  the JDBC data source
   * @param theTablePrefix the table prefix
   */
  private JdbcStateStoreConfig(final DataSource theDataSource,
      final String theTablePrefix) {
    dataSource = theDataSource;
    tablePrefix = theTablePrefix;
  }

  /**
   * Creates a configuration with a custom table prefix.
   *
   * @param dataSource  the JDBC data source, never null
   * @param tablePrefix the table prefix, a plain SQL identifier
   *
   * @return a new configuration instance, never null
   */
  public static JdbcStateStoreConfig create(final DataSource dataSource,
      final String tablePrefix) {
    Objects.requireNonNull(dataSource, "dataSource cannot be null");
    Objects.requireNonNull(tablePrefix, "tablePrefix cannot be null");

    if (!IDENTIFIER.matcher(tablePrefix).matches()) {
      throw new IllegalArgumentException(
          "tablePrefix must be a plain SQL identifier, got: " + tablePrefix);
    }

    return new JdbcStateStoreConfig(dataSource, tablePrefix);
  }

  /**
   * Creates a configuration with the default {@code axis} table prefix.
   *
   * @param dataSource the JDBC data source, never null
   *
   * @return a new configuration instance, never null
   */
  public static JdbcStateStoreConfig create(final DataSource dataSource) {
    return create(dataSource, DEFAULT_TABLE_PREFIX);
  }

  /**
   * Returns the JDBC data source.
   *
   * @return the data source, never null
   */
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Returns the table prefix.
   *
   * @return the prefix, never null
   */
  public String tablePrefix() {
    return tablePrefix;
  }

  /**
   * Returns the name of the mode table.
   *
   * @return the table name, never null
   */
  public String modeTable() {
    return tablePrefix + "_mode";
  }

  /**
   * Returns the name of the status table.
   *
   * @return the table name, never null
   */
  public String statusTable() {
    return tablePrefix + "_status";
  }
}

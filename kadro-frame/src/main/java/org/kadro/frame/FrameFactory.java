/**
 * kadro: Fluent grouped transformations over in-memory tables.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of kadro.
 *
 * kadro is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.kadro.frame;

import javax.annotation.PostConstruct;
import javax.inject.Inject;

import org.kadro.config.Config;
import org.kadro.config.ConfigKey;
import org.kadro.context.AutoInstatiate;
import org.kadro.data.Table;
import org.kadro.data.TableFactory;
import org.kadro.data.TableSource;
import org.kadro.execution.Aggregator;
import org.kadro.execution.GroupSpec;
import org.kadro.execution.GroupedMutator;
import org.kadro.execution.Joiner;
import org.kadro.execution.Reshaper;
import org.kadro.execution.RowSelector;
import org.kadro.execution.RowSorter;

/**
 * Creates {@link Frame}s.
 * 
 * <p>
 * The created frames use the engines of this factory to execute their operations.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class FrameFactory {
  @Inject
  private TableFactory tableFactory;

  @Inject
  private GroupedMutator groupedMutator;

  @Inject
  private Aggregator aggregator;

  @Inject
  private Joiner joiner;

  @Inject
  private RowSorter rowSorter;

  @Inject
  private RowSelector rowSelector;

  @Inject
  private Reshaper reshaper;

  @Config(ConfigKey.GROUP_COLUMN_POLICY)
  private String groupColumnPolicyName;

  @Config(ConfigKey.SHOW_ROWS)
  private int showRows;

  private GroupColumnPolicy groupColumnPolicy;

  @PostConstruct
  public void initialize() {
    try {
      groupColumnPolicy = GroupColumnPolicy.valueOf(groupColumnPolicyName.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Invalid value for " + ConfigKey.GROUP_COLUMN_POLICY + ": '"
          + groupColumnPolicyName + "'", e);
    }
  }

  /**
   * @return A new ungrouped {@link Frame} on the given table, using the configured {@link GroupColumnPolicy}.
   */
  public Frame createFrame(Table table) {
    return new Frame(this, table, GroupSpec.empty(), groupColumnPolicy);
  }

  /**
   * @return A new ungrouped {@link Frame} on the table created from the given source, see
   *         {@link TableFactory#createTable(TableSource)}.
   */
  public Frame createFrame(TableSource source) {
    return createFrame(tableFactory.createTable(source));
  }

  /* package */ GroupedMutator getGroupedMutator() {
    return groupedMutator;
  }

  /* package */ Aggregator getAggregator() {
    return aggregator;
  }

  /* package */ Joiner getJoiner() {
    return joiner;
  }

  /* package */ RowSorter getRowSorter() {
    return rowSorter;
  }

  /* package */ RowSelector getRowSelector() {
    return rowSelector;
  }

  /* package */ Reshaper getReshaper() {
    return reshaper;
  }

  /* package */ int getShowRows() {
    return showRows;
  }
}

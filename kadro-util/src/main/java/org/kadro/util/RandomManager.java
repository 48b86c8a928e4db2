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
package org.kadro.util;

import java.util.Random;

import javax.annotation.PostConstruct;

import org.kadro.config.Config;
import org.kadro.config.ConfigKey;
import org.kadro.context.AutoInstatiate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple manager for random numbers.
 * 
 * <p>
 * If {@link ConfigKey#RANDOM_SEED} is configured, the sequence of numbers is the same on each run.
 *
 * @author Bastian Gloeckle
 */
@AutoInstatiate
public class RandomManager {
  private static final Logger logger = LoggerFactory.getLogger(RandomManager.class);

  @Config(ConfigKey.RANDOM_SEED)
  private String randomSeed;

  private Random random;

  @PostConstruct
  public void initialize() {
    if (randomSeed == null || randomSeed.isEmpty()) {
      random = new Random();
      return;
    }

    try {
      random = new Random(Long.parseLong(randomSeed));
      logger.info("Using fixed random seed {}", randomSeed);
    } catch (NumberFormatException e) {
      throw new RuntimeException("Configured random seed '" + randomSeed + "' is not a valid long.", e);
    }
  }

  /**
   * Return a random integer, see {@link Random#nextInt(int)}.
   */
  public int nextInt(int boundExclusive) {
    return random.nextInt(boundExclusive);
  }
}

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
package org.kadro.config;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a field of an automatically instantiated bean which should be filled with a configuration value.
 * 
 * <p>
 * Supported field types are {@link String}, {@link Integer}, {@link Long}, {@link Double} and {@link Boolean} (and
 * their primitive counterparts). The value is set by {@link ConfigurationPostProcessor} before any
 * <code>PostConstruct</code> method of the bean is called.
 *
 * @author Bastian Gloeckle
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
public @interface Config {
  /**
   * @return The config key, see {@link ConfigKey}.
   */
  String value();
}

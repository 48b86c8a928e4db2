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
package org.kadro.context;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Marks a class whose single instance is created automatically when the {@link AnnotationConfigApplicationContext}
 * scans the <code>org.kadro</code> package.
 * 
 * <p>
 * Instances are wired using <code>javax.inject.Inject</code> and may use <code>javax.annotation.PostConstruct</code>
 * and <code>javax.annotation.PreDestroy</code>.
 *
 * @author Bastian Gloeckle
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface AutoInstatiate {

}

/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.perch.annotation;

import org.jspecify.annotations.NonNull;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Apply to a public method of a resource object to handle HTTP {@code POST} requests for a route pattern.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface POST {
	/**
	 * The route pattern, e.g. {@code /widgets/{widgetId:integer}}.
	 *
	 * @return the route pattern
	 */
	@NonNull
	String value();

	/**
	 * Optional name for the route; blank means unnamed.
	 *
	 * @return the route name
	 */
	@NonNull
	String name() default "";
}

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

package com.perch;

import org.jspecify.annotations.NonNull;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Renders named templates for {@link Template} handler results.
 * <p>
 * Perch ships no template engine; applications plug one in via {@link PerchConfig.Builder#templateRenderer(TemplateRenderer)}.
 * Returning a {@link Template} when no renderer is configured is an application error.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface TemplateRenderer {
	/**
	 * Renders {@code name} against {@code context} to a complete string.
	 *
	 * @param name    the template name
	 * @param context the template variables
	 * @return the rendered markup
	 * @throws Exception if rendering fails
	 */
	@NonNull
	String render(@NonNull String name,
								@NonNull Map<@NonNull String, Object> context) throws Exception;

	/**
	 * Renders {@code name} as a sequence of chunks, for progressive templates.
	 * <p>
	 * The default implementation renders eagerly and yields one chunk. Renderers that can flush early should override.
	 *
	 * @param name    the template name
	 * @param context the template variables
	 * @return the rendered chunks, consumed lazily
	 * @throws Exception if rendering fails before the first chunk
	 */
	@NonNull
	default Iterator<@NonNull String> renderProgressively(@NonNull String name,
																												@NonNull Map<@NonNull String, Object> context) throws Exception {
		return List.of(render(name, context)).iterator();
	}
}

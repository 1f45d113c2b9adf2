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

import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Vends daemon platform threads named {@code <namePrefix>-<id>}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class NonvirtualThreadFactory implements ThreadFactory {
	@NonNull
	private final String namePrefix;
	@NonNull
	private final AtomicInteger idGenerator;

	NonvirtualThreadFactory(@NonNull String namePrefix) {
		requireNonNull(namePrefix);

		this.namePrefix = namePrefix;
		this.idGenerator = new AtomicInteger(0);
	}

	@Override
	@NonNull
	public Thread newThread(@NonNull Runnable runnable) {
		requireNonNull(runnable);

		String name = format("%s-%s", getNamePrefix(), getIdGenerator().incrementAndGet());
		Thread thread = new Thread(runnable, name);
		thread.setDaemon(true);

		return thread;
	}

	@NonNull
	String getNamePrefix() {
		return this.namePrefix;
	}

	@NonNull
	AtomicInteger getIdGenerator() {
		return this.idGenerator;
	}
}

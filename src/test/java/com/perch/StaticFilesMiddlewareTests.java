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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class StaticFilesMiddlewareTests {
	@TempDir
	Path tempDirectory;

	@Test
	public void filesUnderThePrefixAreServed() throws IOException {
		Path publicDirectory = publicDirectory();

		Perch.runSimulator(configWith(publicDirectory), simulator -> {
			RequestResult css = simulator.performRequest(HttpMethod.GET, "/static/css/site.css");

			assertEquals(Integer.valueOf(200), css.getStatusCode());
			assertEquals("body { color: teal; }", css.getBodyAsString());
			assertEquals("text/css; charset=utf-8", css.getHeader("Content-Type").get());
			assertEquals("public, max-age=3600", css.getHeader("Cache-Control").get());

			RequestResult unknown = simulator.performRequest(HttpMethod.GET, "/static/blob.perchdata");

			assertEquals("application/octet-stream", unknown.getHeader("Content-Type").get());
		});
	}

	@Test
	public void unmatchedRequestsFallThrough() throws IOException {
		Path publicDirectory = publicDirectory();

		Perch.runSimulator(configWith(publicDirectory), simulator -> {
			assertEquals(Integer.valueOf(404), simulator.performRequest(HttpMethod.GET, "/static/missing.css").getStatusCode());
			assertEquals(Integer.valueOf(404), simulator.performRequest(HttpMethod.GET, "/static/css").getStatusCode());
			assertEquals("route", simulator.performRequest(HttpMethod.GET, "/static-ish").getBodyAsString());
			assertEquals("posted", simulator.performRequest(HttpMethod.POST, "/static/css/site.css").getBodyAsString());
		});
	}

	@Test
	public void traversalOutsideTheDirectoryIsForbidden() throws IOException {
		Path publicDirectory = publicDirectory();
		Files.writeString(this.tempDirectory.resolve("secret.txt"), "secret", StandardCharsets.UTF_8);

		Perch.runSimulator(configWith(publicDirectory), simulator -> {
			RequestResult requestResult = simulator.performRequest(HttpMethod.GET, "/static/../secret.txt");

			assertEquals(Integer.valueOf(403), requestResult.getStatusCode());
			assertEquals("Forbidden", requestResult.getBodyAsString());

			RequestResult encoded = simulator.performRequest(HttpMethod.GET, "/static/%2e%2e/secret.txt");

			assertEquals(Integer.valueOf(403), encoded.getStatusCode());
			Assertions.assertFalse(encoded.getBodyAsString().contains("secret"));
		});
	}

	@Test
	public void directoryMustExist() {
		assertThrows(IllegalArgumentException.class,
				() -> StaticFilesMiddleware.withDirectory(this.tempDirectory.resolve("nope"), "/static"));
	}

	private Path publicDirectory() throws IOException {
		Path publicDirectory = Files.createDirectories(this.tempDirectory.resolve("public"));
		Files.createDirectories(publicDirectory.resolve("css"));
		Files.writeString(publicDirectory.resolve("css/site.css"), "body { color: teal; }", StandardCharsets.UTF_8);
		Files.write(publicDirectory.resolve("blob.perchdata"), new byte[]{1, 2, 3});
		return publicDirectory;
	}

	private static PerchConfig configWith(Path publicDirectory) {
		Router router = Router.create();
		router.register("/static-ish", request -> "route", Set.of(HttpMethod.GET));
		router.register("/static/css/site.css", request -> "posted", Set.of(HttpMethod.POST));

		return PerchConfig.withRouter(router)
				.middleware(List.of(StaticFilesMiddleware.withDirectory(publicDirectory, "/static")))
				.build();
	}
}

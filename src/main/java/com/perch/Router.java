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

import com.perch.annotation.DELETE;
import com.perch.annotation.GET;
import com.perch.annotation.PATCH;
import com.perch.annotation.POST;
import com.perch.annotation.PUT;
import com.perch.exception.ConfigurationException;
import com.perch.exception.MethodNotAllowedException;
import com.perch.exception.NotFoundException;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

import static com.perch.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Compiles registered routes into a prefix tree keyed by path segment and matches requests against it.
 * <p>
 * Lifecycle:
 * <ol>
 *   <li>{@link #register(String, RouteHandler, Set)} (and {@link #registerResource(Object)}) any number of times</li>
 *   <li>{@link #compile()} exactly once; the tree is immutable from then on</li>
 *   <li>{@link #match(HttpMethod, String)} concurrently from any number of threads</li>
 * </ol>
 * Registering after compilation throws {@link IllegalStateException} immediately.
 * <p>
 * At each level of the tree, literal children are tried before placeholder children, and placeholder children before
 * a {@code rest-of-path} child, so {@code /users/me} always wins over {@code /users/{id}}. Among placeholder children,
 * {@code integer} is tried before {@code float}, and {@code float} before {@code string}. A placeholder child matches
 * only if the segment converts to its declared type; if the subtree under a candidate fails to match, the next
 * candidate is tried.
 * <p>
 * The first tree node that consumes the whole path and carries routes decides the outcome: a route for the
 * request's method matches, otherwise the match fails with {@link MethodNotAllowedException} carrying every method
 * declared at that node. If no node consumes the path, the match fails with {@link NotFoundException}. These
 * failures are ordinary outcomes that callers treat as data.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Router {
	@NonNull
	private static final Comparator<@NonNull ParameterEdge> PARAMETER_EDGE_PRECEDENCE;

	static {
		PARAMETER_EDGE_PRECEDENCE = Comparator.comparingInt(parameterEdge -> precedenceFor(parameterEdge.getPathParameterType()));
	}

	@NonNull
	private final List<@NonNull Route> routes;
	@NonNull
	private final ReentrantLock lock;
	@Nullable
	private volatile Node root;

	@NonNull
	public static Router create() {
		return new Router();
	}

	private Router() {
		this.routes = new ArrayList<>();
		this.lock = new ReentrantLock();
	}

	@NonNull
	public Route register(@NonNull String pattern,
												@NonNull RouteHandler routeHandler,
												@NonNull Set<@NonNull HttpMethod> httpMethods) {
		return register(pattern, routeHandler, httpMethods, null);
	}

	/**
	 * Registers a route.
	 *
	 * @param pattern      the route pattern, e.g. {@code /users/{id:integer}}
	 * @param routeHandler the handler to invoke when the route matches
	 * @param httpMethods  the methods the route accepts
	 * @param name         optional name for the route
	 * @return the registered route
	 * @throws ConfigurationException if the pattern is malformed
	 * @throws IllegalStateException  if this router has already been compiled
	 */
	@NonNull
	public Route register(@NonNull String pattern,
												@NonNull RouteHandler routeHandler,
												@NonNull Set<@NonNull HttpMethod> httpMethods,
												@Nullable String name) {
		requireNonNull(pattern);
		requireNonNull(routeHandler);
		requireNonNull(httpMethods);

		getLock().lock();

		try {
			if (this.root != null)
				throw new IllegalStateException(format("Cannot register route '%s' because this router has already been compiled", pattern));

			Route route = new Route(RoutePath.fromPattern(pattern), routeHandler, httpMethods, trimAggressivelyToNull(name));
			this.routes.add(route);
			return route;
		} finally {
			getLock().unlock();
		}
	}

	/**
	 * Registers a route for every method of {@code resource} annotated with {@link GET}, {@link POST}, {@link PUT},
	 * {@link PATCH} or {@link DELETE}, resolving handler arguments with {@link ResourceMethodParameterProvider#defaultInstance()}.
	 *
	 * @param resource the object whose annotated methods handle requests
	 * @return this router
	 * @throws ConfigurationException if a pattern is malformed or a method declares a parameter that can never be resolved
	 */
	@NonNull
	public Router registerResource(@NonNull Object resource) {
		requireNonNull(resource);
		return registerResource(resource, ResourceMethodParameterProvider.defaultInstance());
	}

	@NonNull
	public Router registerResource(@NonNull Object resource,
																 @NonNull ResourceMethodParameterProvider resourceMethodParameterProvider) {
		requireNonNull(resource);
		requireNonNull(resourceMethodParameterProvider);

		List<Method> methods = new ArrayList<>(Arrays.asList(resource.getClass().getMethods()));
		// Class#getMethods() order is unspecified; keep registration deterministic
		methods.sort(Comparator.comparing(Method::getName).thenComparing(Method::toGenericString));

		Integer registeredRouteCount = 0;

		for (Method method : methods) {
			Map<HttpMethod, String[]> declarations = declarationsFor(method);

			if (declarations.isEmpty())
				continue;

			if (Modifier.isStatic(method.getModifiers()))
				throw new ConfigurationException(format("Resource method %s must not be static", method));

			ResourceMethod resourceMethod = ResourceMethod.withMethod(resource, method, resourceMethodParameterProvider);

			for (Map.Entry<HttpMethod, String[]> declaration : declarations.entrySet()) {
				resourceMethodParameterProvider.validateResourceMethod(resourceMethod, RoutePath.fromPattern(declaration.getValue()[0]));
				register(declaration.getValue()[0], resourceMethod, Set.of(declaration.getKey()), declaration.getValue()[1]);
				++registeredRouteCount;
			}
		}

		if (registeredRouteCount == 0)
			throw new ConfigurationException(format("%s has no methods annotated with @%s, @%s, @%s, @%s or @%s",
					resource.getClass().getName(), GET.class.getSimpleName(), POST.class.getSimpleName(), PUT.class.getSimpleName(),
					PATCH.class.getSimpleName(), DELETE.class.getSimpleName()));

		return this;
	}

	@NonNull
	private Map<@NonNull HttpMethod, @NonNull String[]> declarationsFor(@NonNull Method method) {
		requireNonNull(method);

		Map<HttpMethod, String[]> declarations = new EnumMap<>(HttpMethod.class);

		GET get = method.getAnnotation(GET.class);
		POST post = method.getAnnotation(POST.class);
		PUT put = method.getAnnotation(PUT.class);
		PATCH patch = method.getAnnotation(PATCH.class);
		DELETE delete = method.getAnnotation(DELETE.class);

		if (get != null)
			declarations.put(HttpMethod.GET, new String[]{get.value(), get.name()});
		if (post != null)
			declarations.put(HttpMethod.POST, new String[]{post.value(), post.name()});
		if (put != null)
			declarations.put(HttpMethod.PUT, new String[]{put.value(), put.name()});
		if (patch != null)
			declarations.put(HttpMethod.PATCH, new String[]{patch.value(), patch.name()});
		if (delete != null)
			declarations.put(HttpMethod.DELETE, new String[]{delete.value(), delete.name()});

		return declarations;
	}

	/**
	 * Freezes the registered routes into the immutable matching tree.
	 * <p>
	 * Calling this more than once has no further effect.
	 *
	 * @return this router
	 * @throws ConfigurationException if two routes declare the same method for equivalent patterns
	 */
	@NonNull
	public Router compile() {
		getLock().lock();

		try {
			if (this.root != null)
				return this;

			Node root = new Node();

			for (Route route : this.routes)
				insert(root, route);

			root.freeze();
			this.root = root;
			return this;
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	public Boolean isCompiled() {
		return this.root != null;
	}

	/**
	 * Matches a request method and path against the compiled routes.
	 *
	 * @param httpMethod the request method
	 * @param path       the decoded request path, e.g. {@code /users/42/}
	 * @return the match
	 * @throws NotFoundException         if no route matches the path
	 * @throws MethodNotAllowedException if a route matches the path but not the method
	 * @throws IllegalStateException     if this router has not been compiled
	 */
	@NonNull
	public RouteMatch match(@NonNull HttpMethod httpMethod,
													@NonNull String path) {
		requireNonNull(httpMethod);
		requireNonNull(path);

		Node root = this.root;

		if (root == null)
			throw new IllegalStateException("Router must be compiled before matching");

		List<String> tokens = new ArrayList<>();

		for (String token : path.split("/"))
			if (token.length() > 0)
				tokens.add(token);

		Map<String, String> pathParameters = new LinkedHashMap<>();
		Map<HttpMethod, Route> routesByHttpMethod = matchNode(root, tokens, 0, pathParameters);

		if (routesByHttpMethod == null)
			throw new NotFoundException(format("No route matches %s %s", httpMethod.name(), path));

		Route route = routesByHttpMethod.get(httpMethod);

		if (route == null)
			throw new MethodNotAllowedException(routesByHttpMethod.keySet());

		return new RouteMatch(route, pathParameters);
	}

	@Nullable
	private Map<@NonNull HttpMethod, @NonNull Route> matchNode(@NonNull Node node,
																														 @NonNull List<@NonNull String> tokens,
																														 int index,
																														 @NonNull Map<@NonNull String, @NonNull String> pathParameters) {
		requireNonNull(node);
		requireNonNull(tokens);
		requireNonNull(pathParameters);

		if (index == tokens.size())
			return node.routesByHttpMethod.isEmpty() ? null : node.routesByHttpMethod;

		String token = tokens.get(index);
		Node literalChild = node.literalChildren.get(token);

		if (literalChild != null) {
			Map<HttpMethod, Route> routesByHttpMethod = matchNode(literalChild, tokens, index + 1, pathParameters);

			if (routesByHttpMethod != null)
				return routesByHttpMethod;
		}

		for (ParameterEdge parameterEdge : node.parameterEdges) {
			if (!parameterEdge.getPathParameterType().matches(token))
				continue;

			pathParameters.put(parameterEdge.getPathParameterName(), token);

			Map<HttpMethod, Route> routesByHttpMethod = matchNode(parameterEdge.getNode(), tokens, index + 1, pathParameters);

			if (routesByHttpMethod != null)
				return routesByHttpMethod;

			pathParameters.remove(parameterEdge.getPathParameterName());
		}

		for (ParameterEdge restOfPathEdge : node.restOfPathEdges) {
			if (restOfPathEdge.getNode().routesByHttpMethod.isEmpty())
				continue;

			pathParameters.put(restOfPathEdge.getPathParameterName(), String.join("/", tokens.subList(index, tokens.size())));
			return restOfPathEdge.getNode().routesByHttpMethod;
		}

		return null;
	}

	private void insert(@NonNull Node root,
											@NonNull Route route) {
		requireNonNull(root);
		requireNonNull(route);

		Node node = root;

		for (PathSegment pathSegment : route.getRoutePath().getPathSegments()) {
			if (pathSegment.isLiteral()) {
				node = node.literalChildren.computeIfAbsent(pathSegment.getLiteral().get(), literal -> new Node());
			} else {
				String pathParameterName = pathSegment.getParameterName().get();
				PathParameterType pathParameterType = pathSegment.getParameterType().get();
				List<ParameterEdge> edges = pathParameterType == PathParameterType.REST_OF_PATH ? node.restOfPathEdges : node.parameterEdges;
				ParameterEdge matchingEdge = null;

				for (ParameterEdge edge : edges) {
					if (edge.getPathParameterName().equals(pathParameterName) && edge.getPathParameterType() == pathParameterType) {
						matchingEdge = edge;
						break;
					}
				}

				if (matchingEdge == null) {
					matchingEdge = new ParameterEdge(pathParameterName, pathParameterType, new Node());
					edges.add(matchingEdge);
				}

				node = matchingEdge.getNode();
			}
		}

		for (HttpMethod httpMethod : route.getHttpMethods()) {
			Route existingRoute = node.routesByHttpMethod.putIfAbsent(httpMethod, route);

			if (existingRoute != null)
				throw new ConfigurationException(format("Route %s %s conflicts with previously-registered route %s %s",
						httpMethod.name(), route.getRoutePath().getPattern(), httpMethod.name(), existingRoute.getRoutePath().getPattern()));
		}
	}

	private static int precedenceFor(@NonNull PathParameterType pathParameterType) {
		requireNonNull(pathParameterType);

		switch (pathParameterType) {
			case INTEGER:
				return 0;
			case FLOAT:
				return 1;
			default:
				return 2;
		}
	}

	/**
	 * Every registered route, in registration order.
	 *
	 * @return the routes
	 */
	@NonNull
	public List<@NonNull Route> getRoutes() {
		getLock().lock();

		try {
			return List.copyOf(this.routes);
		} finally {
			getLock().unlock();
		}
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{compiled=%s, routes=%s}", getClass().getSimpleName(), isCompiled(), getRoutes());
	}

	@NonNull
	private ReentrantLock getLock() {
		return this.lock;
	}

	// Mutable only until freeze(), which runs before the tree is published
	private static final class Node {
		@NonNull
		private Map<@NonNull String, @NonNull Node> literalChildren;
		@NonNull
		private List<@NonNull ParameterEdge> parameterEdges;
		@NonNull
		private List<@NonNull ParameterEdge> restOfPathEdges;
		@NonNull
		private Map<@NonNull HttpMethod, @NonNull Route> routesByHttpMethod;

		private Node() {
			this.literalChildren = new HashMap<>();
			this.parameterEdges = new ArrayList<>();
			this.restOfPathEdges = new ArrayList<>();
			this.routesByHttpMethod = new EnumMap<>(HttpMethod.class);
		}

		private void freeze() {
			for (Node literalChild : this.literalChildren.values())
				literalChild.freeze();

			for (ParameterEdge parameterEdge : this.parameterEdges)
				parameterEdge.getNode().freeze();

			for (ParameterEdge restOfPathEdge : this.restOfPathEdges)
				restOfPathEdge.getNode().freeze();

			// List#sort is stable, so equal precedence keeps registration order
			List<ParameterEdge> sortedParameterEdges = new ArrayList<>(this.parameterEdges);
			sortedParameterEdges.sort(PARAMETER_EDGE_PRECEDENCE);

			this.literalChildren = Map.copyOf(this.literalChildren);
			this.parameterEdges = List.copyOf(sortedParameterEdges);
			this.restOfPathEdges = List.copyOf(this.restOfPathEdges);
			this.routesByHttpMethod = Collections.unmodifiableMap(this.routesByHttpMethod);
		}
	}

	private static final class ParameterEdge {
		@NonNull
		private final String pathParameterName;
		@NonNull
		private final PathParameterType pathParameterType;
		@NonNull
		private final Node node;

		private ParameterEdge(@NonNull String pathParameterName,
													@NonNull PathParameterType pathParameterType,
													@NonNull Node node) {
			this.pathParameterName = requireNonNull(pathParameterName);
			this.pathParameterType = requireNonNull(pathParameterType);
			this.node = requireNonNull(node);
		}

		@NonNull
		String getPathParameterName() {
			return this.pathParameterName;
		}

		@NonNull
		PathParameterType getPathParameterType() {
			return this.pathParameterType;
		}

		@NonNull
		Node getNode() {
			return this.node;
		}
	}
}

package io.intellixity.polydata.api;

import io.intellixity.polydata.notify.Subscription;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Generated GraphQL resolvers of one entity plus the SDL declaring them.
 * <p>
 * Subscription fields open a {@link Subscription} on the matching change channel.
 */
public record GraphQlSurface(
    String typeName,
    Map<String, GraphQlResolver> query,
    Map<String, GraphQlResolver> mutation,
    Map<String, Supplier<Subscription>> subscription,
    String sdl
) {
  public GraphQlSurface {
    query = Map.copyOf(query);
    mutation = Map.copyOf(mutation);
    subscription = Map.copyOf(subscription);
  }
}

package io.intellixity.squrrl.render;

/**
 * Render settings fixed when a renderer is constructed.
 *
 * @param positionalPlaceholder text emitted for unnamed parameters ({@code %s} by default)
 */
public record RenderOptions(String positionalPlaceholder) {
  public static final String DEFAULT_POSITIONAL_PLACEHOLDER = "%s";

  public RenderOptions {
    if (positionalPlaceholder == null || positionalPlaceholder.isBlank()) {
      throw new IllegalArgumentException("positionalPlaceholder must not be blank");
    }
  }

  public static RenderOptions defaults() {
    return new RenderOptions(DEFAULT_POSITIONAL_PLACEHOLDER);
  }

  /** Defaults overridden by every {@code META-INF/squrrl.properties} on the context class path. */
  public static RenderOptions load() {
    return RenderOptionsLoader.load(Thread.currentThread().getContextClassLoader());
  }

  public RenderOptions withPositionalPlaceholder(String placeholder) {
    return new RenderOptions(placeholder);
  }
}

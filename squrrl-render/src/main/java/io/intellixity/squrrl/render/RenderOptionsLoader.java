package io.intellixity.squrrl.render;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Enumeration;
import java.util.Properties;

/**
 * Reads {@code META-INF/squrrl.properties} resources, Java Properties files of the form:
 *
 * <pre>
 * squrrl.placeholder.positional=?
 * </pre>
 *
 * Resources are applied in class path order; later ones override earlier ones.
 */
final class RenderOptionsLoader {
  static final String RESOURCE = "META-INF/squrrl.properties";
  static final String POSITIONAL_PLACEHOLDER = "squrrl.placeholder.positional";

  private static final Logger log = LoggerFactory.getLogger(RenderOptionsLoader.class);

  private RenderOptionsLoader() {}

  static RenderOptions load(ClassLoader cl) {
    if (cl == null) cl = RenderOptionsLoader.class.getClassLoader();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to enumerate " + RESOURCE, e);
    }

    RenderOptions options = RenderOptions.defaults();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to load " + RESOURCE + " from " + url, e);
      }

      String placeholder = p.getProperty(POSITIONAL_PLACEHOLDER);
      if (placeholder != null) {
        if (placeholder.isBlank()) {
          throw new IllegalArgumentException(POSITIONAL_PLACEHOLDER + " must not be blank in " + url);
        }
        options = options.withPositionalPlaceholder(placeholder.trim());
      }
      if (log.isDebugEnabled()) {
        log.debug("squrrl.options resource={} positionalPlaceholder={}", url, options.positionalPlaceholder());
      }
    }
    return options;
  }
}

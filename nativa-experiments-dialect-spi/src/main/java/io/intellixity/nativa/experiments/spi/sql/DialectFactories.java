package io.intellixity.nativa.experiments.spi.sql;

import io.intellixity.nativa.experiments.error.MissingConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Discovers {@link SqlDialectFactory} implementations from {@code META-INF/nativa.factories}.
 *
 * Each resource is a Java Properties file; the key is the factory interface name and the value a
 * comma-separated list of implementation classes:
 * <pre>
 * io.intellixity.nativa.experiments.spi.sql.SqlDialectFactory=com.acme.FooDialect$Factory,com.acme.BarDialect$Factory
 * </pre>
 */
public final class DialectFactories {
  private static final Logger log = LoggerFactory.getLogger(DialectFactories.class);

  public static final String RESOURCE = "META-INF/nativa.factories";

  private final Map<String, SqlDialectFactory> byId;

  private DialectFactories(Map<String, SqlDialectFactory> byId) {
    this.byId = Collections.unmodifiableMap(byId);
  }

  public static DialectFactories load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static DialectFactories load(ClassLoader cl) {
    if (cl == null) cl = DialectFactories.class.getClassLoader();
    return of(instantiate(implNames(cl), cl));
  }

  /** Builds a registry from explicit factories; ids are case-insensitive and must be unique. */
  public static DialectFactories of(List<SqlDialectFactory> factories) {
    Map<String, SqlDialectFactory> byId = new LinkedHashMap<>();
    for (SqlDialectFactory f : factories) {
      String id = f.id().toLowerCase(Locale.ROOT);
      SqlDialectFactory prev = byId.putIfAbsent(id, f);
      if (prev != null) {
        throw new IllegalStateException("Duplicate SQL dialect id '" + id + "': "
            + prev.getClass().getName() + " and " + f.getClass().getName());
      }
    }
    if (log.isDebugEnabled()) log.debug("nativa.experiments op=loadDialects ids={}", byId.keySet());
    return new DialectFactories(byId);
  }

  public List<String> ids() {
    return List.copyOf(byId.keySet());
  }

  public SqlDialect create(String id, ConnectionParams params) {
    Objects.requireNonNull(id, "id");
    SqlDialectFactory f = byId.get(id.toLowerCase(Locale.ROOT));
    if (f == null) {
      throw new MissingConfigurationException("Unknown SQL dialect '" + id + "'. Available: " + byId.keySet());
    }
    return f.create(params == null ? ConnectionParams.EMPTY : params);
  }

  private static List<String> implNames(ClassLoader cl) {
    String key = SqlDialectFactory.class.getName();
    LinkedHashSet<String> names = new LinkedHashSet<>();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to load " + RESOURCE + " from " + url, e);
      }
      String v = p.getProperty(key);
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) names.add(name);
      }
    }
    return new ArrayList<>(names);
  }

  private static List<SqlDialectFactory> instantiate(List<String> names, ClassLoader cl) {
    List<SqlDialectFactory> out = new ArrayList<>(names.size());
    for (String name : names) {
      try {
        Class<?> raw = Class.forName(name, true, cl);
        if (!SqlDialectFactory.class.isAssignableFrom(raw)) {
          throw new IllegalArgumentException("Class " + name + " does not implement " + SqlDialectFactory.class.getName());
        }
        out.add((SqlDialectFactory) raw.getDeclaredConstructor().newInstance());
      } catch (ReflectiveOperationException e) {
        throw new IllegalStateException("Failed to instantiate " + name + " for SPI " + SqlDialectFactory.class.getName(), e);
      }
    }
    return out;
  }
}

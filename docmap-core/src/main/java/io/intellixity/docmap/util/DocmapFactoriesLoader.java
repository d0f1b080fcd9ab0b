package io.intellixity.docmap.util;

import io.intellixity.docmap.DocmapException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Discovers extension implementations listed in {@code META-INF/docmap.factories}.
 * <p>
 * Each resource is a properties file keyed by the extension interface name; values are
 * comma-separated implementation class names with a public no-arg constructor:
 * <pre>
 * io.intellixity.docmap.record.RecordAdapterProvider=com.acme.OrderAdapters,com.acme.UserAdapters
 * </pre>
 * Order follows classpath order; duplicates are dropped.
 */
public final class DocmapFactoriesLoader {
  public static final String RESOURCE = "META-INF/docmap.factories";

  private DocmapFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = (cl == null) ? DocmapFactoriesLoader.class.getClassLoader() : cl;

    List<T> out = new ArrayList<>();
    for (String implName : implementationNames(spiType.getName(), loader)) {
      out.add(instantiate(implName, spiType, loader));
    }
    return out;
  }

  private static Set<String> implementationNames(String key, ClassLoader loader) {
    Set<String> names = new LinkedHashSet<>();
    Enumeration<URL> urls;
    try {
      urls = loader.getResources(RESOURCE);
    } catch (IOException e) {
      throw new DocmapException("Failed to enumerate " + RESOURCE, e);
    }
    while (urls.hasMoreElements()) {
      URL url = urls.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new DocmapException("Failed to read " + url, e);
      }
      String v = p.getProperty(key);
      if (v == null) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) names.add(name);
      }
    }
    return names;
  }

  private static <T> T instantiate(String implName, Class<T> spiType, ClassLoader loader) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, loader);
    } catch (ClassNotFoundException e) {
      throw new DocmapException("Class " + implName + " listed for " + spiType.getName() + " was not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new DocmapException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new DocmapException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}

package io.intellixity.docmap.exec;

import io.intellixity.docmap.DocmapException;
import io.intellixity.docmap.query.QuerySpec;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Mapper defaults.
 * <p>
 * {@link #load()} reads {@code docmap.properties} from the classpath, then lets system properties
 * of the same name override it:
 * <pre>
 * docmap.update-batch-size=100
 * </pre>
 */
public record DocmapConfig(int updateBatchSize) {
  public static final String RESOURCE = "docmap.properties";
  public static final String UPDATE_BATCH_SIZE = "docmap.update-batch-size";
  public static final int DEFAULT_UPDATE_BATCH_SIZE = 100;

  public DocmapConfig {
    checkBatchSize(updateBatchSize);
  }

  public static DocmapConfig defaults() {
    return new DocmapConfig(DEFAULT_UPDATE_BATCH_SIZE);
  }

  public static DocmapConfig load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static DocmapConfig load(ClassLoader cl) {
    ClassLoader loader = (cl == null) ? DocmapConfig.class.getClassLoader() : cl;
    Properties p = new Properties();
    try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
      if (in != null) p.load(in);
    } catch (IOException e) {
      throw new DocmapException("Failed to read " + RESOURCE, e);
    }
    String override = System.getProperty(UPDATE_BATCH_SIZE);
    if (override != null) p.setProperty(UPDATE_BATCH_SIZE, override);
    return fromProperties(p);
  }

  public static DocmapConfig fromProperties(Properties p) {
    String raw = p.getProperty(UPDATE_BATCH_SIZE);
    if (raw == null || raw.isBlank()) return defaults();
    try {
      return new DocmapConfig(Integer.parseInt(raw.trim()));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(UPDATE_BATCH_SIZE + " must be an integer, got '" + raw + "'", e);
    }
  }

  static int checkBatchSize(int size) {
    if (size <= 0 || size > QuerySpec.LIMIT_MAX) {
      throw new IllegalArgumentException("update batch size must be in 1.." + QuerySpec.LIMIT_MAX + ", got " + size);
    }
    return size;
  }
}

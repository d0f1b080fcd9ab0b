package io.intellixity.docmap;

/** Root of every failure raised by docmap. */
public class DocmapException extends RuntimeException {
  public DocmapException(String message) {
    super(message);
  }

  public DocmapException(String message, Throwable cause) {
    super(message, cause);
  }
}

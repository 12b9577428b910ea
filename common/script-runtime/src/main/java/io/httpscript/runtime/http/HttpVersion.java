package io.httpscript.runtime.http;

public enum HttpVersion {
  HTTP_0_9("HTTP/0.9"),
  HTTP_1_0("HTTP/1.0"),
  HTTP_1_1("HTTP/1.1"),
  HTTP_2("HTTP/2.0"),
  HTTP_3("HTTP/3.0");

  private final String text;

  HttpVersion(String text) {
    this.text = text;
  }

  public static HttpVersion of(int major, int minor) {
    return switch (major) {
      case 0 -> HTTP_0_9;
      case 1 -> minor == 0 ? HTTP_1_0 : HTTP_1_1;
      case 2 -> HTTP_2;
      case 3 -> HTTP_3;
      default -> throw new IllegalArgumentException("Unsupported HTTP version " + major + "." + minor);
    };
  }

  @Override
  public String toString() {
    return text;
  }
}

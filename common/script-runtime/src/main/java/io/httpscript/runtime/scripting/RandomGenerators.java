package io.httpscript.runtime.scripting;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Values behind the {@code $uuid}, {@code $timestamp}, {@code $isoTimestamp} and {@code $random.*}
 * generators. Every call produces a fresh value.
 */
public final class RandomGenerators {

  private static final String ALPHABETIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";
  private static final String ALPHANUMERIC = ALPHABETIC + "0123456789";
  private static final String HEXADECIMAL = "0123456789ABCDEF";
  private static final String LOWERCASE = "abcdefghijklmnopqrstuvwxyz";

  public String uuid() {
    return UUID.randomUUID().toString();
  }

  /**
   * Seconds since the epoch.
   */
  public long timestamp() {
    return Instant.now().getEpochSecond();
  }

  /**
   * Current time as RFC 3339 text with the local offset.
   */
  public String isoTimestamp() {
    return OffsetDateTime.now().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
  }

  public int integer() {
    return ThreadLocalRandom.current().nextInt();
  }

  /**
   * Random integer in {@code [0, max)}.
   */
  public int integer(int max) {
    return integer(0, max);
  }

  /**
   * Random integer in {@code [min, max)}.
   */
  public int integer(int min, int max) {
    if (max <= min) {
      throw new IllegalArgumentException("$random.integer expects min < max, got " + min + ", " + max);
    }
    return ThreadLocalRandom.current().nextInt(min, max);
  }

  public double decimal() {
    return ThreadLocalRandom.current().nextDouble();
  }

  /**
   * Random number in {@code [0, max)}.
   */
  public double decimal(double max) {
    return decimal(0, max);
  }

  /**
   * Random number in {@code [min, max)}.
   */
  public double decimal(double min, double max) {
    if (!(max > min)) {
      throw new IllegalArgumentException("$random.float expects min < max, got " + min + ", " + max);
    }
    return ThreadLocalRandom.current().nextDouble(min, max);
  }

  public String email() {
    return alphanumeric(12) + "@" + alphanumeric(6) + "." + pick(LOWERCASE, 2);
  }

  public String alphabetic(int length) {
    return pick(ALPHABETIC, length);
  }

  public String alphanumeric(int length) {
    return pick(ALPHANUMERIC, length);
  }

  /**
   * Upper-case hexadecimal digits.
   */
  public String hexadecimal(int length) {
    return pick(HEXADECIMAL, length);
  }

  private static String pick(String alphabet, int length) {
    if (length < 0) {
      throw new IllegalArgumentException("length must not be negative, got " + length);
    }
    ThreadLocalRandom random = ThreadLocalRandom.current();
    StringBuilder out = new StringBuilder(length);
    for (int i = 0; i < length; i++) {
      out.append(alphabet.charAt(random.nextInt(alphabet.length())));
    }
    return out.toString();
  }
}

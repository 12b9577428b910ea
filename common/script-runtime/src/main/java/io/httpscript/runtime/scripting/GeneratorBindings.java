package io.httpscript.runtime.scripting;

import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.Value;

/**
 * Host object the generator prelude calls into. Argument lists arrive as guest arrays.
 */
public final class GeneratorBindings {

  private final RandomGenerators generators;

  GeneratorBindings(RandomGenerators generators) {
    this.generators = generators;
  }

  @HostAccess.Export
  public String uuid() {
    return generators.uuid();
  }

  @HostAccess.Export
  public long timestamp() {
    return generators.timestamp();
  }

  @HostAccess.Export
  public String isoTimestamp() {
    return generators.isoTimestamp();
  }

  @HostAccess.Export
  public String email() {
    return generators.email();
  }

  @HostAccess.Export
  public int integer(Value args) {
    return switch ((int) args.getArraySize()) {
      case 0 -> generators.integer();
      case 1 -> generators.integer(intArgument(args, 0, "integer"));
      case 2 -> generators.integer(intArgument(args, 0, "integer"), intArgument(args, 1, "integer"));
      default -> throw new IllegalArgumentException("$random.integer expects at most 2 arguments");
    };
  }

  @HostAccess.Export
  public double decimal(Value args) {
    return switch ((int) args.getArraySize()) {
      case 0 -> generators.decimal();
      case 1 -> generators.decimal(doubleArgument(args, 0));
      case 2 -> generators.decimal(doubleArgument(args, 0), doubleArgument(args, 1));
      default -> throw new IllegalArgumentException("$random.float expects at most 2 arguments");
    };
  }

  @HostAccess.Export
  public String alphabetic(Value length) {
    return generators.alphabetic(length(length, "alphabetic"));
  }

  @HostAccess.Export
  public String alphanumeric(Value length) {
    return generators.alphanumeric(length(length, "alphanumeric"));
  }

  @HostAccess.Export
  public String hexadecimal(Value length) {
    return generators.hexadecimal(length(length, "hexadecimal"));
  }

  private static int length(Value length, String generator) {
    if (length == null || !length.fitsInInt()) {
      throw new IllegalArgumentException("$random." + generator + " expects an integer length");
    }
    return length.asInt();
  }

  private static int intArgument(Value args, int index, String generator) {
    Value argument = args.getArrayElement(index);
    if (!argument.fitsInInt()) {
      throw new IllegalArgumentException("$random." + generator + " expects integer arguments, got " + argument);
    }
    return argument.asInt();
  }

  private static double doubleArgument(Value args, int index) {
    Value argument = args.getArrayElement(index);
    if (!argument.fitsInDouble()) {
      throw new IllegalArgumentException("$random.float expects numeric arguments, got " + argument);
    }
    return argument.asDouble();
  }
}

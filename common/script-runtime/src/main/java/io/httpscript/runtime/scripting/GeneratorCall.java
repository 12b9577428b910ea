package io.httpscript.runtime.scripting;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A generator reference such as {@code $random.integer(1, 10)} parsed from placeholder text,
 * for contexts where no script may run.
 *
 * <p>{@link #parse} returns empty for anything that is not a well-formed generator call, including
 * non-numeric or wrongly counted arguments; callers leave such placeholders unresolved.
 */
public record GeneratorCall(Generator generator, List<Number> arguments) {

  private static final Pattern CALL = Pattern.compile(
      "\\$(uuid|timestamp|isoTimestamp|random\\.[A-Za-z]+)\\s*(?:\\((.*)\\))?", Pattern.DOTALL);
  private static final Pattern NUMBER = Pattern.compile("[+-]?\\d+(\\.\\d+)?");

  public GeneratorCall {
    Objects.requireNonNull(generator, "generator");
    arguments = List.copyOf(arguments);
  }

  public enum Generator {
    UUID("uuid", 0, 0),
    TIMESTAMP("timestamp", 0, 0),
    ISO_TIMESTAMP("isoTimestamp", 0, 0),
    RANDOM_UUID("random.uuid", 0, 0),
    RANDOM_EMAIL("random.email", 0, 0),
    RANDOM_INTEGER("random.integer", 0, 2),
    RANDOM_FLOAT("random.float", 0, 2),
    RANDOM_ALPHABETIC("random.alphabetic", 1, 1),
    RANDOM_ALPHANUMERIC("random.alphanumeric", 1, 1),
    RANDOM_HEXADECIMAL("random.hexadecimal", 1, 1);

    private final String reference;
    private final int minArguments;
    private final int maxArguments;

    Generator(String reference, int minArguments, int maxArguments) {
      this.reference = reference;
      this.minArguments = minArguments;
      this.maxArguments = maxArguments;
    }

    static Optional<Generator> byReference(String reference) {
      for (Generator generator : values()) {
        if (generator.reference.equals(reference)) {
          return Optional.of(generator);
        }
      }
      return Optional.empty();
    }

    boolean acceptsArgumentCount(int count) {
      return count >= minArguments && count <= maxArguments;
    }

    boolean isIntegral() {
      return this != RANDOM_FLOAT;
    }
  }

  public static Optional<GeneratorCall> parse(String text) {
    Matcher matcher = CALL.matcher(text.trim());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    Optional<Generator> generator = Generator.byReference(matcher.group(1));
    if (generator.isEmpty()) {
      return Optional.empty();
    }
    Optional<List<Number>> arguments = arguments(matcher.group(2), generator.get().isIntegral());
    if (arguments.isEmpty() || !generator.get().acceptsArgumentCount(arguments.get().size())) {
      return Optional.empty();
    }
    return Optional.of(new GeneratorCall(generator.get(), arguments.get()));
  }

  private static Optional<List<Number>> arguments(String list, boolean integral) {
    if (list == null || list.isBlank()) {
      return Optional.of(List.of());
    }
    List<Number> numbers = new ArrayList<>();
    for (String part : list.split(",", -1)) {
      String token = part.trim();
      if (!NUMBER.matcher(token).matches()) {
        return Optional.empty();
      }
      try {
        numbers.add(integral ? Integer.parseInt(token) : Double.parseDouble(token));
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
    }
    return Optional.of(numbers);
  }

  /**
   * Produces a fresh value.
   *
   * @throws IllegalArgumentException when the arguments are out of range, e.g. {@code min >= max}
   */
  public String evaluate(RandomGenerators generators) {
    return switch (generator) {
      case UUID, RANDOM_UUID -> generators.uuid();
      case TIMESTAMP -> Long.toString(generators.timestamp());
      case ISO_TIMESTAMP -> generators.isoTimestamp();
      case RANDOM_EMAIL -> generators.email();
      case RANDOM_INTEGER -> Integer.toString(switch (arguments.size()) {
        case 0 -> generators.integer();
        case 1 -> generators.integer(intArgument(0));
        default -> generators.integer(intArgument(0), intArgument(1));
      });
      case RANDOM_FLOAT -> Double.toString(switch (arguments.size()) {
        case 0 -> generators.decimal();
        case 1 -> generators.decimal(arguments.get(0).doubleValue());
        default -> generators.decimal(arguments.get(0).doubleValue(), arguments.get(1).doubleValue());
      });
      case RANDOM_ALPHABETIC -> generators.alphabetic(intArgument(0));
      case RANDOM_ALPHANUMERIC -> generators.alphanumeric(intArgument(0));
      case RANDOM_HEXADECIMAL -> generators.hexadecimal(intArgument(0));
    };
  }

  private int intArgument(int index) {
    return arguments.get(index).intValue();
  }
}

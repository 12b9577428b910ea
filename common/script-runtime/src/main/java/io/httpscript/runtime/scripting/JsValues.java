package io.httpscript.runtime.scripting;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.graalvm.polyglot.Value;
import org.graalvm.polyglot.proxy.ProxyArray;
import org.graalvm.polyglot.proxy.ProxyObject;

/**
 * Conversions between guest values and the plain Java data kept in variable stores.
 */
final class JsValues {

  // JS prints integral numbers below 1e21 without exponent
  private static final double PLAIN_INTEGRAL_LIMIT = 1e21;

  private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();

  private JsValues() {
  }

  /**
   * Deep copy of a guest value; {@code null}/{@code undefined} and functions become {@code null}.
   */
  static Object toJava(Value value) {
    if (value == null || value.isNull() || value.canExecute()) {
      return null;
    }
    if (value.isBoolean()) {
      return value.asBoolean();
    }
    if (value.isNumber()) {
      return value.fitsInLong() ? (Object) value.asLong() : (Object) value.asDouble();
    }
    if (value.isString()) {
      return value.asString();
    }
    if (value.hasArrayElements()) {
      List<Object> list = new ArrayList<>();
      for (long i = 0; i < value.getArraySize(); i++) {
        list.add(toJava(value.getArrayElement(i)));
      }
      return list;
    }
    if (value.hasMembers()) {
      Map<String, Object> map = new LinkedHashMap<>();
      for (String key : value.getMemberKeys()) {
        Object member = toJava(value.getMember(key));
        if (member != null) {
          map.put(key, member);
        }
      }
      return map;
    }
    return value.toString();
  }

  /**
   * Guest view of stored data. Maps and lists are copied, so scripts cannot change a store by
   * mutating what they read from it.
   */
  static Object toGuest(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      map.forEach((key, item) -> copy.put(String.valueOf(key), toGuest(item)));
      return ProxyObject.fromMap(copy);
    }
    if (value instanceof List<?> list) {
      List<Object> copy = new ArrayList<>();
      list.forEach(item -> copy.add(toGuest(item)));
      return ProxyArray.fromList(copy);
    }
    return value;
  }

  /**
   * Text substituted for a stored value: strings verbatim, integral numbers without a fraction,
   * structures as JSON.
   */
  static String toText(Object value) {
    if (value instanceof String text) {
      return text;
    }
    if (value instanceof Double number && number == Math.rint(number) && Math.abs(number) < PLAIN_INTEGRAL_LIMIT) {
      return BigDecimal.valueOf(number).setScale(0, RoundingMode.UNNECESSARY).toPlainString();
    }
    if (value instanceof Number || value instanceof Boolean) {
      return value.toString();
    }
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Cannot render variable value " + value, ex);
    }
  }

  static String toJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Cannot serialise value to JSON", ex);
    }
  }

  static ObjectMapper mapper() {
    return MAPPER;
  }
}

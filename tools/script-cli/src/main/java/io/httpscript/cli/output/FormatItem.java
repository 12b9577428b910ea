package io.httpscript.cli.output;

import io.httpscript.cli.UsageException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Piece of a request or response format string.
 *
 * <p>Directives: {@code %R} first line, {@code %H} headers, {@code %B} body, {@code %T} tests,
 * {@code %N} request name. {@code %%} is a literal percent sign.
 */
public sealed interface FormatItem {

    enum Directive implements FormatItem {
        FIRST_LINE,
        HEADERS,
        BODY,
        TESTS,
        NAME
    }

    record Text(String text) implements FormatItem {

        public Text {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * @throws UsageException on a {@code %} followed by anything but a known directive
     */
    static List<FormatItem> parse(String format) {
        Objects.requireNonNull(format, "format");
        List<FormatItem> items = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < format.length(); i++) {
            char ch = format.charAt(i);
            if (ch != '%') {
                text.append(ch);
                continue;
            }
            if (++i >= format.length()) {
                throw new UsageException("Format '" + format + "' ends with a dangling '%'");
            }
            char directive = format.charAt(i);
            if (directive == '%') {
                text.append('%');
                continue;
            }
            if (text.length() > 0) {
                items.add(new Text(text.toString()));
                text.setLength(0);
            }
            items.add(switch (directive) {
                case 'R' -> Directive.FIRST_LINE;
                case 'H' -> Directive.HEADERS;
                case 'B' -> Directive.BODY;
                case 'T' -> Directive.TESTS;
                case 'N' -> Directive.NAME;
                default -> throw new UsageException("Invalid formatting character '" + directive + "' in '" + format + "'");
            });
        }
        if (text.length() > 0) {
            items.add(new Text(text.toString()));
        }
        return List.copyOf(items);
    }

    /**
     * Expands the {@code \n} and {@code \t} escapes shells pass through literally.
     */
    static String unescape(String argument) {
        return argument.replace("\\n", "\n").replace("\\t", "\t");
    }
}

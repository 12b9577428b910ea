package io.httpscript.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class HttpScriptParserTest {

  private final HttpScriptParser parser = new HttpScriptParser();

  @Test
  void parsesFullFileWithCommentsVariablesAndHandlers() {
    String source = """
        # Comment 1
        # Comment 2
        @variable=value
        GET http://{{host}}.com HTTP/1.1
        Accept: *#/*
        # Commented Header
        Content-Type: {{ content_type }}

        {
            "fieldA": "value1"
        }

        > {%
            console.log('Success!');
        %}

        ###

        # Request Comment 2
        #
        GET http://example.com/{{url_param}}
        Accept: */*

        ###

        """;

    ScriptFile file = parser.parse("test.http", source);

    assertThat(file.requestScripts()).hasSize(2);

    RequestScript first = file.requestScripts().get(0);
    assertThat(first.name()).isNull();
    assertThat(first.requestVariables()).extracting(VariableDeclaration::name).containsExactly("variable");
    assertThat(first.requestVariables().get(0).value().value()).isEqualTo("value");
    assertThat(first.request().method()).isEqualTo(Method.GET);
    assertThat(first.request().target().value()).isEqualTo("http://{{host}}.com");
    assertThat(first.request().headers()).extracting(Header::fieldName).containsExactly("Accept", "Content-Type");
    assertThat(first.request().headers().get(0).fieldValue().value()).isEqualTo("*#/*");
    assertThat(first.request().body().value()).isEqualTo("{\n    \"fieldA\": \"value1\"\n}");
    assertThat(first.handler().script()).isEqualTo("console.log('Success!');");
    assertThat(first.selection().start()).isEqualTo(new Position(3, 1));

    RequestScript second = file.requestScripts().get(1);
    assertThat(second.request().target().value()).isEqualTo("http://example.com/{{url_param}}");
    assertThat(second.request().body()).isNull();
    assertThat(second.handler()).isNull();
  }

  @Test
  void minimalFile() {
    ScriptFile file = parser.parse("min.http", "POST http://example.com HTTP/1.1\n");

    assertThat(file.requestScripts()).singleElement().satisfies(script -> {
      assertThat(script.request().method()).isEqualTo(Method.POST);
      assertThat(script.request().target()).isInstanceOf(Value.WithoutInline.class);
      assertThat(script.request().target().value()).isEqualTo("http://example.com");
    });
  }

  @Test
  void methodDefaultsToGet() {
    ScriptFile file = parser.parse("get.http", "https://example.com/path\n");

    Request request = file.requestScripts().get(0).request();
    assertThat(request.method()).isEqualTo(Method.GET);
    assertThat(request.target().value()).isEqualTo("https://example.com/path");
  }

  @Test
  void unsupportedMethodIsRejectedWithLocation() {
    assertThatThrownBy(() -> parser.parse("bad.http", "\n\nHEAD http://example.com\n"))
        .isInstanceOf(ScriptParseException.class)
        .hasMessageContaining("Unsupported HTTP method 'HEAD'")
        .satisfies(ex -> assertThat(((ScriptParseException) ex).selection().start()).isEqualTo(new Position(3, 1)));
  }

  @Test
  void sectionNamesComeFromSeparatorLine() {
    String source = """
        ### first request
        GET http://a.com

        ###
        GET http://b.com

        ###    \t
        GET http://c.com
        """;

    List<RequestScript> scripts = parser.parse("names.http", source).requestScripts();

    assertThat(scripts).extracting(RequestScript::name).containsExactly("first request", null, null);
  }

  @Test
  void oneLineHandlerAfterBody() {
    String source = """
        POST http://example.com HTTP/1.1

        {}

        > {% console.log('no'); %}""";

    RequestScript script = parser.parse("weird.http", source).requestScripts().get(0);

    assertThat(script.request().body().value()).isEqualTo("{}");
    assertThat(script.handler().script()).isEqualTo("console.log('no');");
  }

  @Test
  void handlerDirectlyAfterHeadersMeansNoBody() {
    String source = """
        POST http://example.com HTTP/1.1
        Accept: */*

        > {%
            console.log('cool');
        %}
        ###
        """;

    ScriptFile file = parser.parse("empty-body.http", source);

    assertThat(file.requestScripts()).hasSize(1);
    RequestScript script = file.requestScripts().get(0);
    assertThat(script.request().body()).isNull();
    assertThat(script.handler().script()).isEqualTo("console.log('cool');");
  }

  @Test
  void bodyKeepsInnerBlankLinesAndDropsTrailingOnes() {
    String source = """
        POST http://example.com HTTP/1.1
        Accept: */*

        {
            "test": "a",
            "what": [

            ]
        }


        > {%
            console.log('cool');
        %}
        """;

    Value body = parser.parse("body.http", source).requestScripts().get(0).request().body();

    assertThat(body.value()).isEqualTo("{\n    \"test\": \"a\",\n    \"what\": [\n\n    ]\n}");
  }

  @Test
  void commentBeforeResponseHandlerIsNotPartOfBody() {
    String source = """
        POST http://httpbin.org/post

        {}

        # should be fine > {% %}
        > {%
          console.log('hi');
        %}
        """;

    RequestScript script = parser.parse("comment.http", source).requestScripts().get(0);

    assertThat(script.request().body().value()).isEqualTo("{}");
    assertThat(script.handler().script()).isEqualTo("console.log('hi');");
  }

  @Test
  void bodyKeepsLeadingHashLines() {
    String source = "POST http://x\nContent-Type: text/plain\n\n# Title\nline\n";

    RequestScript script = parser.parse("markdown.http", source).requestScripts().get(0);

    assertThat(script.request().body().value()).isEqualTo("# Title\nline");
  }

  @Test
  void onlyCommentsBeforeResponseHandlerMeanNoBody() {
    String source = """
        GET http://example.com

        # nothing to send
        > {% client.log('done'); %}
        """;

    RequestScript script = parser.parse("nobody.http", source).requestScripts().get(0);

    assertThat(script.request().body()).isNull();
    assertThat(script.handler().script()).isEqualTo("client.log('done');");
  }

  @Test
  void lineAfterRequestLineIsAHeader() {
    RequestScript script = parser.parse("mixed.http", "GET http://example.com HTTP/1.1\nheader: some-value")
        .requestScripts().get(0);

    assertThat(script.request().headers()).singleElement().satisfies(header -> {
      assertThat(header.fieldName()).isEqualTo("header");
      assertThat(header.fieldValue().value()).isEqualTo("some-value");
    });
    assertThat(script.request().body()).isNull();
  }

  @Test
  void bodyWithoutBlankLineIsRejected() {
    assertThatThrownBy(() -> parser.parse("nobreak.http", "POST http://example.com\n{\"a\": 1}\n"))
        .isInstanceOf(ScriptParseException.class)
        .hasMessageContaining("Invalid header");
  }

  @Test
  void toleratesWhitespaceAroundRequestLine() {
    RequestScript script = parser.parse("ws.http", "      POST       http://example.com     HTTP/1.1     \n")
        .requestScripts().get(0);

    assertThat(script.request().method()).isEqualTo(Method.POST);
    assertThat(script.request().target().value()).isEqualTo("http://example.com");
  }

  @Test
  void multilineRequestLine() {
    String source = "GET https://httpbin.org/get\n         ?request=2\n         HTTP/1.0\n     ";

    Request request = parser.parse("multi.http", source).requestScripts().get(0).request();

    assertThat(request.target().value().replaceAll("\\s", "")).isEqualTo("https://httpbin.org/get?request=2");
    assertThat(request.headers()).isEmpty();
  }

  @Test
  void variableDeclarationsKeepOrderAndPlaceholders() {
    String source = """
        @a=y
        @b = ywae
        @c = "w"
        @d = {{x}} + y
        GET http://example.com
        """;

    List<VariableDeclaration> variables = parser.parse("vars.http", source).requestScripts().get(0).requestVariables();

    assertThat(variables).extracting(VariableDeclaration::name).containsExactly("a", "b", "c", "d");
    assertThat(variables).extracting(variable -> variable.value().value())
        .containsExactly("y", "ywae", "\"w\"", "{{x}} + y");
    assertThat(variables.get(3).value().inlineScripts()).extracting(InlineScript::script).containsExactly("x");
  }

  @Test
  void variablesCommentsAndPreRequestHandler() {
    String source = """
        @var = {{variable}} + 1
        # comment
        @w = y

        @variable2 = {{var}} + 1
        #comment
        < {%
            client.log("hello");
        %}
        # Comment

        GET http://{{host}}/get?value=10
        my-header: {{variable2}}

        > {%
            client.log("world");
        %}

        """;

    RequestScript script = parser.parse("pre.http", source).requestScripts().get(0);

    assertThat(script.requestVariables()).extracting(VariableDeclaration::name).containsExactly("var", "w", "variable2");
    assertThat(script.preRequestHandler().script()).isEqualTo("client.log(\"hello\");");
    assertThat(script.request().target().value()).isEqualTo("http://{{host}}/get?value=10");
    assertThat(script.request().headers().get(0).fieldValue().value()).isEqualTo("{{variable2}}");
    assertThat(script.handler().script()).isEqualTo("client.log(\"world\");");
  }

  @Test
  void placeholdersAreExtractedInOrderWithSelections() {
    String source = """
        GET http://{{host}}.com HTTP/1.1
        Content-Type: {{ content_type }}

        {
            "fieldA": {{
            content_type
            }},
            "id": "{{$random.uuid}}-{{$random.uuid}}"
        }
        """;

    Request request = parser.parse("inline.http", source).requestScripts().get(0).request();

    InlineScript host = request.target().inlineScripts().get(0);
    assertThat(host.script()).isEqualTo("host");
    assertThat(host.placeholder()).isEqualTo("{{host}}");
    assertThat(host.selection().start()).isEqualTo(new Position(1, 12));
    assertThat(host.selection().end()).isEqualTo(new Position(1, 20));

    InlineScript header = request.headers().get(0).fieldValue().inlineScripts().get(0);
    assertThat(header.script()).isEqualTo("content_type");
    assertThat(header.placeholder()).isEqualTo("{{ content_type }}");

    List<InlineScript> body = request.body().inlineScripts();
    assertThat(body).extracting(InlineScript::script).containsExactly("content_type", "$random.uuid", "$random.uuid");
    assertThat(body.get(0).placeholder()).isEqualTo("{{\n    content_type\n    }}");
    assertThat(body.get(0).selection().start()).isEqualTo(new Position(5, 15));
  }

  @Test
  void unclosedPlaceholderIsLiteralText() {
    Value target = parser.parse("open.http", "GET http://example.com/{{oops\n").requestScripts().get(0).request().target();

    assertThat(target).isInstanceOf(Value.WithoutInline.class);
    assertThat(target.value()).isEqualTo("http://example.com/{{oops");
  }

  @Test
  void crlfLineEndingsAreAccepted() {
    String source = "POST http://example.com\r\nAccept: */*\r\n\r\n{\"a\": 1}\r\n";

    Request request = parser.parse("crlf.http", source).requestScripts().get(0).request();

    assertThat(request.headers().get(0).fieldValue().value()).isEqualTo("*/*");
    assertThat(request.body().value()).isEqualTo("{\"a\": 1}");
  }

  @Test
  void declarationsWithoutRequestLineFail() {
    assertThatThrownBy(() -> parser.parse("vars-only.http", "GET http://a.com\n\n###\n@a = b\n# nothing else\n"))
        .isInstanceOf(ScriptParseException.class)
        .hasMessageContaining("Expected request line");
  }

  @Test
  void unterminatedHandlerFails() {
    assertThatThrownBy(() -> parser.parse("open-handler.http", "GET http://a.com\n\n> {%\n client.log('x');\n"))
        .isInstanceOf(ScriptParseException.class)
        .hasMessageContaining("Unterminated response handler");
  }

  @Test
  void contentAfterResponseHandlerFails() {
    String source = "GET http://a.com\n\n> {% client.log('x'); %}\nGET http://b.com\n";

    assertThatThrownBy(() -> parser.parse("trailing.http", source))
        .isInstanceOf(ScriptParseException.class)
        .hasMessageContaining("after response handler")
        .satisfies(ex -> assertThat(((ScriptParseException) ex).selection().start().line()).isEqualTo(4));
  }

  @Test
  void malformedDeclarationFails() {
    assertThatThrownBy(() -> parser.parse("decl.http", "@ = nothing\nGET http://a.com\n"))
        .isInstanceOf(ScriptParseException.class)
        .hasMessageStartingWith("decl.http:1:1");
  }

  @Test
  void requestScriptLookupIsOneBased() {
    ScriptFile file = parser.parse("many.http", "GET http://a.com\n\n###\nGET http://b.com\n");

    assertThat(file.requestScript(2).request().target().value()).isEqualTo("http://b.com");
    assertThatThrownBy(() -> file.requestScript(3)).isInstanceOf(IllegalArgumentException.class);
  }
}

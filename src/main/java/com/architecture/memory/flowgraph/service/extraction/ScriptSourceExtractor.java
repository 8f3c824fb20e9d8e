package com.architecture.memory.flowgraph.service.extraction;

import com.architecture.memory.flowgraph.config.ConverterProperties;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort declaration extractor for C# scripts.
 *
 * There is no grammar behind this: declarations are recovered with regular expressions and method
 * bodies are cut out with brace-balance scanning. Declarations that do not match are absent from the
 * result; nothing here throws on malformed input.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScriptSourceExtractor {

    private static final Pattern USING_PATTERN = Pattern.compile("using\\s+([^;]+);");

    private static final Pattern NAMESPACE_PATTERN = Pattern.compile("namespace\\s+([^{\\s]+)");

    private static final Pattern CLASS_PATTERN = Pattern.compile("class\\s+(\\w+)\\s*(?::\\s*(\\w+))?");

    // Modifiers consume their own trailing whitespace; no two whitespace runs may be adjacent
    private static final Pattern FIELD_PATTERN = Pattern.compile(
            "(?:\\[(?:[^\\]]+)\\])?\\s*(?:(public|private|protected|internal)\\s+)?(?:(static)\\s+)?"
                    + "(?:(readonly)\\s+)?(\\w+(?:<[^>]+>)?)\\s+(\\w+)\\s*(?:=\\s*([^;]+))?;");

    private static final Pattern METHOD_PATTERN = Pattern.compile(
            "(?:\\[(?:[^\\]]+)\\])?\\s*(?:(public|private|protected|internal)\\s+)?(?:(static)\\s+)?"
                    + "(?:(virtual|override|abstract)\\s+)?(?:(async)\\s+)?(\\w+(?:<[^>]+>)?)\\s+(\\w+)\\s*"
                    + "\\(([^)]*)\\)\\s*\\{");

    // Statement keywords that the declaration patterns would otherwise take for a type or a name
    private static final Set<String> STATEMENT_KEYWORDS = Set.of(
            "return", "else", "new", "if", "for", "foreach", "while", "switch", "case", "using",
            "yield", "goto", "throw", "namespace", "class", "await", "in", "is", "as", "do", "lock",
            "catch", "typeof", "default", "break", "continue"
    );

    private static final String DEFAULT_ACCESS = "private";

    private final ConverterProperties properties;

    /**
     * Recover every declaration this extractor knows about from raw script text.
     */
    public ParsedScript extract(String source) {
        String code = source == null ? "" : source;

        ParsedScript.ParsedScriptBuilder script = ParsedScript.builder()
                .usings(extractUsings(code));

        findNamespace(code).ifPresent(script::namespace);
        findClassHeader(code).ifPresent(header -> script
                .className(header.getClassName())
                .baseClass(header.getBaseClass()));

        List<ParsedMethod> methods = extractMethods(code);
        script.methods(methods);
        script.fields(extractFields(code, methods));

        ParsedScript parsed = script.build();
        log.info("[extractor] Recovered class={} base={} usings={} fields={} methods={}",
                parsed.getClassName(), parsed.getBaseClass(), parsed.getUsings().size(),
                parsed.getFields().size(), parsed.getMethods().size());
        return parsed;
    }

    public List<String> extractUsings(String code) {
        List<String> usings = new ArrayList<>();
        Matcher matcher = USING_PATTERN.matcher(code);
        while (matcher.find()) {
            usings.add(matcher.group(1));
        }
        return usings;
    }

    public Optional<String> findNamespace(String code) {
        Matcher matcher = NAMESPACE_PATTERN.matcher(code);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public Optional<ClassHeader> findClassHeader(String code) {
        Matcher matcher = CLASS_PATTERN.matcher(code);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(new ClassHeader(matcher.group(1), matcher.group(2)));
    }

    // ========================= METHODS =========================

    public List<ParsedMethod> extractMethods(String code) {
        List<ParsedMethod> methods = new ArrayList<>();
        Matcher matcher = METHOD_PATTERN.matcher(code);

        while (matcher.find()) {
            String returnType = matcher.group(5);
            String name = matcher.group(6);
            if (isStatementKeyword(returnType) || isStatementKeyword(name)) {
                log.debug("[extractor] Skipping statement taken for a method: {} {}", returnType, name);
                continue;
            }

            int openBrace = matcher.end() - 1;
            String body = BraceBlockScanner.extractBlock(code, openBrace).orElse("");

            ParsedMethod method = ParsedMethod.builder()
                    .access(matcher.group(1) != null ? matcher.group(1) : DEFAULT_ACCESS)
                    .isStatic(matcher.group(2) != null)
                    .modifier(matcher.group(3))
                    .async(matcher.group(4) != null)
                    .returnType(returnType)
                    .name(name)
                    .parameters(parseParameters(matcher.group(7)))
                    .body(body)
                    .coroutine(returnType.contains("IEnumerator"))
                    .comments(harvestComments(code, matcher.start()))
                    .offset(matcher.start())
                    .build();

            log.debug("[extractor] Method {} returns {} with {} parameter(s), body length {}",
                    name, returnType, method.getParameters().size(), body.length());
            methods.add(method);
        }
        return methods;
    }

    List<ParsedParameter> parseParameters(String parameterList) {
        if (parameterList == null || parameterList.isBlank()) {
            return new ArrayList<>();
        }

        List<ParsedParameter> parameters = new ArrayList<>();
        for (String part : parameterList.split(",")) {
            String trimmed = part.trim();
            int lastSpace = trimmed.lastIndexOf(' ');
            if (lastSpace == -1) {
                continue;
            }
            parameters.add(ParsedParameter.builder()
                    .type(trimmed.substring(0, lastSpace))
                    .name(trimmed.substring(lastSpace + 1))
                    .build());
        }
        return parameters;
    }

    /**
     * Collect the comment lines directly above a declaration.
     * Blank and attribute lines are stepped over; any other line ends the search.
     */
    String harvestComments(String code, int declarationStart) {
        String[] linesBefore = code.substring(0, declarationStart).split("\n", -1);
        int window = Math.max(0, properties.getCommentWindowLines());
        int from = Math.max(0, linesBefore.length - window);

        List<String> comments = new ArrayList<>();
        for (int i = linesBefore.length - 1; i >= from; i--) {
            String line = linesBefore[i].trim();
            if (line.startsWith("//")) {
                comments.add(line.substring(2).trim());
            } else if (line.startsWith("/*") || line.startsWith("*")) {
                comments.add(stripCommentDecoration(line));
            } else if (!line.isEmpty() && !line.startsWith("[")) {
                break;
            }
        }
        Collections.reverse(comments);
        return String.join(" ", comments);
    }

    private String stripCommentDecoration(String line) {
        int start = 0;
        int end = line.length();
        while (start < end && (line.charAt(start) == '/' || line.charAt(start) == '*')) {
            start++;
        }
        while (end > start && (line.charAt(end - 1) == '/' || line.charAt(end - 1) == '*')) {
            end--;
        }
        return line.substring(start, end).trim();
    }

    // ========================= FIELDS =========================

    /**
     * Field declarations outside of the given method bodies.
     */
    public List<ParsedField> extractFields(String code, List<ParsedMethod> methods) {
        List<int[]> bodySpans = bodySpans(code, methods);
        List<ParsedField> fields = new ArrayList<>();
        Matcher matcher = FIELD_PATTERN.matcher(code);

        while (matcher.find()) {
            String type = matcher.group(4);
            String name = matcher.group(5);
            if (isStatementKeyword(type) || isStatementKeyword(name) || insideAny(matcher.start(5), bodySpans)) {
                continue;
            }

            String initializer = matcher.group(6);
            fields.add(ParsedField.builder()
                    .access(matcher.group(1) != null ? matcher.group(1) : DEFAULT_ACCESS)
                    .isStatic(matcher.group(2) != null)
                    .readonly(matcher.group(3) != null)
                    .type(type)
                    .name(name)
                    .initializer(initializer != null ? initializer.trim() : null)
                    .build());
        }
        return fields;
    }

    private List<int[]> bodySpans(String code, List<ParsedMethod> methods) {
        List<int[]> spans = new ArrayList<>();
        for (ParsedMethod method : methods) {
            if (method.getBody() == null || method.getBody().isEmpty()) {
                continue;
            }
            int start = code.indexOf(method.getBody(), method.getOffset());
            if (start >= 0) {
                spans.add(new int[]{start, start + method.getBody().length()});
            }
        }
        return spans;
    }

    private boolean insideAny(int position, List<int[]> spans) {
        return spans.stream().anyMatch(span -> position > span[0] && position < span[1]);
    }

    private boolean isStatementKeyword(String word) {
        return word != null && STATEMENT_KEYWORDS.contains(word);
    }

    /**
     * {@code class Name : Base} header. The base class is null when none is declared.
     */
    @Value
    public static class ClassHeader {
        String className;
        String baseClass;
    }
}

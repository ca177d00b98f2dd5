package com.repo.query.service.chunk;

import com.repo.query.model.repo.ChunkType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * extracts function and class declarations from python source.
 * <p>
 * The source is first split into logical lines (strings, comments, brackets and backslash
 * continuations resolved), then the indentation structure is checked the way the python
 * tokenizer does. Anything that does not hold together is reported as unparsable so the
 * caller can fall back to line windows.
 */
@Slf4j
public class PythonStructureParser {
    public static final String LANGUAGE = "python";

    private static final Pattern FUNCTION_HEADER =
            Pattern.compile("^(?:async\\s+)?def\\s+[\\p{L}_][\\p{L}\\p{N}_]*\\s*\\(");
    private static final Pattern CLASS_HEADER =
            Pattern.compile("^class\\s+[\\p{L}_][\\p{L}\\p{N}_]*\\s*[(:]");
    private static final Pattern DECLARATION_KEYWORD =
            Pattern.compile("^(?:async\\s+def|def|class)\\b");
    private static final int TAB_SIZE = 8;

    /**
     * parses the source and returns one chunk per declaration, outer declarations first
     *
     * @param relativePath
     * @param content
     * @return empty when the source does not parse
     */
    public Optional<List<ChunkData>> extract(String relativePath, String content) {
        String[] lines = content.split("\n", -1);

        List<LogicalLine> logicalLines;
        try {
            logicalLines = tokenize(lines);
            checkIndentation(logicalLines);
        } catch (PythonSyntaxException err) {
            log.debug("Python parse of {} failed: {}", relativePath, err.getMessage());
            return Optional.empty();
        }

        List<Declaration> declarations = new ArrayList<>();
        for (int i = 0; i < logicalLines.size(); i++) {
            LogicalLine header = logicalLines.get(i);
            ChunkType type = declarationType(header);
            if (type == null) continue;

            //  the body is every following logical line indented deeper than the header
            int last = i;
            while (last + 1 < logicalLines.size() && logicalLines.get(last + 1).indent > header.indent) last++;
            declarations.add(new Declaration(type, header, logicalLines.get(last)));
        }

        //  shallow declarations before nested ones, each level in source order
        declarations.sort(Comparator.<Declaration>comparingInt(d -> d.header.depth)
                .thenComparingInt(d -> d.header.startLine));

        List<ChunkData> chunks = new ArrayList<>();
        for (Declaration declaration : declarations) {
            String segment = sourceSegment(lines,
                    declaration.header.startLine, declaration.header.column,
                    declaration.last.endLine, declaration.last.endColumn);
            if (segment.isEmpty()) continue;

            chunks.add(ChunkData.builder()
                    .filePath(relativePath)
                    .chunkText(segment)
                    .chunkType(declaration.type)
                    .lineStart(declaration.header.startLine)
                    .lineEnd(declaration.last.endLine)
                    .language(LANGUAGE)
                    .build());
        }
        return Optional.of(chunks);
    }

    private ChunkType declarationType(LogicalLine line) {
        if (FUNCTION_HEADER.matcher(line.code).find()) return ChunkType.FUNCTION;
        if (CLASS_HEADER.matcher(line.code).find()) return ChunkType.CLASS;
        return null;
    }

    /**
     * splits physical lines into logical lines. Blank and comment-only lines produce nothing;
     * string literals are reduced to an empty placeholder in the logical line's code.
     *
     * @param lines
     * @return
     * @throws PythonSyntaxException on unterminated strings, unbalanced brackets or a dangling continuation
     */
    static List<LogicalLine> tokenize(String[] lines) {
        List<LogicalLine> result = new ArrayList<>();
        Deque<Character> brackets = new ArrayDeque<>();

        LogicalLine current = null;
        char quote = 0;
        boolean triple = false;
        boolean continuation = false;

        for (int index = 0; index < lines.length; index++) {
            String line = lines[index];
            int lineNumber = index + 1;
            int pos = 0;

            boolean inString = quote != 0;
            if (!inString && brackets.isEmpty() && !continuation) {
                int first = firstNonBlank(line);
                //  blank and comment-only lines are not statements
                if (first < 0 || line.charAt(first) == '#') continue;

                current = new LogicalLine(lineNumber, first, indentWidth(line, first));
                pos = first;
            }
            continuation = false;

            while (pos < line.length()) {
                char c = line.charAt(pos);

                if (quote != 0) {
                    if (c == '\\') {
                        pos += 2;
                        continue;
                    }
                    if (triple ? line.startsWith(String.valueOf(quote).repeat(3), pos) : c == quote) {
                        pos += triple ? 3 : 1;
                        quote = 0;
                        current.markToken(lineNumber, pos);
                        continue;
                    }
                    pos++;
                    continue;
                }

                if (c == '#') break;

                if (c == '"' || c == '\'') {
                    quote = c;
                    triple = line.startsWith(String.valueOf(c).repeat(3), pos);
                    pos += triple ? 3 : 1;
                    current.buffer.append("\"\"");
                    continue;
                }

                if (c == '\\') {
                    if (line.substring(pos + 1).isBlank()) {
                        continuation = true;
                        current.buffer.append(' ');
                        break;
                    }
                    throw new PythonSyntaxException("unexpected character after line continuation", lineNumber);
                }

                if (c == '(' || c == '[' || c == '{') {
                    brackets.push(c);
                } else if (c == ')' || c == ']' || c == '}') {
                    if (brackets.isEmpty() || brackets.pop() != opening(c))
                        throw new PythonSyntaxException("unmatched '" + c + "'", lineNumber);
                }

                if (Character.isWhitespace(c)) {
                    current.buffer.append(' ');
                } else {
                    current.buffer.append(c);
                    current.markToken(lineNumber, pos + 1);
                }
                pos++;
            }

            //  a single-quoted string only survives the line break through a trailing backslash
            if (quote != 0 && !triple && !line.endsWith("\\"))
                throw new PythonSyntaxException("unterminated string literal", lineNumber);

            if (quote == 0 && brackets.isEmpty() && !continuation && current != null) {
                result.add(current.finish());
                current = null;
            }
        }

        if (quote != 0) throw new PythonSyntaxException("unterminated string literal", lines.length);
        if (!brackets.isEmpty()) throw new PythonSyntaxException("'" + brackets.peek() + "' was never closed", lines.length);
        if (continuation) throw new PythonSyntaxException("unexpected end of file after line continuation", lines.length);
        return result;
    }

    /**
     * checks block structure: a line ending in ':' must be followed by a deeper block, a dedent must
     * return to an enclosing level, and declaration headers must be well formed. Sets
     * {@link LogicalLine#depth} on the way.
     *
     * @param logicalLines
     */
    static void checkIndentation(List<LogicalLine> logicalLines) {
        Deque<Integer> levels = new ArrayDeque<>();
        levels.push(0);
        boolean expectBlock = false;

        for (LogicalLine line : logicalLines) {
            if (expectBlock) {
                if (line.indent <= levels.peek())
                    throw new PythonSyntaxException("expected an indented block", line.startLine);
                levels.push(line.indent);
            } else if (line.indent > levels.peek()) {
                throw new PythonSyntaxException("unexpected indent", line.startLine);
            } else {
                while (line.indent < levels.peek()) levels.pop();
                if (line.indent != levels.peek())
                    throw new PythonSyntaxException("unindent does not match any outer indentation level", line.startLine);
            }
            line.depth = levels.size() - 1;

            if (DECLARATION_KEYWORD.matcher(line.code).find()) {
                boolean wellFormed = FUNCTION_HEADER.matcher(line.code).find() || CLASS_HEADER.matcher(line.code).find();
                if (!wellFormed || topLevelColon(line.code) < 0)
                    throw new PythonSyntaxException("invalid declaration", line.startLine);
            }
            expectBlock = line.code.endsWith(":");
        }

        if (expectBlock) {
            int lastLine = logicalLines.get(logicalLines.size() - 1).endLine;
            throw new PythonSyntaxException("expected an indented block", lastLine);
        }
    }

    private static int topLevelColon(String code) {
        int depth = 0;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c == '(' || c == '[' || c == '{') depth++;
            else if (c == ')' || c == ']' || c == '}') depth--;
            else if (c == ':' && depth == 0) return i;
        }
        return -1;
    }

    /**
     * cuts the text between two positions. The begin column is 0-based, the end column exclusive.
     *
     * @param lines
     * @param beginLine
     * @param beginColumn
     * @param endLine
     * @param endColumn
     * @return
     */
    static String sourceSegment(String[] lines, int beginLine, int beginColumn, int endLine, int endColumn) {
        if (beginLine < 1 || endLine > lines.length || endLine < beginLine) return "";

        if (beginLine == endLine) return slice(lines[beginLine - 1], beginColumn, endColumn);

        StringBuilder segment = new StringBuilder();
        String first = lines[beginLine - 1];
        segment.append(slice(first, beginColumn, first.length()));
        for (int i = beginLine; i < endLine - 1; i++) {
            segment.append('\n').append(lines[i]);
        }
        segment.append('\n').append(slice(lines[endLine - 1], 0, endColumn));
        return segment.toString();
    }

    private static String slice(String line, int from, int to) {
        int start = Math.max(0, Math.min(from, line.length()));
        int stop = Math.max(start, Math.min(to, line.length()));
        return line.substring(start, stop);
    }

    private static int firstNonBlank(String line) {
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c != ' ' && c != '\t' && c != '\f' && c != '\r') return i;
        }
        return -1;
    }

    private static int indentWidth(String line, int first) {
        int width = 0;
        for (int i = 0; i < first; i++) {
            char c = line.charAt(i);
            if (c == '\t') width = (width / TAB_SIZE + 1) * TAB_SIZE;
            else if (c == '\f') width = 0;
            else width++;
        }
        return width;
    }

    private static char opening(char closing) {
        if (closing == ')') return '(';
        if (closing == ']') return '[';
        return '{';
    }

    static final class LogicalLine {
        final int startLine;
        final int column;
        final int indent;
        final StringBuilder buffer = new StringBuilder();
        String code = "";
        int endLine;
        int endColumn;
        int depth;

        LogicalLine(int startLine, int column, int indent) {
            this.startLine = startLine;
            this.column = column;
            this.indent = indent;
            this.endLine = startLine;
            this.endColumn = column;
        }

        void markToken(int line, int column) {
            this.endLine = line;
            this.endColumn = column;
        }

        LogicalLine finish() {
            code = buffer.toString().trim();
            return this;
        }
    }

    private static final class Declaration {
        private final ChunkType type;
        private final LogicalLine header;
        private final LogicalLine last;

        private Declaration(ChunkType type, LogicalLine header, LogicalLine last) {
            this.type = type;
            this.header = header;
            this.last = last;
        }
    }

    static class PythonSyntaxException extends RuntimeException {
        PythonSyntaxException(String message, int line) {
            super(message + " (line " + line + ")");
        }
    }
}

package org.pragmatica.purify.docker;

import org.pragmatica.purify.error.ParseError;
import org.pragmatica.purify.error.ParseOutcome;
import org.pragmatica.purify.error.SyntaxFailure;
import org.pragmatica.purify.format.LineWrapper;
import org.pragmatica.purify.tree.SourceLocation;
import org.pragmatica.purify.tree.SourceSpan;
import org.pragmatica.purify.tree.SyntaxMetadata;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dockerfile parser. Parser directives such as {@code # syntax=} are ordinary comments here.
 */
public final class DockerfileParser {
    private static final Logger log = LoggerFactory.getLogger(DockerfileParser.class);

    private static final int MAX_INPUT_SIZE = 4_000_000;

    static final Set<String> KEYWORDS = Set.of(
        "FROM", "RUN", "CMD", "LABEL", "MAINTAINER", "EXPOSE", "ENV", "ADD", "COPY", "ENTRYPOINT",
        "VOLUME", "USER", "WORKDIR", "ARG", "ONBUILD", "STOPSIGNAL", "HEALTHCHECK", "SHELL");

    private final String[] physical;
    private final int count;
    private final List<DockerItem> items = new ArrayList<>();
    private int index;
    private int offset;

    private DockerfileParser(String source) {
        this.physical = source.replace("\r", "").split("\n", -1);
        this.count = physical.length > 0 && physical[physical.length - 1].isEmpty()
                     ? physical.length - 1
                     : physical.length;
    }

    public static ParseOutcome<Dockerfile> parse(String source) {
        return parse(source, Optional.empty());
    }

    /**
     * Parses Dockerfile text.
     *
     * @throws IllegalArgumentException when the input exceeds the size limit
     */
    public static ParseOutcome<Dockerfile> parse(String source, Optional<String> sourceFile) {
        if (source.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException("Dockerfile input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        long started = System.nanoTime();
        try {
            var parser = new DockerfileParser(source);
            parser.parseLines();
            var elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.debug("Parsed Dockerfile {} into {} items in {} us",
                      sourceFile.orElse("<input>"), parser.items.size(), elapsed.toNanos() / 1000);
            return ParseOutcome.success(new Dockerfile(parser.items, SyntaxMetadata.of(sourceFile, source, elapsed)));
        } catch (SyntaxFailure failure) {
            log.debug("Dockerfile parse failed: {}", failure.error().describe(sourceFile));
            return ParseOutcome.failure(failure.error());
        }
    }

    private void parseLines() {
        while (index < count) {
            var line = physical[index];
            var trimmed = line.strip();
            if (trimmed.isEmpty()) {
                items.add(new DockerItem.Blank(SourceSpan.ofLine(index + 1, offset, line.length())));
                advance();
            } else if (trimmed.startsWith("#")) {
                items.add(new DockerItem.Comment(trimmed.substring(1), SourceSpan.ofLine(index + 1, offset, line.length())));
                advance();
            } else {
                items.add(instruction());
            }
        }
    }

    private DockerItem.Instruction instruction() {
        var start = SourceLocation.at(index + 1, 1, offset);
        var segments = new ArrayList<String>();
        var code = new ArrayList<String>();
        String last;
        int lastOffset;
        while (true) {
            last = physical[index];
            lastOffset = offset;
            segments.add(last);
            boolean commentLine = !code.isEmpty() && last.strip().startsWith("#");
            if (!commentLine) {
                code.add(last);
            }
            advance();
            if (!commentLine && !continues(last)) {
                break;
            }
            if (index >= count) {
                throw new SyntaxFailure(new ParseError.UnexpectedEof(SourceLocation.at(index, last.length() + 1,
                                                                                       lastOffset + last.length()),
                                                                     "continuation line"));
            }
        }
        var span = SourceSpan.of(start, SourceLocation.at(index, last.length() + 1, lastOffset + last.length()));
        var text = LineWrapper.join(code).strip();
        int blank = 0;
        while (blank < text.length() && !Character.isWhitespace(text.charAt(blank))) {
            blank++;
        }
        var keyword = text.substring(0, blank);
        if (!KEYWORDS.contains(keyword.toUpperCase(Locale.ROOT))) {
            throw new SyntaxFailure(new ParseError.UnexpectedInput(start, keyword, "Dockerfile instruction"));
        }
        var arguments = text.substring(blank).strip();
        if (arguments.isEmpty()) {
            throw new SyntaxFailure(new ParseError.InvalidSyntax(start,
                                                                 "Instruction " + keyword.toUpperCase(Locale.ROOT) + " has no arguments",
                                                                 "instruction arguments"));
        }
        return new DockerItem.Instruction(keyword, arguments, segments, span);
    }

    private static boolean continues(String line) {
        return line.stripTrailing().endsWith("\\");
    }

    private void advance() {
        offset += physical[index].length() + 1;
        index++;
    }
}

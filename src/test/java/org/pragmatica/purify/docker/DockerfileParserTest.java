package org.pragmatica.purify.docker;

import org.pragmatica.purify.error.ParseError;
import org.pragmatica.purify.format.FormatOptions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class DockerfileParserTest {

    private static Dockerfile parse(String source) {
        var result = DockerfileParser.parse(source);
        assertTrue(result.isSuccess(), () -> "Parse failed: " + result.error().message());
        return result.unwrap();
    }

    private static ParseError parseError(String source) {
        var result = DockerfileParser.parse(source);
        assertTrue(result.isFailure(), "Expected parse failure for: " + source);
        return result.error();
    }

    // === Instructions ===

    @Test
    void parse_instructions_upperCaseKeywords() {
        var dockerfile = parse("from alpine:3.19\nrun apk add --no-cache curl\n");

        assertEquals(List.of("FROM", "RUN"), dockerfile.instructions().map(DockerItem.Instruction::keyword).toList());
        assertEquals(2, dockerfile.statementCount());
    }

    @Test
    void parse_continuation_joinsArguments() {
        var dockerfile = parse("""
            RUN apt-get update && \\
                apt-get install -y curl
            """);

        var run = dockerfile.instructions().findFirst().orElseThrow();
        assertEquals("apt-get update && apt-get install -y curl", run.arguments());
        assertEquals(2, run.segments().size());
        assertEquals(2, run.span().end().line());
    }

    @Test
    void parse_commentInsideContinuation_dropped() {
        var dockerfile = parse("""
            RUN make \\
            # build everything
                && make install
            """);

        assertEquals("make && make install", dockerfile.instructions().findFirst().orElseThrow().arguments());
    }

    @Test
    void parse_commentsAndBlanks_keptAsItems() {
        var items = parse("# syntax=docker/dockerfile:1\n\nFROM scratch\n").items();

        assertEquals(" syntax=docker/dockerfile:1", assertInstanceOf(DockerItem.Comment.class, items.get(0)).text());
        assertInstanceOf(DockerItem.Blank.class, items.get(1));
        assertInstanceOf(DockerItem.Instruction.class, items.get(2));
    }

    @Test
    void baseImages_listsStagesInOrder() {
        var dockerfile = parse("FROM golang:1.22 AS build\nFROM alpine:3.19\n");

        assertEquals(List.of("golang", "alpine"), dockerfile.baseImages().stream().map(BaseImage::name).toList());
    }

    // === Errors ===

    @Test
    void parse_unknownKeyword_reportsUnexpectedInput() {
        var error = assertInstanceOf(ParseError.UnexpectedInput.class, parseError("FROM alpine\nINSTALL curl\n"));

        assertEquals("INSTALL", error.found());
        assertEquals(2, error.location().line());
    }

    @Test
    void parse_instructionWithoutArguments_reportsInvalidSyntax() {
        assertInstanceOf(ParseError.InvalidSyntax.class, parseError("FROM alpine\nRUN\n"));
    }

    @Test
    void parse_continuationAtEnd_reportsEof() {
        assertInstanceOf(ParseError.UnexpectedEof.class, parseError("RUN echo \\\n"));
    }

    // === Rendering ===

    @Test
    void render_joinsContinuationsByDefault() {
        var dockerfile = parse("RUN a && \\\n    b\n\nCMD [\"app\"]\n");

        assertEquals("RUN a && b\nCMD [\"app\"]\n", DockerfileRenderer.render(dockerfile));
    }

    @Test
    void render_preserveFormatting_keepsOriginalLines() {
        var source = "RUN a && \\\n    b\n\nCMD [\"app\"]\n";

        var text = DockerfileRenderer.render(parse(source), new FormatOptions(true, OptionalInt.empty(), false, false));

        assertEquals(source, text);
    }

    @Test
    void render_rewrittenInstruction_dropsSegments() {
        var dockerfile = parse("ADD a \\\n    /a\n");
        var copy = dockerfile.instructions().findFirst().orElseThrow().withKeyword("COPY");

        var text = DockerfileRenderer.render(dockerfile.withItems(List.of(copy)),
                                             new FormatOptions(true, OptionalInt.empty(), false, false));

        assertEquals("COPY a /a\n", text);
    }
}

package org.pragmatica.purify.docker;

import org.pragmatica.purify.tree.SourceSpan;

import java.util.List;
import java.util.Locale;

/**
 * Lines of a Dockerfile.
 */
public sealed interface DockerItem {
    SourceSpan span();

    /**
     * One instruction. {@code keyword} is upper-cased, {@code arguments} has continuation
     * lines joined and comment lines inside the continuation dropped. {@code segments} keeps
     * the physical lines and is empty for instructions produced by a rewrite.
     */
    record Instruction(String keyword, String arguments, List<String> segments, SourceSpan span) implements DockerItem {
        public Instruction {
            keyword = keyword.toUpperCase(Locale.ROOT);
            segments = List.copyOf(segments);
        }

        public boolean is(String name) {
            return keyword.equals(name);
        }

        public Instruction withArguments(String newArguments) {
            return new Instruction(keyword, newArguments, List.of(), span);
        }

        public Instruction withKeyword(String newKeyword) {
            return new Instruction(newKeyword, arguments, List.of(), span);
        }
    }

    record Comment(String text, SourceSpan span) implements DockerItem {}

    record Blank(SourceSpan span) implements DockerItem {}
}

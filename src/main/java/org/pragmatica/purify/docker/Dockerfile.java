package org.pragmatica.purify.docker;

import org.pragmatica.purify.tree.SyntaxMetadata;
import org.pragmatica.purify.tree.SyntaxTree;

import java.util.List;
import java.util.stream.Stream;

/**
 * Parsed Dockerfile.
 */
public record Dockerfile(List<DockerItem> items, SyntaxMetadata metadata) implements SyntaxTree {

    public Dockerfile {
        items = List.copyOf(items);
    }

    public Dockerfile withItems(List<DockerItem> newItems) {
        return new Dockerfile(newItems, metadata);
    }

    public Stream<DockerItem.Instruction> instructions() {
        return items.stream()
                    .filter(DockerItem.Instruction.class::isInstance)
                    .map(DockerItem.Instruction.class::cast);
    }

    public Stream<DockerItem.Instruction> instructions(String keyword) {
        return instructions().filter(instruction -> instruction.is(keyword));
    }

    /**
     * Base images of all build stages, in stage order.
     */
    public List<BaseImage> baseImages() {
        return instructions("FROM").flatMap(from -> BaseImage.of(from).stream())
                                   .toList();
    }

    @Override
    public int statementCount() {
        return (int) instructions().count();
    }
}

package org.pragmatica.purify.docker;

import org.pragmatica.purify.format.FormatOptions;
import org.pragmatica.purify.format.LineWrapper;

/**
 * Renders a {@link Dockerfile} back to text.
 */
public final class DockerfileRenderer {
    private static final String CONTINUATION_INDENT = "    ";

    private DockerfileRenderer() {}

    public static String render(Dockerfile dockerfile) {
        return render(dockerfile, FormatOptions.DEFAULT);
    }

    public static String render(Dockerfile dockerfile, FormatOptions options) {
        var out = new StringBuilder();
        for (var item : dockerfile.items()) {
            if (item instanceof DockerItem.Instruction instruction) {
                instruction(out, instruction, options);
            } else if (item instanceof DockerItem.Comment comment) {
                out.append('#').append(comment.text()).append('\n');
            } else if (item instanceof DockerItem.Blank) {
                if (!options.removeBlankLines()) {
                    out.append('\n');
                }
            } else {
                throw new IllegalStateException("Unknown Dockerfile item " + item.getClass().getSimpleName());
            }
        }
        return out.toString();
    }

    private static void instruction(StringBuilder out, DockerItem.Instruction instruction, FormatOptions options) {
        var segments = instruction.segments();
        boolean keepSegments = !segments.isEmpty()
                               && (options.preserveFormatting() || (!options.joinContinuations() && segments.size() > 1));
        if (keepSegments) {
            segments.forEach(segment -> out.append(segment).append('\n'));
            return;
        }
        var line = instruction.keyword() + " " + instruction.arguments();
        if (options.maxLineLength().isEmpty()) {
            out.append(line).append('\n');
            return;
        }
        LineWrapper.wrap(line, options.maxLineLength().getAsInt(), CONTINUATION_INDENT)
                   .forEach(piece -> out.append(piece).append('\n'));
    }
}

package org.pragmatica.purify.transform;

import org.pragmatica.purify.analysis.DockerfileRules;
import org.pragmatica.purify.docker.BaseImage;
import org.pragmatica.purify.docker.DockerItem;
import org.pragmatica.purify.docker.DockerItem.Instruction;
import org.pragmatica.purify.docker.Dockerfile;
import org.pragmatica.purify.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies Dockerfile transformations to a copy of a Dockerfile, in source order.
 */
public final class DockerfileRewriter {
    private static final Logger log = LoggerFactory.getLogger(DockerfileRewriter.class);
    private static final Pattern APT_INSTALL = Pattern.compile("apt-get\\s+install((?:\\s+-\\S+)*)");

    private DockerfileRewriter() {}

    public static RewriteOutcome<Dockerfile> apply(Dockerfile dockerfile, List<Transformation> transformations) {
        var recorder = new RewriteOutcome.Recorder();
        var items = dockerfile.items();
        for (var transformation : sourceOrder(transformations)) {
            if (!transformation.safe()) {
                recorder.advisory(transformation);
                continue;
            }
            var rewritten = new ArrayList<DockerItem>(items.size());
            boolean hit = false;
            for (var item : items) {
                var replacement = item instanceof Instruction instruction && instruction.span().equals(transformation.span())
                    ? rewrite(instruction, transformation)
                    : Optional.<Instruction>empty();
                hit |= replacement.isPresent();
                rewritten.add(replacement.isPresent() ? replacement.get() : item);
            }
            if (hit) {
                items = rewritten;
                recorder.applied(transformation);
            } else {
                var advisory = Transformation.Advisory.downgrade(transformation, "target changed or not found");
                log.debug("Downgraded {} at {}: {}", transformation.ruleId(), transformation.span(), advisory.message());
                recorder.downgraded(advisory);
            }
        }
        return recorder.finish(dockerfile.withItems(items));
    }

    private static List<Transformation> sourceOrder(List<Transformation> transformations) {
        return transformations.stream()
                              .sorted(Comparator.comparing(Transformation::span, SourceSpan.SOURCE_ORDER))
                              .toList();
    }

    private static Optional<Instruction> rewrite(Instruction instruction, Transformation transformation) {
        if (transformation instanceof Transformation.PinBaseImage pin && instruction.is("FROM")) {
            return BaseImage.of(instruction)
                            .filter(BaseImage::isUnpinned)
                            .map(image -> instruction.withArguments(image.withTag(pin.tag()).toArguments()));
        }
        if (transformation instanceof Transformation.ConvertAddToCopy && instruction.is("ADD")
            && DockerfileRules.addsLocalFiles(instruction)) {
            return Optional.of(instruction.withKeyword("COPY"));
        }
        if (transformation instanceof Transformation.AddAptFlag flag && instruction.is("RUN")
            && !instruction.arguments().contains(flag.flag())) {
            return addAptFlag(instruction.arguments(), flag.flag()).map(instruction::withArguments);
        }
        if (transformation instanceof Transformation.AddPackageCleanup cleanup && instruction.is("RUN")
            && DockerfileRules.cleanupFor(instruction.arguments()).filter(cleanup.cleanup()::equals).isPresent()) {
            return Optional.of(instruction.withArguments(instruction.arguments().stripTrailing() + " && " + cleanup.cleanup()));
        }
        return Optional.empty();
    }

    /**
     * Puts the flag after the options of every {@code apt-get install} in the command.
     */
    private static Optional<String> addAptFlag(String command, String flag) {
        Matcher matcher = APT_INSTALL.matcher(command);
        var sb = new StringBuilder();
        boolean changed = false;
        while (matcher.find()) {
            var options = matcher.group(1);
            if (options.contains(flag)) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group()));
            } else {
                matcher.appendReplacement(sb, Matcher.quoteReplacement("apt-get install" + options + " " + flag));
                changed = true;
            }
        }
        matcher.appendTail(sb);
        return changed ? Optional.of(sb.toString()) : Optional.empty();
    }
}

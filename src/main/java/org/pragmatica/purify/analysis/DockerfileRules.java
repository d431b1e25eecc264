package org.pragmatica.purify.analysis;

import org.pragmatica.purify.analysis.ShellRule.Finding;
import org.pragmatica.purify.docker.BaseImage;
import org.pragmatica.purify.docker.DockerItem.Instruction;
import org.pragmatica.purify.docker.Dockerfile;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.pragmatica.purify.analysis.IssueCategory.*;
import static org.pragmatica.purify.analysis.IssueSeverity.*;

/**
 * The Dockerfile rule catalog.
 */
public final class DockerfileRules {
    private DockerfileRules() {}

    public static final String UNPINNED_IMAGE = "DOCKER_UNPINNED_IMAGE";
    public static final String ADD_LOCAL = "DOCKER_ADD_LOCAL";
    public static final String APT_RECOMMENDS = "DOCKER_APT_RECOMMENDS";
    public static final String PACKAGE_CLEANUP = "DOCKER_PACKAGE_CLEANUP";

    public static final String NO_RECOMMENDS = "--no-install-recommends";
    public static final String APT_CLEANUP = "rm -rf /var/lib/apt/lists/*";
    public static final String APK_CLEANUP = "rm -rf /var/cache/apk/*";

    private static final Map<String, String> KNOWN_PINS = Map.of(
        "ubuntu", "22.04",
        "debian", "12-slim",
        "alpine", "3.19",
        "node", "20-alpine",
        "python", "3.11-slim",
        "rust", "1.75-alpine",
        "nginx", "1.25-alpine",
        "postgres", "16-alpine",
        "redis", "7-alpine");

    private static final List<String> TARBALLS = List.of(".tar", ".tar.gz", ".tgz", ".tar.bz2", ".tar.xz", ".tar.Z");

    public static final List<DockerRule> CATALOG = List.of(
        new DockerRule(UNPINNED_IMAGE, REPRODUCIBILITY, HIGH, DockerfileRules::unpinnedImage),
        new DockerRule(ADD_LOCAL, SECURITY, LOW, DockerfileRules::addForLocalFile),
        new DockerRule(APT_RECOMMENDS, REPRODUCIBILITY, LOW, DockerfileRules::aptRecommends),
        new DockerRule(PACKAGE_CLEANUP, PERFORMANCE, LOW, DockerfileRules::packageCache),
        new DockerRule("DOCKER_ROOT_USER", SECURITY, HIGH, DockerfileRules::rootUser),
        new DockerRule("UNPINNED_PACKAGE", REPRODUCIBILITY, MEDIUM, DockerfileRules::unpinnedPackage));

    /**
     * Tag that pins a well-known official image, such as {@code 22.04} for {@code ubuntu}.
     */
    public static Optional<String> knownPin(BaseImage image) {
        if (image.registry().isPresent()) {
            return Optional.empty();
        }
        var name = image.name().startsWith("library/") ? image.name().substring("library/".length()) : image.name();
        return Optional.ofNullable(KNOWN_PINS.get(name));
    }

    // === Base images ===

    private static List<Finding> unpinnedImage(Dockerfile dockerfile) {
        var findings = new ArrayList<Finding>();
        var stages = new HashSet<String>();
        dockerfile.instructions("FROM").forEach(from -> BaseImage.of(from).ifPresent(image -> {
            boolean stageReference = stages.contains(image.name());
            image.alias().ifPresent(stages::add);
            if (stageReference || image.isScratch() || !image.isUnpinned() || image.reference().contains("$")) {
                return;
            }
            var fix = knownPin(image).map(tag -> "FROM " + image.withTag(tag).toArguments())
                                     .orElse("Pin '" + image.name() + "' to a specific version tag or digest");
            findings.add(Finding.of(from.span(), "Base image '" + image.reference() + "' is not pinned to a version", fix));
        }));
        return findings;
    }

    // === Instructions ===

    private static List<Finding> addForLocalFile(Dockerfile dockerfile) {
        return dockerfile.instructions("ADD")
                         .filter(DockerfileRules::addsLocalFiles)
                         .map(add -> Finding.of(add.span(), "ADD of local files has implicit download and extraction behavior",
                                                "COPY " + add.arguments()))
                         .toList();
    }

    /**
     * Whether every source of an {@code ADD} is a local, non-archive path, so that COPY does the same.
     */
    public static boolean addsLocalFiles(Instruction add) {
        var arguments = add.arguments().strip();
        if (arguments.startsWith("[")) {
            return false;
        }
        var words = List.of(arguments.split("\\s+"));
        var sources = words.stream()
                           .filter(word -> !word.startsWith("--"))
                           .toList();
        if (sources.size() < 2) {
            return false;
        }
        return sources.subList(0, sources.size() - 1)
                      .stream()
                      .noneMatch(source -> source.contains("://") || TARBALLS.stream().anyMatch(source::endsWith)
                                           || source.startsWith("git@"));
    }

    private static List<Finding> aptRecommends(Dockerfile dockerfile) {
        return dockerfile.instructions("RUN")
                         .filter(run -> run.arguments().contains("apt-get install") && !run.arguments().contains(NO_RECOMMENDS))
                         .map(run -> Finding.of(run.span(), "apt-get install pulls in recommended packages",
                                                "apt-get install " + NO_RECOMMENDS))
                         .toList();
    }

    private static List<Finding> packageCache(Dockerfile dockerfile) {
        var findings = new ArrayList<Finding>();
        dockerfile.instructions("RUN").forEach(run -> cleanupFor(run.arguments()).ifPresent(
            cleanup -> findings.add(Finding.of(run.span(), "Package manager cache is left in the image layer", "&& " + cleanup))));
        return findings;
    }

    /**
     * Cleanup command a {@code RUN} needs after installing packages, if any is missing.
     */
    public static Optional<String> cleanupFor(String command) {
        if (command.contains("apt-get install") && !command.contains("/var/lib/apt/lists")) {
            return Optional.of(APT_CLEANUP);
        }
        if (command.contains("apk add") && !command.contains("--no-cache") && !command.contains("/var/cache/apk")) {
            return Optional.of(APK_CLEANUP);
        }
        return Optional.empty();
    }

    private static List<Finding> rootUser(Dockerfile dockerfile) {
        if (dockerfile.instructions("USER").findAny().isPresent()) {
            return List.of();
        }
        var images = dockerfile.baseImages();
        if (images.isEmpty() || images.get(images.size() - 1).isScratch()) {
            return List.of();
        }
        return dockerfile.instructions()
                         .filter(instruction -> instruction.is("CMD") || instruction.is("ENTRYPOINT"))
                         .findFirst()
                         .map(start -> List.of(Finding.of(start.span(), "Container runs as root",
                                                          "RUN groupadd -r appuser && useradd -r -g appuser appuser, then USER appuser")))
                         .orElse(List.of());
    }

    private static List<Finding> unpinnedPackage(Dockerfile dockerfile) {
        var findings = new ArrayList<Finding>();
        dockerfile.instructions("RUN").forEach(run -> PackagePins.unpinned(run.arguments()).forEach(
            pkg -> findings.add(Finding.of(run.span(), "Package '" + pkg.name() + "' is installed without a version pin",
                                           pkg.suggestion()))));
        return findings;
    }
}

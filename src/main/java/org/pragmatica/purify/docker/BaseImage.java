package org.pragmatica.purify.docker;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Image reference of a {@code FROM} instruction:
 * {@code [--flag ...] [registry/]name[:tag][@digest] [AS alias]}.
 *
 * @param flags    leading options such as {@code --platform=...}, as written
 * @param registry host part, present only when it contains a dot, a port or is {@code localhost}
 * @param name     repository path without registry
 */
public record BaseImage(List<String> flags,
                        Optional<String> registry,
                        String name,
                        Optional<String> tag,
                        Optional<String> digest,
                        Optional<String> alias) {

    public BaseImage {
        flags = List.copyOf(flags);
    }

    public static Optional<BaseImage> of(DockerItem.Instruction from) {
        if (!from.is("FROM")) {
            return Optional.empty();
        }
        return parse(from.arguments());
    }

    public static Optional<BaseImage> parse(String arguments) {
        var words = arguments.strip().split("\\s+");
        var flags = new ArrayList<String>();
        int index = 0;
        while (index < words.length && words[index].startsWith("--")) {
            flags.add(words[index++]);
        }
        if (index >= words.length || words[index].isEmpty()) {
            return Optional.empty();
        }
        var reference = words[index++];
        Optional<String> alias = Optional.empty();
        if (index + 1 < words.length && words[index].equalsIgnoreCase("AS")) {
            alias = Optional.of(words[index + 1]);
        }

        Optional<String> digest = Optional.empty();
        int at = reference.indexOf('@');
        if (at >= 0) {
            digest = Optional.of(reference.substring(at + 1));
            reference = reference.substring(0, at);
        }
        Optional<String> registry = Optional.empty();
        int slash = reference.indexOf('/');
        if (slash > 0) {
            var host = reference.substring(0, slash);
            if (host.contains(".") || host.contains(":") || host.equals("localhost")) {
                registry = Optional.of(host);
                reference = reference.substring(slash + 1);
            }
        }
        Optional<String> tag = Optional.empty();
        int colon = reference.lastIndexOf(':');
        if (colon >= 0) {
            tag = Optional.of(reference.substring(colon + 1));
            reference = reference.substring(0, colon);
        }
        return Optional.of(new BaseImage(flags, registry, reference, tag, digest, alias));
    }

    public boolean isScratch() {
        return name.equals("scratch") && registry.isEmpty();
    }

    /**
     * True when neither a digest nor a tag other than {@code latest} fixes the image.
     */
    public boolean isUnpinned() {
        return digest.isEmpty() && tag.filter(value -> !value.equals("latest")).isEmpty();
    }

    public BaseImage withTag(String newTag) {
        return new BaseImage(flags, registry, name, Optional.of(newTag), digest, alias);
    }

    /**
     * Image reference without flags and alias.
     */
    public String reference() {
        return registry.map(host -> host + "/").orElse("")
               + name
               + tag.map(value -> ":" + value).orElse("")
               + digest.map(value -> "@" + value).orElse("");
    }

    /**
     * Arguments of a {@code FROM} instruction naming this image.
     */
    public String toArguments() {
        var sb = new StringBuilder();
        flags.forEach(flag -> sb.append(flag).append(' '));
        sb.append(reference());
        alias.ifPresent(value -> sb.append(" AS ").append(value));
        return sb.toString();
    }
}

package org.pragmatica.purify.make;

import org.pragmatica.purify.error.ParseError;
import org.pragmatica.purify.error.ParseOutcome;
import org.pragmatica.purify.error.SyntaxFailure;
import org.pragmatica.purify.format.LineWrapper;
import org.pragmatica.purify.tree.SourceLocation;
import org.pragmatica.purify.tree.SourceSpan;
import org.pragmatica.purify.tree.SyntaxMetadata;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-oriented Makefile parser.
 *
 * <p>Physical lines ending in an odd number of backslashes are joined into one logical line.
 * Lines starting with a tab are recipe lines; everything else is classified by its leading
 * keyword or by the first assignment operator or colon outside parentheses.
 */
public final class MakefileParser {
    private static final Logger log = LoggerFactory.getLogger(MakefileParser.class);

    private static final int MAX_INPUT_SIZE = 4_000_000;
    private static final int MAX_DEPTH = 100;
    private static final Set<String> CONDITIONALS = Set.of("ifeq", "ifneq", "ifdef", "ifndef");
    private static final Set<String> INCLUDES = Set.of("include", "-include", "sinclude");
    private static final Set<String> BLOCK_ENDS = Set.of("else", "endif");

    private record LogicalLine(List<String> segments, SourceSpan span) {
        boolean isRecipe() {
            return segments.get(0).startsWith("\t");
        }

        boolean isBlank() {
            return segments.stream().allMatch(String::isBlank);
        }

        String text() {
            if (isRecipe()) {
                var stripped = new ArrayList<>(segments);
                stripped.set(0, segments.get(0).substring(1));
                return LineWrapper.join(stripped);
            }
            return LineWrapper.join(segments).strip();
        }

        String keyword() {
            return firstWord(text());
        }
    }

    private record Assignment(int nameEnd, int operatorStart, String operator) {}

    private final List<LogicalLine> lines;
    private int pos;
    private int depth;
    private boolean ruleSeen;

    private MakefileParser(List<LogicalLine> lines) {
        this.lines = lines;
    }

    public static ParseOutcome<Makefile> parse(String source) {
        return parse(source, Optional.empty());
    }

    /**
     * Parses Makefile text. The tree is returned only when the whole input parses.
     *
     * @throws IllegalArgumentException when the input exceeds the size limit
     */
    public static ParseOutcome<Makefile> parse(String source, Optional<String> sourceFile) {
        if (source.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException("Makefile input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        long started = System.nanoTime();
        try {
            var parser = new MakefileParser(logicalLines(source));
            var items = resolvePhony(parser.parseItems(Set.of()));
            var elapsed = Duration.ofNanos(System.nanoTime() - started);
            log.debug("Parsed Makefile {} into {} items in {} us",
                      sourceFile.orElse("<input>"), items.size(), elapsed.toNanos() / 1000);
            return ParseOutcome.success(new Makefile(items, SyntaxMetadata.of(sourceFile, source, elapsed)));
        } catch (SyntaxFailure failure) {
            log.debug("Makefile parse failed: {}", failure.error().describe(sourceFile));
            return ParseOutcome.failure(failure.error());
        }
    }

    // === Line splitting ===

    private static List<LogicalLine> logicalLines(String source) {
        var physical = source.replace("\r", "").split("\n", -1);
        int count = physical.length;
        if (count > 0 && physical[count - 1].isEmpty()) {
            count--;
        }
        var result = new ArrayList<LogicalLine>();
        int offset = 0;
        int index = 0;
        while (index < count) {
            int firstLine = index + 1;
            int startOffset = offset;
            var segments = new ArrayList<String>();
            int lastOffset;
            String segment;
            do {
                segment = physical[index];
                segments.add(segment);
                lastOffset = offset;
                offset += segment.length() + 1;
                index++;
            } while (endsWithContinuation(segment) && index < count);
            var start = SourceLocation.at(firstLine, 1, startOffset);
            var end = SourceLocation.at(index, segment.length() + 1, lastOffset + segment.length());
            result.add(new LogicalLine(List.copyOf(segments), SourceSpan.of(start, end)));
        }
        return result;
    }

    static boolean endsWithContinuation(String segment) {
        int backslashes = 0;
        for (int i = segment.length() - 1; i >= 0 && segment.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    // === Items ===

    private List<MakeItem> parseItems(Set<String> stopWords) {
        var items = new ArrayList<MakeItem>();
        while (pos < lines.size()) {
            var line = lines.get(pos);
            if (line.isBlank()) {
                items.add(new MakeItem.Blank(line.span()));
                pos++;
                continue;
            }
            if (line.isRecipe()) {
                if (!ruleSeen) {
                    throw new SyntaxFailure(new ParseError.InvalidSyntax(line.span().start(),
                                                                         "Recipe line before the first target",
                                                                         "target definition"));
                }
                items.add(recipeLine(line));
                pos++;
                continue;
            }
            var text = line.text();
            if (text.startsWith("#")) {
                items.add(new MakeItem.Comment(text.substring(1), line.span()));
                pos++;
                continue;
            }
            var keyword = line.keyword();
            if (stopWords.contains(keyword)) {
                return items;
            }
            if (BLOCK_ENDS.contains(keyword)) {
                throw new SyntaxFailure(new ParseError.UnexpectedInput(line.span().start(), keyword,
                                                                       "ifeq, ifneq, ifdef or ifndef before it"));
            }
            if (keyword.equals("endef")) {
                throw new SyntaxFailure(new ParseError.UnexpectedInput(line.span().start(), keyword, "define before it"));
            }
            items.add(parseItem(line, keyword, text));
        }
        return items;
    }

    private MakeItem parseItem(LogicalLine line, String keyword, String text) {
        if (CONDITIONALS.contains(keyword)) {
            pos++;
            return parseConditional(line, keyword, text.substring(keyword.length()).strip());
        }
        if (INCLUDES.contains(keyword) && text.length() > keyword.length()) {
            pos++;
            return new MakeItem.Include(text.substring(keyword.length()).strip(), !keyword.equals("include"), keyword, line.span());
        }
        if (keyword.equals("define")) {
            pos++;
            return parseDefine(line, text.substring(keyword.length()).strip());
        }
        pos++;
        return parseDefinition(line, text);
    }

    private MakeItem.Conditional parseConditional(LogicalLine opening, String directive, String arguments) {
        if (++depth > MAX_DEPTH) {
            throw new SyntaxFailure(new ParseError.NestingTooDeep(opening.span().start(), MAX_DEPTH));
        }
        var thenItems = parseItems(BLOCK_ENDS);
        var closing = closingLine(opening, directive);
        pos++;
        if (closing.keyword().equals("endif")) {
            depth--;
            return new MakeItem.Conditional(directive, arguments, thenItems, List.of(), false,
                                            opening.span().merge(closing.span()));
        }
        var rest = closing.text().substring("else".length()).strip();
        var chainedDirective = firstWord(rest);
        if (CONDITIONALS.contains(chainedDirective)) {
            var chained = parseConditional(closing, chainedDirective, rest.substring(chainedDirective.length()).strip());
            depth--;
            return new MakeItem.Conditional(directive, arguments, thenItems, List.of(chained), true,
                                            opening.span().merge(chained.span()));
        }
        if (!rest.isEmpty()) {
            throw new SyntaxFailure(new ParseError.UnexpectedInput(closing.span().start(), rest, "end of line after 'else'"));
        }
        var elseItems = parseItems(BLOCK_ENDS);
        var end = closingLine(opening, directive);
        if (!end.keyword().equals("endif")) {
            throw new SyntaxFailure(new ParseError.UnexpectedInput(end.span().start(), end.keyword(), "endif"));
        }
        pos++;
        depth--;
        return new MakeItem.Conditional(directive, arguments, thenItems, elseItems, false,
                                        opening.span().merge(end.span()));
    }

    private LogicalLine closingLine(LogicalLine opening, String directive) {
        if (pos >= lines.size()) {
            throw new SyntaxFailure(new ParseError.UnterminatedBlock(opening.span().start(), directive, "endif"));
        }
        return lines.get(pos);
    }

    private MakeItem.Define parseDefine(LogicalLine opening, String header) {
        var words = header.split("\\s+");
        if (header.isEmpty()) {
            throw new SyntaxFailure(new ParseError.InvalidSyntax(opening.span().start(), "define without a name", "variable name"));
        }
        var flavor = words.length > 1 && MakeItem.Flavor.fromSymbol(words[words.length - 1]).isPresent()
                     ? Optional.of(words[words.length - 1])
                     : Optional.<String>empty();
        var name = flavor.isPresent() ? header.substring(0, header.lastIndexOf(flavor.get())).strip() : header;
        var body = new ArrayList<String>();
        while (pos < lines.size()) {
            var line = lines.get(pos++);
            if (!line.isRecipe() && line.text().equals("endef")) {
                return new MakeItem.Define(name, flavor, body, opening.span().merge(line.span()));
            }
            body.addAll(line.segments());
        }
        throw new SyntaxFailure(new ParseError.UnterminatedBlock(opening.span().start(), "define", "endef"));
    }

    private MakeItem parseDefinition(LogicalLine line, String text) {
        boolean exported = false;
        boolean override = false;
        var rest = text;
        while (true) {
            if (rest.startsWith("export ")) {
                exported = true;
                rest = rest.substring("export ".length()).stripLeading();
            } else if (rest.startsWith("override ")) {
                override = true;
                rest = rest.substring("override ".length()).stripLeading();
            } else {
                break;
            }
        }
        var assignment = findAssignment(rest);
        if (assignment.isEmpty()) {
            return new MakeItem.Directive(text, line.span());
        }
        var found = assignment.get();
        if (found.operator().equals(":")) {
            if (exported || override) {
                return new MakeItem.Directive(text, line.span());
            }
            return parseRule(line, rest, found.operatorStart());
        }
        var name = rest.substring(0, found.nameEnd()).strip();
        if (name.isEmpty()) {
            throw new SyntaxFailure(new ParseError.InvalidSyntax(line.span().start(), "Assignment without a variable name",
                                                                 "variable name"));
        }
        var value = rest.substring(found.operatorStart() + found.operator().length()).strip();
        var flavor = MakeItem.Flavor.fromSymbol(found.operator()).orElseThrow();
        return new MakeItem.Variable(name, flavor, value, line.segments(), exported, override, line.span());
    }

    /**
     * First assignment operator or rule colon outside parentheses and braces.
     */
    private static Optional<Assignment> findAssignment(String text) {
        int nesting = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '{') {
                nesting++;
            } else if ((c == ')' || c == '}') && nesting > 0) {
                nesting--;
            } else if (nesting == 0 && c == '=') {
                if (i > 0 && "?+!".indexOf(text.charAt(i - 1)) >= 0) {
                    return Optional.of(new Assignment(i - 1, i - 1, text.charAt(i - 1) + "="));
                }
                return Optional.of(new Assignment(i, i, "="));
            } else if (nesting == 0 && c == ':') {
                if (text.startsWith("::=", i)) {
                    return Optional.of(new Assignment(i, i, "::="));
                }
                if (text.startsWith(":=", i)) {
                    return Optional.of(new Assignment(i, i, ":="));
                }
                return Optional.of(new Assignment(i, i, ":"));
            }
        }
        return Optional.empty();
    }

    private MakeItem parseRule(LogicalLine line, String text, int colon) {
        var targets = text.substring(0, colon).strip();
        if (targets.isEmpty()) {
            throw new SyntaxFailure(new ParseError.InvalidSyntax(line.span().start(), "Rule without a target", "target name"));
        }
        boolean doubleColon = text.startsWith("::", colon);
        var rest = text.substring(colon + (doubleColon ? 2 : 1));
        Optional<String> inline = Optional.empty();
        int semicolon = rest.indexOf(';');
        if (semicolon >= 0) {
            inline = Optional.of(rest.substring(semicolon + 1).strip());
            rest = rest.substring(0, semicolon);
        }
        var prerequisites = rest;
        var orderOnly = "";
        int bar = rest.indexOf('|');
        if (bar >= 0) {
            prerequisites = rest.substring(0, bar);
            orderOnly = rest.substring(bar + 1);
        }
        ruleSeen = true;
        var recipe = new ArrayList<MakeItem.RecipeLine>();
        var span = line.span();
        while (pos < lines.size() && lines.get(pos).isRecipe() && !lines.get(pos).isBlank()) {
            var recipeLine = recipeLine(lines.get(pos++));
            recipe.add(recipeLine);
            span = span.merge(recipeLine.span());
        }
        if (targets.contains("%")) {
            return new MakeItem.PatternRule(targets, words(prerequisites), words(orderOnly), inline, recipe, doubleColon, span);
        }
        return new MakeItem.Target(targets, words(prerequisites), words(orderOnly), inline, recipe, false, doubleColon, span);
    }

    private static MakeItem.RecipeLine recipeLine(LogicalLine line) {
        return new MakeItem.RecipeLine(line.text(), line.segments(), line.span());
    }

    // === .PHONY ===

    private static List<MakeItem> resolvePhony(List<MakeItem> items) {
        var phony = new HashSet<String>();
        collectPhony(items, phony);
        return phony.isEmpty() ? items : markPhony(items, phony);
    }

    private static void collectPhony(List<MakeItem> items, Set<String> phony) {
        for (var item : items) {
            if (item instanceof MakeItem.Target target && target.name().equals(".PHONY")) {
                phony.addAll(target.prerequisites());
            } else if (item instanceof MakeItem.Conditional conditional) {
                collectPhony(conditional.thenItems(), phony);
                collectPhony(conditional.elseItems(), phony);
            }
        }
    }

    private static List<MakeItem> markPhony(List<MakeItem> items, Set<String> phony) {
        var result = new ArrayList<MakeItem>(items.size());
        for (var item : items) {
            if (item instanceof MakeItem.Target target && phony.containsAll(words(target.name()))) {
                result.add(target.withPhony(true));
            } else if (item instanceof MakeItem.Conditional conditional) {
                result.add(new MakeItem.Conditional(conditional.directive(), conditional.arguments(),
                                                    markPhony(conditional.thenItems(), phony),
                                                    markPhony(conditional.elseItems(), phony),
                                                    conditional.elseChained(), conditional.span()));
            } else {
                result.add(item);
            }
        }
        return result;
    }

    // === Helpers ===

    static List<String> words(String text) {
        var trimmed = text.strip();
        return trimmed.isEmpty() ? List.of() : List.of(trimmed.split("\\s+"));
    }

    private static String firstWord(String text) {
        int end = 0;
        while (end < text.length() && !Character.isWhitespace(text.charAt(end)) && text.charAt(end) != '(') {
            end++;
        }
        return text.substring(0, end);
    }
}

package org.pragmatica.purify.analysis;

import org.pragmatica.purify.analysis.MakefileFacts.Rule;
import org.pragmatica.purify.analysis.ShellRule.Finding;
import org.pragmatica.purify.make.MakeFunctions;
import org.pragmatica.purify.make.MakeItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.pragmatica.purify.analysis.IssueCategory.*;
import static org.pragmatica.purify.analysis.IssueSeverity.*;

/**
 * The Makefile rule catalog. Rules report in catalog order, each in source order.
 */
public final class MakefileRules {
    private MakefileRules() {}

    public static final String NO_WILDCARD = "NO_WILDCARD";
    public static final String NO_UNORDERED_FIND = "NO_UNORDERED_FIND";

    private static final Set<String> COMMON_PHONY = Set.of("all", "build", "clean", "deploy", "help", "install", "test");
    private static final List<String> CHECKED_COMMANDS = List.of("mkdir", "cp", "mv", "gcc");
    private static final List<String> BASHISMS = List.of("[[", "source ", "declare ", "echo -e", "sed -i", "/proc/", "ifconfig");

    private static final Pattern SHELL_DATE = Pattern.compile("\\$[({]shell\\s+date(?=[\\s)}+-]|$)");
    private static final Pattern RANDOM = Pattern.compile("\\$\\$?\\{?RANDOM\\b");
    private static final Pattern GIT_TIMESTAMP = Pattern.compile("git\\s+log\\b.*(%c[dti]|--date)");
    private static final Pattern MKTEMP = Pattern.compile("(^|[\\s;&|(`])mktemp\\b");
    private static final Pattern OUTPUT_FILE = Pattern.compile("(?:\\s>|\\s-o)\\s*([^\\s;&|>]+)");
    private static final Pattern INPUT_FILE = Pattern.compile("(?:^|[\\s;&|])(?:cat\\s+|<\\s*)([^\\s;&|<>]+)");
    private static final Pattern UNAME = Pattern.compile("(^|[\\s;&|(`])uname\\b");
    private static final Pattern FOR_LOOP = Pattern.compile("(^|[\\s;&|(@+-])for\\s.*\\bdo\\s");
    private static final Pattern SUB_MAKE = Pattern.compile("\\$[({]MAKE[)}].*\\s-C\\s*\\S+");

    public static final List<MakeRule> CATALOG = List.of(
        new MakeRule("NO_TIMESTAMPS", REPRODUCIBILITY, CRITICAL, MakefileRules::shellDate),
        new MakeRule(NO_WILDCARD, DETERMINISM, HIGH, MakefileRules::unsortedWildcard),
        new MakeRule(NO_UNORDERED_FIND, DETERMINISM, HIGH, MakefileRules::unsortedFind),
        new MakeRule("NO_RANDOM", REPRODUCIBILITY, CRITICAL, MakefileRules::randomValue),
        new MakeRule("NO_PROCESS_ID", REPRODUCIBILITY, HIGH, MakefileRules::processId),
        new MakeRule("NO_HOSTNAME", REPRODUCIBILITY, MEDIUM, MakefileRules::hostname),
        new MakeRule("NO_GIT_TIMESTAMP", REPRODUCIBILITY, MEDIUM, MakefileRules::gitTimestamp),
        new MakeRule("NO_MKTEMP", REPRODUCIBILITY, MEDIUM, MakefileRules::mktemp),
        new MakeRule("UNPINNED_PACKAGE", REPRODUCIBILITY, MEDIUM, MakefileRules::unpinnedPackage),
        new MakeRule("AUTO_PHONY", IDEMPOTENCY, HIGH, MakefileRules::missingPhony),
        new MakeRule("PARALLEL_OUTPUT_CONFLICT", PARALLEL_SAFETY, HIGH, MakefileRules::outputConflict),
        new MakeRule("PARALLEL_MISSING_DEPENDENCY", PARALLEL_SAFETY, MEDIUM, MakefileRules::missingDependency),
        new MakeRule("PARALLEL_DIRECTORY_RACE", PARALLEL_SAFETY, MEDIUM, MakefileRules::directoryRace),
        new MakeRule("PARALLEL_RECURSIVE_MAKE", PARALLEL_SAFETY, MEDIUM, MakefileRules::recursiveMake),
        new MakeRule("PARALLEL_NOT_PARALLEL", PARALLEL_SAFETY, LOW, MakefileRules::notParallel),
        new MakeRule("PERF_SHELL_RECURSIVE", PERFORMANCE, MEDIUM, MakefileRules::recursiveShell),
        new MakeRule("PERF_MANY_SHELLS", PERFORMANCE, LOW, MakefileRules::manyShells),
        new MakeRule("PERF_REPEATED_RM", PERFORMANCE, LOW, MakefileRules::repeatedRm),
        new MakeRule("PERF_PATTERN_RULE", PERFORMANCE, LOW, MakefileRules::explicitObjectRules),
        new MakeRule("PERF_SUFFIXES", PERFORMANCE, LOW, MakefileRules::builtinSuffixes),
        new MakeRule("ERR_UNCHECKED_COMMAND", ERROR_HANDLING, MEDIUM, MakefileRules::uncheckedCommand),
        new MakeRule("ERR_SILENT_FAILURE", ERROR_HANDLING, MEDIUM, MakefileRules::silentFailure),
        new MakeRule("ERR_NO_ONESHELL", ERROR_HANDLING, MEDIUM, MakefileRules::cdAcrossLines),
        new MakeRule("ERR_MISSING_SET_E", ERROR_HANDLING, MEDIUM, MakefileRules::bashWithoutSetE),
        new MakeRule("ERR_LOOP_UNCHECKED", ERROR_HANDLING, MEDIUM, MakefileRules::uncheckedLoop),
        new MakeRule("ERR_DELETE_ON_ERROR", ERROR_HANDLING, LOW, MakefileRules::deleteOnError),
        new MakeRule("PORT_BASHISM", PORTABILITY, LOW, MakefileRules::bashism),
        new MakeRule("PORT_PLATFORM", PORTABILITY, LOW, MakefileRules::platformDetection));

    public static Optional<MakeRule> byId(String id) {
        return CATALOG.stream()
                      .filter(rule -> rule.id().equals(id))
                      .findFirst();
    }

    // === Determinism and reproducibility ===

    private static List<Finding> shellDate(MakefileFacts facts, List<SemanticIssue> earlier) {
        return variablesMatching(facts, value -> SHELL_DATE.matcher(value).find(),
                                 name -> "Variable '" + name + "' uses non-deterministic $(shell date) - replace with explicit version",
                                 name -> name + " := 1.0.0");
    }

    private static List<Finding> unsortedWildcard(MakefileFacts facts, List<SemanticIssue> earlier) {
        return variablesMatching(facts, value -> !MakeFunctions.unsortedCalls(value, "wildcard", "").isEmpty(),
                                 name -> "Variable '" + name + "' uses non-deterministic $(wildcard) - wrap it in $(sort ...)",
                                 name -> name + " := $(sort $(wildcard ...))");
    }

    private static List<Finding> unsortedFind(MakefileFacts facts, List<SemanticIssue> earlier) {
        return variablesMatching(facts, value -> !MakeFunctions.unsortedCalls(value, "shell", "find").isEmpty(),
                                 name -> "Variable '" + name + "' uses non-deterministic $(shell find) - wrap it in $(sort ...)",
                                 name -> name + " := $(sort $(shell find ...))");
    }

    private static List<Finding> randomValue(MakefileFacts facts, List<SemanticIssue> earlier) {
        var findings = variablesMatching(facts, value -> RANDOM.matcher(value).find(),
                                         name -> "Variable '" + name + "' uses non-deterministic $RANDOM - replace with fixed value",
                                         name -> name + " := 42");
        findings.addAll(recipeLinesMatching(facts, line -> RANDOM.matcher(line).find(),
                                            rule -> "Recipe of '" + rule.name() + "' uses non-deterministic $RANDOM",
                                            "Use a fixed seed"));
        return findings;
    }

    private static List<Finding> processId(MakefileFacts facts, List<SemanticIssue> earlier) {
        var findings = variablesMatching(facts, value -> value.contains("$$$$"),
                                         name -> "Variable '" + name + "' uses the process ID $$$$",
                                         name -> "Use a fixed identifier");
        findings.addAll(recipeLinesMatching(facts, line -> line.contains("$$$$"),
                                            rule -> "Recipe of '" + rule.name() + "' uses the process ID $$$$",
                                            "Use a fixed identifier"));
        return findings;
    }

    private static List<Finding> hostname(MakefileFacts facts, List<SemanticIssue> earlier) {
        return variablesMatching(facts, value -> value.contains("hostname") && (value.contains("$(shell") || value.contains("${shell")),
                                 name -> "Variable '" + name + "' depends on the build host name",
                                 name -> "Pass the host name in explicitly: make " + name + "=...");
    }

    private static List<Finding> gitTimestamp(MakefileFacts facts, List<SemanticIssue> earlier) {
        return variablesMatching(facts, value -> GIT_TIMESTAMP.matcher(value).find(),
                                 name -> "Variable '" + name + "' uses a git commit timestamp",
                                 name -> "Derive the date from SOURCE_DATE_EPOCH");
    }

    private static List<Finding> mktemp(MakefileFacts facts, List<SemanticIssue> earlier) {
        return recipeLinesMatching(facts, line -> MKTEMP.matcher(line).find(),
                                   rule -> "Recipe of '" + rule.name() + "' uses mktemp, which creates random file names",
                                   "Use a fixed path under the build directory");
    }

    private static List<Finding> unpinnedPackage(MakefileFacts facts, List<SemanticIssue> earlier) {
        var findings = new ArrayList<Finding>();
        for (var rule : facts.rules()) {
            for (var line : rule.recipe()) {
                for (var pkg : PackagePins.unpinned(MakefileFacts.command(line))) {
                    findings.add(Finding.of(line.span(), "Package '" + pkg.name() + "' is installed without a version pin",
                                            pkg.suggestion()));
                }
            }
        }
        return findings;
    }

    // === Idempotency ===

    private static List<Finding> missingPhony(MakefileFacts facts, List<SemanticIssue> earlier) {
        var findings = new ArrayList<Finding>();
        for (var rule : facts.rules()) {
            if (COMMON_PHONY.contains(rule.name()) && !rule.phony()) {
                findings.add(Finding.of(rule.span(),
                                        "Target '" + rule.name() + "' should be marked as .PHONY (common non-file target)",
                                        ".PHONY: " + rule.name()));
            }
        }
        return findings;
    }

    // === Parallel safety ===

    private static List<Finding> outputConflict(MakefileFacts facts, List<SemanticIssue> earlier) {
        var writers = new LinkedHashMap<String, List<Rule>>();
        var firstLine = new LinkedHashMap<String, List<MakeItem.RecipeLine>>();
        for (var rule : facts.rules()) {
            for (var line : rule.recipe()) {
                for (var file : outputs(line)) {
                    var rules = writers.computeIfAbsent(file, key -> new ArrayList<>());
                    if (!rules.contains(rule)) {
                        rules.add(rule);
                        firstLine.computeIfAbsent(file, key -> new ArrayList<>()).add(line);
                    }
                }
            }
        }
        var findings = new ArrayList<Finding>();
        writers.forEach((file, rules) -> {
            for (int i = 1; i < rules.size(); i++) {
                findings.add(Finding.of(firstLine.get(file).get(i).span(),
                                        "Targets '" + rules.get(0).name() + "' and '" + rules.get(i).name()
                                        + "' both write '" + file + "'",
                                        "Give each target its own output file"));
            }
        });
        return findings;
    }

    private static List<Finding> missingDependency(MakefileFacts facts, List<SemanticIssue> earlier) {
        var producers = new LinkedHashMap<String, Rule>();
        for (var rule : facts.rules()) {
            for (var line : rule.recipe()) {
                outputs(line).forEach(file -> producers.putIfAbsent(file, rule));
            }
        }
        var findings = new ArrayList<Finding>();
        for (var rule : facts.rules()) {
            for (var line : rule.recipe()) {
                for (var file : inputs(line)) {
                    var producer = producers.get(file);
                    if (producer != null && producer != rule && !rule.dependsOn(file)
                        && producer.targets().stream().noneMatch(rule::dependsOn)) {
                        findings.add(Finding.of(line.span(),
                                                "Target '" + rule.name() + "' reads '" + file + "' created by '"
                                                + producer.name() + "' without depending on it",
                                                "Add '" + producer.name() + "' as a prerequisite of '" + rule.name() + "'"));
                    }
                }
            }
        }
        return findings;
    }

    private static List<Finding> directoryRace(MakefileFacts facts, List<SemanticIssue> earlier) {
        var creators = new LinkedHashMap<String, List<Rule>>();
        var lines = new LinkedHashMap<String, List<MakeItem.RecipeLine>>();
        for (var rule : facts.rules()) {
            for (var line : rule.recipe()) {
                for (var dir : mkdirTargets(line)) {
                    var rules = creators.computeIfAbsent(dir, key -> new ArrayList<>());
                    if (!rules.contains(rule)) {
                        rules.add(rule);
                        lines.computeIfAbsent(dir, key -> new ArrayList<>()).add(line);
                    }
                }
            }
        }
        var findings = new ArrayList<Finding>();
        creators.forEach((dir, rules) -> {
            if (rules.size() > 1) {
                findings.add(Finding.of(lines.get(dir).get(1).span(),
                                        "Directory '" + dir + "' is created by " + rules.size() + " targets",
                                        "Create '" + dir + "' in one target and add it as an order-only prerequisite"));
            }
        });
        return findings;
    }

    private static List<Finding> recursiveMake(MakefileFacts facts, List<SemanticIssue> earlier) {
        return recipeLinesMatching(facts, line -> SUB_MAKE.matcher(line).find(),
                                   rule -> "Recursive make in '" + rule.name() + "' runs without ordering against sibling targets",
                                   "Order sub-make invocations with prerequisites");
    }

    private static List<Finding> notParallel(MakefileFacts facts, List<SemanticIssue> earlier) {
        return summary(facts, earlier, PARALLEL_SAFETY, ".NOTPARALLEL",
                       "Makefile has parallel-safety issues and no .NOTPARALLEL", ".NOTPARALLEL:");
    }

    // === Performance ===

    private static List<Finding> recursiveShell(MakefileFacts facts, List<SemanticIssue> earlier) {
        var findings = new ArrayList<Finding>();
        for (var variable : facts.variables()) {
            if (variable.flavor() == MakeItem.Flavor.RECURSIVE
                && (variable.value().contains("$(shell") || variable.value().contains("${shell"))) {
                findings.add(Finding.of(variable.span(),
                                        "Variable '" + variable.name() + "' re-runs $(shell) on every expansion",
                                        variable.name() + " := " + variable.value()));
            }
        }
        return findings;
    }

    private static List<Finding> manyShells(MakefileFacts facts, List<SemanticIssue> earlier) {
        var findings = new ArrayList<Finding>();
        for (var rule : facts.rules()) {
            var recipe = rule.recipe();
            if (recipe.size() >= 3 && recipe.stream().noneMatch(line -> line.text().contains("&&") || line.text().contains(";"))) {
                findings.add(Finding.of(rule.span(),
                                        "Target '" + rule.name() + "' starts " + recipe.size() + " separate shells",
                                        "Combine the commands with && or use .ONESHELL"));
            }
        }
        return findings;
    }

    private static List<Finding> repeatedRm(MakefileFacts facts, List<SemanticIssue> earlier) {
        var findings = new ArrayList<Finding>();
        for (var rule : facts.rules()) {
            var removals = rule.recipe()
                               .stream()
                               .filter(line -> MakefileFacts.command(line).startsWith("rm "))
                               .toList();
            if (removals.size() >= 2) {
                findings.add(Finding.of(removals.get(1).span(),
                                        "Target '" + rule.name() + "' runs rm " + removals.size() + " times",
                                        "Remove all files with a single rm command"));
            }
        }
        return findings;
    }

    private static List<Finding> explicitObjectRules(MakefileFacts facts, List<SemanticIssue> earlier) {
        var compiles = facts.rules()
                            .stream()
                            .filter(rule -> rule.name().endsWith(".o") && !rule.name().contains("%"))
                            .filter(rule -> rule.recipe().stream().anyMatch(line -> line.text().contains(" -c")))
                            .toList();
        if (compiles.size() < 3) {
            return List.of();
        }
        return List.of(Finding.of(compiles.get(2).span(),
                                  compiles.size() + " object files are compiled by explicit rules",
                                  "Use a pattern rule such as %.o: %.c"));
    }

    private static List<Finding> builtinSuffixes(MakefileFacts facts, List<SemanticIssue> earlier) {
        if (facts.rules().isEmpty()) {
            return List.of();
        }
        return summary(facts, earlier, PERFORMANCE, ".SUFFIXES",
                       "Makefile has performance issues and still searches the builtin suffix rules", ".SUFFIXES:");
    }

    // === Error handling ===

    private static List<Finding> uncheckedCommand(MakefileFacts facts, List<SemanticIssue> earlier) {
        var findings = new ArrayList<Finding>();
        for (var rule : facts.rules()) {
            for (var line : rule.recipe()) {
                var text = MakefileFacts.command(line);
                if (!text.contains(";") || text.contains("&&") || text.contains("||")) {
                    continue;
                }
                var parts = List.of(text.split(";"));
                var unchecked = parts.subList(0, parts.size() - 1)
                                     .stream()
                                     .map(String::strip)
                                     .filter(part -> CHECKED_COMMANDS.stream().anyMatch(cmd -> startsWithCommand(part, cmd)))
                                     .findFirst();
                unchecked.ifPresent(part -> findings.add(Finding.of(line.span(),
                                                                    "Failure of '" + part + "' is ignored by the next command",
                                                                    text.replace(";", " &&"))));
            }
        }
        return findings;
    }

    private static List<Finding> silentFailure(MakefileFacts facts, List<SemanticIssue> earlier) {
        var findings = new ArrayList<Finding>();
        for (var rule : facts.rules()) {
            for (var line : rule.recipe()) {
                if (MakefileFacts.ignoresErrors(line)) {
                    findings.add(Finding.of(line.span(), "Recipe of '" + rule.name() + "' ignores the exit status of '"
                                                         + MakefileFacts.command(line) + "'",
                                            "Handle the failure explicitly with || or remove the '-' prefix"));
                } else if (line.text().contains("/dev/null") && !line.text().contains("||")) {
                    findings.add(Finding.of(line.span(), "Recipe of '" + rule.name() + "' discards output without a fallback",
                                            "Add an explicit fallback with ||"));
                }
            }
        }
        return findings;
    }

    private static List<Finding> cdAcrossLines(MakefileFacts facts, List<SemanticIssue> earlier) {
        if (facts.hasSpecialTarget(".ONESHELL")) {
            return List.of();
        }
        var findings = new ArrayList<Finding>();
        for (var rule : facts.rules()) {
            var recipe = rule.recipe();
            for (int i = 0; i + 1 < recipe.size(); i++) {
                var text = MakefileFacts.command(recipe.get(i));
                if (startsWithCommand(text, "cd") && !text.contains("&&") && !text.contains(";")) {
                    findings.add(Finding.of(recipe.get(i).span(),
                                            "'" + text + "' does not apply to the following recipe lines of '" + rule.name() + "'",
                                            "Join the commands with && or add .ONESHELL:"));
                }
            }
        }
        return findings;
    }

    private static List<Finding> bashWithoutSetE(MakefileFacts facts, List<SemanticIssue> earlier) {
        return recipeLinesMatching(facts, line -> line.contains("bash -c") && !line.contains("set -e"),
                                   rule -> "Recipe of '" + rule.name() + "' runs bash -c without set -e",
                                   "Start the script with set -e: bash -c 'set -e; ...'");
    }

    private static List<Finding> uncheckedLoop(MakefileFacts facts, List<SemanticIssue> earlier) {
        return recipeLinesMatching(facts,
                                   line -> FOR_LOOP.matcher(line).find() && !line.contains("|| exit") && !line.contains("|| return"),
                                   rule -> "Loop in recipe of '" + rule.name() + "' keeps going after a failed iteration",
                                   "Add || exit 1 to the loop body");
    }

    private static List<Finding> deleteOnError(MakefileFacts facts, List<SemanticIssue> earlier) {
        return summary(facts, earlier, ERROR_HANDLING, ".DELETE_ON_ERROR",
                       "Makefile has error-handling issues and no .DELETE_ON_ERROR", ".DELETE_ON_ERROR:");
    }

    // === Portability ===

    private static List<Finding> bashism(MakefileFacts facts, List<SemanticIssue> earlier) {
        if (facts.bashShell()) {
            return List.of();
        }
        var findings = new ArrayList<Finding>();
        for (var rule : facts.rules()) {
            for (var line : rule.recipe()) {
                BASHISMS.stream()
                        .filter(line.text()::contains)
                        .findFirst()
                        .ifPresent(construct -> findings.add(Finding.of(line.span(),
                                                                        "Recipe of '" + rule.name() + "' uses non-portable '"
                                                                        + construct.strip() + "'",
                                                                        "Use POSIX sh syntax or set SHELL := /bin/bash")));
            }
        }
        return findings;
    }

    private static List<Finding> platformDetection(MakefileFacts facts, List<SemanticIssue> earlier) {
        return recipeLinesMatching(facts, line -> UNAME.matcher(line).find(),
                                   rule -> "Recipe of '" + rule.name() + "' branches on uname, which differs between platforms",
                                   "Detect features with a configure step instead of the platform name");
    }

    // === Helpers ===

    private static List<Finding> variablesMatching(MakefileFacts facts,
                                                   Predicate<String> test,
                                                   Function<String, String> message,
                                                   Function<String, String> fix) {
        var findings = new ArrayList<Finding>();
        for (var variable : facts.variables()) {
            if (test.test(variable.value())) {
                findings.add(Finding.of(variable.span(), message.apply(variable.name()), fix.apply(variable.name())));
            }
        }
        return findings;
    }

    private static List<Finding> recipeLinesMatching(MakefileFacts facts,
                                                     Predicate<String> test,
                                                     Function<Rule, String> message,
                                                     String fix) {
        var findings = new ArrayList<Finding>();
        for (var rule : facts.rules()) {
            for (var line : rule.recipe()) {
                if (test.test(line.text())) {
                    findings.add(Finding.of(line.span(), message.apply(rule), fix));
                }
            }
        }
        return findings;
    }

    // Reported once, at the first sibling issue, when the file lacks the special target.
    private static List<Finding> summary(MakefileFacts facts,
                                         List<SemanticIssue> earlier,
                                         IssueCategory category,
                                         String specialTarget,
                                         String message,
                                         String fix) {
        if (facts.hasSpecialTarget(specialTarget)) {
            return List.of();
        }
        return earlier.stream()
                      .filter(issue -> issue.category() == category)
                      .findFirst()
                      .map(issue -> List.of(Finding.of(issue.span(), message, fix)))
                      .orElse(List.of());
    }

    private static List<String> outputs(MakeItem.RecipeLine line) {
        return matches(OUTPUT_FILE, " " + MakefileFacts.command(line)).stream()
                                                                      .filter(file -> !file.startsWith("$@") && !file.startsWith("/dev/"))
                                                                      .filter(file -> !file.startsWith("&"))
                                                                      .toList();
    }

    private static List<String> inputs(MakeItem.RecipeLine line) {
        return matches(INPUT_FILE, MakefileFacts.command(line)).stream()
                                                               .filter(file -> !file.startsWith("-") && !file.startsWith("$"))
                                                               .toList();
    }

    private static List<String> mkdirTargets(MakeItem.RecipeLine line) {
        var result = new ArrayList<String>();
        for (var command : MakefileFacts.command(line).split("&&|;|\\|\\|")) {
            var words = command.strip().split("\\s+");
            if (words.length > 1 && words[0].equals("mkdir")) {
                for (int i = 1; i < words.length; i++) {
                    if (!words[i].startsWith("-")) {
                        result.add(words[i]);
                    }
                }
            }
        }
        return result;
    }

    private static List<String> matches(Pattern pattern, String text) {
        var result = new ArrayList<String>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            result.add(matcher.group(1));
        }
        return result;
    }

    private static boolean startsWithCommand(String text, String command) {
        return text.equals(command) || text.startsWith(command + " ");
    }
}

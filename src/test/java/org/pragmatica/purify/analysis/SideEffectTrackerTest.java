package org.pragmatica.purify.analysis;

import org.pragmatica.purify.shell.ShellParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SideEffectTrackerTest {

    private static List<String> collect(String source) {
        return SideEffectTracker.collect(ShellParser.parse(source).unwrap());
    }

    @Test
    void collect_stateChangingCommands_listedWithLine() {
        var effects = collect("""
            echo start
            mkdir -p /srv/app
            cp app.jar /srv/app/
            """);

        assertEquals(List.of("line 2: mkdir -p /srv/app (creates directory)",
                             "line 3: cp app.jar /srv/app/ (copies files)"),
                     effects);
    }

    @Test
    void collect_fileRedirects_listedAsWrites() {
        var effects = collect("echo a > out.txt\necho b >> out.txt\necho c > /dev/null\n");

        assertEquals(List.of("line 1: > out.txt (writes file)", "line 2: >> out.txt (appends to file)"), effects);
    }

    @Test
    void collect_nestedCommands_found() {
        var effects = collect("if [ -d old ]; then\n    rm -rf old\nfi\n");

        assertEquals(List.of("line 2: rm -rf old (removes files)"), effects);
    }

    @Test
    void collect_readOnlyScript_empty() {
        assertTrue(collect("ls -l\ncat file\n").isEmpty());
    }
}

package org.pragmatica.purify.shell;

import org.pragmatica.purify.format.FormatOptions;
import org.pragmatica.purify.tree.SourceLocation;
import org.pragmatica.purify.tree.SourceSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShellRendererTest {

    private static String roundTrip(String source) {
        return ShellRenderer.render(ShellParser.parse(source).unwrap());
    }

    private static void assertFixpoint(String source) {
        var once = roundTrip(source);
        assertEquals(once, roundTrip(once), "Rendered text must render to itself");
    }

    // === Layout ===

    @Test
    void render_ifStatement_usesIndentedBlock() {
        assertEquals("""
            if [ -f config ]; then
                echo found
            fi
            """, roundTrip("if [ -f config ]; then echo found; fi\n"));
    }

    @Test
    void render_ifElifElse_alignsKeywords() {
        assertEquals("""
            if [ "$a" = 1 ]; then
                echo one
            elif [ "$a" = 2 ]; then
                echo two
            else
                echo other
            fi
            """, roundTrip("if [ \"$a\" = 1 ]; then echo one; elif [ \"$a\" = 2 ]; then echo two; else echo other; fi\n"));
    }

    @Test
    void render_loops_placeDoOnHeaderLine() {
        assertEquals("""
            for f in a b; do
                echo "$f"
            done
            while true; do
                sleep 1
            done
            """, roundTrip("for f in a b\ndo\n  echo \"$f\"\ndone\nwhile true\ndo sleep 1; done\n"));
    }

    @Test
    void render_caseStatement_indentsArms() {
        assertEquals("""
            case "$1" in
                start|run)
                    echo starting
                    ;;
                *)
                    echo usage
                    ;;
            esac
            """, roundTrip("case \"$1\" in start|run) echo starting ;; *) echo usage ;; esac\n"));
    }

    @Test
    void render_functions_keepTheirSyntax() {
        assertEquals("""
            function build {
                make
            }
            clean() {
                rm -f out
            }
            """, roundTrip("function build { make; }\nclean() { rm -f out; }\n"));
    }

    @Test
    void render_simpleGroups_stayOnOneLine() {
        assertEquals("{ echo a; }\n( cd /tmp )\n", roundTrip("{ echo a; }\n(cd /tmp)\n"));
    }

    @Test
    void render_listsAndPipelines_keepOperators() {
        assertEquals("make && make install || echo failed\nls | sort\n",
                     roundTrip("make&&make install||echo failed\nls|sort\n"));
    }

    // === Words ===

    @Test
    void render_quoting_preservesQuoteStyle() {
        assertEquals("echo 'single $x' \"double $x\" $x\n", roundTrip("echo 'single $x' \"double $x\" $x\n"));
    }

    @Test
    void render_commandSubstitution_rendersInline() {
        assertEquals("files=$(ls | sort)\n", roundTrip("files=$(ls | sort)\n"));
    }

    @Test
    void render_arithmetic_spacesOperators() {
        assertEquals("x=$((a + 1))\n", roundTrip("x=$((a+1))\n"));
    }

    @Test
    void render_reservedWordArgument_isQuoted() {
        var span = SourceSpan.at(SourceLocation.START);
        var command = new ShellStatement.Command("echo",
                                                 List.of(new ShellExpression.Literal("fi", ShellExpression.Quoting.NONE, span)),
                                                 List.of(),
                                                 span);

        assertEquals("echo 'fi'", ShellRenderer.renderStatement(command));
    }

    @Test
    void render_timeKeyword_staysBare() {
        assertEquals("time make build\ntime -p ls | sort\n", roundTrip("time make build\ntime -p ls | sort\n"));
    }

    @Test
    void render_keywordAsCommandName_isQuoted() {
        var span = SourceSpan.at(SourceLocation.START);
        var command = new ShellStatement.Command("done", List.of(), List.of(), span);

        assertEquals("'done'", ShellRenderer.renderStatement(command));
    }

    @Test
    void render_hereDocument_writesBodyAfterLine() {
        var source = """
            cat <<EOF > out.txt
            hello
            EOF
            echo finished
            """;

        assertEquals(source, roundTrip(source));
    }

    @Test
    void render_shebangAndComments_kept() {
        assertEquals("#!/bin/sh\n# setup\necho hi\n", roundTrip("#!/bin/sh\n# setup\necho hi\n"));
    }

    // === Options ===

    @Test
    void render_maxLineLength_wrapsLongCommands() {
        var script = ShellParser.parse("echo aaaa bbbb cccc dddd\n").unwrap();

        var text = ShellRenderer.render(script, FormatOptions.DEFAULT.withMaxLineLength(20));

        assertEquals("echo aaaa bbbb \\\n    cccc dddd\n", text);
    }

    // === Fixpoint ===

    @Test
    void render_renderedScript_rendersToItself() {
        assertFixpoint("""
            #!/bin/sh
            set -e
            deploy() {
                for host in a b c; do
                    if [ -n "$host" ] && ping -c 1 "$host" > /dev/null 2>&1; then
                        scp build.tar "$host:/srv" || exit 1
                    fi
                done
            }
            count=$((count * 2))
            while read -r line; do echo "${line%%.*}"; done < input.txt
            case $mode in fast) deploy & ;; *) wait ;; esac
            """);
    }
}

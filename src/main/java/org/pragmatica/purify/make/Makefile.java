package org.pragmatica.purify.make;

import org.pragmatica.purify.tree.SyntaxMetadata;
import org.pragmatica.purify.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Parsed Makefile.
 */
public record Makefile(List<MakeItem> items, SyntaxMetadata metadata) implements SyntaxTree {

    public Makefile {
        items = List.copyOf(items);
    }

    public Makefile withItems(List<MakeItem> newItems) {
        return new Makefile(newItems, metadata);
    }

    /**
     * Every item, including those nested in conditionals and rule recipes, in source order.
     */
    public List<MakeItem> allItems() {
        var result = new ArrayList<MakeItem>();
        forEach(items, result::add);
        return result;
    }

    public boolean hasSpecialTarget(String name) {
        return allItems().stream()
                         .anyMatch(item -> item instanceof MakeItem.Target target && target.name().equals(name));
    }

    /**
     * Rules, blocks and directives; blanks and comments are layout.
     */
    @Override
    public int statementCount() {
        int[] count = {0};
        forEach(items, item -> {
            if (!(item instanceof MakeItem.Blank) && !(item instanceof MakeItem.Comment)) {
                count[0]++;
            }
        });
        return count[0];
    }

    private static void forEach(List<MakeItem> items, Consumer<MakeItem> action) {
        for (var item : items) {
            action.accept(item);
            if (item instanceof MakeItem.Conditional conditional) {
                forEach(conditional.thenItems(), action);
                forEach(conditional.elseItems(), action);
            } else if (item instanceof MakeItem.Target target) {
                target.recipe().forEach(action);
            } else if (item instanceof MakeItem.PatternRule rule) {
                rule.recipe().forEach(action);
            }
        }
    }
}

package org.pragmatica.purify.transform;

import org.pragmatica.purify.make.MakeItem;
import org.pragmatica.purify.make.Makefile;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies Makefile transformations to a copy of a Makefile, descending into conditionals.
 */
public final class MakefileRewriter {
    private static final Logger log = LoggerFactory.getLogger(MakefileRewriter.class);

    private MakefileRewriter() {}

    public static RewriteOutcome<Makefile> apply(Makefile makefile, List<Transformation> transformations) {
        var recorder = new RewriteOutcome.Recorder();
        var items = makefile.items();
        for (var transformation : transformations) {
            if (!transformation.safe()) {
                recorder.advisory(transformation);
                continue;
            }
            var hits = new int[1];
            var rewritten = items(items, transformation, hits);
            if (hits[0] > 0) {
                items = rewritten;
                recorder.applied(transformation);
            } else {
                var advisory = Transformation.Advisory.downgrade(transformation, "target changed or not found");
                log.debug("Downgraded {} at {}: {}", transformation.ruleId(), transformation.span(), advisory.message());
                recorder.downgraded(advisory);
            }
        }
        return recorder.finish(makefile.withItems(items));
    }

    private static List<MakeItem> items(List<MakeItem> items, Transformation transformation, int[] hits) {
        var result = new ArrayList<MakeItem>(items.size());
        for (var item : items) {
            result.add(item(item, transformation, hits));
        }
        return result;
    }

    private static MakeItem item(MakeItem item, Transformation transformation, int[] hits) {
        if (item instanceof MakeItem.Conditional conditional) {
            return new MakeItem.Conditional(conditional.directive(), conditional.arguments(),
                                            items(conditional.thenItems(), transformation, hits),
                                            items(conditional.elseItems(), transformation, hits),
                                            conditional.elseChained(), conditional.span());
        }
        if (!item.span().equals(transformation.span())) {
            return item;
        }
        if (transformation instanceof Transformation.WrapWithSort wrap
            && item instanceof MakeItem.Variable variable
            && SortWrapper.needsWrapping(variable.value(), wrap.function(), wrap.command())) {
            hits[0]++;
            return variable.withValue(SortWrapper.wrap(variable.value(), wrap.function(), wrap.command()));
        }
        return item;
    }
}

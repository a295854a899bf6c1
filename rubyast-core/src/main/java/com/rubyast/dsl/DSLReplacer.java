package com.rubyast.dsl;

import com.rubyast.ast.ClassDef;
import com.rubyast.ast.EmptyTree;
import com.rubyast.ast.Expression;
import com.rubyast.ast.Send;
import com.rubyast.ast.treemap.TreeTransformer;
import com.rubyast.common.Enforce;
import com.rubyast.core.MutableContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a {@link DslRuleSet} to every class body and every call in a tree.
 */
public final class DSLReplacer implements TreeTransformer<MutableContext> {

    private static final Logger LOGGER = LoggerFactory.getLogger(DSLReplacer.class);

    private final DslRuleSet rules;
    private final RewriteObserver observer;

    public DSLReplacer(DslRuleSet rules, RewriteObserver observer) {
        this.rules = Enforce.notNull(rules, "rules");
        this.observer = Enforce.notNull(observer, "observer");
    }

    @Override
    public Expression postTransformClassDef(MutableContext ctx, ClassDef original) {
        ClassDef classDef = original;
        for (ClassDefRule rule : rules.classRules()) {
            classDef = Enforce.notNull(rule.patch(ctx, classDef), "ClassDefRule result");
        }

        List<Expression> rhs = classDef.rhs();
        Expression prevStat = new EmptyTree();
        // Keyed by position; equal statements must not share an entry.
        Map<Integer, List<Expression>> replaceNodes = new HashMap<>();
        for (int i = 0; i < rhs.size(); i++) {
            Expression stat = rhs.get(i);
            for (DslRuleSet.Entry<?> entry : rules.statementRules()) {
                if (!entry.appliesTo(stat)) {
                    continue;
                }
                List<Expression> nodes = entry.replace(ctx, stat, prevStat);
                Enforce.elementsNotNull(nodes, entry.name() + " result");
                if (!nodes.isEmpty()) {
                    LOGGER.debug("{} replaced {} at {} with {} statement(s)", entry.name(), stat.type(),
                        stat.loc(), nodes.size());
                    observer.onReplaced(entry.name(), stat, nodes.size());
                    replaceNodes.put(i, nodes);
                    break;
                }
            }
            prevStat = stat;
        }
        if (replaceNodes.isEmpty()) {
            return classDef;
        }

        List<Expression> newRhs = new ArrayList<>(rhs.size());
        for (int i = 0; i < rhs.size(); i++) {
            List<Expression> replacement = replaceNodes.get(i);
            if (replacement != null) {
                newRhs.addAll(replacement);
            } else {
                newRhs.add(rhs.get(i));
            }
        }
        return classDef.withRhs(newRhs);
    }

    @Override
    public Expression postTransformSend(MutableContext ctx, Send original) {
        Expression result = original;
        for (SendRewriter rewriter : rules.sendRewriters()) {
            if (!(result instanceof Send)) {
                break;
            }
            result = Enforce.notNull(rewriter.rewrite(ctx, (Send) result), "SendRewriter result");
        }
        return result;
    }
}

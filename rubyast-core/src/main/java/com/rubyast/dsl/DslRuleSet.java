package com.rubyast.dsl;

import com.rubyast.ast.Assign;
import com.rubyast.ast.Expression;
import com.rubyast.ast.MethodDef;
import com.rubyast.ast.Send;
import com.rubyast.core.MutableContext;
import com.rubyast.dsl.rules.AttrReader;
import com.rubyast.dsl.rules.ChalkODMProp;
import com.rubyast.dsl.rules.Command;
import com.rubyast.dsl.rules.DSLBuilder;
import com.rubyast.dsl.rules.InterfaceWrapper;
import com.rubyast.dsl.rules.MixinEncryptedProp;
import com.rubyast.dsl.rules.Sinatra;
import com.rubyast.dsl.rules.Struct;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered collection of rewrite rules.
 *
 * <p>Statement rules are tried in registration order; for a given statement the first
 * rule whose kind matches and whose result is non-empty wins.</p>
 */
public final class DslRuleSet {

    private static final DslRuleSet STANDARD = builder()
        .classRule(new Command())
        .statementRule(Assign.class, "Struct", new Struct())
        .statementRule(Send.class, "ChalkODMProp", new ChalkODMProp())
        .statementRule(Send.class, "MixinEncryptedProp", new MixinEncryptedProp())
        .statementRule(Send.class, "DSLBuilder", new DSLBuilder())
        .statementRule(Send.class, "AttrReader", new AttrReader())
        .statementRule(MethodDef.class, "Sinatra", new Sinatra())
        .sendRewriter(new InterfaceWrapper())
        .build();

    private final List<ClassDefRule> classRules;
    private final List<Entry<?>> statementRules;
    private final List<SendRewriter> sendRewriters;

    private DslRuleSet(Builder builder) {
        this.classRules = List.copyOf(builder.classRules);
        this.statementRules = List.copyOf(builder.statementRules);
        this.sendRewriters = List.copyOf(builder.sendRewriters);
    }

    /**
     * The rules run by {@link DSL#run(MutableContext, Expression)}.
     */
    public static DslRuleSet standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ClassDefRule> classRules() {
        return classRules;
    }

    public List<Entry<?>> statementRules() {
        return statementRules;
    }

    public List<SendRewriter> sendRewriters() {
        return sendRewriters;
    }

    /**
     * A statement rule together with the statement variant it inspects.
     */
    public record Entry<T extends Expression>(
        Class<T> kind,
        String name,
        StatementRule<T> rule
    ) {
        public boolean appliesTo(Expression stat) {
            return kind.isInstance(stat);
        }

        public List<Expression> replace(MutableContext ctx, Expression stat, Expression prevStat) {
            return rule.replace(ctx, kind.cast(stat), prevStat);
        }
    }

    public static final class Builder {
        private final List<ClassDefRule> classRules = new ArrayList<>();
        private final List<Entry<?>> statementRules = new ArrayList<>();
        private final List<SendRewriter> sendRewriters = new ArrayList<>();

        private Builder() {
        }

        public Builder classRule(ClassDefRule rule) {
            classRules.add(rule);
            return this;
        }

        public <T extends Expression> Builder statementRule(Class<T> kind, String name, StatementRule<T> rule) {
            statementRules.add(new Entry<>(kind, name, rule));
            return this;
        }

        public Builder sendRewriter(SendRewriter rewriter) {
            sendRewriters.add(rewriter);
            return this;
        }

        public DslRuleSet build() {
            return new DslRuleSet(this);
        }
    }
}

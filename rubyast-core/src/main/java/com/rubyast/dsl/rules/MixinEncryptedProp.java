package com.rubyast.dsl.rules;

import com.rubyast.ast.Expression;
import com.rubyast.ast.Send;
import com.rubyast.core.Loc;
import com.rubyast.core.MutableContext;
import com.rubyast.core.NameRef;
import com.rubyast.dsl.StatementRule;

import java.util.List;

/**
 * {@code encrypted_prop :foo} defines the plaintext accessors {@code foo} and {@code foo=}
 * plus the ciphertext accessors {@code encrypted_foo} and {@code encrypted_foo=}.
 */
public final class MixinEncryptedProp implements StatementRule<Send> {

    private static final String ENCRYPTED_PREFIX = "encrypted_";

    @Override
    public List<Expression> replace(MutableContext ctx, Send send, Expression prevStat) {
        if (!RuleSupport.isSelfCall(ctx, send, "encrypted_prop")) {
            return List.of();
        }
        if (send.args().isEmpty() || send.args().size() > 2) {
            return List.of();
        }
        NameRef name = RuleSupport.symbolArg(send.args().get(0));
        if (name == null) {
            return List.of();
        }

        Loc loc = send.loc();
        String text = RuleSupport.text(ctx, name);
        String encrypted = ENCRYPTED_PREFIX + text;
        return List.of(
            RuleSupport.reader(loc, name, RuleSupport.instanceVar(ctx, loc, text)),
            RuleSupport.reader(loc, ctx.name(encrypted), RuleSupport.instanceVar(ctx, loc, encrypted)),
            RuleSupport.writer(ctx, loc, text, text),
            RuleSupport.writer(ctx, loc, encrypted, encrypted));
    }
}

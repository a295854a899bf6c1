package com.rubyast.ast;

import com.rubyast.core.GlobalState;
import com.rubyast.core.NameRef;

/**
 * The literal type-value carried by a {@link Literal}.
 */
public sealed interface LiteralValue {

    String show(GlobalState gs);

    record IntegerValue(long value) implements LiteralValue {
        @Override
        public String show(GlobalState gs) {
            return Long.toString(value);
        }
    }

    record FloatValue(double value) implements LiteralValue {
        @Override
        public String show(GlobalState gs) {
            return Double.toString(value);
        }
    }

    record StringValue(NameRef value) implements LiteralValue {
        @Override
        public String show(GlobalState gs) {
            return "\"" + value.show(gs) + "\"";
        }
    }

    record SymbolValue(NameRef value) implements LiteralValue {
        @Override
        public String show(GlobalState gs) {
            return ":" + value.show(gs);
        }
    }

    record TrueValue() implements LiteralValue {
        @Override
        public String show(GlobalState gs) {
            return "true";
        }
    }

    record FalseValue() implements LiteralValue {
        @Override
        public String show(GlobalState gs) {
            return "false";
        }
    }

    record NilValue() implements LiteralValue {
        @Override
        public String show(GlobalState gs) {
            return "nil";
        }
    }
}

package com.rubyast;

import com.rubyast.core.GlobalState;
import com.rubyast.core.NameRef;
import com.rubyast.core.SymbolRef;
import com.rubyast.core.TypeRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory name, symbol and type tables.
 */
public class TestGlobalState implements GlobalState {

    private final List<String> names = new ArrayList<>(List.of("<none>"));
    private final Map<String, NameRef> nameIds = new HashMap<>();
    // 0 and 1 are the noSymbol and todo sentinels
    private final List<String> symbols = new ArrayList<>(List.of("<none>", "<todo sym>"));
    private final List<String> types = new ArrayList<>();

    @Override
    public String nameText(NameRef name) {
        return names.get(name.id());
    }

    @Override
    public NameRef enterName(String text) {
        return nameIds.computeIfAbsent(text, t -> {
            names.add(t);
            return new NameRef(names.size() - 1);
        });
    }

    public SymbolRef enterSymbol(String fullName) {
        symbols.add(fullName);
        return new SymbolRef(symbols.size() - 1);
    }

    @Override
    public String symbolName(SymbolRef symbol) {
        String fullName = symbolFullName(symbol);
        int sep = fullName.lastIndexOf("::");
        return sep < 0 ? fullName : fullName.substring(sep + 2);
    }

    @Override
    public String symbolFullName(SymbolRef symbol) {
        return symbols.get(symbol.id());
    }

    @Override
    public boolean symbolExists(SymbolRef symbol) {
        return symbol.id() > 1 && symbol.id() < symbols.size();
    }

    public TypeRef enterType(String text) {
        types.add(text);
        return new TypeRef(types.size() - 1);
    }

    @Override
    public String typeToString(TypeRef type) {
        return types.get(type.id());
    }
}

package org.sysmlite.engine.eval;

import java.util.Map;
import java.util.Optional;

/**
 * Maps operator tokens to the library functions implementing them.
 */
public final class Operators {

    public static final String BASE = "BaseFunctions";
    public static final String DATA = "DataFunctions";
    public static final String CONTROL = "ControlFunctions";

    private static final Map<String, FunctionKey> OPERATORS = Map.ofEntries(
            // BaseFunctions
            Map.entry("as", FunctionKey.of(BASE, "as")),
            Map.entry("meta", FunctionKey.of(BASE, "meta")),
            Map.entry("@", FunctionKey.of(BASE, "@")),
            Map.entry("@@", FunctionKey.of(BASE, "@@")),
            Map.entry("==", FunctionKey.of(BASE, "==")),
            Map.entry("===", FunctionKey.of(BASE, "===")),
            Map.entry("!=", FunctionKey.of(BASE, "!=")),
            Map.entry("!==", FunctionKey.of(BASE, "!==")),
            Map.entry("hastype", FunctionKey.of(BASE, "hastype")),
            Map.entry("istype", FunctionKey.of(BASE, "istype")),
            Map.entry("#", FunctionKey.of(BASE, "#")),
            Map.entry(",", FunctionKey.of(BASE, ",")),
            // DataFunctions
            Map.entry("+", FunctionKey.of(DATA, "+")),
            Map.entry("-", FunctionKey.of(DATA, "-")),
            Map.entry("*", FunctionKey.of(DATA, "*")),
            Map.entry("/", FunctionKey.of(DATA, "/")),
            Map.entry("%", FunctionKey.of(DATA, "%")),
            Map.entry("**", FunctionKey.of(DATA, "**")),
            Map.entry("^", FunctionKey.of(DATA, "^")),
            Map.entry("<", FunctionKey.of(DATA, "<")),
            Map.entry(">", FunctionKey.of(DATA, ">")),
            Map.entry("<=", FunctionKey.of(DATA, "<=")),
            Map.entry(">=", FunctionKey.of(DATA, ">=")),
            Map.entry("..", FunctionKey.of(DATA, "..")),
            Map.entry("not", FunctionKey.of(DATA, "not")),
            Map.entry("~", FunctionKey.of(DATA, "~")),
            Map.entry("xor", FunctionKey.of(DATA, "xor")),
            Map.entry("&", FunctionKey.of(DATA, "&")),
            Map.entry("|", FunctionKey.of(DATA, "|")),
            // ControlFunctions
            Map.entry("if", FunctionKey.of(CONTROL, "if")),
            Map.entry("??", FunctionKey.of(CONTROL, "??")),
            Map.entry("and", FunctionKey.of(CONTROL, "and")),
            Map.entry("or", FunctionKey.of(CONTROL, "or")),
            Map.entry("implies", FunctionKey.of(CONTROL, "implies")),
            Map.entry(".", FunctionKey.of(CONTROL, ".")));

    private Operators() {
        // Static utility class
    }

    public static Optional<FunctionKey> functionFor(String operator) {
        return Optional.ofNullable(OPERATORS.get(operator));
    }

    public static boolean isOperator(String token) {
        return OPERATORS.containsKey(token);
    }
}

package org.sysmlite.engine.eval;

import java.util.Objects;

/**
 * Identifies a library function by its package and name, e.g.
 * {@code SequenceFunctions::size} or {@code DataFunctions::'+'}.
 *
 * @param packageName Library package declaring the function
 * @param name        Unquoted function name
 */
public record FunctionKey(String packageName, String name) {

    public FunctionKey {
        Objects.requireNonNull(packageName, "Package name cannot be null");
        Objects.requireNonNull(name, "Function name cannot be null");
    }

    public static FunctionKey of(String packageName, String name) {
        return new FunctionKey(packageName, name);
    }

    /**
     * @return the qualified name as the model prints it, with operator names quoted
     */
    public String qualifiedName() {
        return packageName + "::" + quote(name);
    }

    private static String quote(String name) {
        boolean plain = !name.isEmpty() && (Character.isLetter(name.charAt(0)) || name.charAt(0) == '_');
        for (int i = 1; plain && i < name.length(); i++) {
            char c = name.charAt(i);
            plain = Character.isLetterOrDigit(c) || c == '_';
        }
        return plain ? name : "'" + name.replace("'", "\\'") + "'";
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}

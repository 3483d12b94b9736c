package com.backport.transpiler.model;

import java.util.Optional;

import lombok.NonNull;
import lombok.Value;

/**
 * An import that must be present in the rewritten module:
 * {@code import module} when there is no member, {@code from module import member} otherwise.
 * Equality is by the (module, member) pair.
 */
@Value
public class ImportDeclaration {

    public static final String FUTURE_MODULE = "__future__";

    @NonNull
    String moduleName;
    String memberName;

    public static ImportDeclaration module(String moduleName) {
        return new ImportDeclaration(moduleName, null);
    }

    public static ImportDeclaration member(String moduleName, String memberName) {
        return new ImportDeclaration(moduleName, memberName);
    }

    public static ImportDeclaration future(String feature) {
        return new ImportDeclaration(FUTURE_MODULE, feature);
    }

    public Optional<String> getMember() {
        return Optional.ofNullable(memberName);
    }

    public boolean isFuture() {
        return FUTURE_MODULE.equals(moduleName);
    }

    public Node toStatement() {
        return memberName == null
                ? Nodes.importStmt(moduleName)
                : Nodes.importFrom(moduleName, memberName);
    }

    /**
     * True if the given statement already provides this import.
     */
    public boolean isProvidedBy(Node statement) {
        if (statement.is(NodeKind.IMPORT) && memberName == null) {
            return statement.getNodes("names").stream()
                    .anyMatch(alias -> moduleName.equals(alias.getString("name")) && alias.getString("asname") == null);
        }
        if (statement.is(NodeKind.IMPORT_FROM) && memberName != null) {
            return moduleName.equals(statement.getString("module"))
                    && statement.getNodes("names").stream()
                            .anyMatch(alias -> memberName.equals(alias.getString("name"))
                                    && alias.getString("asname") == null);
        }
        return false;
    }

    @Override
    public String toString() {
        return memberName == null ? "import " + moduleName : "from " + moduleName + " import " + memberName;
    }
}

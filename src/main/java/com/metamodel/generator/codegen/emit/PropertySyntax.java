package com.metamodel.generator.codegen.emit;

import java.util.List;
import java.util.stream.Collectors;

import com.metamodel.generator.codegen.util.LiteralUtil;

/**
 * Spelling of every statement the coder writes. Emitters decide what to write; this class
 * decides how it reads.
 */
public class PropertySyntax {

    public static final String INDENT = "    ";

    private static final String IGNORE_ASSIGNMENT = "  # type: ignore[assignment]";
    private static final String IGNORE_ATTR_DEFINED = "  # type: ignore[attr-defined]";

    public String classDeclaration(String className, List<String> baseNames) {
        return "class " + className + "(" + String.join(", ", baseNames) + "):";
    }

    public String emptyBody() {
        return INDENT + "pass";
    }

    public String member(String declaration) {
        return INDENT + declaration;
    }

    public String importStatement(String module, String typeName) {
        return "from " + module + " import " + typeName;
    }

    public String annotatedMember(String name, String type) {
        return name + ": " + type;
    }

    /**
     * {@code name: _attribute[str] = _attribute("name", str, default="x")}
     */
    public String literalAttribute(String name, String kind, String defaultLiteral) {
        String defaultPart = defaultLiteral != null ? ", default=" + defaultLiteral : "";
        return name + ": _attribute[" + kind + "] = _attribute(" + LiteralUtil.quote(name) + ", " + kind
                + defaultPart + ")";
    }

    /**
     * {@code name = _enumeration("name", ("a", "b"), "a")}
     */
    public String enumerationAttribute(String name, List<String> literals, String defaultLiteral) {
        String values = literals.stream().map(LiteralUtil::quote).collect(Collectors.joining(", "));
        return name + " = _enumeration(" + LiteralUtil.quote(name) + ", (" + values + "), "
                + LiteralUtil.quote(defaultLiteral) + ")";
    }

    /**
     * {@code name: relation_one[Type]} or {@code name: relation_many[Type]}
     */
    public String relationAttribute(String name, String typeName, boolean singleValued, boolean shadowed) {
        String relation = singleValued ? "relation_one" : "relation_many";
        return name + ": " + relation + "[" + typeName + "]" + (shadowed ? IGNORE_ASSIGNMENT : "");
    }

    public String association(String qualifiedName, String name, String typeName, String lower, String upper,
                              boolean composite, String opposite) {
        StringBuilder sb = new StringBuilder();
        sb.append(qualifiedName).append(" = association(").append(LiteralUtil.quote(name)).append(", ").append(typeName);
        appendBounds(sb, lower, upper);
        if (composite) {
            sb.append(", composite=True");
        }
        if (opposite != null) {
            sb.append(", opposite=").append(LiteralUtil.quote(opposite));
        }
        return sb.append(")").toString();
    }

    public String derivedUnion(String qualifiedName, String name, String typeName, String lower, String upper) {
        StringBuilder sb = new StringBuilder();
        sb.append(qualifiedName).append(" = derivedunion(").append(LiteralUtil.quote(name)).append(", ").append(typeName);
        appendBounds(sb, lower, upper);
        return sb.append(")").toString();
    }

    public String redefinition(String qualifiedName, String ownerName, String name, String typeName,
                               String redefined) {
        return qualifiedName + " = redefine(" + ownerName + ", " + LiteralUtil.quote(name) + ", " + typeName + ", "
                + redefined + ")";
    }

    /**
     * Registers {@code subsetQualifiedName} as contributing to the union {@code unionOwner.unionName}.
     */
    public String subsetLink(String unionOwner, String unionName, String subsetQualifiedName) {
        return unionOwner + "." + unionName + ".add(" + subsetQualifiedName + ")" + IGNORE_ATTR_DEFINED;
    }

    // lower 0 and upper * are the defaults of the properties runtime
    private static void appendBounds(StringBuilder sb, String lower, String upper) {
        if (lower != null && !lower.equals("0")) {
            sb.append(", lower=").append(lower);
        }
        if (upper != null && !upper.equals("*")) {
            sb.append(", upper=").append(upper);
        }
    }
}

package com.example.contractlens.diff;

import com.example.contractlens.domain.EventInfo;
import com.example.contractlens.domain.FunctionInfo;
import com.example.contractlens.domain.FunctionKind;
import com.example.contractlens.domain.ImportInfo;
import com.example.contractlens.domain.ModifierInfo;
import com.example.contractlens.domain.Parameter;
import com.example.contractlens.domain.VariableInfo;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Textual renderings of entity shapes.
 *
 * <p>Display signatures keep the source spelling and are what change records show.
 * Canonical signatures normalize type names and are what equality is decided on.
 * Event and modifier canonical forms leave parameter names out; function canonical
 * forms keep them.
 */
public final class CanonicalSignatures {
    private static final Pattern VISIBILITY = Pattern.compile("\\b(public|external|internal|private)\\b");
    private static final Pattern MUTABILITY = Pattern.compile("\\b(view|pure|payable|nonpayable)\\b");

    private CanonicalSignatures() {}

    /** {@code function name(type name, ...) visibility mutability modifiers returns (...)}. */
    public static String functionSignature(FunctionInfo function) {
        return renderFunction(function, false);
    }

    public static String canonicalFunction(FunctionInfo function) {
        return renderFunction(function, true);
    }

    private static String renderFunction(FunctionInfo function, boolean normalized) {
        String head = function.kind() == FunctionKind.FUNCTION
                ? "function " + function.name()
                : function.kind().keyword();
        StringBuilder signature = new StringBuilder(head)
                .append('(')
                .append(namedParameters(function.parameters(), normalized))
                .append(") ")
                .append(function.visibility().keyword())
                .append(' ')
                .append(function.mutability().keyword());
        if (!function.modifiers().isEmpty()) {
            signature.append(' ').append(String.join(" ", function.modifiers()));
        }
        if (!function.returns().isEmpty()) {
            signature.append(" returns (").append(namedParameters(function.returns(), normalized)).append(')');
        }
        return signature.toString();
    }

    /** {@code event Name(type indexed name, ...)}. */
    public static String eventSignature(EventInfo event) {
        String parameters = event.parameters().stream()
                .map(p -> join(p.type() + (p.indexed() ? " indexed" : ""), p.name()))
                .collect(Collectors.joining(", "));
        return "event " + event.name() + "(" + parameters + ")";
    }

    public static String canonicalEvent(EventInfo event) {
        String parameters = event.parameters().stream()
                .map(p -> TypeNames.normalize(p.type()) + (p.indexed() ? " indexed" : ""))
                .collect(Collectors.joining(","));
        return "event " + event.name() + "(" + parameters + ")";
    }

    public static String modifierSignature(ModifierInfo modifier) {
        return "modifier " + modifier.name() + "(" + namedParameters(modifier.parameters(), false) + ")";
    }

    public static String canonicalModifier(ModifierInfo modifier) {
        return "modifier " + modifier.name() + "(" + String.join(",", typeSequence(modifier.parameters())) + ")";
    }

    /** {@code type visibility name}, followed by {@code (constant)} or {@code (immutable)} when set. */
    public static String variableSignature(VariableInfo variable) {
        StringBuilder signature = new StringBuilder(variable.type())
                .append(' ')
                .append(variable.visibility().keyword())
                .append(' ')
                .append(variable.name());
        if (variable.constant()) {
            signature.append(" (constant)");
        }
        if (variable.immutable()) {
            signature.append(" (immutable)");
        }
        return signature.toString();
    }

    public static String importSignature(ImportInfo importInfo) {
        String what;
        if (!importInfo.symbols().isEmpty()) {
            what = "{" + String.join(", ", importInfo.symbols()) + "}";
        } else if (importInfo.alias() != null) {
            what = "* as " + importInfo.alias();
        } else {
            what = "*";
        }
        return "import " + what + " from \"" + importInfo.path() + "\"";
    }

    public static List<String> typeSequence(List<Parameter> parameters) {
        return parameters.stream().map(p -> TypeNames.normalize(p.type())).toList();
    }

    /**
     * Visibility keyword of a function signature, read from the attributes after the
     * parameter list; {@code public} when none is present.
     */
    public static String visibilityOf(String signature) {
        Matcher matcher = VISIBILITY.matcher(attributesOf(signature));
        return matcher.find() ? matcher.group(1) : "public";
    }

    /** Mutability keyword of a function signature; {@code nonpayable} when none is present. */
    public static String mutabilityOf(String signature) {
        Matcher matcher = MUTABILITY.matcher(attributesOf(signature));
        return matcher.find() ? matcher.group(1) : "nonpayable";
    }

    // text between the parameter list and the returns clause, so parameter types such
    // as "address payable" are never mistaken for attributes
    private static String attributesOf(String signature) {
        int open = signature.indexOf('(');
        if (open < 0) {
            return signature;
        }
        int depth = 0;
        int close = -1;
        for (int i = open; i < signature.length(); i++) {
            char c = signature.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                close = i;
                break;
            }
        }
        if (close < 0) {
            return signature;
        }
        String attributes = signature.substring(close + 1);
        int returns = attributes.indexOf(" returns (");
        return returns >= 0 ? attributes.substring(0, returns) : attributes;
    }

    private static String namedParameters(List<Parameter> parameters, boolean normalized) {
        return parameters.stream()
                .map(p -> join(normalized ? TypeNames.normalize(p.type()) : p.type(), p.name()))
                .collect(Collectors.joining(", "));
    }

    private static String join(String type, String name) {
        return name.isEmpty() ? type : type + " " + name;
    }
}

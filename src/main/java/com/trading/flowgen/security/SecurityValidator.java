package com.trading.flowgen.security;

import com.trading.flowgen.security.ast.Alias;
import com.trading.flowgen.security.ast.Expr;
import com.trading.flowgen.security.ast.PyModule;
import com.trading.flowgen.security.ast.PyTreeWalker;
import com.trading.flowgen.security.ast.PythonParser;
import com.trading.flowgen.security.ast.Stmt;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import lombok.extern.log4j.Log4j2;

/**
 * Static capability check over a parsed module.
 *
 * <p>
 * Walks the tree breadth-first and reports:
 * <ul>
 * <li>imports of deny-listed packages (CRITICAL) or of anything not
 * allow-listed (HIGH), including relative imports;</li>
 * <li>calls to dynamic-execution primitives and process-spawning functions
 * (CRITICAL), with the callee resolved through attribute chains and import
 * aliases;</li>
 * <li>access to interpreter internals through dunder attributes or names
 * such as {@code __builtins__} (HIGH).</li>
 * </ul>
 */
@Log4j2
public final class SecurityValidator {
    private final SourceParser parser;
    private final SecurityPolicy policy;

    public SecurityValidator(SecurityPolicy policy) {
        this(new PythonParser(), policy);
    }

    public SecurityValidator(SourceParser parser, SecurityPolicy policy) {
        this.parser = parser;
        this.policy = policy;
    }

    /** Parses and checks; unparseable code yields a single CRITICAL violation. */
    public SecurityCheckResult check(String code) {
        PyModule tree;
        try {
            tree = parser.parse(code);
        } catch (SourceSyntaxException e) {
            log.debug("Security check on unparseable code: {}", e.getMessage());
            return SecurityCheckResult.invalidSyntax();
        }
        return check(tree);
    }

    public SecurityCheckResult check(PyModule tree) {
        Map<String, String> aliases = importAliases(tree);
        List<Violation> violations = new ArrayList<>();

        PyTreeWalker.walk(tree, node -> {
            if (node instanceof Stmt.Import imp) {
                for (Alias alias : imp.names())
                    checkImport(imp.line(), alias.name(), "import " + alias.name(), violations);
            } else if (node instanceof Stmt.ImportFrom from) {
                checkImportFrom(from, violations);
            } else if (node instanceof Expr.Call call) {
                checkCall(call, aliases, violations);
            } else if (node instanceof Expr.Attribute attr && policy.isForbiddenAttribute(attr.attr())) {
                violations.add(Violation.high(attr.line(), attr.attr(),
                        "Access to restricted attribute: " + attr.attr(),
                        "Remove introspection of interpreter internals"));
            } else if (node instanceof Expr.Name name && policy.isForbiddenAttribute(name.id())) {
                violations.add(Violation.high(name.line(), name.id(),
                        "Access to restricted name: " + name.id(),
                        "Remove introspection of interpreter internals"));
            }
        });

        if (violations.isEmpty())
            log.debug("Security check passed");
        else
            log.debug("Security check found {} violation(s)", violations.size());
        return new SecurityCheckResult(violations);
    }

    private void checkImport(int line, String module, String code, List<Violation> out) {
        if (policy.isForbiddenImport(module)) {
            out.add(Violation.critical(line, code, "Forbidden import detected: " + module,
                    "Remove import of " + module + ". Use allowed modules only."));
        } else if (!policy.isAllowedImport(module)) {
            out.add(Violation.high(line, code, "Potentially unsafe import: " + module,
                    "Verify " + module + " is in allowed imports list"));
        }
    }

    private void checkImportFrom(Stmt.ImportFrom from, List<Violation> out) {
        if (from.isRelative()) {
            String target = ".".repeat(from.level()) + (from.module() == null ? "" : from.module());
            out.add(Violation.high(from.line(), "from " + target + " import ...",
                    "Relative import is not allowed: " + target,
                    "Import from allowed packages by absolute name"));
            return;
        }
        String module = from.module();
        String code = "from " + module + " import ...";
        if (policy.isForbiddenImport(module)) {
            out.add(Violation.critical(from.line(), code, "Forbidden import detected: " + module,
                    "Remove import from " + module));
        } else if (!policy.isAllowedImport(module)) {
            out.add(Violation.high(from.line(), code, "Potentially unsafe import: " + module,
                    "Verify " + module + " is in allowed imports list"));
        }
    }

    private void checkCall(Expr.Call call, Map<String, String> aliases, List<Violation> out) {
        String written = qualifiedName(call.func());
        if (written == null)
            return;
        String resolved = resolve(written, aliases);

        String dangerous = firstMatch(policy::isDangerousFunction, written, resolved);
        if (dangerous != null) {
            out.add(Violation.critical(call.line(), written, "Dangerous function call detected: " + dangerous,
                    "Remove " + dangerous + " call. This function is prohibited for security reasons."));
        }
        String process = firstMatch(policy::isProcessCall, written, resolved);
        if (process != null) {
            out.add(Violation.critical(call.line(), written, "System command execution detected: " + process,
                    "Remove system command execution"));
        }
    }

    private static String firstMatch(Predicate<String> test, String written, String resolved) {
        if (test.test(written))
            return written;
        if (!resolved.equals(written) && test.test(resolved))
            return resolved;
        String builtin = stripBuiltins(resolved);
        if (builtin != null && test.test(builtin))
            return builtin;
        return null;
    }

    private static String stripBuiltins(String name) {
        for (String prefix : new String[] { "builtins.", "__builtins__." })
            if (name.startsWith(prefix))
                return name.substring(prefix.length());
        return null;
    }

    /**
     * Dotted callee name for {@code a.b.c(...)} style calls, or null when the
     * callee is computed (a call result, subscript, lambda).
     */
    static String qualifiedName(Expr e) {
        Deque<String> parts = new ArrayDeque<>();
        while (e instanceof Expr.Attribute a) {
            parts.push(a.attr());
            e = a.value();
        }
        if (!(e instanceof Expr.Name n))
            return null;
        parts.push(n.id());
        return String.join(".", parts);
    }

    /** Rewrites the first segment of a dotted name through the import alias table. */
    static String resolve(String name, Map<String, String> aliases) {
        int dot = name.indexOf('.');
        String head = dot < 0 ? name : name.substring(0, dot);
        String target = aliases.get(head);
        if (target == null)
            return name;
        return dot < 0 ? target : target + name.substring(dot);
    }

    /** Maps each name bound by an import to the module or attribute it denotes. */
    static Map<String, String> importAliases(PyModule tree) {
        Map<String, String> aliases = new HashMap<>();
        PyTreeWalker.walk(tree, node -> {
            if (node instanceof Stmt.Import imp) {
                for (Alias a : imp.names())
                    aliases.put(a.boundName(), a.asName() != null ? a.name() : a.boundName());
            } else if (node instanceof Stmt.ImportFrom from && !from.isRelative()) {
                for (Alias a : from.names())
                    if (!a.name().equals("*"))
                        aliases.put(a.boundName(), from.module() + "." + a.name());
            }
        });
        return aliases;
    }
}

package com.trading.flowgen.security.ast;

import com.trading.flowgen.security.SourceParser;
import com.trading.flowgen.security.SourceSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive descent parser for Python 3 source.
 *
 * <p>
 * Covers the statement and expression grammar that strategy modules use:
 * imports, assignments (plain, augmented, annotated), function and class
 * definitions with decorators, all compound statements except {@code match},
 * lambdas, comprehensions, slices, starred and keyword arguments, and
 * f-strings whose replacement fields are parsed as expressions so they are
 * visible to tree checks.
 *
 * <p>
 * Errors are reported as {@link SourceSyntaxException} carrying the 1-based
 * line and column of the offending token.
 */
public final class PythonParser implements SourceParser {

    private static final Set<String> KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
            "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
            "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
            "try", "while", "with", "yield");

    private static final Set<String> AUGMENTED = Set.of(
            "+=", "-=", "*=", "/=", "//=", "%=", "@=", "&=", "|=", "^=", ">>=", "<<=", "**=");

    private static final Set<String> COMPARISONS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
            "True", "False", "None", "lambda", "not", "await", "yield");

    private static final Set<String> EXPRESSION_OPENERS = Set.of("(", "[", "{", "-", "+", "~", "*", "...");

    /** Bound on expression recursion; keeps deeply nested input from exhausting the stack. */
    static final int MAX_NESTING = 200;

    @Override
    public PyModule parse(String source) {
        if (source == null)
            throw new SourceSyntaxException("source is null", 0, 0);
        return new Grammar(new PythonLexer(source).tokenize()).file();
    }

    private static final class Grammar {
        private final List<Token> tokens;
        private int pos;
        private int depth;

        Grammar(List<Token> tokens) {
            this.tokens = tokens;
        }

        // ---------------------------------------------------------------
        // Statements
        // ---------------------------------------------------------------

        PyModule file() {
            List<Stmt> body = new ArrayList<>();
            while (peek().type() != TokenType.ENDMARKER) {
                if (peek().type() == TokenType.NEWLINE) {
                    next();
                    continue;
                }
                body.addAll(statement());
            }
            return new PyModule(body);
        }

        private List<Stmt> statement() {
            Token t = peek();
            if (t.type() == TokenType.INDENT)
                throw error(t, "unexpected indent");
            if (t.isOp("@"))
                return List.of(decorated());
            if (t.type() == TokenType.NAME) {
                switch (t.text()) {
                    case "def":
                        return List.of(functionDef(List.of(), false, t));
                    case "class":
                        return List.of(classDef(List.of(), t));
                    case "if":
                        return List.of(ifStatement());
                    case "for":
                        return List.of(forStatement(false, t));
                    case "while":
                        return List.of(whileStatement());
                    case "try":
                        return List.of(tryStatement());
                    case "with":
                        return List.of(withStatement(false, t));
                    case "async":
                        return List.of(asyncStatement(List.of()));
                    default:
                        break;
                }
            }
            return simpleStatements();
        }

        private List<Stmt> simpleStatements() {
            List<Stmt> out = new ArrayList<>();
            out.add(simpleStatement());
            while (acceptOp(";")) {
                if (peek().type() == TokenType.NEWLINE)
                    break;
                out.add(simpleStatement());
            }
            expectNewline();
            return out;
        }

        private Stmt simpleStatement() {
            Token t = peek();
            if (t.type() == TokenType.NAME) {
                switch (t.text()) {
                    case "pass", "break", "continue" -> {
                        next();
                        return new Stmt.Simple(t.line(), t.text());
                    }
                    case "return" -> {
                        next();
                        Expr value = atStatementEnd() ? null : testListStarExpr();
                        return new Stmt.Return(t.line(), value);
                    }
                    case "import" -> {
                        return importName();
                    }
                    case "from" -> {
                        return importFrom();
                    }
                    case "raise" -> {
                        next();
                        if (atStatementEnd())
                            return new Stmt.Raise(t.line(), null, null);
                        Expr exc = test();
                        Expr cause = acceptKeyword("from") ? test() : null;
                        return new Stmt.Raise(t.line(), exc, cause);
                    }
                    case "del" -> {
                        next();
                        Expr targets = targetList();
                        List<Expr> list = targets instanceof Expr.TupleExpr tuple ? tuple.elts() : List.of(targets);
                        for (Expr e : list)
                            checkTarget(e, t, "delete");
                        return new Stmt.Delete(t.line(), list);
                    }
                    case "global", "nonlocal" -> {
                        next();
                        List<String> names = new ArrayList<>();
                        names.add(expectName());
                        while (acceptOp(","))
                            names.add(expectName());
                        return new Stmt.Global(t.line(), names, t.text().equals("nonlocal"));
                    }
                    case "assert" -> {
                        next();
                        Expr test = test();
                        Expr msg = acceptOp(",") ? test() : null;
                        return new Stmt.Assert(t.line(), test, msg);
                    }
                    default -> {
                    }
                }
            }
            return expressionStatement();
        }

        private Stmt expressionStatement() {
            Token start = peek();
            Expr first = atKeyword("yield") ? yieldExpr() : testListStarExpr();

            if (first instanceof Expr.Name n && (n.id().equals("print") || n.id().equals("exec"))
                    && startsExpression())
                throw error(start, "Missing parentheses in call to '" + n.id() + "'");

            if (atOp(":")) {
                if (!(first instanceof Expr.Name || first instanceof Expr.Attribute
                        || first instanceof Expr.Subscript))
                    throw error(start, "illegal target for annotation");
                next();
                Expr annotation = test();
                Expr value = null;
                if (acceptOp("="))
                    value = atKeyword("yield") ? yieldExpr() : testListStarExpr();
                return new Stmt.AnnAssign(start.line(), first, annotation, value);
            }

            Token op = peek();
            if (op.type() == TokenType.OP && AUGMENTED.contains(op.text())) {
                if (!(first instanceof Expr.Name || first instanceof Expr.Attribute
                        || first instanceof Expr.Subscript))
                    throw error(start, "'" + describe(first) + "' is an illegal expression for augmented assignment");
                next();
                Expr value = atKeyword("yield") ? yieldExpr() : testListStarExpr();
                return new Stmt.AugAssign(start.line(), first, op.text().substring(0, op.text().length() - 1),
                        value);
            }

            if (atOp("=")) {
                List<Expr> chain = new ArrayList<>();
                chain.add(first);
                while (acceptOp("="))
                    chain.add(atKeyword("yield") ? yieldExpr() : testListStarExpr());
                Expr value = chain.remove(chain.size() - 1);
                for (Expr target : chain)
                    checkTarget(target, start, "assign to");
                return new Stmt.Assign(start.line(), chain, value);
            }
            return new Stmt.ExprStmt(start.line(), first);
        }

        private Stmt importName() {
            Token t = next();
            List<Alias> names = new ArrayList<>();
            do {
                String name = dottedName();
                String as = acceptKeyword("as") ? expectName() : null;
                names.add(new Alias(name, as));
            } while (acceptOp(","));
            return new Stmt.Import(t.line(), names);
        }

        private Stmt importFrom() {
            Token t = next();
            int level = 0;
            while (atOp(".") || atOp("...")) {
                level += next().text().length();
            }
            String module = null;
            if (!atKeyword("import"))
                module = dottedName();
            else if (level == 0)
                throw error(peek(), "invalid syntax");
            expectKeyword("import");

            List<Alias> names = new ArrayList<>();
            if (acceptOp("*")) {
                names.add(new Alias("*", null));
            } else if (acceptOp("(")) {
                do {
                    if (atOp(")"))
                        break;
                    String name = expectName();
                    names.add(new Alias(name, acceptKeyword("as") ? expectName() : null));
                } while (acceptOp(","));
                expectOp(")");
            } else {
                do {
                    String name = expectName();
                    names.add(new Alias(name, acceptKeyword("as") ? expectName() : null));
                } while (acceptOp(","));
            }
            if (names.isEmpty())
                throw error(peek(), "invalid syntax");
            return new Stmt.ImportFrom(t.line(), module, level, names);
        }

        private String dottedName() {
            StringBuilder sb = new StringBuilder(expectName());
            while (acceptOp("."))
                sb.append('.').append(expectName());
            return sb.toString();
        }

        private Stmt decorated() {
            List<Expr> decorators = new ArrayList<>();
            while (acceptOp("@")) {
                decorators.add(namedExprTest());
                expectNewline();
            }
            Token t = peek();
            if (t.isKeyword("def"))
                return functionDef(decorators, false, t);
            if (t.isKeyword("class"))
                return classDef(decorators, t);
            if (t.isKeyword("async"))
                return asyncStatement(decorators);
            throw error(t, "invalid syntax");
        }

        private Stmt asyncStatement(List<Expr> decorators) {
            Token async = next();
            Token t = peek();
            if (t.isKeyword("def"))
                return functionDef(decorators, true, async);
            if (decorators.isEmpty() && t.isKeyword("for"))
                return forStatement(true, async);
            if (decorators.isEmpty() && t.isKeyword("with"))
                return withStatement(true, async);
            throw error(t, "invalid syntax");
        }

        private Stmt functionDef(List<Expr> decorators, boolean async, Token start) {
            expectKeyword("def");
            String name = expectName();
            expectOp("(");
            Arguments args = parameters(")", true);
            expectOp(")");
            Expr returns = acceptOp("->") ? test() : null;
            expectOp(":");
            List<Stmt> body = block();
            return new Stmt.FunctionDef(start.line(), name, args, decorators, returns, body, async);
        }

        private Stmt classDef(List<Expr> decorators, Token start) {
            expectKeyword("class");
            String name = expectName();
            List<Expr> bases = new ArrayList<>();
            List<Keyword> keywords = new ArrayList<>();
            if (acceptOp("(")) {
                arguments(")", bases, keywords);
                expectOp(")");
            }
            expectOp(":");
            List<Stmt> body = block();
            return new Stmt.ClassDef(start.line(), name, bases, keywords, decorators, body);
        }

        private Stmt ifStatement() {
            Token t = next();
            Expr test = namedExprTest();
            expectOp(":");
            List<Stmt> body = block();
            List<Stmt> orelse = List.of();
            if (atKeyword("elif"))
                orelse = List.of(ifStatement());
            else if (acceptKeyword("else")) {
                expectOp(":");
                orelse = block();
            }
            return new Stmt.If(t.line(), test, body, orelse);
        }

        private Stmt forStatement(boolean async, Token start) {
            expectKeyword("for");
            Expr target = targetList();
            checkTarget(target, start, "assign to");
            expectKeyword("in");
            Expr iter = testListStarExpr();
            expectOp(":");
            List<Stmt> body = block();
            List<Stmt> orelse = elseBlock();
            return new Stmt.For(start.line(), target, iter, body, orelse, async);
        }

        private Stmt whileStatement() {
            Token t = next();
            Expr test = namedExprTest();
            expectOp(":");
            List<Stmt> body = block();
            return new Stmt.While(t.line(), test, body, elseBlock());
        }

        private List<Stmt> elseBlock() {
            if (!acceptKeyword("else"))
                return List.of();
            expectOp(":");
            return block();
        }

        private Stmt tryStatement() {
            Token t = next();
            expectOp(":");
            List<Stmt> body = block();
            List<Stmt.ExceptHandler> handlers = new ArrayList<>();
            while (atKeyword("except")) {
                Token e = next();
                Expr type = null;
                String name = null;
                if (!atOp(":")) {
                    type = test();
                    if (atOp(","))
                        throw error(peek(), "multiple exception types must be parenthesized");
                    if (acceptKeyword("as"))
                        name = expectName();
                }
                expectOp(":");
                handlers.add(new Stmt.ExceptHandler(e.line(), type, name, block()));
            }
            List<Stmt> orelse = List.of();
            if (!handlers.isEmpty())
                orelse = elseBlock();
            List<Stmt> finalbody = List.of();
            if (acceptKeyword("finally")) {
                expectOp(":");
                finalbody = block();
            }
            if (handlers.isEmpty() && finalbody.isEmpty())
                throw error(peek(), "expected 'except' or 'finally' block");
            return new Stmt.Try(t.line(), body, handlers, orelse, finalbody);
        }

        private Stmt withStatement(boolean async, Token start) {
            expectKeyword("with");
            List<Stmt.WithItem> items = parenthesizedWithItems();
            if (items == null) {
                items = new ArrayList<>();
                do {
                    items.add(withItem());
                } while (acceptOp(","));
            }
            expectOp(":");
            return new Stmt.With(start.line(), items, block(), async);
        }

        private Stmt.WithItem withItem() {
            Token item = peek();
            Expr context = test();
            Expr target = null;
            if (acceptKeyword("as")) {
                target = starOrExpr();
                checkTarget(target, item, "assign to");
            }
            return new Stmt.WithItem(item.line(), context, target);
        }

        /**
         * The {@code with (a as x, b as y):} form. Returns null, with the
         * position restored, when the parenthesis opens an ordinary expression.
         */
        private List<Stmt.WithItem> parenthesizedWithItems() {
            if (!atOp("("))
                return null;
            int mark = pos;
            int markDepth = depth;
            try {
                next();
                List<Stmt.WithItem> items = new ArrayList<>();
                do {
                    if (atOp(")"))
                        break;
                    items.add(withItem());
                } while (acceptOp(","));
                expectOp(")");
                if (!items.isEmpty() && atOp(":"))
                    return items;
            } catch (SourceSyntaxException e) {
                pos = mark;
                depth = markDepth;
                return null;
            }
            pos = mark;
            depth = markDepth;
            return null;
        }

        private List<Stmt> block() {
            if (peek().type() != TokenType.NEWLINE)
                return simpleStatements();
            next();
            if (peek().type() != TokenType.INDENT)
                throw error(peek(), "expected an indented block");
            next();
            List<Stmt> body = new ArrayList<>();
            while (peek().type() != TokenType.DEDENT && peek().type() != TokenType.ENDMARKER)
                body.addAll(statement());
            if (peek().type() == TokenType.DEDENT)
                next();
            return body;
        }

        private Arguments parameters(String closing, boolean annotations) {
            List<Arguments.Param> params = new ArrayList<>();
            boolean keywordOnly = false;
            boolean seenDefault = false;
            while (!atOp(closing)) {
                Token t = peek();
                if (acceptOp("**")) {
                    String name = expectName();
                    Expr ann = annotations && acceptOp(":") ? test() : null;
                    params.add(new Arguments.Param(name, Arguments.Kind.VAR_KEYWORD, ann, null));
                } else if (acceptOp("*")) {
                    keywordOnly = true;
                    if (!atOp(",") && !atOp(closing)) {
                        String name = expectName();
                        Expr ann = annotations && acceptOp(":") ? test() : null;
                        params.add(new Arguments.Param(name, Arguments.Kind.VAR_POSITIONAL, ann, null));
                    }
                } else if (acceptOp("/")) {
                    if (keywordOnly || params.isEmpty())
                        throw error(t, "invalid syntax");
                } else {
                    String name = expectName();
                    Expr ann = annotations && acceptOp(":") ? test() : null;
                    Expr def = acceptOp("=") ? test() : null;
                    if (!keywordOnly) {
                        if (def != null)
                            seenDefault = true;
                        else if (seenDefault)
                            throw error(t, "non-default argument follows default argument");
                    }
                    params.add(new Arguments.Param(name,
                            keywordOnly ? Arguments.Kind.KEYWORD_ONLY : Arguments.Kind.POSITIONAL, ann, def));
                }
                if (!acceptOp(","))
                    break;
            }
            return new Arguments(params);
        }

        // ---------------------------------------------------------------
        // Expressions
        // ---------------------------------------------------------------

        private Expr testListStarExpr() {
            Token start = peek();
            Expr first = starOrTest();
            if (!atOp(","))
                return first;
            List<Expr> elts = new ArrayList<>();
            elts.add(first);
            while (acceptOp(",")) {
                if (!startsExpression())
                    break;
                elts.add(starOrTest());
            }
            return new Expr.TupleExpr(start.line(), elts);
        }

        /** Assignment targets of {@code for}, {@code del}, comprehensions and {@code with ... as}. */
        private Expr targetList() {
            Token start = peek();
            Expr first = starOrExpr();
            if (!atOp(","))
                return first;
            List<Expr> elts = new ArrayList<>();
            elts.add(first);
            while (acceptOp(",")) {
                if (!startsExpression() || atKeyword("in"))
                    break;
                elts.add(starOrExpr());
            }
            return new Expr.TupleExpr(start.line(), elts);
        }

        private Expr starOrTest() {
            Token t = peek();
            if (acceptOp("*"))
                return new Expr.Starred(t.line(), expr());
            return test();
        }

        private Expr starOrExpr() {
            Token t = peek();
            if (acceptOp("*"))
                return new Expr.Starred(t.line(), expr());
            return expr();
        }

        private Expr starOrNamed() {
            Token t = peek();
            if (acceptOp("*"))
                return new Expr.Starred(t.line(), expr());
            return namedExprTest();
        }

        private Expr namedExprTest() {
            Token start = peek();
            Expr e = test();
            if (atOp(":=")) {
                if (!(e instanceof Expr.Name))
                    throw error(start, "cannot use assignment expressions with " + describe(e));
                next();
                return new Expr.NamedExpr(start.line(), e, test());
            }
            return e;
        }

        private Expr test() {
            enter(peek());
            try {
                return conditional();
            } finally {
                depth--;
            }
        }

        private Expr conditional() {
            if (atKeyword("lambda"))
                return lambda(true);
            Expr e = orTest();
            if (acceptKeyword("if")) {
                Expr cond = orTest();
                expectKeyword("else");
                Expr orelse = test();
                return new Expr.IfExp(e.line(), cond, e, orelse);
            }
            return e;
        }

        private Expr testNoCond() {
            if (atKeyword("lambda"))
                return lambda(false);
            return orTest();
        }

        private Expr lambda(boolean allowConditional) {
            Token t = next();
            Arguments args = parameters(":", false);
            expectOp(":");
            Expr body = allowConditional ? test() : testNoCond();
            return new Expr.Lambda(t.line(), args, body);
        }

        private Expr orTest() {
            return boolOp("or", this::andTest);
        }

        private Expr andTest() {
            return boolOp("and", this::notTest);
        }

        private Expr boolOp(String op, Supplier<Expr> operand) {
            Expr first = operand.get();
            if (!atKeyword(op))
                return first;
            List<Expr> values = new ArrayList<>();
            values.add(first);
            while (acceptKeyword(op))
                values.add(operand.get());
            return new Expr.BoolOp(first.line(), op, values);
        }

        private Expr notTest() {
            Token t = peek();
            if (!acceptKeyword("not"))
                return comparison();
            enter(t);
            try {
                return new Expr.UnaryOp(t.line(), "not", notTest());
            } finally {
                depth--;
            }
        }

        private Expr comparison() {
            Expr left = expr();
            List<String> ops = new ArrayList<>();
            List<Expr> comparators = new ArrayList<>();
            String op;
            while ((op = comparisonOperator()) != null) {
                ops.add(op);
                comparators.add(expr());
            }
            return ops.isEmpty() ? left : new Expr.Compare(left.line(), left, ops, comparators);
        }

        private String comparisonOperator() {
            Token t = peek();
            if (t.type() == TokenType.OP && COMPARISONS.contains(t.text())) {
                next();
                return t.text();
            }
            if (t.isKeyword("in")) {
                next();
                return "in";
            }
            if (t.isKeyword("not") && peek(1).isKeyword("in")) {
                next();
                next();
                return "not in";
            }
            if (t.isKeyword("is")) {
                next();
                return acceptKeyword("not") ? "is not" : "is";
            }
            return null;
        }

        private Expr expr() {
            return binary(this::xorExpr, "|");
        }

        private Expr xorExpr() {
            return binary(this::andExpr, "^");
        }

        private Expr andExpr() {
            return binary(this::shiftExpr, "&");
        }

        private Expr shiftExpr() {
            return binary(this::arithExpr, "<<", ">>");
        }

        private Expr arithExpr() {
            return binary(this::term, "+", "-");
        }

        private Expr term() {
            return binary(this::factor, "*", "@", "/", "%", "//");
        }

        private Expr binary(Supplier<Expr> operand, String... ops) {
            Expr left = operand.get();
            while (true) {
                String matched = null;
                for (String op : ops)
                    if (atOp(op))
                        matched = op;
                if (matched == null)
                    return left;
                next();
                left = new Expr.BinOp(left.line(), left, matched, operand.get());
            }
        }

        private Expr factor() {
            Token t = peek();
            if (!atOp("+") && !atOp("-") && !atOp("~"))
                return power();
            next();
            enter(t);
            try {
                return new Expr.UnaryOp(t.line(), t.text(), factor());
            } finally {
                depth--;
            }
        }

        private Expr power() {
            Token t = peek();
            Expr base;
            if (acceptKeyword("await"))
                base = new Expr.Await(t.line(), primary());
            else
                base = primary();
            Token op = peek();
            if (!acceptOp("**"))
                return base;
            enter(op);
            try {
                return new Expr.BinOp(base.line(), base, "**", factor());
            } finally {
                depth--;
            }
        }

        private Expr primary() {
            Expr e = atom();
            while (true) {
                Token t = peek();
                if (acceptOp("(")) {
                    List<Expr> args = new ArrayList<>();
                    List<Keyword> keywords = new ArrayList<>();
                    arguments(")", args, keywords);
                    expectOp(")");
                    e = new Expr.Call(e.line(), e, args, keywords);
                } else if (acceptOp("[")) {
                    Expr slice = subscriptList();
                    expectOp("]");
                    e = new Expr.Subscript(e.line(), e, slice);
                } else if (acceptOp(".")) {
                    e = new Expr.Attribute(t.line(), e, expectName());
                } else {
                    return e;
                }
            }
        }

        private void arguments(String closing, List<Expr> args, List<Keyword> keywords) {
            while (!atOp(closing)) {
                Token t = peek();
                if (acceptOp("**")) {
                    keywords.add(new Keyword(t.line(), null, test()));
                } else if (acceptOp("*")) {
                    args.add(new Expr.Starred(t.line(), test()));
                } else if (t.type() == TokenType.NAME && !KEYWORDS.contains(t.text()) && peek(1).isOp("=")) {
                    next();
                    next();
                    keywords.add(new Keyword(t.line(), t.text(), test()));
                } else {
                    Expr e = namedExprTest();
                    if (atComprehension())
                        e = comprehension(Expr.ComprehensionKind.GENERATOR, e, null);
                    if (!keywords.isEmpty()) {
                        boolean unpacking = keywords.get(keywords.size() - 1).arg() == null;
                        throw error(t, unpacking ? "positional argument follows keyword argument unpacking"
                                : "positional argument follows keyword argument");
                    }
                    args.add(e);
                }
                if (!acceptOp(","))
                    break;
            }
        }

        private Expr subscriptList() {
            Token start = peek();
            Expr first = subscript();
            if (!atOp(","))
                return first;
            List<Expr> elts = new ArrayList<>();
            elts.add(first);
            while (acceptOp(",")) {
                if (atOp("]"))
                    break;
                elts.add(subscript());
            }
            return new Expr.TupleExpr(start.line(), elts);
        }

        private Expr subscript() {
            Token t = peek();
            Expr lower = null;
            if (!atOp(":")) {
                lower = starOrNamed();
                if (!atOp(":"))
                    return lower;
            }
            expectOp(":");
            Expr upper = atSliceEnd() || atOp(":") ? null : test();
            Expr step = null;
            if (acceptOp(":") && !atSliceEnd())
                step = test();
            return new Expr.Slice(t.line(), lower, upper, step);
        }

        private boolean atSliceEnd() {
            return atOp("]") || atOp(",");
        }

        private Expr atom() {
            Token t = peek();
            switch (t.type()) {
                case NAME -> {
                    switch (t.text()) {
                        case "True" -> {
                            next();
                            return new Expr.Constant(t.line(), Expr.ConstantKind.TRUE, "True");
                        }
                        case "False" -> {
                            next();
                            return new Expr.Constant(t.line(), Expr.ConstantKind.FALSE, "False");
                        }
                        case "None" -> {
                            next();
                            return new Expr.Constant(t.line(), Expr.ConstantKind.NONE, "None");
                        }
                        default -> {
                            if (KEYWORDS.contains(t.text()))
                                throw error(t, "invalid syntax");
                            next();
                            return new Expr.Name(t.line(), t.text());
                        }
                    }
                }
                case NUMBER -> {
                    next();
                    return new Expr.Constant(t.line(), Expr.ConstantKind.NUMBER, t.text());
                }
                case STRING -> {
                    return strings();
                }
                case OP -> {
                    switch (t.text()) {
                        case "(", "[", "{" -> {
                            enter(t);
                            try {
                                return display(t.text());
                            } finally {
                                depth--;
                            }
                        }
                        case "..." -> {
                            next();
                            return new Expr.Constant(t.line(), Expr.ConstantKind.ELLIPSIS, "...");
                        }
                        default -> throw error(t, "invalid syntax");
                    }
                }
                case INDENT -> throw error(t, "unexpected indent");
                default -> throw error(t, "invalid syntax");
            }
        }

        private Expr display(String open) {
            return switch (open) {
                case "(" -> parenthesized();
                case "[" -> listDisplay();
                default -> braceDisplay();
            };
        }

        private Expr parenthesized() {
            Token open = next();
            if (acceptOp(")"))
                return new Expr.TupleExpr(open.line(), List.of());
            if (atKeyword("yield")) {
                Expr y = yieldExpr();
                expectOp(")");
                return y;
            }
            Expr first = starOrNamed();
            if (atComprehension()) {
                Expr c = comprehension(Expr.ComprehensionKind.GENERATOR, first, null);
                expectOp(")");
                return c;
            }
            if (!atOp(",")) {
                expectOp(")");
                if (first instanceof Expr.Starred)
                    throw error(open, "cannot use starred expression here");
                return first;
            }
            List<Expr> elts = new ArrayList<>();
            elts.add(first);
            while (acceptOp(",")) {
                if (atOp(")"))
                    break;
                elts.add(starOrNamed());
            }
            expectOp(")");
            return new Expr.TupleExpr(open.line(), elts);
        }

        private Expr listDisplay() {
            Token open = next();
            List<Expr> elts = new ArrayList<>();
            if (acceptOp("]"))
                return new Expr.ListExpr(open.line(), elts);
            Expr first = starOrNamed();
            if (atComprehension()) {
                Expr c = comprehension(Expr.ComprehensionKind.LIST, first, null);
                expectOp("]");
                return c;
            }
            elts.add(first);
            while (acceptOp(",")) {
                if (atOp("]"))
                    break;
                elts.add(starOrNamed());
            }
            expectOp("]");
            return new Expr.ListExpr(open.line(), elts);
        }

        private Expr braceDisplay() {
            Token open = next();
            List<Expr> keys = new ArrayList<>();
            List<Expr> values = new ArrayList<>();
            if (acceptOp("}"))
                return new Expr.Dict(open.line(), keys, values);

            if (acceptOp("**")) {
                keys.add(null);
                values.add(expr());
                return dictRest(open, keys, values);
            }
            Expr first = starOrNamed();
            if (acceptOp(":")) {
                Expr value = test();
                if (atComprehension()) {
                    Expr c = comprehension(Expr.ComprehensionKind.DICT, first, value);
                    expectOp("}");
                    return c;
                }
                keys.add(first);
                values.add(value);
                return dictRest(open, keys, values);
            }
            if (atComprehension()) {
                Expr c = comprehension(Expr.ComprehensionKind.SET, first, null);
                expectOp("}");
                return c;
            }
            List<Expr> elts = new ArrayList<>();
            elts.add(first);
            while (acceptOp(",")) {
                if (atOp("}"))
                    break;
                elts.add(starOrNamed());
            }
            expectOp("}");
            return new Expr.SetExpr(open.line(), elts);
        }

        private Expr dictRest(Token open, List<Expr> keys, List<Expr> values) {
            while (acceptOp(",")) {
                if (atOp("}"))
                    break;
                if (acceptOp("**")) {
                    keys.add(null);
                    values.add(expr());
                } else {
                    keys.add(test());
                    expectOp(":");
                    values.add(test());
                }
            }
            expectOp("}");
            return new Expr.Dict(open.line(), keys, values);
        }

        private boolean atComprehension() {
            return atKeyword("for") || (atKeyword("async") && peek(1).isKeyword("for"));
        }

        private Expr comprehension(Expr.ComprehensionKind kind, Expr elt, Expr value) {
            List<Expr.ComprehensionClause> generators = new ArrayList<>();
            while (atComprehension()) {
                Token t = peek();
                boolean async = acceptKeyword("async");
                expectKeyword("for");
                Expr target = targetList();
                checkTarget(target, t, "assign to");
                expectKeyword("in");
                Expr iter = orTest();
                List<Expr> ifs = new ArrayList<>();
                while (acceptKeyword("if"))
                    ifs.add(testNoCond());
                generators.add(new Expr.ComprehensionClause(t.line(), target, iter, ifs, async));
            }
            return new Expr.Comprehension(elt.line(), kind, elt, value, generators);
        }

        private Expr yieldExpr() {
            Token t = next();
            if (acceptKeyword("from"))
                return new Expr.Yield(t.line(), test(), true);
            if (!startsExpression())
                return new Expr.Yield(t.line(), null, false);
            return new Expr.Yield(t.line(), testListStarExpr(), false);
        }

        private Expr strings() {
            Token first = peek();
            List<Token> parts = new ArrayList<>();
            while (peek().type() == TokenType.STRING)
                parts.add(next());

            boolean bytes = false;
            boolean text = false;
            boolean formatted = false;
            for (Token p : parts) {
                String prefix = StringLiterals.prefix(p.text());
                if (prefix.contains("b"))
                    bytes = true;
                else
                    text = true;
                if (prefix.contains("f"))
                    formatted = true;
            }
            if (bytes && text)
                throw error(first, "cannot mix bytes and nonbytes literals");

            if (!formatted) {
                StringBuilder sb = new StringBuilder();
                for (Token p : parts)
                    sb.append(StringLiterals.value(p));
                return new Expr.Constant(first.line(), bytes ? Expr.ConstantKind.BYTES : Expr.ConstantKind.STRING,
                        sb.toString());
            }

            List<Expr> values = new ArrayList<>();
            for (Token p : parts) {
                if (StringLiterals.prefix(p.text()).contains("f"))
                    values.addAll(StringLiterals.formatted(p, Grammar::fieldExpression));
                else
                    values.add(new Expr.Constant(p.line(), Expr.ConstantKind.STRING,
                            StringLiterals.value(p)));
            }
            return new Expr.JoinedStr(first.line(), values);
        }

        /** Parses one f-string replacement field as a parenthesized expression. */
        static Expr fieldExpression(String source, int line) {
            Grammar g = new Grammar(new PythonLexer("(" + source + "\n)", line).tokenize());
            Expr e = g.atom();
            while (g.peek().type() == TokenType.NEWLINE)
                g.next();
            if (g.peek().type() != TokenType.ENDMARKER)
                throw g.error(g.peek(), "invalid syntax");
            return e;
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private void checkTarget(Expr e, Token at, String verb) {
            if (e instanceof Expr.Name || e instanceof Expr.Attribute || e instanceof Expr.Subscript)
                return;
            if (e instanceof Expr.Starred s) {
                checkTarget(s.value(), at, verb);
                return;
            }
            if (e instanceof Expr.TupleExpr t) {
                for (Expr x : t.elts())
                    checkTarget(x, at, verb);
                return;
            }
            if (e instanceof Expr.ListExpr l) {
                for (Expr x : l.elts())
                    checkTarget(x, at, verb);
                return;
            }
            throw new SourceSyntaxException("cannot " + verb + " " + describe(e), e.line(),
                    e.line() == at.line() ? at.column() : 1);
        }

        private static String describe(Expr e) {
            if (e instanceof Expr.Call)
                return "function call";
            if (e instanceof Expr.Constant c)
                return switch (c.kind()) {
                    case TRUE, FALSE, NONE -> c.text();
                    case ELLIPSIS -> "ellipsis";
                    default -> "literal";
                };
            if (e instanceof Expr.Compare)
                return "comparison";
            if (e instanceof Expr.Lambda)
                return "lambda";
            if (e instanceof Expr.Comprehension)
                return "comprehension";
            if (e instanceof Expr.JoinedStr)
                return "f-string expression";
            if (e instanceof Expr.Name || e instanceof Expr.Attribute || e instanceof Expr.Subscript)
                return "name";
            return "expression";
        }

        private boolean startsExpression() {
            Token t = peek();
            return switch (t.type()) {
                case NAME -> !KEYWORDS.contains(t.text()) || EXPRESSION_KEYWORDS.contains(t.text());
                case NUMBER, STRING -> true;
                case OP -> EXPRESSION_OPENERS.contains(t.text());
                default -> false;
            };
        }

        private boolean atStatementEnd() {
            Token t = peek();
            return t.type() == TokenType.NEWLINE || t.type() == TokenType.ENDMARKER || t.isOp(";");
        }

        private void enter(Token at) {
            if (++depth > MAX_NESTING)
                throw error(at, "too many nested expressions");
        }

        private Token peek() {
            return peek(0);
        }

        private Token peek(int k) {
            int i = Math.min(pos + k, tokens.size() - 1);
            return tokens.get(i);
        }

        private Token next() {
            Token t = peek();
            if (pos < tokens.size() - 1)
                pos++;
            return t;
        }

        private boolean atOp(String op) {
            return peek().isOp(op);
        }

        private boolean atKeyword(String kw) {
            return peek().isKeyword(kw);
        }

        private boolean acceptOp(String op) {
            if (!atOp(op))
                return false;
            next();
            return true;
        }

        private boolean acceptKeyword(String kw) {
            if (!atKeyword(kw))
                return false;
            next();
            return true;
        }

        private void expectOp(String op) {
            if (!acceptOp(op))
                throw error(peek(), "expected '" + op + "'");
        }

        private void expectKeyword(String kw) {
            if (!acceptKeyword(kw))
                throw error(peek(), "expected '" + kw + "'");
        }

        private String expectName() {
            Token t = peek();
            if (t.type() != TokenType.NAME || KEYWORDS.contains(t.text()))
                throw error(t, "invalid syntax");
            next();
            return t.text();
        }

        private void expectNewline() {
            Token t = peek();
            if (t.type() == TokenType.NEWLINE) {
                next();
                return;
            }
            if (t.type() == TokenType.ENDMARKER)
                return;
            throw error(t, "invalid syntax");
        }

        private SourceSyntaxException error(Token t, String message) {
            if (t.type() == TokenType.INDENT)
                return new SourceSyntaxException("unexpected indent", t.line(), t.column());
            if (t.type() == TokenType.ENDMARKER && message.equals("invalid syntax"))
                return new SourceSyntaxException("unexpected EOF while parsing", t.line(), t.column());
            return new SourceSyntaxException(message, t.line(), t.column());
        }
    }
}

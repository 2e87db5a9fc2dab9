package com.trading.flowgen.security.ast;

import com.trading.flowgen.security.SourceSyntaxException;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class PythonParserTest {

    private final PythonParser parser = new PythonParser();

    private SourceSyntaxException fails(String src) {
        try {
            parser.parse(src);
        } catch (SourceSyntaxException e) {
            return e;
        }
        fail("Expected a syntax error for: " + src);
        return null;
    }

    @Test
    public void testWithItems() {
        PyModule m = parser.parse(String.join("\n",
                "with open('a') as f, open('b') as g:",
                "    pass",
                "with (open('a') as f, open('b')):",
                "    pass",
                "with (a, b) as c:",
                "    pass",
                "with (lock):",
                "    pass",
                ""));
        assertEquals(4, m.body().size());

        Stmt.With two = (Stmt.With) m.body().get(0);
        assertEquals(2, two.items().size());
        assertEquals(new Expr.Name(1, "f"), two.items().get(0).target());
        assertEquals(new Expr.Name(1, "g"), two.items().get(1).target());
        assertTrue(two.items().get(1).context() instanceof Expr.Call);

        Stmt.With grouped = (Stmt.With) m.body().get(1);
        assertEquals(2, grouped.items().size());
        assertNull(grouped.items().get(1).target());

        Stmt.With tuple = (Stmt.With) m.body().get(2);
        assertEquals(1, tuple.items().size());
        assertTrue(tuple.items().get(0).context() instanceof Expr.TupleExpr);
        assertEquals(new Expr.Name(5, "c"), tuple.items().get(0).target());

        Stmt.With single = (Stmt.With) m.body().get(3);
        assertEquals(new Expr.Name(7, "lock"), single.items().get(0).context());
    }

    @Test
    public void testNestingLimits() {
        SourceSyntaxException unary = fails("x = " + "-".repeat(1_000) + "1\n");
        assertEquals("too many nested expressions", unary.getMessage());
        assertEquals(1, unary.line());

        SourceSyntaxException power = fails("x = 2" + "**2".repeat(1_000) + "\n");
        assertEquals("too many nested expressions", power.getMessage());

        SourceSyntaxException negation = fails("x = " + "not ".repeat(1_000) + "y\n");
        assertEquals("too many nested expressions", negation.getMessage());

        SourceSyntaxException parens = fails("x = " + "[".repeat(150) + "]".repeat(150) + "\n");
        assertEquals("too many nested expressions", parens.getMessage());

        PyModule ok = parser.parse("x = " + "(".repeat(50) + "-1" + ")".repeat(50) + "\n");
        assertEquals(1, ok.body().size());
    }

    @Test
    public void testImports() {
        PyModule m = parser.parse("import numpy as np, pandas\nfrom a.b import (c as d, e,)\nfrom .. import x\n");
        assertEquals(3, m.body().size());

        Stmt.Import imp = (Stmt.Import) m.body().get(0);
        assertEquals(List.of(new Alias("numpy", "np"), new Alias("pandas", null)), imp.names());
        assertEquals("np", imp.names().get(0).boundName());

        Stmt.ImportFrom from = (Stmt.ImportFrom) m.body().get(1);
        assertEquals("a.b", from.module());
        assertFalse(from.isRelative());
        assertEquals("d", from.names().get(0).boundName());
        assertEquals(2, from.names().size());

        Stmt.ImportFrom relative = (Stmt.ImportFrom) m.body().get(2);
        assertNull(relative.module());
        assertEquals(2, relative.level());
    }

    @Test
    public void testCallsAndAttributes() {
        PyModule m = parser.parse("y = df['close'].rolling(window=20).mean()\n");
        Stmt.Assign assign = (Stmt.Assign) m.body().get(0);
        assertEquals(List.of(new Expr.Name(1, "y")), assign.targets());

        List<Expr.Call> calls = PyTreeWalker.nodesOfType(m, Expr.Call.class);
        assertEquals(2, calls.size());
        Expr.Call rolling = calls.get(1);
        assertEquals("window", rolling.keywords().get(0).arg());
        assertEquals(1, PyTreeWalker.nodesOfType(m, Expr.Subscript.class).size());
    }

    @Test
    public void testCompoundStatements() {
        String src = String.join("\n",
                "@staticmethod",
                "def f(a, b=1, *args, c, **kw) -> int:",
                "    for i in range(3):",
                "        if i > 1 and not a:",
                "            break",
                "        elif i == 0:",
                "            continue",
                "    else:",
                "        pass",
                "    while a:",
                "        a -= 1",
                "    try:",
                "        x = 1 / a",
                "    except (ValueError, ZeroDivisionError) as e:",
                "        raise RuntimeError('bad') from e",
                "    finally:",
                "        del b",
                "    with open_ctx() as (p, q):",
                "        return [v * 2 for v in range(p) if v]",
                "",
                "class S(Base, metaclass=Meta):",
                "    x: int = 5",
                "    async def run(self):",
                "        await self.step()",
                "");
        PyModule m = parser.parse(src);
        assertEquals(2, m.body().size());

        Stmt.FunctionDef f = (Stmt.FunctionDef) m.body().get(0);
        assertEquals("f", f.name());
        assertEquals(1, f.decorators().size());
        assertEquals(5, f.args().params().size());
        assertEquals(Arguments.Kind.KEYWORD_ONLY, f.args().params().get(3).kind());
        assertEquals(Arguments.Kind.VAR_KEYWORD, f.args().params().get(4).kind());
        assertEquals(4, f.body().size());

        Stmt.ClassDef c = (Stmt.ClassDef) m.body().get(1);
        assertEquals("S", c.name());
        assertEquals("metaclass", c.keywords().get(0).arg());
        assertTrue(c.body().get(0) instanceof Stmt.AnnAssign);
        assertTrue(((Stmt.FunctionDef) c.body().get(1)).async());

        assertEquals(1, PyTreeWalker.nodesOfType(m, Stmt.Try.class).size());
        assertEquals(1, PyTreeWalker.nodesOfType(m, Expr.Comprehension.class).size());
        assertEquals(1, PyTreeWalker.nodesOfType(m, Expr.Await.class).size());
    }

    @Test
    public void testExpressions() {
        PyModule m = parser.parse(String.join("\n",
                "ops = {'>': lambda a, b: a > b, **extra}",
                "s = x[1:-1:2]",
                "t = a if b else c",
                "u = (n := 10)",
                "v = 1 < x <= 3",
                "w = not a or b and c",
                "z = -x ** 2 // 3 % 4 @ m",
                "g = sum(v for v in xs)",
                ""));
        assertEquals(8, m.body().size());
        assertEquals(1, PyTreeWalker.nodesOfType(m, Expr.Lambda.class).size());
        assertEquals(1, PyTreeWalker.nodesOfType(m, Expr.Slice.class).size());
        assertEquals(1, PyTreeWalker.nodesOfType(m, Expr.IfExp.class).size());
        assertEquals(1, PyTreeWalker.nodesOfType(m, Expr.NamedExpr.class).size());
        Expr.Compare chain = PyTreeWalker.nodesOfType(m, Expr.Compare.class).stream()
                .filter(c -> c.ops().size() == 2).findFirst().orElseThrow();
        assertEquals(List.of("<", "<="), chain.ops());
    }

    @Test
    public void testFormattedStringFieldsAreParsed() {
        PyModule m = parser.parse("msg = f\"{name!r:>{width}} = {value}\"\n");
        Expr.JoinedStr js = PyTreeWalker.nodesOfType(m, Expr.JoinedStr.class).get(0);
        List<String> names = PyTreeWalker.nodesOfType(js, Expr.Name.class).stream().map(Expr.Name::id).toList();
        assertTrue(names.containsAll(List.of("name", "width", "value")));
    }

    @Test
    public void testStringDecoding() {
        PyModule m = parser.parse("s = 'a\\tb' 'c'\nr = r'a\\tb'\n");
        List<Expr.Constant> constants = PyTreeWalker.nodesOfType(m, Expr.Constant.class);
        assertEquals("a\tbc", constants.get(0).text());
        assertEquals("a\\tb", constants.get(1).text());
    }

    @Test
    public void testErrors() {
        SourceSyntaxException e = fails("f(x) = 1\n");
        assertEquals("cannot assign to function call", e.getMessage());
        assertEquals(1, e.line());
        assertEquals(1, e.column());

        assertEquals("cannot assign to literal", fails("1 = x\n").getMessage());
        assertEquals("Missing parentheses in call to 'print'", fails("print 'hello'\n").getMessage());
        assertEquals("expected 'except' or 'finally' block", fails("try:\n    x = 1\ny = 2\n").getMessage());
        assertEquals("non-default argument follows default argument",
                fails("def f(a=1, b):\n    pass\n").getMessage());
        assertEquals("multiple exception types must be parenthesized",
                fails("try:\n    x = 1\nexcept ValueError, TypeError:\n    pass\n").getMessage());
        assertEquals("illegal target for annotation", fails("f(): int = 1\n").getMessage());

        e = fails("def f():\nreturn 1\n");
        assertEquals("expected an indented block", e.getMessage());
        assertEquals(2, e.line());
    }

    @Test
    public void testMatchStatementIsUnsupported() {
        fails("match x:\n    case 1:\n        pass\n");
    }
}

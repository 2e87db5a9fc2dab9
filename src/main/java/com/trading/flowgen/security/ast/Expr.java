package com.trading.flowgen.security.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Expression nodes.
 */
public interface Expr extends PyNode {

    record Name(int line, String id) implements Expr {
        @Override
        public List<PyNode> children() {
            return List.of();
        }
    }

    enum ConstantKind {
        STRING,
        BYTES,
        NUMBER,
        TRUE,
        FALSE,
        NONE,
        ELLIPSIS
    }

    /** Literal. For strings {@code text} is the decoded value, otherwise the source spelling. */
    record Constant(int line, ConstantKind kind, String text) implements Expr {
        @Override
        public List<PyNode> children() {
            return List.of();
        }
    }

    /** f-string: literal parts as STRING constants, replacement fields as parsed expressions. */
    record JoinedStr(int line, List<Expr> values) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(values);
        }
    }

    record Attribute(int line, Expr value, String attr) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(value);
        }
    }

    record Subscript(int line, Expr value, Expr slice) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(value, slice);
        }
    }

    record Slice(int line, Expr lower, Expr upper, Expr step) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(lower, upper, step);
        }
    }

    record Call(int line, Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(func, args, keywords);
        }
    }

    record Starred(int line, Expr value) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(value);
        }
    }

    record BoolOp(int line, String op, List<Expr> values) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(values);
        }
    }

    record BinOp(int line, Expr left, String op, Expr right) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(left, right);
        }
    }

    record UnaryOp(int line, String op, Expr operand) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(operand);
        }
    }

    record Compare(int line, Expr left, List<String> ops, List<Expr> comparators) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(left, comparators);
        }
    }

    record NamedExpr(int line, Expr target, Expr value) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(target, value);
        }
    }

    record IfExp(int line, Expr test, Expr body, Expr orelse) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(test, body, orelse);
        }
    }

    record Lambda(int line, Arguments args, Expr body) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(args.expressions(), body);
        }
    }

    record ListExpr(int line, List<Expr> elts) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(elts);
        }
    }

    record TupleExpr(int line, List<Expr> elts) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(elts);
        }
    }

    record SetExpr(int line, List<Expr> elts) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(elts);
        }
    }

    /** Dict display; a null key marks a {@code **mapping} entry. */
    record Dict(int line, List<Expr> keys, List<Expr> values) implements Expr {
        @Override
        public List<PyNode> children() {
            List<Object> parts = new ArrayList<>();
            for (int i = 0; i < values.size(); i++) {
                parts.add(keys.get(i));
                parts.add(values.get(i));
            }
            return PyNode.childrenOf(parts);
        }
    }

    record ComprehensionClause(int line, Expr target, Expr iter, List<Expr> ifs, boolean async) implements PyNode {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(target, iter, ifs);
        }
    }

    enum ComprehensionKind {
        LIST,
        SET,
        DICT,
        GENERATOR
    }

    /** List/set/dict comprehension or generator expression; {@code value} is set only for dicts. */
    record Comprehension(int line, ComprehensionKind kind, Expr elt, Expr value,
            List<ComprehensionClause> generators) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(elt, value, generators);
        }
    }

    record Await(int line, Expr value) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(value);
        }
    }

    record Yield(int line, Expr value, boolean from) implements Expr {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(value);
        }
    }
}

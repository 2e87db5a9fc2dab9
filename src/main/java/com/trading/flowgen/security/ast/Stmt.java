package com.trading.flowgen.security.ast;

import java.util.List;

/**
 * Statement nodes.
 */
public interface Stmt extends PyNode {

    record Import(int line, List<Alias> names) implements Stmt {
        @Override
        public List<PyNode> children() {
            return List.of();
        }
    }

    /** {@code from module import names}; {@code level} counts leading dots, module is null for {@code from . import x}. */
    record ImportFrom(int line, String module, int level, List<Alias> names) implements Stmt {
        @Override
        public List<PyNode> children() {
            return List.of();
        }

        public boolean isRelative() {
            return level > 0;
        }
    }

    record FunctionDef(int line, String name, Arguments args, List<Expr> decorators, Expr returns,
            List<Stmt> body, boolean async) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(decorators, args.expressions(), returns, body);
        }
    }

    record ClassDef(int line, String name, List<Expr> bases, List<Keyword> keywords, List<Expr> decorators,
            List<Stmt> body) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(decorators, bases, keywords, body);
        }
    }

    record Return(int line, Expr value) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(value);
        }
    }

    record Delete(int line, List<Expr> targets) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(targets);
        }
    }

    record Assign(int line, List<Expr> targets, Expr value) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(targets, value);
        }
    }

    record AugAssign(int line, Expr target, String op, Expr value) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(target, value);
        }
    }

    record AnnAssign(int line, Expr target, Expr annotation, Expr value) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(target, annotation, value);
        }
    }

    record For(int line, Expr target, Expr iter, List<Stmt> body, List<Stmt> orelse, boolean async)
            implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(target, iter, body, orelse);
        }
    }

    record While(int line, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(test, body, orelse);
        }
    }

    record If(int line, Expr test, List<Stmt> body, List<Stmt> orelse) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(test, body, orelse);
        }
    }

    record WithItem(int line, Expr context, Expr target) implements PyNode {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(context, target);
        }
    }

    record With(int line, List<WithItem> items, List<Stmt> body, boolean async) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(items, body);
        }
    }

    record Raise(int line, Expr exc, Expr cause) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(exc, cause);
        }
    }

    record ExceptHandler(int line, Expr type, String name, List<Stmt> body) implements PyNode {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(type, body);
        }
    }

    record Try(int line, List<Stmt> body, List<ExceptHandler> handlers, List<Stmt> orelse,
            List<Stmt> finalbody) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(body, handlers, orelse, finalbody);
        }
    }

    record Assert(int line, Expr test, Expr msg) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(test, msg);
        }
    }

    /** {@code global} or {@code nonlocal} declaration. */
    record Global(int line, List<String> names, boolean nonlocal) implements Stmt {
        @Override
        public List<PyNode> children() {
            return List.of();
        }
    }

    record ExprStmt(int line, Expr value) implements Stmt {
        @Override
        public List<PyNode> children() {
            return PyNode.childrenOf(value);
        }
    }

    /** {@code pass}, {@code break} or {@code continue}. */
    record Simple(int line, String keyword) implements Stmt {
        @Override
        public List<PyNode> children() {
            return List.of();
        }
    }
}

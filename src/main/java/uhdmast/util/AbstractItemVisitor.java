// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package uhdmast.util;

import java.util.List;

import uhdmast.core.AstFile.Decl;
import uhdmast.core.AstFile.Expr;
import uhdmast.core.AstFile.Item;
import uhdmast.core.AstFile.Stmt;
import uhdmast.core.AstFile.Type;
import uhdmast.core.AstFile.Unit;

/**
 * A depth-first traversal over every item of a unit. Nodes are visited in
 * declaration order and may be modified in place; subclasses hook in before
 * or after the children of a node by overriding the corresponding method.
 */
public abstract class AbstractItemVisitor {

    public void visitUnit(Unit unit) {
        visitItems(unit.getItems());
    }

    public void visitItems(List<? extends Item> items) {
        for (int i = 0; i != items.size(); ++i) {
            visitItem(items.get(i));
        }
    }

    public void visitItem(Item item) {
        if (item instanceof Decl) {
            visitDeclaration((Decl) item);
        } else if (item instanceof Stmt) {
            visitStatement((Stmt) item);
        } else if (item instanceof Expr) {
            visitExpression((Expr) item);
        } else if (item instanceof Type) {
            visitType((Type) item);
        } else {
            throw new IllegalArgumentException("unknown item encountered (" + item.getClass().getName() + ")");
        }
    }

    public void visitDeclaration(Decl decl) {
        if (decl instanceof Decl.Variable) {
            visitVariable((Decl.Variable) decl);
        } else if (decl instanceof Decl.TypeDef) {
            visitTypeDef((Decl.TypeDef) decl);
        } else if (decl instanceof Decl.EnumItem) {
            visitEnumItem((Decl.EnumItem) decl);
        } else {
            throw new IllegalArgumentException("unknown declaration encountered (" + decl.getClass().getName() + ")");
        }
    }

    public void visitVariable(Decl.Variable decl) {
        visitExpressions(decl.getPacked());
        visitExpressions(decl.getUnpacked());
        if (decl.getType() != null) {
            visitType(decl.getType());
        }
        if (decl.getInitialiser() != null) {
            visitExpression(decl.getInitialiser());
        }
    }

    public void visitTypeDef(Decl.TypeDef decl) {
        visitType(decl.getType());
    }

    public void visitEnumItem(Decl.EnumItem decl) {
        if (decl.getValue() != null) {
            visitExpression(decl.getValue());
        }
    }

    public void visitType(Type type) {
        if (type instanceof Type.Vector) {
            visitExpressions(((Type.Vector) type).getPacked());
        } else if (type instanceof Type.Record) {
            for (Type.Field f : ((Type.Record) type).getFields()) {
                visitType(f.getType());
                if (f.getDimension() != null) {
                    visitExpression(f.getDimension());
                }
            }
        } else if (type instanceof Type.Enumeration) {
            Type.Enumeration t = (Type.Enumeration) type;
            if (t.getBase() != null) {
                visitExpression(t.getBase());
            }
            for (Decl.EnumItem item : t.getItems()) {
                visitEnumItem(item);
            }
        } else if (!(type instanceof Type.Named)) {
            throw new IllegalArgumentException("unknown type encountered (" + type.getClass().getName() + ")");
        }
    }

    public void visitStatement(Stmt stmt) {
        if (stmt instanceof Stmt.Assign) {
            visitAssign((Stmt.Assign) stmt);
        } else if (stmt instanceof Stmt.Call) {
            visitCall((Stmt.Call) stmt);
        } else if (stmt instanceof Stmt.Block) {
            visitBlock((Stmt.Block) stmt);
        } else {
            throw new IllegalArgumentException("unknown statement encountered (" + stmt.getClass().getName() + ")");
        }
    }

    public void visitAssign(Stmt.Assign stmt) {
        visitExpression(stmt.getLeftHandSide());
        visitExpression(stmt.getRightHandSide());
    }

    public void visitCall(Stmt.Call stmt) {
        visitExpressions(stmt.getArguments());
    }

    public void visitBlock(Stmt.Block stmt) {
        visitItems(stmt.getAll());
    }

    public void visitExpressions(List<? extends Expr> exprs) {
        for (int i = 0; i != exprs.size(); ++i) {
            visitExpression(exprs.get(i));
        }
    }

    public void visitExpression(Expr expr) {
        if (expr instanceof Expr.Identifier) {
            visitIdentifier((Expr.Identifier) expr);
        } else if (expr instanceof Expr.Range) {
            Expr.Range r = (Expr.Range) expr;
            visitExpression(r.getLeft());
            if (r.getRight() != null) {
                visitExpression(r.getRight());
            }
        } else if (expr instanceof Expr.BinaryOperator) {
            Expr.BinaryOperator b = (Expr.BinaryOperator) expr;
            visitExpression(b.getLeftHandSide());
            visitExpression(b.getRightHandSide());
        } else if (expr instanceof Expr.Invoke) {
            visitExpressions(((Expr.Invoke) expr).getArguments());
        }
    }

    public void visitIdentifier(Expr.Identifier expr) {
        visitExpressions(expr.getSelectors());
        if (expr.getDot() != null) {
            visitDot(expr.getDot());
        }
    }

    public void visitDot(Expr.Dot dot) {
        visitExpressions(dot.getSelectors());
        if (dot.getNext() != null) {
            visitDot(dot.getNext());
        }
    }
}

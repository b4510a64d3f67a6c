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

import uhdmast.core.AstFile.Expr;

import java.util.ArrayList;
import java.util.List;

public abstract class AbstractExpressionVisitor<E> {

    public E visitExpression(Expr expr) {
        if(expr instanceof Expr.Integer) {
            return constructInteger((Expr.Integer) expr);
        } else if(expr instanceof Expr.Real) {
            return constructReal((Expr.Real) expr);
        } else if(expr instanceof Expr.Str) {
            return constructString((Expr.Str) expr);
        } else if(expr instanceof Expr.Identifier) {
            return visitIdentifier((Expr.Identifier) expr);
        } else if(expr instanceof Expr.Range) {
            return visitRange((Expr.Range) expr);
        } else if(expr instanceof Expr.Addition) {
            return visitAddition((Expr.Addition) expr);
        } else if(expr instanceof Expr.Subtraction) {
            return visitSubtraction((Expr.Subtraction) expr);
        } else if(expr instanceof Expr.Multiplication) {
            return visitMultiplication((Expr.Multiplication) expr);
        } else if(expr instanceof Expr.Invoke) {
            return visitInvoke((Expr.Invoke) expr);
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected List<E> visitExpressions(List<? extends Expr> exprs) {
        List<E> results = new ArrayList<>();
        for (int i = 0; i != exprs.size(); ++i) {
            results.add(visitExpression(exprs.get(i)));
        }
        return results;
    }

    protected E visitIdentifier(Expr.Identifier expr) {
        List<E> selectors = visitExpressions(expr.getSelectors());
        return constructIdentifier(expr, selectors);
    }

    protected E visitRange(Expr.Range expr) {
        E left = visitExpression(expr.getLeft());
        E right = expr.getRight() == null ? null : visitExpression(expr.getRight());
        return constructRange(expr, left, right);
    }

    protected E visitAddition(Expr.Addition expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructAddition(expr, lhs, rhs);
    }

    protected E visitSubtraction(Expr.Subtraction expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructSubtraction(expr, lhs, rhs);
    }

    protected E visitMultiplication(Expr.Multiplication expr) {
        E lhs = visitExpression(expr.getLeftHandSide());
        E rhs = visitExpression(expr.getRightHandSide());
        return constructMultiplication(expr, lhs, rhs);
    }

    protected E visitInvoke(Expr.Invoke expr) {
        List<E> arguments = visitExpressions(expr.getArguments());
        return constructInvoke(expr, arguments);
    }

    protected abstract E constructInteger(Expr.Integer expr);

    protected abstract E constructReal(Expr.Real expr);

    protected abstract E constructString(Expr.Str expr);

    protected abstract E constructIdentifier(Expr.Identifier expr, List<E> selectors);

    protected abstract E constructRange(Expr.Range expr, E left, E right);

    protected abstract E constructAddition(Expr.Addition expr, E lhs, E rhs);

    protected abstract E constructSubtraction(Expr.Subtraction expr, E lhs, E rhs);

    protected abstract E constructMultiplication(Expr.Multiplication expr, E lhs, E rhs);

    protected abstract E constructInvoke(Expr.Invoke expr, List<E> arguments);
}

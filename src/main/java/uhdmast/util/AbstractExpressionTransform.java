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

import uhdmast.core.AstFile;
import uhdmast.core.AstFile.Expr;

/**
 * Rebuilds an expression from the bottom up. A node is only reconstructed when
 * one of its children was replaced, so an expression which is unchanged by the
 * transform is returned as is.
 */
public abstract class AbstractExpressionTransform extends AbstractExpressionVisitor<Expr> {

    @Override
    protected Expr constructInteger(Expr.Integer expr) {
        return expr;
    }

    @Override
    protected Expr constructReal(Expr.Real expr) {
        return expr;
    }

    @Override
    protected Expr constructString(Expr.Str expr) {
        return expr;
    }

    @Override
    protected Expr constructIdentifier(Expr.Identifier expr, List<Expr> selectors) {
        if (equals(expr.getSelectors(), selectors)) {
            return expr;
        } else {
            List ranges = selectors;
            return AstFile.VAR(expr.getName(), ranges, expr.getDot(), expr.getAttributes());
        }
    }

    @Override
    protected Expr constructRange(Expr.Range expr, Expr left, Expr right) {
        if (expr.getLeft() == left && expr.getRight() == right) {
            return expr;
        } else {
            return AstFile.RANGE(left, right, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructAddition(Expr.Addition expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return AstFile.ADD(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructSubtraction(Expr.Subtraction expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return AstFile.SUB(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructMultiplication(Expr.Multiplication expr, Expr lhs, Expr rhs) {
        if (expr.getLeftHandSide() == lhs && expr.getRightHandSide() == rhs) {
            return expr;
        } else {
            return AstFile.MUL(lhs, rhs, expr.getAttributes());
        }
    }

    @Override
    protected Expr constructInvoke(Expr.Invoke expr, List<Expr> arguments) {
        if (equals(expr.getArguments(), arguments)) {
            return expr;
        } else {
            return AstFile.INVOKE(expr.getName(), arguments, expr.getAttributes());
        }
    }

    private static boolean equals(List<? extends Expr> before, List<Expr> after) {
        for (int i = 0; i != before.size(); ++i) {
            if (before.get(i) != after.get(i)) {
                return false;
            }
        }
        return true;
    }
}

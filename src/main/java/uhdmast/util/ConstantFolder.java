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

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uhdmast.core.AstFile;
import uhdmast.core.AstFile.Decl;
import uhdmast.core.AstFile.Expr;
import uhdmast.core.ScopeTable;

/**
 * Folds integer arithmetic, substituting the values of parameters and
 * enumeration items found in scope. Expressions which cannot be reduced to a
 * constant are partially folded, removing additions of zero and
 * multiplications by one.
 */
public class ConstantFolder extends AbstractExpressionTransform implements Simplifier {
    private static final Logger logger = LogManager.getLogger();

    private ScopeTable scope;
    /**
     * Names currently being substituted, used to break cyclic definitions.
     */
    private final Set<String> expanding = new HashSet<>();

    @Override
    public Expr fold(Expr expr, ScopeTable scope) {
        ScopeTable previous = this.scope;
        this.scope = scope;
        try {
            return visitExpression(expr);
        } finally {
            this.scope = previous;
        }
    }

    @Override
    public boolean simplify(Expr.Range range, ScopeTable scope) {
        Expr left = fold(range.getLeft(), scope);
        Expr right = range.getRight() == null ? null : fold(range.getRight(), scope);
        range.setBounds(left, right);
        return range.isConstant();
    }

    @Override
    protected Expr constructIdentifier(Expr.Identifier expr, List<Expr> selectors) {
        if (scope == null || !expr.getSelectors().isEmpty() || expr.getDot() != null) {
            return super.constructIdentifier(expr, selectors);
        }
        Expr value = valueOf(scope.resolve(expr.getName()));
        if (value == null || expanding.contains(expr.getName())) {
            return expr;
        }
        expanding.add(expr.getName());
        try {
            Expr r = visitExpression(value.copy());
            if (r instanceof Expr.Integer) {
                logger.trace("substituted {} = {}", expr.getName(), ((Expr.Integer) r).getValue());
                return r;
            }
            return expr;
        } finally {
            expanding.remove(expr.getName());
        }
    }

    @Override
    protected Expr constructAddition(Expr.Addition expr, Expr lhs, Expr rhs) {
        if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
            return AstFile.CONST(valueOf(lhs).add(valueOf(rhs)), expr.getAttributes());
        } else if (isConstant(rhs, 0)) {
            return lhs;
        } else if (isConstant(lhs, 0)) {
            return rhs;
        }
        return super.constructAddition(expr, lhs, rhs);
    }

    @Override
    protected Expr constructSubtraction(Expr.Subtraction expr, Expr lhs, Expr rhs) {
        if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
            return AstFile.CONST(valueOf(lhs).subtract(valueOf(rhs)), expr.getAttributes());
        } else if (isConstant(rhs, 0)) {
            return lhs;
        }
        return super.constructSubtraction(expr, lhs, rhs);
    }

    @Override
    protected Expr constructMultiplication(Expr.Multiplication expr, Expr lhs, Expr rhs) {
        if (lhs instanceof Expr.Integer && rhs instanceof Expr.Integer) {
            return AstFile.CONST(valueOf(lhs).multiply(valueOf(rhs)), expr.getAttributes());
        } else if (isConstant(lhs, 0) || isConstant(rhs, 0)) {
            return AstFile.CONST(0, expr.getAttributes());
        } else if (isConstant(rhs, 1)) {
            return lhs;
        } else if (isConstant(lhs, 1)) {
            return rhs;
        }
        return super.constructMultiplication(expr, lhs, rhs);
    }

    @Override
    protected Expr constructInvoke(Expr.Invoke expr, List<Expr> arguments) {
        if (expr.getName().equals("$clog2") && arguments.size() == 1 && arguments.get(0) instanceof Expr.Integer) {
            BigInteger n = valueOf(arguments.get(0));
            int r = n.signum() <= 0 ? 0 : n.subtract(BigInteger.ONE).bitLength();
            return AstFile.CONST(r, expr.getAttributes());
        }
        return super.constructInvoke(expr, arguments);
    }

    private static Expr valueOf(Decl decl) {
        if (decl instanceof Decl.Variable && ((Decl.Variable) decl).isParameter()) {
            return ((Decl.Variable) decl).getInitialiser();
        } else if (decl instanceof Decl.EnumItem) {
            return ((Decl.EnumItem) decl).getValue();
        }
        return null;
    }

    private static BigInteger valueOf(Expr e) {
        return ((Expr.Integer) e).getValue();
    }

    private static boolean isConstant(Expr e, int value) {
        return e instanceof Expr.Integer && valueOf(e).equals(BigInteger.valueOf(value));
    }
}

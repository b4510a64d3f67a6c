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

import java.util.Set;

import uhdmast.core.AstFile.Expr;
import uhdmast.core.Dimensions.Dimension;
import uhdmast.core.ScopeTable;
import uhdmast.core.SyntacticException;

/**
 * Reduces expressions towards constants, using the declarations in scope to
 * resolve symbolic names.
 *
 * @author David J. Pearce
 *
 */
public interface Simplifier {

    /**
     * Fold a given expression as far as possible. The expression itself is not
     * modified, though parts of it may be shared with the result.
     *
     * @param expr
     * @param scope
     * @return
     */
    public Expr fold(Expr expr, ScopeTable scope);

    /**
     * Fold the bounds of a range in place.
     *
     * @param range
     * @param scope
     * @return <code>true</code> if both bounds are now integer constants.
     */
    public boolean simplify(Expr.Range range, ScopeTable scope);

    /**
     * Fold an expression which must produce an integer constant.
     *
     * @param expr
     * @param scope
     * @return
     */
    public default int evaluate(Expr expr, ScopeTable scope) {
        Expr r = fold(expr, scope);
        if (r instanceof Expr.Integer) {
            return toInt(expr, (Expr.Integer) r);
        }
        throw unresolved(expr, r);
    }

    /**
     * Resolve a declared range to a dimension. The range is folded on a copy, so
     * the declaration itself is left untouched. A single bound <code>[N]</code>
     * is the single point <code>[N:N]</code>.
     *
     * @param range
     * @param scope
     * @return
     */
    public default Dimension evaluate(Expr.Range range, ScopeTable scope) {
        Expr.Range r = range.copy();
        if (!simplify(r, scope)) {
            Expr culprit = r.getLeft() instanceof Expr.Integer ? r.getLow() : r.getLeft();
            throw unresolved(range, culprit);
        }
        int left = toInt(range, (Expr.Integer) r.getLeft());
        int right = r.isIndex() ? left : toInt(range, (Expr.Integer) r.getRight());
        try {
            return Dimension.of(left, right);
        } catch (ArithmeticException e) {
            throw new SyntacticException(SyntacticException.Kind.UNRESOLVED_CONSTANT,
                    "dimension [" + left + ":" + right + "] is too large", range, e);
        }
    }

    static int toInt(Expr element, Expr.Integer value) {
        try {
            return value.getValue().intValueExact();
        } catch (ArithmeticException e) {
            throw new SyntacticException(SyntacticException.Kind.UNRESOLVED_CONSTANT,
                    "constant " + value.getValue() + " is out of range", element, e);
        }
    }

    static SyntacticException unresolved(Expr element, Expr residue) {
        Set<String> symbols = AbstractExpressionFold.freeSymbols(residue);
        String message = symbols.isEmpty() ? "unable to evaluate constant expression"
                : "unable to evaluate constant expression (unresolved " + String.join(", ", symbols) + ")";
        return new SyntacticException(SyntacticException.Kind.UNRESOLVED_CONSTANT, message, element);
    }
}

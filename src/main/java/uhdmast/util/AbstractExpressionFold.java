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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public abstract class AbstractExpressionFold<E> extends AbstractExpressionVisitor<E> {

    @Override
    protected E constructInteger(Expr.Integer expr) {
        return BOTTOM();
    }

    @Override
    protected E constructReal(Expr.Real expr) {
        return BOTTOM();
    }

    @Override
    protected E constructString(Expr.Str expr) {
        return BOTTOM();
    }

    @Override
    protected E constructIdentifier(Expr.Identifier expr, List<E> selectors) {
        return join(selectors);
    }

    @Override
    protected E constructRange(Expr.Range expr, E left, E right) {
        return right == null ? left : join(left, right);
    }

    @Override
    protected E constructAddition(Expr.Addition expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructSubtraction(Expr.Subtraction expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructMultiplication(Expr.Multiplication expr, E lhs, E rhs) {
        return join(lhs, rhs);
    }

    @Override
    protected E constructInvoke(Expr.Invoke expr, List<E> arguments) {
        return join(arguments);
    }

    protected abstract E BOTTOM();

    protected abstract E join(E lhs, E rhs);

    protected E join(List<E> operands) {
        E r = BOTTOM();
        for (int i = 0; i != operands.size(); ++i) {
            r = join(r, operands.get(i));
        }
        return r;
    }

    /**
     * Determine the set of symbols referenced by an expression. This is used to
     * report which names prevented an expression from being folded.
     *
     * @param expr
     * @return
     */
    public static Set<String> freeSymbols(Expr expr) {
        return new AbstractExpressionFold<Set<String>>() {
            @Override
            protected Set<String> constructIdentifier(Expr.Identifier expr, List<Set<String>> selectors) {
                Set<String> r = join(selectors);
                r.add(expr.getName());
                return r;
            }

            @Override
            protected Set<String> BOTTOM() {
                return new HashSet<>();
            }

            @Override
            protected Set<String> join(Set<String> lhs, Set<String> rhs) {
                HashSet<String> r = new HashSet<>(lhs);
                r.addAll(rhs);
                return r;
            }
        }.visitExpression(expr);
    }
}

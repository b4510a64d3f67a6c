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
package uhdmast.tasks;

import static uhdmast.core.AstFile.*;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uhdmast.core.AstFile.Expr;
import uhdmast.core.AstFile.Item;
import uhdmast.core.Dimensions;
import uhdmast.core.Dimensions.Dimension;
import uhdmast.core.ScopeTable;
import uhdmast.core.SyntacticException;
import uhdmast.util.Simplifier;

/**
 * Rewrites an access to a normalized declaration into a single range over its
 * flattened bits. Given one selector per dimension (in source order), each
 * selector is converted into a position within its dimension and scaled by the
 * number of bits one step of that dimension spans. Trailing dimensions may be
 * omitted, in which case they are selected whole.
 *
 * @author David J. Pearce
 *
 */
public class AccessRewriter {
	private static final Logger logger = LogManager.getLogger();

	private final Simplifier simplifier;

	public AccessRewriter(Simplifier simplifier) {
		this.simplifier = simplifier;
	}

	/**
	 * Replace the selectors of an identifier with the flat range they denote,
	 * returning the detached selectors.
	 *
	 * @param expr
	 * @param dimensions
	 * @param scope
	 * @return
	 */
	public List<Expr.Range> rewrite(Expr.Identifier expr, Dimensions dimensions, ScopeTable scope) {
		Expr.Range flat = locate(expr, expr.getSelectors(), dimensions, scope);
		logger.debug("rewriting {} over {}", expr.getName(), dimensions);
		return expr.prepare(flat);
	}

	/**
	 * Determine the flat range denoted by a given list of selectors. The
	 * selectors themselves are not modified.
	 *
	 * @param element    Element reported in any diagnostic.
	 * @param selectors  One selector per dimension, outermost first.
	 * @param dimensions Normalized dimensions being accessed.
	 * @param scope
	 * @return
	 */
	public Expr.Range locate(Item element, List<Expr.Range> selectors, Dimensions dimensions, ScopeTable scope) {
		if (selectors.size() > dimensions.size()) {
			throw new SyntacticException(SyntacticException.Kind.INVALID_DIMENSION_COUNT, "too many indices ("
					+ selectors.size() + " given, but only " + dimensions.size() + " dimensions declared)", element);
		} else if (selectors.isEmpty()) {
			return RANGE(dimensions.getSize() - 1, 0);
		}
		Expr.Range r = locate(element, selectors, dimensions, 0);
		if (simplifier.simplify(r, scope)) {
			Expr.Integer left = (Expr.Integer) r.getLeft();
			Expr.Integer right = (Expr.Integer) r.getRight();
			if (left.getValue().compareTo(right.getValue()) < 0) {
				// Selector written against the declared direction
				r.setBounds(right, left);
			}
		}
		return r;
	}

	/**
	 * Determine the range denoted by the i'th selector onwards, relative to the
	 * start of the slot selected by the preceding selectors.
	 */
	private Expr.Range locate(Item element, List<Expr.Range> selectors, Dimensions dimensions, int i) {
		Expr.Range selector = selectors.get(i);
		Dimension d = dimensions.get(i);
		int slot = dimensions.getSlotSize(i);
		Expr high;
		Expr low;
		if (selector.isIndex()) {
			low = MUL(d.offset(selector.getLeft().copy()), CONST(slot));
			high = ADD(low.copy(), CONST(slot - 1));
		} else if (i + 1 != selectors.size()) {
			throw new SyntacticException(SyntacticException.Kind.UNSUPPORTED_SELECTOR,
					"range selector must be the last selector", element);
		} else {
			Expr left = d.offset(selector.getLeft().copy());
			Expr right = d.offset(selector.getRight().copy());
			low = MUL(right, CONST(slot));
			high = ADD(MUL(left, CONST(slot)), CONST(slot - 1));
		}
		if (i + 1 == selectors.size()) {
			return RANGE(high, low);
		}
		// Nest the remaining selectors within the slot selected here
		Expr.Range inner = locate(element, selectors, dimensions, i + 1);
		return RANGE(ADD(low.copy(), inner.getLeft()), ADD(low, inner.getRight()));
	}
}

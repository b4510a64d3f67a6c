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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uhdmast.core.AstFile.Expr;
import uhdmast.core.AstFile.Type;
import uhdmast.core.Dimensions.Dimension;
import uhdmast.core.ScopeTable;
import uhdmast.core.SyntacticException;
import uhdmast.util.Simplifier;

/**
 * Translates a chain of field accesses (e.g. <code>.a[1].y</code>) into the
 * bit range it occupies within a record. The resulting range is relative to
 * bit zero of the outermost record in the chain.
 *
 * @author David J. Pearce
 *
 */
public class RecordPathExpander {
	private static final Logger logger = LogManager.getLogger();

	private final Simplifier simplifier;

	public RecordPathExpander(Simplifier simplifier) {
		this.simplifier = simplifier;
	}

	/**
	 * Expand a field access chain against a given record.
	 *
	 * @param record The record type being accessed.
	 * @param dot    The first segment of the access chain.
	 * @param scope  Scope used for resolving constants and type names.
	 * @return A range <code>[high:low]</code> within the record.
	 */
	public Expr.Range expand(Type.Record record, Expr.Dot dot, ScopeTable scope) {
		Expr.Range r = locate(record, dot, scope);
		if (simplifier.simplify(r, scope)) {
			Expr.Integer left = (Expr.Integer) r.getLeft();
			Expr.Integer right = (Expr.Integer) r.getRight();
			if (left.getValue().compareTo(right.getValue()) < 0) {
				// Selector written against the declared direction
				r.setBounds(right, left);
			}
			logger.debug("expanded .{} to [{}:{}]", dot.getField(), r.getLeft(), r.getRight());
		}
		return r;
	}

	private Expr.Range locate(Type.Record record, Expr.Dot dot, ScopeTable scope) {
		RecordLayout layout = RecordLayout.of(record, scope, simplifier);
		RecordLayout.Slot slot = layout.get(dot.getField());
		if (slot == null) {
			throw new SyntacticException(SyntacticException.Kind.UNKNOWN_FIELD,
					"unknown field " + dot.getField(), dot);
		} else if (dot.getSelectors().size() > 1) {
			throw new SyntacticException(SyntacticException.Kind.UNSUPPORTED_SELECTOR,
					"too many selectors on field " + dot.getField(), dot);
		} else if (dot.getSelectors().isEmpty()) {
			return locateWhole(slot, dot, scope);
		} else if (slot.getInstances() != null) {
			return locateInstances(slot, dot, scope);
		} else {
			return locateBits(slot, dot);
		}
	}

	/**
	 * Access a field without any selector. This either selects the whole field,
	 * or continues into the record it holds.
	 */
	private Expr.Range locateWhole(RecordLayout.Slot slot, Expr.Dot dot, ScopeTable scope) {
		if (dot.getNext() == null) {
			return RANGE(slot.getHigh(), slot.getLow());
		} else if (slot.getInstances() != null) {
			throw new SyntacticException(SyntacticException.Kind.UNSUPPORTED_SELECTOR,
					"field " + dot.getField() + " requires an index before ." + dot.getNext().getField(), dot);
		} else if (slot.getElement() == null) {
			throw new SyntacticException(SyntacticException.Kind.UNKNOWN_FIELD,
					"unknown field " + dot.getNext().getField() + " (" + dot.getField() + " is not a record)",
					dot.getNext());
		}
		return compose(CONST(slot.getLow()), locate(slot.getElement(), dot.getNext(), scope));
	}

	/**
	 * Access one or more instances of a field holding several elements, such as
	 * <code>.a[1]</code> or <code>.a[2:1]</code>.
	 */
	private Expr.Range locateInstances(RecordLayout.Slot slot, Expr.Dot dot, ScopeTable scope) {
		Expr.Range selector = dot.getSelectors().get(0);
		Dimension d = slot.getInstances();
		int width = slot.getElementWidth();
		if (selector.isIndex()) {
			Expr base = ADD(CONST(slot.getLow()), MUL(d.offset(selector.getLeft().copy()), CONST(width)));
			if (dot.getNext() == null) {
				return RANGE(ADD(base.copy(), CONST(width - 1)), base);
			} else if (slot.getElement() == null) {
				throw new SyntacticException(SyntacticException.Kind.UNKNOWN_FIELD,
						"unknown field " + dot.getNext().getField() + " (" + dot.getField() + " is not a record)",
						dot.getNext());
			}
			return compose(base, locate(slot.getElement(), dot.getNext(), scope));
		} else if (dot.getNext() != null) {
			throw new SyntacticException(SyntacticException.Kind.UNSUPPORTED_SELECTOR,
					"cannot access ." + dot.getNext().getField() + " of a range of " + dot.getField(), dot);
		}
		Expr high = MUL(ADD(d.offset(selector.getLeft().copy()), CONST(1)), CONST(width));
		Expr low = MUL(d.offset(selector.getRight().copy()), CONST(width));
		return RANGE(ADD(CONST(slot.getLow() - 1), high), ADD(CONST(slot.getLow()), low));
	}

	/**
	 * Select bits from a field holding a single element, such as
	 * <code>.b[3]</code> or <code>.b[3:0]</code>.
	 */
	private Expr.Range locateBits(RecordLayout.Slot slot, Expr.Dot dot) {
		if (dot.getNext() != null) {
			if (slot.getElement() != null) {
				throw new SyntacticException(SyntacticException.Kind.UNSUPPORTED_SELECTOR,
						"cannot access ." + dot.getNext().getField() + " of a bit selection", dot);
			}
			throw new SyntacticException(SyntacticException.Kind.UNKNOWN_FIELD,
					"unknown field " + dot.getNext().getField() + " (" + dot.getField() + " is not a record)",
					dot.getNext());
		}
		Expr.Range selector = dot.getSelectors().get(0);
		Dimension d = slot.getBits();
		Expr left = ADD(CONST(slot.getLow()), d.offset(selector.getLeft().copy()));
		if (selector.isIndex()) {
			return RANGE(left, left.copy());
		}
		return RANGE(left, ADD(CONST(slot.getLow()), d.offset(selector.getRight().copy())));
	}

	private static Expr.Range compose(Expr base, Expr.Range inner) {
		return RANGE(ADD(base.copy(), inner.getLeft()), ADD(base, inner.getLow()));
	}
}

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

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uhdmast.core.AstFile;
import uhdmast.core.AstFile.Decl;
import uhdmast.core.AstFile.Expr;
import uhdmast.core.AstFile.Type;
import uhdmast.core.AstFile.Unit;
import uhdmast.core.Dimensions;
import uhdmast.core.ScopeTable;
import uhdmast.core.SyntacticException;
import uhdmast.util.AbstractItemVisitor;
import uhdmast.util.Simplifier;

/**
 * Walks a single unit in declaration order, recording each declaration in the
 * active scope as it is reached. Declarations are normalized once their
 * children have been visited, and accesses are rewritten against any
 * normalized declaration they refer to. Field accesses are expanded before
 * their children are visited.
 * <p>
 * A problem with a declaration or access is recorded and the pass moves on to
 * the next one.
 * </p>
 *
 * @author David J. Pearce
 *
 */
public class ScopeThreadingPass extends AbstractItemVisitor {
	private static final Logger logger = LogManager.getLogger();

	private final ScopeTable scope;
	private final Simplifier simplifier;
	private final DimensionCollector collector;
	private final AccessRewriter rewriter;
	private final RecordPathExpander expander;
	private final List<SyntacticException> errors = new ArrayList<>();

	public ScopeThreadingPass(ScopeTable scope, Simplifier simplifier) {
		this.scope = scope;
		this.simplifier = simplifier;
		this.collector = new DimensionCollector(simplifier);
		this.rewriter = new AccessRewriter(simplifier);
		this.expander = new RecordPathExpander(simplifier);
	}

	/**
	 * Apply this pass to a given unit, which must be the unit of the active
	 * scope.
	 *
	 * @param unit
	 * @return The problems encountered.
	 */
	public List<SyntacticException> apply(Unit unit) {
		if (scope.getUnit() != unit) {
			throw new IllegalStateException("scope is not active for " + unit.getName());
		}
		visitUnit(unit);
		return errors;
	}

	public List<SyntacticException> getErrors() {
		return errors;
	}

	@Override
	public void visitVariable(Decl.Variable decl) {
		super.visitVariable(decl);
		scope.declare(decl);
		try {
			collector.collect(decl, scope);
		} catch (SyntacticException e) {
			report(e);
		}
	}

	@Override
	public void visitTypeDef(Decl.TypeDef decl) {
		super.visitTypeDef(decl);
		scope.declare(decl);
		Type type = decl.getType();
		if (type instanceof Type.Enumeration) {
			for (Decl.EnumItem item : ((Type.Enumeration) type).getItems()) {
				scope.declare(item);
			}
		}
	}

	@Override
	public void visitIdentifier(Expr.Identifier expr) {
		if (expr.getState() == AstFile.State.PREPARED) {
			return;
		}
		try {
			if (expr.getDot() != null) {
				expandDot(expr);
				if (expr.getState() == AstFile.State.PREPARED) {
					return;
				}
			}
			super.visitIdentifier(expr);
			Decl.Variable decl = normalized(expr.getName());
			if (decl != null && !expr.getSelectors().isEmpty()) {
				Dimensions dimensions = decl.getDimensions();
				if (dimensions.size() > 1 || !dimensions.isCanonical()) {
					rewriter.rewrite(expr, dimensions, scope);
				}
			}
		} catch (SyntacticException e) {
			report(e);
		}
	}

	/**
	 * Expand a field access against a record variable into a flat range. When
	 * the root is not a normalized record variable, the chain is folded into a
	 * single composite name instead, keeping only the selectors of the last
	 * segment.
	 */
	private void expandDot(Expr.Identifier expr) {
		Decl.Variable decl = normalized(expr.getName());
		if (decl == null || decl.getRecord() == null) {
			StringBuilder name = new StringBuilder(expr.getName());
			List<Expr.Range> selectors = expr.getSelectors();
			for (Expr.Dot d = expr.detachDot(); d != null; d = d.getNext()) {
				name.append('.').append(d.getField());
				selectors = d.getSelectors();
			}
			logger.debug("treating {} as a composite name", name);
			expr.setName(name.toString());
			expr.replaceSelectors(selectors);
			return;
		}
		Dimensions dimensions = decl.getDimensions();
		if (expr.getSelectors().size() >= dimensions.size()) {
			throw new SyntacticException(SyntacticException.Kind.UNSUPPORTED_SELECTOR,
					"cannot access ." + expr.getDot().getField() + " of a bit selection of " + expr.getName(), expr);
		}
		List<Expr.Range> selectors = expr.getSelectors();
		if (!selectors.isEmpty() && !selectors.get(selectors.size() - 1).isIndex()) {
			throw new SyntacticException(SyntacticException.Kind.UNSUPPORTED_SELECTOR,
					"cannot access ." + expr.getDot().getField() + " of a range of " + expr.getName(), expr);
		}
		// Children first, so nested accesses within selectors are rewritten
		super.visitIdentifier(expr);
		Expr.Range instance = rewriter.locate(expr, expr.getSelectors(), dimensions, scope);
		Expr.Range field = expander.expand(decl.getRecord(), expr.getDot(), scope);
		Expr.Range flat = RANGE(ADD(instance.getLow().copy(), field.getLeft()), ADD(instance.getLow(), field.getLow()));
		simplifier.simplify(flat, scope);
		expr.prepare(flat);
	}

	private Decl.Variable normalized(String name) {
		Decl d = scope.resolve(name);
		if (d instanceof Decl.Variable && ((Decl.Variable) d).getState() == AstFile.State.NORMALIZED) {
			return (Decl.Variable) d;
		}
		return null;
	}

	private void report(SyntacticException e) {
		logger.error(e.toDiagnostic());
		errors.add(e);
	}
}

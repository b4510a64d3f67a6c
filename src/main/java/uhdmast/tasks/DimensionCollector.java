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

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uhdmast.core.AstFile;
import uhdmast.core.AstFile.Decl;
import uhdmast.core.AstFile.Expr;
import uhdmast.core.AstFile.Type;
import uhdmast.core.Dimensions;
import uhdmast.core.Dimensions.Dimension;
import uhdmast.core.ScopeTable;
import uhdmast.core.SyntacticException;
import uhdmast.util.Simplifier;

/**
 * Collapses the packed and unpacked dimensions of a declaration into a single
 * flat range <code>[size-1:0]</code>, retaining the original shape on the
 * declaration so that accesses can later be rewritten against it.
 *
 * @author David J. Pearce
 *
 */
public class DimensionCollector {
	private static final Logger logger = LogManager.getLogger();

	private final Simplifier simplifier;

	public DimensionCollector(Simplifier simplifier) {
		this.simplifier = simplifier;
	}

	/**
	 * Normalize a given declaration, if it needs to be. All bounds are resolved
	 * before the declaration is modified, such that a failure leaves it exactly
	 * as it was.
	 *
	 * @param decl
	 * @param scope
	 * @return The flattened size of the declaration, or zero if it was left as is.
	 */
	public int collect(Decl.Variable decl, ScopeTable scope) {
		if (decl.getState() != AstFile.State.RAW) {
			return decl.getDimensions().getSize();
		}
		// Determine the contribution of the declared type (if any)
		Type type = declaredType(decl, scope);
		Type.Record record = type instanceof Type.Record ? (Type.Record) type : null;
		List<Dimension> packed = evaluate(decl.getPacked(), scope);
		if (type != null) {
			packed.addAll(innermost(type, scope));
		}
		List<Dimension> unpacked = evaluate(decl.getUnpacked(), scope);
		//
		if (!requiresFlattening(decl, packed.size(), unpacked.size())) {
			if (decl.getKind() == Decl.Variable.Kind.WIRE && !decl.isPort() && packed.size() == 1
					&& unpacked.size() == 1) {
				logger.debug("treating {} as memory", decl.getName());
				decl.setKind(Decl.Variable.Kind.MEMORY);
			}
			return 0;
		}
		Dimensions dimensions = new Dimensions(packed, unpacked);
		int size;
		try {
			size = dimensions.getSize();
		} catch (ArithmeticException e) {
			throw new SyntacticException(SyntacticException.Kind.UNRESOLVED_CONSTANT,
					"flattened size of " + decl.getName() + dimensions + " exceeds " + Integer.MAX_VALUE + " bits", decl,
					e);
		}
		decl.normalize(dimensions, record);
		logger.debug("flattened {} {} to [{}:0]", decl.getName(), dimensions, size - 1);
		return size;
	}

	private static boolean requiresFlattening(Decl.Variable decl, int packed, int unpacked) {
		if (packed + unpacked == 0) {
			return false;
		}
		return packed > 1 || unpacked > 1 || decl.hasType() || decl.isParameter() || decl.isPort()
				|| decl.getConversion() == Decl.Variable.Conversion.FORCE;
	}

	private Type declaredType(Decl.Variable decl, ScopeTable scope) {
		if (decl.getTypeName() != null) {
			return RecordLayout.resolve(AstFile.NAMED(decl.getTypeName()), scope);
		} else if (decl.getType() != null) {
			return RecordLayout.resolve(decl.getType(), scope);
		}
		return null;
	}

	/**
	 * Determine the innermost packed dimensions contributed by a type.
	 */
	private List<Dimension> innermost(Type type, ScopeTable scope) {
		if (type instanceof Type.Vector) {
			return evaluate(((Type.Vector) type).getPacked(), scope);
		}
		List<Dimension> r = new ArrayList<>();
		if (type instanceof Type.Enumeration && ((Type.Enumeration) type).getBase() != null) {
			r.add(simplifier.evaluate(((Type.Enumeration) type).getBase(), scope));
		} else {
			int width = RecordLayout.widthOf(type, scope, simplifier);
			r.add(Dimension.of(width - 1, 0));
		}
		return r;
	}

	private List<Dimension> evaluate(List<Expr.Range> ranges, ScopeTable scope) {
		List<Dimension> r = new ArrayList<>();
		for (Expr.Range range : ranges) {
			r.add(simplifier.evaluate(range, scope));
		}
		return r;
	}
}

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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uhdmast.core.AstFile;
import uhdmast.core.AstFile.Decl;
import uhdmast.core.AstFile.Expr;
import uhdmast.core.AstFile.Stmt;
import uhdmast.core.AstFile.Unit;
import uhdmast.util.AbstractItemVisitor;

/**
 * Decides which memory-like declarations (exactly one packed and one unpacked
 * range) must stay memories and which must be flattened. A memory loaded by a
 * bulk loader stays a memory, whilst one referenced as a whole anywhere else
 * is flattened.
 *
 * @author David J. Pearce
 *
 */
public class MemoryChecker extends AbstractItemVisitor {
	private static final Logger logger = LogManager.getLogger();

	/**
	 * System tasks which load an entire memory from a file. The memory is given
	 * as the second argument.
	 */
	public static final Set<String> BULK_LOADERS = Collections
			.unmodifiableSet(new HashSet<>(Arrays.asList("$readmemh", "$readmemb")));

	private final Map<String, Decl.Variable> candidates = new HashMap<>();

	public void apply(Unit unit) {
		candidates.clear();
		new AbstractItemVisitor() {
			@Override
			public void visitVariable(Decl.Variable decl) {
				if (decl.getState() == AstFile.State.RAW && decl.getPacked().size() == 1
						&& decl.getUnpacked().size() == 1) {
					candidates.put(decl.getName(), decl);
				}
			}
		}.visitUnit(unit);
		visitUnit(unit);
	}

	@Override
	public void visitCall(Stmt.Call stmt) {
		if (!BULK_LOADERS.contains(stmt.getName()) || stmt.getArguments().size() < 2) {
			super.visitCall(stmt);
			return;
		}
		for (int i = 0; i != stmt.getArguments().size(); ++i) {
			Expr arg = stmt.getArguments().get(i);
			Decl.Variable target = i == 1 ? candidateOf(arg) : null;
			if (target != null) {
				logger.debug("keeping {} as memory (loaded by {})", target.getName(), stmt.getName());
				target.setConversion(Decl.Variable.Conversion.KEEP);
			} else {
				visitExpression(arg);
			}
		}
	}

	@Override
	public void visitIdentifier(Expr.Identifier expr) {
		Decl.Variable target = candidateOf(expr);
		if (target != null && target.getConversion() == Decl.Variable.Conversion.UNSET) {
			logger.debug("forcing {} to be flattened", target.getName());
			target.setConversion(Decl.Variable.Conversion.FORCE);
		}
		super.visitIdentifier(expr);
	}

	/**
	 * Determine the candidate memory referenced as a whole by an expression, or
	 * <code>null</code> if there is none.
	 */
	private Decl.Variable candidateOf(Expr expr) {
		if (expr instanceof Expr.Identifier) {
			Expr.Identifier e = (Expr.Identifier) expr;
			if (e.getSelectors().isEmpty() && e.getDot() == null) {
				return candidates.get(e.getName());
			}
		}
		return null;
	}
}

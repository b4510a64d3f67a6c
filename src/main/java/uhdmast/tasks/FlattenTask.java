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

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uhdmast.core.AstFile;
import uhdmast.core.AstFile.Unit;
import uhdmast.core.ScopeTable;
import uhdmast.core.SyntacticException;
import uhdmast.io.AstFilePrinter;
import uhdmast.util.ConstantFolder;
import uhdmast.util.Simplifier;
import uhdmast.util.Util;

/**
 * Flattens every unit of a file. Packages are processed before modules, and
 * the constants and type definitions of every package are visible in every
 * other unit.
 */
public class FlattenTask {
	private static final Logger logger = LogManager.getLogger();

	/**
	 * Used for resolving bounds to constants.
	 */
	private Simplifier simplifier = new ConstantFolder();
	/**
	 * Specify whether to print each unit after it has been processed.
	 */
	private boolean verbose = false;
	/**
	 * The problems encountered during the most recent run.
	 */
	private final List<SyntacticException> errors = new ArrayList<>();

	public FlattenTask setSimplifier(Simplifier simplifier) {
		this.simplifier = simplifier;
		return this;
	}

	public FlattenTask setVerbose(boolean flag) {
		this.verbose = flag;
		return this;
	}

	public List<SyntacticException> getErrors() {
		return errors;
	}

	/**
	 * Flatten all units in a given file in place.
	 *
	 * @param file
	 * @return <code>true</code> if no problems were encountered.
	 */
	public boolean run(AstFile file) {
		errors.clear();
		List<Unit> units = Util.packagesFirst(file.getUnits());
		List<Unit.Package> packages = Util.filter(units, Unit.Package.class);
		for (Unit unit : units) {
			ScopeTable scope = new ScopeTable();
			scope.enter(unit);
			try {
				for (Unit.Package pkg : packages) {
					if (pkg != unit) {
						scope.importPackage(pkg);
					}
				}
				new MemoryChecker().apply(unit);
				errors.addAll(new ScopeThreadingPass(scope, simplifier).apply(unit));
			} catch (SyntacticException e) {
				logger.error(e.toDiagnostic());
				errors.add(e);
			} finally {
				scope.leave();
			}
			if (verbose) {
				logger.info("{}:\n{}", unit.getName(), print(unit));
			}
		}
		logger.debug("flattened {} units ({} problems)", units.size(), errors.size());
		return errors.isEmpty();
	}

	private static String print(Unit unit) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		AstFilePrinter printer = new AstFilePrinter(out);
		printer.write(unit);
		printer.flush();
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}
}

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
package uhdmast.core;

import java.util.HashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import uhdmast.core.AstFile.Decl;
import uhdmast.core.AstFile.Item;
import uhdmast.core.AstFile.Type;
import uhdmast.core.AstFile.Unit;

/**
 * Maps names to their declarations for the unit currently being processed.
 * A table is only active between matching calls to {@link #enter(Unit)} and
 * {@link #leave()}, and a later declaration of the same name replaces an
 * earlier one.
 *
 * @author David J. Pearce
 *
 */
public class ScopeTable {
	private static final Logger logger = LogManager.getLogger();

	private final Map<String, Decl> symbols = new HashMap<>();
	private Unit unit;

	public void enter(Unit unit) {
		if (this.unit != null) {
			throw new IllegalStateException("scope already active for " + this.unit.getName());
		}
		this.unit = unit;
		logger.debug("entering scope {}", unit.getName());
	}

	public void leave() {
		if (unit != null) {
			logger.debug("leaving scope {}", unit.getName());
		}
		this.unit = null;
		this.symbols.clear();
	}

	public boolean isActive() {
		return unit != null;
	}

	public Unit getUnit() {
		return unit;
	}

	public void declare(Decl decl) {
		declare(decl.getName(), decl);
	}

	public void declare(String name, Decl decl) {
		symbols.put(name, decl);
	}

	/**
	 * Resolve a name to its declaration, or return <code>null</code> if no such
	 * declaration is in scope.
	 *
	 * @param name
	 * @return
	 */
	public Decl resolve(String name) {
		return symbols.get(name);
	}

	public int size() {
		return symbols.size();
	}

	/**
	 * Import the type definitions and constants of a package. Each is declared
	 * under its qualified name (<code>pkg::name</code>) and its bare name. The
	 * items of an enumeration are imported alongside it.
	 *
	 * @param pkg
	 */
	public void importPackage(Unit.Package pkg) {
		for (Item item : pkg.getItems()) {
			if (item instanceof Decl.TypeDef) {
				Decl.TypeDef td = (Decl.TypeDef) item;
				importDecl(pkg, td);
				if (td.getType() instanceof Type.Enumeration) {
					for (Decl.EnumItem e : ((Type.Enumeration) td.getType()).getItems()) {
						importDecl(pkg, e);
					}
				}
			} else if (item instanceof Decl.Variable && ((Decl.Variable) item).isParameter()) {
				importDecl(pkg, (Decl) item);
			}
		}
	}

	private void importDecl(Unit.Package pkg, Decl decl) {
		declare(pkg.getName() + "::" + decl.getName(), decl);
		declare(decl.getName(), decl);
	}
}

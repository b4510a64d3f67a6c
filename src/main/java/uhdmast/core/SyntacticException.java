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

/**
 * Signals a problem with a particular element of the tree, such as a
 * dimension whose bounds cannot be resolved to constants. The offending
 * element is retained so that a diagnostic can point at its location.
 *
 * @author David J. Pearce
 *
 */
public class SyntacticException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public enum Kind {
		UNRESOLVED_CONSTANT, UNKNOWN_FIELD, UNSUPPORTED_SELECTOR, INVALID_DIMENSION_COUNT
	}

	private final Kind kind;
	private final AstFile.Item element;

	public SyntacticException(Kind kind, String message, AstFile.Item element) {
		super(message);
		this.kind = kind;
		this.element = element;
	}

	public SyntacticException(Kind kind, String message, AstFile.Item element, Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.element = element;
	}

	public Kind getKind() {
		return kind;
	}

	public AstFile.Item getElement() {
		return element;
	}

	/**
	 * Get the location of the offending element, or <code>null</code> if it
	 * has none.
	 *
	 * @return
	 */
	public AstFile.Location getLocation() {
		return element == null ? null : element.getAttribute(AstFile.Location.class);
	}

	public String toDiagnostic() {
		AstFile.Location l = getLocation();
		String prefix = l == null ? "<unknown>" : l.toString();
		return prefix + ": " + getMessage();
	}
}

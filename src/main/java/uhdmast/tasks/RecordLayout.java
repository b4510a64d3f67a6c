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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import uhdmast.core.AstFile.Decl;
import uhdmast.core.AstFile.Expr;
import uhdmast.core.AstFile.Item;
import uhdmast.core.AstFile.Type;
import uhdmast.core.Dimensions.Dimension;
import uhdmast.core.ScopeTable;
import uhdmast.core.SyntacticException;
import uhdmast.util.Simplifier;

/**
 * The packed bit layout of a record. Struct fields are placed from the most
 * significant bit downwards in declaration order, with no gaps. Union members
 * all start at bit zero, and the union is as wide as its widest member.
 *
 * @author David J. Pearce
 *
 */
public class RecordLayout {

	/**
	 * The bits occupied by a single field. A field occupies
	 * <code>count</code> consecutive instances of its element, each
	 * <code>elementWidth</code> bits wide.
	 */
	public static class Slot {
		private final String name;
		private final int high;
		private final int low;
		private final int elementWidth;
		private final Dimension instances;
		private final Dimension bits;
		private final Type.Record element;

		public Slot(String name, int high, int low, int elementWidth, Dimension instances, Dimension bits,
				Type.Record element) {
			this.name = name;
			this.high = high;
			this.low = low;
			this.elementWidth = elementWidth;
			this.instances = instances;
			this.bits = bits;
			this.element = element;
		}

		public String getName() {
			return name;
		}

		public int getHigh() {
			return high;
		}

		public int getLow() {
			return low;
		}

		public int getWidth() {
			return (high - low) + 1;
		}

		public int getElementWidth() {
			return elementWidth;
		}

		/**
		 * Get the dimension indexing the instances of this field, or
		 * <code>null</code> if it holds exactly one.
		 *
		 * @return
		 */
		public Dimension getInstances() {
			return instances;
		}

		/**
		 * Get the dimension used when selecting bits of a single instance.
		 *
		 * @return
		 */
		public Dimension getBits() {
			return bits;
		}

		/**
		 * Get the record type of each instance, or <code>null</code> if the element
		 * is not a record.
		 *
		 * @return
		 */
		public Type.Record getElement() {
			return element;
		}

		@Override
		public String toString() {
			return name + "[" + high + ":" + low + "]";
		}
	}

	private final Map<String, Slot> slots;
	private final int width;

	private RecordLayout(Map<String, Slot> slots, int width) {
		this.slots = slots;
		this.width = width;
	}

	public int getWidth() {
		return width;
	}

	/**
	 * Get the slot of a named field, or <code>null</code> if there is no such
	 * field.
	 *
	 * @param field
	 * @return
	 */
	public Slot get(String field) {
		return slots.get(field);
	}

	public static RecordLayout of(Type.Record record, ScopeTable scope, Simplifier simplifier) {
		List<Type.Field> fields = record.getFields();
		Slot[] shapes = new Slot[fields.size()];
		int total = 0;
		// Determine the shape of each field
		for (int i = 0; i != fields.size(); ++i) {
			shapes[i] = shape(fields.get(i), scope, simplifier);
			int w = shapes[i].getWidth();
			total = record.isUnion() ? Math.max(total, w) : add(total, w, record);
		}
		// Position fields within the record
		LinkedHashMap<String, Slot> slots = new LinkedHashMap<>();
		int cursor = total;
		for (Slot s : shapes) {
			int low = record.isUnion() ? 0 : cursor - s.getWidth();
			int high = low + s.getWidth() - 1;
			slots.put(s.getName(), new Slot(s.getName(), high, low, s.getElementWidth(), s.getInstances(),
					s.getBits(), s.getElement()));
			cursor = low;
		}
		return new RecordLayout(slots, total);
	}

	/**
	 * Determine the width of a field positioned at bit zero.
	 */
	private static Slot shape(Type.Field field, ScopeTable scope, Simplifier simplifier) {
		Type type = resolve(field.getType(), scope);
		Dimension instances = null;
		Dimension bits;
		int elementWidth;
		if (field.getDimension() != null) {
			instances = simplifier.evaluate(field.getDimension(), scope);
			elementWidth = widthOf(type, scope, simplifier);
			bits = Dimension.of(elementWidth - 1, 0);
		} else if (type instanceof Type.Vector && ((Type.Vector) type).getPacked().size() > 1) {
			// The outermost packed range of a vector indexes its instances
			List<Expr.Range> packed = ((Type.Vector) type).getPacked();
			instances = simplifier.evaluate(packed.get(0), scope);
			elementWidth = 1;
			for (int i = 1; i < packed.size(); ++i) {
				elementWidth = multiply(elementWidth, simplifier.evaluate(packed.get(i), scope).getLength(), field);
			}
			bits = packed.size() == 2 ? simplifier.evaluate(packed.get(1), scope) : Dimension.of(elementWidth - 1, 0);
		} else if (type instanceof Type.Vector && ((Type.Vector) type).getPacked().size() == 1) {
			bits = simplifier.evaluate(((Type.Vector) type).getPacked().get(0), scope);
			elementWidth = bits.getLength();
		} else {
			elementWidth = widthOf(type, scope, simplifier);
			bits = Dimension.of(elementWidth - 1, 0);
		}
		int count = instances == null ? 1 : instances.getLength();
		Type.Record element = type instanceof Type.Record ? (Type.Record) type : null;
		return new Slot(field.getName(), multiply(elementWidth, count, field) - 1, 0, elementWidth, instances, bits,
				element);
	}

	/**
	 * Determine the number of bits occupied by a value of a given type.
	 *
	 * @param type
	 * @param scope
	 * @param simplifier
	 * @return
	 */
	public static int widthOf(Type type, ScopeTable scope, Simplifier simplifier) {
		type = resolve(type, scope);
		if (type instanceof Type.Vector) {
			int width = 1;
			for (Expr.Range r : ((Type.Vector) type).getPacked()) {
				width = multiply(width, simplifier.evaluate(r, scope).getLength(), type);
			}
			return width;
		} else if (type instanceof Type.Record) {
			return of((Type.Record) type, scope, simplifier).getWidth();
		} else if (type instanceof Type.Enumeration) {
			Type.Enumeration e = (Type.Enumeration) type;
			return e.getBase() == null ? 32 : simplifier.evaluate(e.getBase(), scope).getLength();
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + type.getClass().getName() + ")");
		}
	}

	/**
	 * Follow named type references until a concrete type is reached.
	 *
	 * @param type
	 * @param scope
	 * @return
	 */
	public static Type resolve(Type type, ScopeTable scope) {
		int depth = 0;
		while (type instanceof Type.Named) {
			String name = ((Type.Named) type).getName();
			Decl d = scope.resolve(name);
			if (!(d instanceof Decl.TypeDef) || ++depth > 64) {
				throw new SyntacticException(SyntacticException.Kind.UNRESOLVED_CONSTANT,
						"unable to resolve type " + name, type);
			}
			type = ((Decl.TypeDef) d).getType();
		}
		return type;
	}

	private static int add(int lhs, int rhs, Item element) {
		try {
			return Math.addExact(lhs, rhs);
		} catch (ArithmeticException e) {
			throw tooWide(element, e);
		}
	}

	private static int multiply(int lhs, int rhs, Item element) {
		try {
			return Math.multiplyExact(lhs, rhs);
		} catch (ArithmeticException e) {
			throw tooWide(element, e);
		}
	}

	private static SyntacticException tooWide(Item element, ArithmeticException cause) {
		return new SyntacticException(SyntacticException.Kind.UNRESOLVED_CONSTANT,
				"packed width exceeds " + Integer.MAX_VALUE + " bits", element, cause);
	}
}

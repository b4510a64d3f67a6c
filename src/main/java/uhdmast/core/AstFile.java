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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * The syntax tree handed to the synthesis front end. Elaborated designs are
 * translated into a list of units (modules and packages), each owning a
 * mutable list of declarations and statements. Unlike the elaborated model,
 * a declaration in this tree may carry at most one packed and one unpacked
 * range once it has been normalized.
 *
 * @author David J. Pearce
 *
 */
public class AstFile {

	/**
	 * The list of elaboration units within this file.
	 */
	private final List<Unit> units;

	public AstFile() {
		this.units = new ArrayList<>();
	}

	public AstFile(Collection<? extends Unit> units) {
		this.units = new ArrayList<>(units);
	}

	public List<Unit> getUnits() {
		return units;
	}

	// =========================================================================
	// Processing State
	// =========================================================================

	/**
	 * Tracks how far a node has been processed. Declarations move from
	 * <code>RAW</code> to <code>NORMALIZED</code> once their dimensions have been
	 * collapsed; identifiers move from <code>RAW</code> to <code>PREPARED</code>
	 * once their selectors have been replaced by a single flat range.
	 */
	public enum State {
		RAW, NORMALIZED, PREPARED
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		/**
		 * Get the source location of this item, or <code>null</code> if none was
		 * recorded.
		 *
		 * @return
		 */
		public Location getLocation() {
			return getAttribute(Location.class);
		}
	}

	// =========================================================================
	// Units
	// =========================================================================

	public interface Unit extends Item {

		public String getName();

		/**
		 * Get the (mutable) list of items declared in this unit.
		 *
		 * @return
		 */
		public List<Item> getItems();

		public static abstract class AbstractUnit extends AbstractItem implements Unit {
			private final String name;
			private final List<Item> items;

			public AbstractUnit(String name, Collection<? extends Item> items, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.items = new ArrayList<>(items);
			}

			@Override
			public String getName() {
				return name;
			}

			@Override
			public List<Item> getItems() {
				return items;
			}
		}

		public static class Module extends AbstractUnit {
			public Module(String name, Collection<? extends Item> items, Attribute... attributes) {
				super(name, items, attributes);
			}
		}

		/**
		 * A package contributes constants and type definitions to every other unit.
		 * Variables declared in a package are never imported.
		 */
		public static class Package extends AbstractUnit {
			public Package(String name, Collection<? extends Item> items, Attribute... attributes) {
				super(name, items, attributes);
			}
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		public String getName();

		/**
		 * A declared storage object (a wire, memory or parameter). The packed and
		 * unpacked range lists are given in source order, outermost first.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Variable extends AbstractItem implements Decl {
			public enum Kind {
				WIRE, MEMORY, PARAMETER, LOCALPARAM
			}

			public enum Direction {
				NONE, INPUT, OUTPUT, INOUT
			}

			/**
			 * Records whether a memory-like declaration must be flattened
			 * (<code>FORCE</code>) or must stay a memory (<code>KEEP</code>).
			 */
			public enum Conversion {
				UNSET, FORCE, KEEP
			}

			private final String name;
			private final Direction direction;
			private final List<Expr.Range> packed;
			private final List<Expr.Range> unpacked;
			private final String typeName;
			private final Type type;
			private final Expr initialiser;
			private Kind kind;
			private Conversion conversion;
			private State state;
			private Dimensions dimensions;
			private Type.Record record;

			public Variable(Kind kind, Direction direction, String name, List<Expr.Range> packed,
					List<Expr.Range> unpacked, String typeName, Type type, Expr initialiser, Attribute... attributes) {
				super(attributes);
				if (typeName != null && type != null) {
					throw new IllegalArgumentException("Cannot specify both a type name and an inline type");
				}
				this.kind = kind;
				this.direction = direction;
				this.name = name;
				this.packed = new ArrayList<>(packed);
				this.unpacked = new ArrayList<>(unpacked);
				this.typeName = typeName;
				this.type = type;
				this.initialiser = initialiser;
				this.conversion = Conversion.UNSET;
				this.state = State.RAW;
			}

			@Override
			public String getName() {
				return name;
			}

			public Kind getKind() {
				return kind;
			}

			public void setKind(Kind kind) {
				this.kind = kind;
			}

			public Direction getDirection() {
				return direction;
			}

			public boolean isPort() {
				return direction != Direction.NONE;
			}

			public boolean isParameter() {
				return kind == Kind.PARAMETER || kind == Kind.LOCALPARAM;
			}

			public List<Expr.Range> getPacked() {
				return packed;
			}

			public List<Expr.Range> getUnpacked() {
				return unpacked;
			}

			/**
			 * Get the name of the type this variable was declared with, or
			 * <code>null</code> if it has none.
			 *
			 * @return
			 */
			public String getTypeName() {
				return typeName;
			}

			/**
			 * Get the inline type this variable was declared with, or <code>null</code>
			 * if it has none.
			 *
			 * @return
			 */
			public Type getType() {
				return type;
			}

			public boolean hasType() {
				return typeName != null || type != null;
			}

			public Expr getInitialiser() {
				return initialiser;
			}

			public Conversion getConversion() {
				return conversion;
			}

			public void setConversion(Conversion conversion) {
				this.conversion = conversion;
			}

			public State getState() {
				return state;
			}

			/**
			 * Get the normalized dimensions of this variable. This is only available
			 * once the variable has been normalized.
			 *
			 * @return
			 */
			public Dimensions getDimensions() {
				return dimensions;
			}

			/**
			 * Get the record type of this variable, if it was declared with one and has
			 * been normalized.
			 *
			 * @return
			 */
			public Type.Record getRecord() {
				return record;
			}

			/**
			 * Replace all ranges on this variable with a single flat range covering the
			 * given dimensions. The original ranges are detached and returned to the
			 * caller.
			 *
			 * @param dimensions Normalized dimensions of this variable.
			 * @param record     Record type of this variable (or <code>null</code>).
			 * @return
			 */
			public List<Expr.Range> normalize(Dimensions dimensions, Type.Record record) {
				if (state != State.RAW) {
					throw new IllegalStateException("variable " + name + " already normalized");
				}
				List<Expr.Range> detached = new ArrayList<>(packed);
				detached.addAll(unpacked);
				packed.clear();
				unpacked.clear();
				packed.add(RANGE(dimensions.getSize() - 1, 0));
				this.dimensions = dimensions;
				this.record = record;
				this.state = State.NORMALIZED;
				return detached;
			}
		}

		/**
		 * Introduces a name for a type descriptor. An enumeration typedef also
		 * introduces each of its items into the enclosing scope.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class TypeDef extends AbstractItem implements Decl {
			private final String name;
			private final Type type;

			public TypeDef(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			@Override
			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}
		}

		public static class EnumItem extends AbstractItem implements Decl {
			private final String name;
			private final Expr value;

			public EnumItem(String name, Expr value, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.value = value;
			}

			@Override
			public String getName() {
				return name;
			}

			public Expr getValue() {
				return value;
			}
		}
	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {

		/**
		 * A packed bit vector, such as <code>logic [3:0][7:0]</code>. A vector
		 * without ranges is a single bit.
		 */
		public static class Vector extends AbstractItem implements Type {
			private final List<Expr.Range> packed;

			public Vector(List<Expr.Range> packed, Attribute... attributes) {
				super(attributes);
				this.packed = new ArrayList<>(packed);
			}

			public List<Expr.Range> getPacked() {
				return packed;
			}
		}

		/**
		 * A reference to a type declared elsewhere through a typedef.
		 */
		public static class Named extends AbstractItem implements Type {
			private final String name;

			public Named(String name, Attribute... attributes) {
				super(attributes);
				this.name = name;
			}

			public String getName() {
				return name;
			}
		}

		/**
		 * A packed struct or union. The order of fields is fixed at declaration;
		 * struct fields are laid out from the most significant bit downwards.
		 */
		public static class Record extends AbstractItem implements Type {
			private final boolean union;
			private final List<Field> fields;

			public Record(boolean union, List<Field> fields, Attribute... attributes) {
				super(attributes);
				this.union = union;
				this.fields = new ArrayList<>(fields);
			}

			public boolean isUnion() {
				return union;
			}

			public List<Field> getFields() {
				return fields;
			}

			public Field getField(String name) {
				for (Field f : fields) {
					if (f.getName().equals(name)) {
						return f;
					}
				}
				return null;
			}
		}

		/**
		 * A field within a record. A field may carry a single dimension, in which
		 * case it holds a packed array of its type.
		 */
		public static class Field extends AbstractItem implements Item {
			private final String name;
			private final Type type;
			private final Expr.Range dimension;

			public Field(String name, Type type, Expr.Range dimension, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
				this.dimension = dimension;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}

			public Expr.Range getDimension() {
				return dimension;
			}
		}

		public static class Enumeration extends AbstractItem implements Type {
			private final Expr.Range base;
			private final List<Decl.EnumItem> items;

			public Enumeration(Expr.Range base, List<Decl.EnumItem> items, Attribute... attributes) {
				super(attributes);
				this.base = base;
				this.items = new ArrayList<>(items);
			}

			/**
			 * Get the base range of this enumeration, or <code>null</code> for the
			 * default integer base.
			 *
			 * @return
			 */
			public Expr.Range getBase() {
				return base;
			}

			public List<Decl.EnumItem> getItems() {
				return items;
			}
		}
	}

	// =========================================================================
	// Statements
	// =========================================================================

	public interface Stmt extends Item {

		public static class Assign extends AbstractItem implements Stmt {
			private final Expr lhs;
			private final Expr rhs;

			private Assign(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}
		}

		/**
		 * A call to a (system) task, such as <code>$readmemh</code>.
		 */
		public static class Call extends AbstractItem implements Stmt {
			private final String name;
			private final List<Expr> arguments;

			private Call(String name, Collection<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}
		}

		public static class Block extends AbstractItem implements Stmt {
			private final String name;
			private final List<Item> items;

			private Block(String name, Collection<? extends Item> items, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.items = new ArrayList<>(items);
			}

			/**
			 * Get the label of this block, or <code>null</code> if it is unnamed.
			 *
			 * @return
			 */
			public String getName() {
				return name;
			}

			public int size() {
				return items.size();
			}

			public Item get(int i) {
				return items.get(i);
			}

			public List<Item> getAll() {
				return items;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		/**
		 * Produce a fully independent copy of this expression.
		 *
		 * @return
		 */
		public Expr copy();

		public interface BinaryOperator {
			Expr getLeftHandSide();
			Expr getRightHandSide();
		}

		public enum Format {
			BINARY, OCTAL, DECIMAL, HEX, INTEGER
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;
			private final Format format;

			private Integer(BigInteger value, Format format, Attribute[] attributes) {
				super(attributes);
				this.value = value;
				this.format = format;
			}

			public BigInteger getValue() {
				return value;
			}

			public Format getFormat() {
				return format;
			}

			@Override
			public Integer copy() {
				return new Integer(value, format, getAttributes());
			}

			@Override
			public String toString() {
				return value.toString();
			}
		}

		public static class Real extends AbstractItem implements Expr {
			private final double value;

			private Real(double value, Attribute[] attributes) {
				super(attributes);
				this.value = value;
			}

			public double getValue() {
				return value;
			}

			@Override
			public Real copy() {
				return new Real(value, getAttributes());
			}
		}

		public static class Str extends AbstractItem implements Expr {
			private final String value;

			private Str(String value, Attribute[] attributes) {
				super(attributes);
				this.value = value;
			}

			public String getValue() {
				return value;
			}

			@Override
			public Str copy() {
				return new Str(value, getAttributes());
			}
		}

		/**
		 * A range <code>[left:right]</code>, or an index <code>[left]</code> when no
		 * right bound is given. Ranges appear both as declared dimensions and as
		 * selectors on identifiers.
		 */
		public static class Range extends AbstractItem implements Expr {
			private Expr left;
			private Expr right;

			private Range(Expr left, Expr right, Attribute[] attributes) {
				super(attributes);
				this.left = left;
				this.right = right;
			}

			public Expr getLeft() {
				return left;
			}

			/**
			 * Get the right bound of this range, or <code>null</code> if this is an
			 * index.
			 *
			 * @return
			 */
			public Expr getRight() {
				return right;
			}

			/**
			 * Get the right bound of this range, or the left bound if this is an index.
			 *
			 * @return
			 */
			public Expr getLow() {
				return right == null ? left : right;
			}

			public boolean isIndex() {
				return right == null;
			}

			public boolean isConstant() {
				return left instanceof Integer && getLow() instanceof Integer;
			}

			/**
			 * Replace the bounds of this range in place.
			 *
			 * @param left
			 * @param right
			 */
			public void setBounds(Expr left, Expr right) {
				this.left = left;
				this.right = right;
			}

			@Override
			public Range copy() {
				return new Range(left.copy(), right == null ? null : right.copy(), getAttributes());
			}
		}

		/**
		 * One segment of a hierarchical field access, such as <code>.a[1]</code> in
		 * <code>s.a[1].y</code>. Each segment names a field and may carry selectors;
		 * segments are chained outermost first.
		 */
		public static class Dot extends AbstractItem implements Item {
			private final String field;
			private final List<Range> selectors;
			private final Dot next;

			private Dot(String field, List<Range> selectors, Dot next, Attribute[] attributes) {
				super(attributes);
				this.field = field;
				this.selectors = new ArrayList<>(selectors);
				this.next = next;
			}

			public String getField() {
				return field;
			}

			public List<Range> getSelectors() {
				return selectors;
			}

			public Dot getNext() {
				return next;
			}

			public Dot copy() {
				ArrayList<Range> nselectors = new ArrayList<>();
				for (Range r : selectors) {
					nselectors.add(r.copy());
				}
				return new Dot(field, nselectors, next == null ? null : next.copy(), getAttributes());
			}
		}

		/**
		 * A reference to a declared symbol, optionally carrying one selector per
		 * dimension (in source order) and a field access chain.
		 */
		public static class Identifier extends AbstractItem implements Expr {
			private String name;
			private List<Range> selectors;
			private Dot dot;
			private State state;

			private Identifier(String name, List<Range> selectors, Dot dot, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.selectors = new ArrayList<>(selectors);
				this.dot = dot;
				this.state = State.RAW;
			}

			public String getName() {
				return name;
			}

			public void setName(String name) {
				this.name = name;
			}

			public List<Range> getSelectors() {
				return selectors;
			}

			public Dot getDot() {
				return dot;
			}

			public State getState() {
				return state;
			}

			/**
			 * Replace the selectors of this identifier, returning the detached ones.
			 *
			 * @param selectors
			 * @return
			 */
			public List<Range> replaceSelectors(List<Range> selectors) {
				List<Range> detached = this.selectors;
				this.selectors = new ArrayList<>(selectors);
				return detached;
			}

			/**
			 * Detach the field access chain from this identifier.
			 *
			 * @return
			 */
			public Dot detachDot() {
				Dot detached = this.dot;
				this.dot = null;
				return detached;
			}

			/**
			 * Replace all selectors (and any field access chain) with a single flat
			 * range, and mark this identifier as prepared so it is never rewritten
			 * again. The detached selectors are returned.
			 *
			 * @param flat
			 * @return
			 */
			public List<Range> prepare(Range flat) {
				if (state == State.PREPARED) {
					throw new IllegalStateException("identifier " + name + " already prepared");
				}
				this.dot = null;
				this.state = State.PREPARED;
				return replaceSelectors(Collections.singletonList(flat));
			}

			@Override
			public Identifier copy() {
				ArrayList<Range> nselectors = new ArrayList<>();
				for (Range r : selectors) {
					nselectors.add(r.copy());
				}
				Identifier r = new Identifier(name, nselectors, dot == null ? null : dot.copy(), getAttributes());
				r.state = state;
				return r;
			}
		}

		public static class Addition extends AbstractItem implements Expr, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Addition(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public Addition copy() {
				return new Addition(lhs.copy(), rhs.copy(), getAttributes());
			}
		}

		public static class Subtraction extends AbstractItem implements Expr, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Subtraction(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public Subtraction copy() {
				return new Subtraction(lhs.copy(), rhs.copy(), getAttributes());
			}
		}

		public static class Multiplication extends AbstractItem implements Expr, BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private Multiplication(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public Multiplication copy() {
				return new Multiplication(lhs.copy(), rhs.copy(), getAttributes());
			}
		}

		public static class Invoke extends AbstractItem implements Expr {
			private final String name;
			private final List<Expr> arguments;

			private Invoke(String name, List<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			@Override
			public Invoke copy() {
				ArrayList<Expr> nargs = new ArrayList<>();
				for (Expr e : arguments) {
					nargs.add(e.copy());
				}
				return new Invoke(name, nargs, getAttributes());
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	/**
	 * Identifies the point in the original design an item was translated from.
	 */
	public static class Location {
		private final String file;
		private final int line;

		public Location(String file, int line) {
			this.file = file;
			this.line = line;
		}

		public String getFile() {
			return file;
		}

		public int getLine() {
			return line;
		}

		@Override
		public String toString() {
			return file + ":" + line;
		}
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return (T) o;
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	public static Attribute LOCATION(String file, int line) {
		return ATTRIBUTE(new Location(file, line));
	}

	// Units

	public static Unit.Module MODULE(String name, List<? extends Item> items, Attribute... attributes) {
		return new Unit.Module(name, items, attributes);
	}

	public static Unit.Module MODULE(String name, Item... items) {
		return new Unit.Module(name, Arrays.asList(items));
	}

	public static Unit.Package PACKAGE(String name, List<? extends Item> items, Attribute... attributes) {
		return new Unit.Package(name, items, attributes);
	}

	public static Unit.Package PACKAGE(String name, Item... items) {
		return new Unit.Package(name, Arrays.asList(items));
	}

	// Declarations

	public static Decl.Variable WIRE(String name, List<Expr.Range> packed, List<Expr.Range> unpacked, Attribute... attributes) {
		return new Decl.Variable(Decl.Variable.Kind.WIRE, Decl.Variable.Direction.NONE, name, packed, unpacked, null, null,
				null, attributes);
	}

	public static Decl.Variable WIRE(String name, String typeName, List<Expr.Range> unpacked, Attribute... attributes) {
		return new Decl.Variable(Decl.Variable.Kind.WIRE, Decl.Variable.Direction.NONE, name, Collections.emptyList(),
				unpacked, typeName, null, null, attributes);
	}

	public static Decl.Variable PORT(Decl.Variable.Direction direction, String name, List<Expr.Range> packed,
			List<Expr.Range> unpacked, Attribute... attributes) {
		return new Decl.Variable(Decl.Variable.Kind.WIRE, direction, name, packed, unpacked, null, null, null, attributes);
	}

	public static Decl.Variable PARAMETER(String name, List<Expr.Range> packed, Expr initialiser, Attribute... attributes) {
		return new Decl.Variable(Decl.Variable.Kind.PARAMETER, Decl.Variable.Direction.NONE, name, packed,
				Collections.emptyList(), null, null, initialiser, attributes);
	}

	public static Decl.Variable PARAMETER(String name, Expr initialiser, Attribute... attributes) {
		return PARAMETER(name, Collections.emptyList(), initialiser, attributes);
	}

	public static Decl.Variable LOCALPARAM(String name, List<Expr.Range> packed, Expr initialiser, Attribute... attributes) {
		return new Decl.Variable(Decl.Variable.Kind.LOCALPARAM, Decl.Variable.Direction.NONE, name, packed,
				Collections.emptyList(), null, null, initialiser, attributes);
	}

	public static Decl.TypeDef TYPEDEF(String name, Type type, Attribute... attributes) {
		return new Decl.TypeDef(name, type, attributes);
	}

	public static Decl.EnumItem ENUMITEM(String name, Expr value, Attribute... attributes) {
		return new Decl.EnumItem(name, value, attributes);
	}

	// Types

	public static Type.Vector VECTOR(Expr.Range... packed) {
		return new Type.Vector(Arrays.asList(packed));
	}

	public static Type.Named NAMED(String name) {
		return new Type.Named(name);
	}

	public static Type.Record STRUCT(Type.Field... fields) {
		return new Type.Record(false, Arrays.asList(fields));
	}

	public static Type.Record UNION(Type.Field... fields) {
		return new Type.Record(true, Arrays.asList(fields));
	}

	public static Type.Field FIELD(String name, Type type, Attribute... attributes) {
		return new Type.Field(name, type, null, attributes);
	}

	public static Type.Field FIELD(String name, Type type, Expr.Range dimension, Attribute... attributes) {
		return new Type.Field(name, type, dimension, attributes);
	}

	public static Type.Enumeration ENUM(Expr.Range base, Decl.EnumItem... items) {
		return new Type.Enumeration(base, Arrays.asList(items));
	}

	// Statements

	public static Stmt.Assign ASSIGN(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Stmt.Assign(lhs, rhs, attributes);
	}

	public static Stmt.Call CALL(String name, List<Expr> arguments, Attribute... attributes) {
		return new Stmt.Call(name, arguments, attributes);
	}

	public static Stmt.Call CALL(String name, Expr... arguments) {
		return new Stmt.Call(name, Arrays.asList(arguments), new Attribute[0]);
	}

	public static Stmt.Block BLOCK(String name, List<? extends Item> items, Attribute... attributes) {
		return new Stmt.Block(name, items, attributes);
	}

	public static Stmt.Block BLOCK(Item... items) {
		return new Stmt.Block(null, Arrays.asList(items), new Attribute[0]);
	}

	// Ranges

	/**
	 * Construct a range whose bounds are both integer constants.
	 *
	 * @param left
	 * @param right
	 * @param attributes
	 * @return
	 */
	public static Expr.Range RANGE(int left, int right, Attribute... attributes) {
		return new Expr.Range(CONST(left), CONST(right), attributes);
	}

	public static Expr.Range RANGE(Expr left, Expr right, Attribute... attributes) {
		if (left == null) {
			throw new IllegalArgumentException("range requires a left bound");
		}
		return new Expr.Range(left, right, attributes);
	}

	public static Expr.Range INDEX(Expr index, Attribute... attributes) {
		return RANGE(index, null, attributes);
	}

	public static Expr.Range INDEX(int index, Attribute... attributes) {
		return RANGE(CONST(index), null, attributes);
	}

	public static List<Expr.Range> RANGES(Expr.Range... ranges) {
		return new ArrayList<>(Arrays.asList(ranges));
	}

	// Arithmetic Operators

	public static Expr.Addition ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Addition(lhs, rhs, attributes);
	}

	public static Expr.Subtraction SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Subtraction(lhs, rhs, attributes);
	}

	public static Expr.Multiplication MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Multiplication(lhs, rhs, attributes);
	}

	// Misc

	public static Expr.Integer CONST(int i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), Expr.Format.INTEGER, attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, Expr.Format.INTEGER, attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Expr.Format format, Attribute... attributes) {
		return new Expr.Integer(i, format, attributes);
	}

	public static Expr.Real REAL(double d, Attribute... attributes) {
		return new Expr.Real(d, attributes);
	}

	public static Expr.Str STRING(String s, Attribute... attributes) {
		return new Expr.Str(s, attributes);
	}

	public static Expr.Invoke INVOKE(String name, List<Expr> arguments, Attribute... attributes) {
		return new Expr.Invoke(name, arguments, attributes);
	}

	public static Expr.Invoke INVOKE(String name, Expr argument, Attribute... attributes) {
		return new Expr.Invoke(name, Arrays.asList(argument), attributes);
	}

	public static Expr.Identifier VAR(String name) {
		return new Expr.Identifier(name, Collections.emptyList(), null, new Attribute[0]);
	}

	public static Expr.Identifier VAR(String name, Expr.Range... selectors) {
		return new Expr.Identifier(name, Arrays.asList(selectors), null, new Attribute[0]);
	}

	public static Expr.Identifier VAR(String name, List<Expr.Range> selectors, Expr.Dot dot, Attribute... attributes) {
		return new Expr.Identifier(name, selectors, dot, attributes);
	}

	public static Expr.Dot DOT(String field, Expr.Range... selectors) {
		return new Expr.Dot(field, Arrays.asList(selectors), null, new Attribute[0]);
	}

	public static Expr.Dot DOT(String field, Expr.Dot next, Expr.Range... selectors) {
		return new Expr.Dot(field, Arrays.asList(selectors), next, new Attribute[0]);
	}

	public static Expr.Dot DOT(String field, List<Expr.Range> selectors, Expr.Dot next, Attribute... attributes) {
		return new Expr.Dot(field, selectors, next, attributes);
	}
}

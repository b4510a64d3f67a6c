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

import static uhdmast.core.AstFile.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import uhdmast.core.AstFile.Expr;

/**
 * The dimension metadata recorded against a normalized declaration. Entries
 * are held innermost first: the packed dimensions in reverse source order,
 * followed by the unpacked dimensions in reverse source order. Thus, the
 * outermost source dimension is always the last entry.
 *
 * @author David J. Pearce
 *
 */
public class Dimensions {
	/**
	 * A single resolved dimension. The swapped flag records a declaration
	 * written low-to-high (e.g. <code>[0:7]</code>).
	 */
	public static class Dimension {
		private final int min;
		private final int length;
		private final boolean swapped;

		public Dimension(int min, int length, boolean swapped) {
			if (length <= 0) {
				throw new IllegalArgumentException("invalid dimension length (" + length + ")");
			}
			this.min = min;
			this.length = length;
			this.swapped = swapped;
		}

		/**
		 * Construct a dimension from its declared left and right bounds.
		 *
		 * @param left
		 * @param right
		 * @return
		 * @throws ArithmeticException if the length does not fit in an int.
		 */
		public static Dimension of(int left, int right) {
			int min = Math.min(left, right);
			int max = Math.max(left, right);
			return new Dimension(min, Math.addExact(Math.subtractExact(max, min), 1), left < right);
		}

		public int getMin() {
			return min;
		}

		public int getMax() {
			return min + length - 1;
		}

		public int getLength() {
			return length;
		}

		public boolean isSwapped() {
			return swapped;
		}

		/**
		 * Convert a declared index into a zero-based position within this
		 * dimension, where position zero is the least significant element.
		 *
		 * @param index
		 * @return
		 */
		public Expr offset(Expr index) {
			if (swapped) {
				return SUB(CONST(getMax()), index);
			} else if (min == 0) {
				return index;
			} else {
				return SUB(index, CONST(min));
			}
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Dimension) {
				Dimension d = (Dimension) o;
				return min == d.min && length == d.length && swapped == d.swapped;
			}
			return false;
		}

		@Override
		public int hashCode() {
			return min ^ (length << 8) ^ (swapped ? 1 : 0);
		}

		@Override
		public String toString() {
			return swapped ? "[" + min + ":" + getMax() + "]" : "[" + getMax() + ":" + min + "]";
		}
	}

	private final List<Dimension> packed;
	private final List<Dimension> unpacked;
	private final List<Dimension> all;

	/**
	 * Construct dimensions from packed and unpacked lists, both given in source
	 * order (outermost first).
	 *
	 * @param packed
	 * @param unpacked
	 */
	public Dimensions(List<Dimension> packed, List<Dimension> unpacked) {
		this.packed = reverse(packed);
		this.unpacked = reverse(unpacked);
		this.all = new ArrayList<>(this.packed);
		this.all.addAll(this.unpacked);
	}

	/**
	 * Get the packed dimensions, innermost first.
	 *
	 * @return
	 */
	public List<Dimension> getPacked() {
		return Collections.unmodifiableList(packed);
	}

	/**
	 * Get the unpacked dimensions, innermost first.
	 *
	 * @return
	 */
	public List<Dimension> getUnpacked() {
		return Collections.unmodifiableList(unpacked);
	}

	public List<Dimension> getAll() {
		return Collections.unmodifiableList(all);
	}

	public int size() {
		return all.size();
	}

	/**
	 * Get the total number of bits covered, which is the product of all
	 * dimension lengths.
	 *
	 * @return
	 * @throws ArithmeticException if the size does not fit in an int.
	 */
	public int getSize() {
		int size = 1;
		for (Dimension d : all) {
			size = Math.multiplyExact(size, d.getLength());
		}
		return size;
	}

	/**
	 * Get the dimension selected by the i'th selector in source order.
	 *
	 * @param i
	 * @return
	 */
	public Dimension get(int i) {
		return all.get(all.size() - 1 - i);
	}

	/**
	 * Get the number of bits spanned by one step of the i'th selector in source
	 * order. This is the product of the lengths of all dimensions inside it.
	 *
	 * @param i
	 * @return
	 */
	public int getSlotSize(int i) {
		int size = 1;
		for (int j = 0; j < all.size() - 1 - i; ++j) {
			size = Math.multiplyExact(size, all.get(j).getLength());
		}
		return size;
	}

	/**
	 * Check whether these dimensions are a single <code>[n-1:0]</code> range,
	 * such that any access is already expressed against the flat range.
	 *
	 * @return
	 */
	public boolean isCanonical() {
		if (all.size() != 1) {
			return false;
		}
		Dimension d = all.get(0);
		return d.getMin() == 0 && !d.isSwapped();
	}

	/**
	 * Render the packed (or unpacked) dimensions in source order, such as
	 * <code>[1:0][3:0]</code>.
	 *
	 * @param packed
	 * @return
	 */
	public String toString(boolean packed) {
		List<Dimension> ds = packed ? this.packed : this.unpacked;
		StringBuilder r = new StringBuilder();
		for (int i = ds.size() - 1; i >= 0; --i) {
			r.append(ds.get(i));
		}
		return r.toString();
	}

	@Override
	public String toString() {
		return toString(true) + toString(false);
	}

	private static List<Dimension> reverse(List<Dimension> items) {
		ArrayList<Dimension> r = new ArrayList<>(items);
		Collections.reverse(r);
		return r;
	}
}

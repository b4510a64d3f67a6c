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

import static org.junit.jupiter.api.Assertions.*;
import static uhdmast.core.AstFile.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import uhdmast.core.AstFile;
import uhdmast.core.AstFile.Expr;
import uhdmast.core.Dimensions;
import uhdmast.core.Dimensions.Dimension;
import uhdmast.core.ScopeTable;
import uhdmast.core.SyntacticException;
import uhdmast.util.ConstantFolder;

public class AccessRewriterTests {
	private final AccessRewriter rewriter = new AccessRewriter(new ConstantFolder());
	private final ScopeTable scope = new ScopeTable();

	/**
	 * Dimensions of <code>logic [1:0][3:0] x</code>.
	 */
	private static Dimensions packed2x4() {
		return new Dimensions(Arrays.asList(Dimension.of(1, 0), Dimension.of(3, 0)), Collections.emptyList());
	}

	@Test
	public void test_slot_sizes() {
		Dimensions dims = packed2x4();
		assertEquals(8, dims.getSize());
		assertEquals(4, dims.getSlotSize(0));
		assertEquals(1, dims.getSlotSize(1));
		assertEquals(Dimension.of(1, 0), dims.get(0));
		assertEquals(Dimension.of(3, 0), dims.get(1));
	}

	@Test
	public void test_two_indices() {
		Expr.Identifier x = VAR("x", INDEX(1), INDEX(2));
		rewriter.rewrite(x, packed2x4(), scope);
		assertEquals(AstFile.State.PREPARED, x.getState());
		assertEquals(1, x.getSelectors().size());
		assertRange(6, 6, x.getSelectors().get(0));
	}

	@Test
	public void test_trailing_dimension_omitted() {
		Expr.Range r = rewriter.locate(null, RANGES(INDEX(1)), packed2x4(), scope);
		assertRange(7, 4, r);
	}

	@Test
	public void test_no_indices_selects_whole() {
		Expr.Range r = rewriter.locate(null, RANGES(), packed2x4(), scope);
		assertRange(7, 0, r);
	}

	@Test
	public void test_range_selector() {
		Expr.Range r = rewriter.locate(null, RANGES(INDEX(1), RANGE(2, 1)), packed2x4(), scope);
		assertRange(6, 5, r);
	}

	@Test
	public void test_too_many_indices() {
		Expr.Identifier x = VAR("x", INDEX(1), INDEX(2), INDEX(0));
		SyntacticException e = assertThrows(SyntacticException.class,
				() -> rewriter.rewrite(x, packed2x4(), scope));
		assertEquals(SyntacticException.Kind.INVALID_DIMENSION_COUNT, e.getKind());
		assertEquals(AstFile.State.RAW, x.getState());
		assertEquals(3, x.getSelectors().size());
	}

	@Test
	public void test_range_before_index_unsupported() {
		SyntacticException e = assertThrows(SyntacticException.class,
				() -> rewriter.locate(null, RANGES(RANGE(1, 0), INDEX(2)), packed2x4(), scope));
		assertEquals(SyntacticException.Kind.UNSUPPORTED_SELECTOR, e.getKind());
	}

	@Test
	public void test_swapped_boundaries() {
		// [0:7][1:0] versus [7:0][1:0]
		Dimensions ascending = new Dimensions(Arrays.asList(Dimension.of(0, 7), Dimension.of(1, 0)),
				Collections.emptyList());
		Dimensions descending = new Dimensions(Arrays.asList(Dimension.of(7, 0), Dimension.of(1, 0)),
				Collections.emptyList());
		Expr.Range a0 = rewriter.locate(null, RANGES(INDEX(0)), ascending, scope);
		Expr.Range d7 = rewriter.locate(null, RANGES(INDEX(7)), descending, scope);
		Expr.Range a7 = rewriter.locate(null, RANGES(INDEX(7)), ascending, scope);
		Expr.Range d0 = rewriter.locate(null, RANGES(INDEX(0)), descending, scope);
		assertRange(15, 14, a0);
		assertRange(15, 14, d7);
		assertRange(1, 0, a7);
		assertRange(1, 0, d0);
	}

	@Test
	public void test_swapped_range_selector() {
		// logic x [0:7], accessed as x[1:2]
		Dimensions dims = new Dimensions(Arrays.asList(Dimension.of(3, 0)), Arrays.asList(Dimension.of(0, 7)));
		Expr.Range r = rewriter.locate(null, RANGES(RANGE(1, 2)), dims, scope);
		assertRange(27, 20, r);
	}

	@Test
	public void test_offset_by_minimum() {
		// logic [15:8] x, accessed as x[8]
		Dimensions dims = new Dimensions(Arrays.asList(Dimension.of(15, 8)), Collections.emptyList());
		assertFalse(dims.isCanonical());
		assertRange(0, 0, rewriter.locate(null, RANGES(INDEX(8)), dims, scope));
		assertRange(7, 0, rewriter.locate(null, RANGES(RANGE(15, 8)), dims, scope));
	}

	@Test
	public void test_symbolic_index() {
		Expr.Identifier x = VAR("x", INDEX(VAR("i")), INDEX(2));
		List<Expr.Range> detached = rewriter.rewrite(x, packed2x4(), scope);
		assertEquals(2, detached.size());
		Expr.Range r = x.getSelectors().get(0);
		assertFalse(r.isConstant());
		assertEquals(AstFile.State.PREPARED, x.getState());
		// An identifier is only ever rewritten once
		assertThrows(IllegalStateException.class, () -> x.prepare(RANGE(0, 0)));
	}

	@ParameterizedTest
	@MethodSource("shapes")
	public void test_every_index_tuple_is_distinct(List<Integer> packed, List<Integer> unpacked) {
		Dimensions dims = new Dimensions(toDimensions(packed), toDimensions(unpacked));
		int size = dims.getSize();
		Set<Integer> covered = new HashSet<>();
		for (List<Integer> tuple : tuples(dims, 0)) {
			List<Expr.Range> selectors = new ArrayList<>();
			for (int i : tuple) {
				selectors.add(INDEX(i));
			}
			Expr.Range r = rewriter.locate(null, selectors, dims, scope);
			int high = value(r.getLeft());
			int low = value(r.getRight());
			assertEquals(high, low, "full index tuple should select one bit");
			assertTrue(low >= 0 && high < size, "out of bounds for " + tuple);
			assertTrue(covered.add(low), "overlap for " + tuple);
		}
		assertEquals(size, covered.size());
	}

	private static Stream<Arguments> shapes() {
		return Stream.of(
				Arguments.of(Arrays.asList(7, 0), Collections.emptyList()),
				Arguments.of(Arrays.asList(1, 0, 3, 0), Collections.emptyList()),
				Arguments.of(Arrays.asList(3, 0), Arrays.asList(0, 2)),
				Arguments.of(Arrays.asList(0, 1, 2, 0), Arrays.asList(5, 4)),
				Arguments.of(Arrays.asList(1, 0), Arrays.asList(0, 1, 3, 2)));
	}

	/**
	 * Generate all in-bound index tuples, outermost dimension first.
	 */
	private static List<List<Integer>> tuples(Dimensions dims, int i) {
		List<List<Integer>> r = new ArrayList<>();
		if (i == dims.size()) {
			r.add(new ArrayList<>());
			return r;
		}
		Dimension d = dims.get(i);
		for (int idx = d.getMin(); idx <= d.getMax(); ++idx) {
			for (List<Integer> rest : tuples(dims, i + 1)) {
				List<Integer> t = new ArrayList<>();
				t.add(idx);
				t.addAll(rest);
				r.add(t);
			}
		}
		return r;
	}

	private static List<Dimension> toDimensions(List<Integer> bounds) {
		List<Dimension> r = new ArrayList<>();
		for (int i = 0; i < bounds.size(); i += 2) {
			r.add(Dimension.of(bounds.get(i), bounds.get(i + 1)));
		}
		return r;
	}

	private static int value(Expr e) {
		return ((Expr.Integer) e).getValue().intValue();
	}

	static void assertRange(int high, int low, Expr.Range r) {
		assertTrue(r.isConstant(), "range is not constant");
		assertEquals(high, value(r.getLeft()), "high bound");
		assertEquals(low, value(r.getLow()), "low bound");
	}
}

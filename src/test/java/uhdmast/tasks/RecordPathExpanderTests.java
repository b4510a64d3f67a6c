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
import static uhdmast.tasks.AccessRewriterTests.assertRange;

import org.junit.jupiter.api.Test;

import uhdmast.core.AstFile.Expr;
import uhdmast.core.AstFile.Type;
import uhdmast.core.ScopeTable;
import uhdmast.core.SyntacticException;
import uhdmast.util.ConstantFolder;

public class RecordPathExpanderTests {
	private final ConstantFolder folder = new ConstantFolder();
	private final RecordPathExpander expander = new RecordPathExpander(folder);
	private final ScopeTable scope = new ScopeTable();

	/**
	 * <code>struct packed { struct packed { logic [7:0] x; logic [7:0] y; } a; logic [3:0] b; }</code>
	 */
	private static Type.Record nested() {
		return STRUCT(
				FIELD("a", STRUCT(FIELD("x", VECTOR(RANGE(7, 0))), FIELD("y", VECTOR(RANGE(7, 0))))),
				FIELD("b", VECTOR(RANGE(3, 0))));
	}

	@Test
	public void test_layout_is_high_to_low() {
		RecordLayout layout = RecordLayout.of(nested(), scope, folder);
		assertEquals(20, layout.getWidth());
		assertEquals(19, layout.get("a").getHigh());
		assertEquals(4, layout.get("a").getLow());
		assertEquals(3, layout.get("b").getHigh());
		assertEquals(0, layout.get("b").getLow());
		assertNull(layout.get("c"));
	}

	@Test
	public void test_nested_field() {
		assertRange(11, 4, expander.expand(nested(), DOT("a", DOT("y")), scope));
		assertRange(19, 12, expander.expand(nested(), DOT("a", DOT("x")), scope));
	}

	@Test
	public void test_whole_fields() {
		assertRange(19, 4, expander.expand(nested(), DOT("a"), scope));
		assertRange(3, 0, expander.expand(nested(), DOT("b"), scope));
	}

	@Test
	public void test_bit_selectors() {
		assertRange(2, 2, expander.expand(nested(), DOT("b", INDEX(2)), scope));
		assertRange(7, 4, expander.expand(nested(), DOT("a", DOT("y", RANGE(3, 0))), scope));
		assertRange(12, 12, expander.expand(nested(), DOT("a", DOT("x", INDEX(0))), scope));
	}

	@Test
	public void test_reversed_selector_normalized() {
		assertRange(3, 0, expander.expand(nested(), DOT("b", RANGE(0, 3)), scope));
		Type.Record r = STRUCT(FIELD("up", VECTOR(RANGE(0, 7))));
		assertRange(7, 4, expander.expand(r, DOT("up", RANGE(0, 3)), scope));
	}

	@Test
	public void test_union_members_share_bits() {
		Type.Record u = UNION(FIELD("wide", VECTOR(RANGE(7, 0))), FIELD("narrow", VECTOR(RANGE(3, 0))));
		assertEquals(8, RecordLayout.of(u, scope, folder).getWidth());
		assertRange(7, 0, expander.expand(u, DOT("wide"), scope));
		assertRange(3, 0, expander.expand(u, DOT("narrow"), scope));
	}

	@Test
	public void test_array_field() {
		// struct packed { logic [7:0] arr [3:0]; logic [3:0] b; }
		Type.Record r = STRUCT(FIELD("arr", VECTOR(RANGE(7, 0)), RANGE(3, 0)), FIELD("b", VECTOR(RANGE(3, 0))));
		assertEquals(36, RecordLayout.of(r, scope, folder).getWidth());
		assertRange(35, 4, expander.expand(r, DOT("arr"), scope));
		assertRange(27, 20, expander.expand(r, DOT("arr", INDEX(2)), scope));
		assertRange(27, 12, expander.expand(r, DOT("arr", RANGE(2, 1)), scope));
	}

	@Test
	public void test_array_of_records() {
		// struct packed { pair_t [1:0] p; } where pair_t is { logic [3:0] lo; logic [3:0] hi; }
		scope.declare(TYPEDEF("pair_t", STRUCT(FIELD("lo", VECTOR(RANGE(3, 0))), FIELD("hi", VECTOR(RANGE(3, 0))))));
		Type.Record r = STRUCT(FIELD("p", NAMED("pair_t"), RANGE(1, 0)));
		assertRange(15, 12, expander.expand(r, DOT("p", DOT("lo"), INDEX(1)), scope));
		assertRange(3, 0, expander.expand(r, DOT("p", DOT("hi"), INDEX(0)), scope));
	}

	@Test
	public void test_packed_vector_field() {
		// struct packed { logic [3:0][7:0] bytes; }
		Type.Record r = STRUCT(FIELD("bytes", VECTOR(RANGE(3, 0), RANGE(7, 0))));
		assertRange(15, 8, expander.expand(r, DOT("bytes", INDEX(1)), scope));
	}

	@Test
	public void test_symbolic_selector() {
		Type.Record r = STRUCT(FIELD("arr", VECTOR(RANGE(7, 0)), RANGE(3, 0)));
		Expr.Range range = expander.expand(r, DOT("arr", INDEX(VAR("i"))), scope);
		assertFalse(range.isConstant());
	}

	@Test
	public void test_unknown_field() {
		SyntacticException e = assertThrows(SyntacticException.class,
				() -> expander.expand(nested(), DOT("c"), scope));
		assertEquals(SyntacticException.Kind.UNKNOWN_FIELD, e.getKind());
		assertTrue(e.getMessage().contains("c"));
		e = assertThrows(SyntacticException.class, () -> expander.expand(nested(), DOT("b", DOT("z")), scope));
		assertEquals(SyntacticException.Kind.UNKNOWN_FIELD, e.getKind());
		e = assertThrows(SyntacticException.class, () -> expander.expand(nested(), DOT("a", DOT("q")), scope));
		assertEquals(SyntacticException.Kind.UNKNOWN_FIELD, e.getKind());
	}

	@Test
	public void test_unsupported_selectors() {
		SyntacticException e = assertThrows(SyntacticException.class,
				() -> expander.expand(nested(), DOT("b", INDEX(1), INDEX(0)), scope));
		assertEquals(SyntacticException.Kind.UNSUPPORTED_SELECTOR, e.getKind());
		Type.Record r = STRUCT(FIELD("arr", nested(), RANGE(3, 0)));
		e = assertThrows(SyntacticException.class, () -> expander.expand(r, DOT("arr", DOT("b")), scope));
		assertEquals(SyntacticException.Kind.UNSUPPORTED_SELECTOR, e.getKind());
		e = assertThrows(SyntacticException.class,
				() -> expander.expand(r, DOT("arr", DOT("b"), RANGE(1, 0)), scope));
		assertEquals(SyntacticException.Kind.UNSUPPORTED_SELECTOR, e.getKind());
	}
}

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

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import uhdmast.core.AstFile;
import uhdmast.core.AstFile.Decl;
import uhdmast.core.AstFile.Expr;
import uhdmast.core.AstFile.Unit;
import uhdmast.core.ScopeTable;
import uhdmast.core.SyntacticException;
import uhdmast.util.ConstantFolder;

public class ScopeThreadingPassTests {

	private static Decl.TypeDef recordType() {
		return TYPEDEF("rec_t", STRUCT(
				FIELD("a", STRUCT(FIELD("x", VECTOR(RANGE(7, 0))), FIELD("y", VECTOR(RANGE(7, 0))))),
				FIELD("b", VECTOR(RANGE(3, 0)))));
	}

	private static List<SyntacticException> apply(Unit unit) {
		ScopeTable scope = new ScopeTable();
		scope.enter(unit);
		try {
			return new ScopeThreadingPass(scope, new ConstantFolder()).apply(unit);
		} finally {
			scope.leave();
		}
	}

	@Test
	public void test_multidimensional_access() {
		Decl.Variable x = WIRE("x", RANGES(RANGE(1, 0), RANGE(3, 0)), RANGES());
		Expr.Identifier lhs = VAR("x", INDEX(1), INDEX(2));
		Expr.Identifier rhs = VAR("x", INDEX(0));
		Unit.Module m = MODULE("top", x, ASSIGN(lhs, rhs));
		assertTrue(apply(m).isEmpty());
		assertRange(7, 0, x.getPacked().get(0));
		assertRange(6, 6, lhs.getSelectors().get(0));
		assertRange(3, 0, rhs.getSelectors().get(0));
		assertEquals(AstFile.State.PREPARED, lhs.getState());
	}

	@Test
	public void test_canonical_access_untouched() {
		Decl.Variable x = PORT(Decl.Variable.Direction.OUTPUT, "x", RANGES(RANGE(7, 0)), RANGES());
		Expr.Identifier lhs = VAR("x", INDEX(3));
		Unit.Module m = MODULE("top", x, ASSIGN(lhs, CONST(1)));
		assertTrue(apply(m).isEmpty());
		assertEquals(AstFile.State.NORMALIZED, x.getState());
		assertEquals(AstFile.State.RAW, lhs.getState());
		assertTrue(lhs.getSelectors().get(0).isIndex());
	}

	@Test
	public void test_access_before_declaration_untouched() {
		Expr.Identifier lhs = VAR("x", INDEX(1), INDEX(2));
		Unit.Module m = MODULE("top", ASSIGN(lhs, CONST(1)), WIRE("x", RANGES(RANGE(1, 0), RANGE(3, 0)), RANGES()));
		assertTrue(apply(m).isEmpty());
		assertEquals(AstFile.State.RAW, lhs.getState());
		assertEquals(2, lhs.getSelectors().size());
	}

	@Test
	public void test_nested_access_in_selector() {
		Decl.Variable x = WIRE("x", RANGES(RANGE(1, 0), RANGE(3, 0)), RANGES());
		Decl.Variable y = WIRE("y", RANGES(RANGE(1, 0), RANGE(1, 0)), RANGES());
		Expr.Identifier inner = VAR("y", INDEX(1), INDEX(0));
		Expr.Identifier outer = VAR("x", INDEX(inner), INDEX(2));
		Unit.Module m = MODULE("top", x, y, ASSIGN(VAR("z"), outer));
		assertTrue(apply(m).isEmpty());
		assertEquals(AstFile.State.PREPARED, inner.getState());
		assertRange(2, 2, inner.getSelectors().get(0));
		assertEquals(AstFile.State.PREPARED, outer.getState());
	}

	@Test
	public void test_record_access() {
		Expr.Identifier s = VAR("s", RANGES(), DOT("a", DOT("y")));
		Unit.Module m = MODULE("top", recordType(), WIRE("s", "rec_t", RANGES()), ASSIGN(s, CONST(0)));
		assertTrue(apply(m).isEmpty());
		assertEquals(AstFile.State.PREPARED, s.getState());
		assertNull(s.getDot());
		assertRange(11, 4, s.getSelectors().get(0));
	}

	@Test
	public void test_record_array_access() {
		// rec_t s [0:1]
		Expr.Identifier s1 = VAR("s", RANGES(INDEX(1)), DOT("a", DOT("y")));
		Expr.Identifier s0 = VAR("s", RANGES(INDEX(0)), DOT("b"));
		Unit.Module m = MODULE("top", recordType(), WIRE("s", "rec_t", RANGES(RANGE(0, 1))), ASSIGN(s1, s0));
		assertTrue(apply(m).isEmpty());
		assertRange(11, 4, s1.getSelectors().get(0));
		assertRange(23, 20, s0.getSelectors().get(0));
	}

	@Test
	public void test_record_bit_selection_unsupported() {
		Expr.Identifier s = VAR("s", RANGES(INDEX(3)), DOT("b"));
		Unit.Module m = MODULE("top", recordType(), WIRE("s", "rec_t", RANGES()), ASSIGN(s, CONST(0)));
		List<SyntacticException> errors = apply(m);
		assertEquals(1, errors.size());
		assertEquals(SyntacticException.Kind.UNSUPPORTED_SELECTOR, errors.get(0).getKind());
	}

	@Test
	public void test_record_range_before_field_unsupported() {
		Expr.Identifier arr = VAR("arr", RANGES(RANGE(1, 0)), DOT("a"));
		Unit.Module m = MODULE("top", recordType(), WIRE("arr", "rec_t", RANGES(RANGE(3, 0))), ASSIGN(arr, CONST(0)));
		List<SyntacticException> errors = apply(m);
		assertEquals(1, errors.size());
		assertEquals(SyntacticException.Kind.UNSUPPORTED_SELECTOR, errors.get(0).getKind());
		assertEquals(AstFile.State.RAW, arr.getState());
		assertNotNull(arr.getDot());
	}

	@Test
	public void test_composite_name_fallback() {
		Expr.Identifier e = VAR("bus", RANGES(INDEX(0)), DOT("data", DOT("bits", INDEX(3))));
		Unit.Module m = MODULE("top", ASSIGN(VAR("q"), e));
		assertTrue(apply(m).isEmpty());
		assertEquals("bus.data.bits", e.getName());
		assertNull(e.getDot());
		assertEquals(1, e.getSelectors().size());
		assertTrue(e.getSelectors().get(0).isIndex());
		assertEquals("3", e.getSelectors().get(0).getLeft().toString());
	}

	@Test
	public void test_enum_items_in_scope() {
		Decl.TypeDef t = TYPEDEF("op_t", ENUM(RANGE(1, 0), ENUMITEM("ADD", CONST(0)), ENUMITEM("LANES", CONST(4))));
		Decl.Variable x = WIRE("x", RANGES(RANGE(SUB(VAR("LANES"), CONST(1)), CONST(0)), RANGE(1, 0)), RANGES());
		Unit.Module m = MODULE("top", t, x);
		assertTrue(apply(m).isEmpty());
		assertRange(7, 0, x.getPacked().get(0));
	}

	@Test
	public void test_declarations_in_blocks() {
		Decl.Variable x = WIRE("x", RANGES(RANGE(1, 0), RANGE(3, 0)), RANGES());
		Expr.Identifier lhs = VAR("x", INDEX(0), INDEX(1));
		Unit.Module m = MODULE("top", BLOCK("gen", Arrays.asList(x)), ASSIGN(lhs, CONST(1)));
		assertTrue(apply(m).isEmpty());
		assertRange(1, 1, lhs.getSelectors().get(0));
	}

	@Test
	public void test_errors_do_not_stop_pass() {
		Decl.Variable bad = WIRE("bad", RANGES(RANGE(SUB(VAR("N"), CONST(1)), CONST(0)), RANGE(1, 0)), RANGES(),
				LOCATION("top.sv", 3));
		Decl.Variable good = WIRE("good", RANGES(RANGE(1, 0), RANGE(1, 0)), RANGES());
		Expr.Identifier unknown = VAR("s", RANGES(), DOT("nope"), LOCATION("top.sv", 7));
		Unit.Module m = MODULE("top", recordType(), WIRE("s", "rec_t", RANGES()), bad, good,
				ASSIGN(unknown, CONST(0)));
		List<SyntacticException> errors = apply(m);
		assertEquals(2, errors.size());
		assertEquals(SyntacticException.Kind.UNRESOLVED_CONSTANT, errors.get(0).getKind());
		assertEquals(SyntacticException.Kind.UNKNOWN_FIELD, errors.get(1).getKind());
		assertEquals(AstFile.State.RAW, bad.getState());
		assertEquals(AstFile.State.NORMALIZED, good.getState());
		assertEquals(AstFile.State.RAW, unknown.getState());
		assertNotNull(unknown.getDot());
	}

	@Test
	public void test_scope_must_be_active() {
		Unit.Module m = MODULE("top");
		ScopeThreadingPass pass = new ScopeThreadingPass(new ScopeTable(), new ConstantFolder());
		assertThrows(IllegalStateException.class, () -> pass.apply(m));
	}
}

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
package uhdmast.io;

import static org.junit.jupiter.api.Assertions.*;
import static uhdmast.core.AstFile.*;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import uhdmast.core.AstFile;
import uhdmast.core.AstFile.Decl;
import uhdmast.tasks.FlattenTask;

public class AstFilePrinterTests {

	private static String print(AstFile file, AstFilePrinter[] printer) {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		printer[0] = new AstFilePrinter(bytes);
		printer[0].write(file);
		return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
	}

	private static String print(AstFile file) {
		return print(file, new AstFilePrinter[1]);
	}

	@Test
	public void test_raw_module() {
		AstFile file = new AstFile(Arrays.asList(MODULE("top", PORT(Decl.Variable.Direction.INPUT, "a",
				RANGES(RANGE(SUB(VAR("W"), CONST(1)), CONST(0))), RANGES()), ASSIGN(VAR("b"), ADD(VAR("a"), CONST(1))),
				ASSIGN(VAR("r"), REAL(1.5)))));
		String text = print(file);
		assertTrue(text.startsWith("module top;"), text);
		assertTrue(text.contains("input wire [W - 1:0] a;"), text);
		assertTrue(text.contains("assign b = a + 1;"), text);
		assertTrue(text.contains("assign r = 1.5;"), text);
		assertTrue(text.trim().endsWith("endmodule"), text);
	}

	@Test
	public void test_flattened_declaration() {
		Decl.Variable x = WIRE("x", RANGES(RANGE(1, 0), RANGE(3, 0)), RANGES());
		AstFile file = new AstFile(Arrays.asList(MODULE("top", x, ASSIGN(VAR("x", INDEX(1), INDEX(2)), CONST(1)))));
		assertTrue(new FlattenTask().run(file));
		String text = print(file);
		assertTrue(text.contains("(* packed_ranges = \"[1:0][3:0]\", unpacked_ranges = \"\" *)"), text);
		assertTrue(text.contains("wire [7:0] x;"), text);
		assertTrue(text.contains("assign x[6:6] = 1;"), text);
	}

	@Test
	public void test_memory_declaration() {
		Decl.Variable mem = WIRE("mem", RANGES(RANGE(7, 0)), RANGES(RANGE(0, 15)));
		AstFile file = new AstFile(Arrays.asList(MODULE("top", mem)));
		assertTrue(new FlattenTask().run(file));
		String text = print(file);
		assertTrue(text.contains("reg [7:0] mem[0:15];"), text);
		assertFalse(text.contains("packed_ranges"), text);
	}

	@Test
	public void test_package_and_typedef() {
		AstFile file = new AstFile(Arrays.asList(PACKAGE("cfg", PARAMETER("W", CONST(8)),
				TYPEDEF("op_t", ENUM(RANGE(1, 0), ENUMITEM("ADD", CONST(0)), ENUMITEM("SUB", CONST(1)))))));
		String text = print(file);
		assertTrue(text.startsWith("package cfg;"), text);
		assertTrue(text.contains("parameter W = 8;"), text);
		assertTrue(text.contains("typedef enum logic[1:0] {ADD = 0, SUB = 1} op_t;"), text);
		assertTrue(text.trim().endsWith("endpackage"), text);
	}

	@Test
	public void test_mapping_records_items() {
		Decl.Variable x = WIRE("x", RANGES(RANGE(7, 0)), RANGES());
		AstFilePrinter[] printer = new AstFilePrinter[1];
		print(new AstFile(Arrays.asList(MODULE("top", x))), printer);
		// line 2 is "  wire [7:0] x;"
		assertSame(x, printer[0].getMapping().get(2, 2));
		assertNull(printer[0].getMapping().get(2, 0));
		assertNull(printer[0].getMapping().get(10, 0));
	}
}
